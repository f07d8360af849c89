package com.flamingo.ai.devicerag.service.template.strategy;

import com.flamingo.ai.devicerag.service.template.model.FillSource;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Uses the value from the batched fill call. A {@code NOT_FOUND} answer is definitive; a failed
 * call passes the field to the next strategy.
 */
@Component
@Order(1)
public class GeneratedValueStrategy implements ValueExtractionStrategy {

  public static final String NOT_FOUND = "NOT_FOUND";

  private static final Pattern GENERIC_PREFIX =
      Pattern.compile("^(?:value|answer|result)\\s*:\\s*", Pattern.CASE_INSENSITIVE);

  @Override
  public StrategyResult extract(FillContext context) {
    if (context.generated() == null || !context.generated().isSuccess()) {
      return StrategyResult.skipped();
    }
    String value = clean(context.generated().value(), context.field().getName());
    if (value.isEmpty() || value.toUpperCase(Locale.ROOT).contains(NOT_FOUND)) {
      return StrategyResult.absent();
    }
    return StrategyResult.found(value, FillSource.GENERATED);
  }

  /** Removes "{field}:", "Value:", "Answer:" and "Result:" prefixes and surrounding quotes. */
  static String clean(String raw, String fieldName) {
    String value = raw == null ? "" : raw.strip();
    Pattern fieldPrefix =
        Pattern.compile("^" + Pattern.quote(fieldName) + "\\s*:\\s*", Pattern.CASE_INSENSITIVE);
    String previous;
    do {
      previous = value;
      value = fieldPrefix.matcher(value).replaceFirst("");
      value = GENERIC_PREFIX.matcher(value).replaceFirst("");
      value = value.replaceAll("^[\"'`]+|[\"'`]+$", "").strip();
    } while (!value.equals(previous));
    int lineBreak = value.indexOf('\n');
    return lineBreak >= 0 ? value.substring(0, lineBreak).strip() : value;
  }
}
