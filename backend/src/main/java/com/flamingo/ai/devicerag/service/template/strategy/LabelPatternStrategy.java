package com.flamingo.ai.devicerag.service.template.strategy;

import com.flamingo.ai.devicerag.service.rag.search.RetrievalResult;
import com.flamingo.ai.devicerag.service.template.model.FieldType;
import com.flamingo.ai.devicerag.service.template.model.FillSource;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Scans evidence for a "label: value" line naming the field or one of its type's aliases. */
@Component
@Order(2)
public class LabelPatternStrategy implements ValueExtractionStrategy {

  private static final Map<FieldType, List<String>> ALIASES = new EnumMap<>(FieldType.class);

  static {
    ALIASES.put(FieldType.PRODUCT_NAME, List.of("product name", "device name", "trade name"));
    ALIASES.put(FieldType.MANUFACTURER, List.of("manufacturer", "legal manufacturer"));
    ALIASES.put(
        FieldType.DOCUMENT_NUMBER, List.of("document number", "document no", "reference number"));
    ALIASES.put(FieldType.MODEL_NUMBER, List.of("model number", "model", "catalogue number"));
    ALIASES.put(FieldType.DATE, List.of("date", "date of issue", "issue date"));
    ALIASES.put(FieldType.SIGNATURE, List.of("signed by", "approved by", "signature"));
    ALIASES.put(FieldType.GENERIC, List.of());
  }

  @Override
  public StrategyResult extract(FillContext context) {
    List<String> labels = new ArrayList<>();
    labels.add(context.field().getName());
    labels.addAll(ALIASES.get(context.field().getFieldType()));
    for (String label : labels) {
      Pattern pattern = patternFor(label);
      for (RetrievalResult evidence : context.evidence()) {
        Matcher matcher = pattern.matcher(evidence.content());
        if (matcher.find()) {
          String value = matcher.group(1).strip();
          if (!value.isEmpty()) {
            return StrategyResult.found(value, FillSource.PATTERN);
          }
        }
      }
    }
    return StrategyResult.skipped();
  }

  static Pattern patternFor(String label) {
    String words = Pattern.quote(label.strip()).replace(" ", "\\E\\s+\\Q");
    return Pattern.compile(
        "(?im)(?:^|[|;]\\s*)" + words + "\\s*[:=]\\s*([^\\n|;]{1,120}?)\\s*(?:$|[|;])");
  }
}
