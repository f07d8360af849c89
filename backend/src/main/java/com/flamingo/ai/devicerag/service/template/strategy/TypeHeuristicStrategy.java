package com.flamingo.ai.devicerag.service.template.strategy;

import com.flamingo.ai.devicerag.service.rag.search.RetrievalResult;
import com.flamingo.ai.devicerag.service.template.model.FieldType;
import com.flamingo.ai.devicerag.service.template.model.FillSource;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Type-specific expressions, e.g. "signed by Dr. Smith" for signatures. */
@Component
@Order(3)
public class TypeHeuristicStrategy implements ValueExtractionStrategy {

  private static final String MONTHS =
      "January|February|March|April|May|June|July|August|September|October|November|December";

  private static final Map<FieldType, Pattern> PATTERNS = new EnumMap<>(FieldType.class);

  static {
    PATTERNS.put(
        FieldType.SIGNATURE,
        Pattern.compile(
            "(?i:signed|approved|authori[sz]ed)\\s+(?i:by)\\s*:?\\s*"
                + "((?:(?:Dr|Mr|Mrs|Ms|Prof)\\.?\\s+)?\\p{Lu}[\\p{L}'-]*\\.?"
                + "(?:\\s+\\p{Lu}[\\p{L}'-]*\\.?){0,3})"));
    PATTERNS.put(
        FieldType.DATE,
        Pattern.compile(
            "\\b(\\d{4}-\\d{2}-\\d{2}|\\d{1,2}[/.-]\\d{1,2}[/.-]\\d{2,4}"
                + "|\\d{1,2}\\s+(?:"
                + MONTHS
                + ")\\s+\\d{4}|(?:"
                + MONTHS
                + ")\\s+\\d{1,2},\\s*\\d{4})\\b"));
    PATTERNS.put(
        FieldType.MODEL_NUMBER,
        Pattern.compile(
            "(?i:model)(?:\\s+(?i:no\\.?|number|#))?\\s*:?\\s+"
                + "((?=[A-Za-z0-9-]*\\d)[A-Za-z0-9][A-Za-z0-9-]{1,30})"));
    PATTERNS.put(
        FieldType.DOCUMENT_NUMBER,
        Pattern.compile(
            "(?i:doc(?:ument)?\\.?\\s*(?:no\\.?|number|#|id)"
                + "|ref(?:erence)?\\.?\\s*(?:no\\.?|number))"
                + "\\s*:?\\s*((?=[A-Za-z0-9./-]*\\d)[A-Za-z0-9][A-Za-z0-9./-]{2,40})"));
    PATTERNS.put(
        FieldType.MANUFACTURER,
        Pattern.compile(
            "(?i:manufactured\\s+by|manufacturer)\\s*:?\\s+(\\p{Lu}[^\\n.;,]{1,60}"
                + "(?:,?\\s+(?:Inc|Ltd|LLC|GmbH|Corp|Co|AG|SA|BV)\\.?)?)"));
    PATTERNS.put(
        FieldType.PRODUCT_NAME,
        Pattern.compile(
            "(?i:product\\s+name|device\\s+name|trade\\s+name)\\s*:?\\s+(\\p{Lu}[^\\n.;]{1,60})"));
  }

  @Override
  public StrategyResult extract(FillContext context) {
    Pattern pattern = PATTERNS.get(context.field().getFieldType());
    if (pattern == null) {
      return StrategyResult.skipped();
    }
    for (RetrievalResult evidence : context.evidence()) {
      Matcher matcher = pattern.matcher(evidence.content());
      if (matcher.find()) {
        String value = matcher.group(1).strip();
        if (!value.isEmpty()) {
          return StrategyResult.found(value, FillSource.HEURISTIC);
        }
      }
    }
    return StrategyResult.skipped();
  }
}
