package com.flamingo.ai.devicerag.service.template;

import com.flamingo.ai.devicerag.service.template.model.FieldType;
import com.flamingo.ai.devicerag.service.template.model.PatternKind;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assigns a semantic type to each field from keyword rules. The label is tried against every rule
 * first; only when no rule matches the label is the surrounding context tried, in the same order.
 */
@Component
@Slf4j
public class FieldClassifier {

  private static final Map<FieldType, Pattern> RULES = new LinkedHashMap<>();

  static {
    RULES.put(
        FieldType.SIGNATURE,
        keywords(
            "signature",
            "signed",
            "signatory",
            "sign here",
            "approved by",
            "authorized by",
            "authorised by"));
    RULES.put(
        FieldType.DATE,
        keywords("date", "dated", "issued on", "effective from", "valid until", "expiry"));
    RULES.put(
        FieldType.DOCUMENT_NUMBER,
        keywords(
            "document number",
            "document no",
            "doc no",
            "doc number",
            "document id",
            "reference number",
            "ref no",
            "certificate number",
            "certificate no",
            "report number"));
    RULES.put(
        FieldType.MODEL_NUMBER,
        keywords("model", "model number", "catalog", "catalogue", "part number", "sku"));
    RULES.put(
        FieldType.MANUFACTURER,
        keywords("manufacturer", "manufactured by", "legal manufacturer", "company", "maker"));
    RULES.put(
        FieldType.PRODUCT_NAME,
        keywords("product", "device name", "trade name", "brand name", "generic name", "device"));
  }

  public FieldType classify(TemplateField field) {
    if (field.getPatternKind() == PatternKind.SIGNATURE_LINE && !field.isLabelled()) {
      return FieldType.SIGNATURE;
    }
    FieldType byLabel = match(field.getName());
    if (byLabel != null) {
      return byLabel;
    }
    FieldType byContext = match(field.getContext());
    return byContext != null ? byContext : FieldType.GENERIC;
  }

  /** Classifies every field in place. */
  public void classifyAll(List<TemplateField> fields) {
    for (TemplateField field : fields) {
      field.setFieldType(classify(field));
      log.debug("Field '{}' classified as {}", field.getName(), field.getFieldType());
    }
  }

  private static FieldType match(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    for (Map.Entry<FieldType, Pattern> rule : RULES.entrySet()) {
      if (rule.getValue().matcher(text).find()) {
        return rule.getKey();
      }
    }
    return null;
  }

  private static Pattern keywords(String... words) {
    StringBuilder regex = new StringBuilder("\\b(?:");
    for (int i = 0; i < words.length; i++) {
      if (i > 0) {
        regex.append('|');
      }
      regex.append(words[i].replace(" ", "\\s+"));
    }
    return Pattern.compile(regex.append(")\\b").toString(), Pattern.CASE_INSENSITIVE);
  }
}
