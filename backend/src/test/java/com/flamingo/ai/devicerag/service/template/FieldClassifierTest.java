package com.flamingo.ai.devicerag.service.template;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.devicerag.service.template.model.FieldType;
import com.flamingo.ai.devicerag.service.template.model.PatternKind;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("FieldClassifier Tests")
class FieldClassifierTest {

  private final FieldClassifier classifier = new FieldClassifier();

  private static TemplateField field(String name, String context, PatternKind kind) {
    return new TemplateField("field-1", name, kind, 0, 0, 0, "", context, true);
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "Generic name, PRODUCT_NAME",
    "Trade Name, PRODUCT_NAME",
    "Legal manufacturer, MANUFACTURER",
    "Model, MODEL_NUMBER",
    "Catalogue number, MODEL_NUMBER",
    "Document No, DOCUMENT_NUMBER",
    "Date of issue, DATE",
    "Approved by, SIGNATURE",
    "Intended purpose, GENERIC"
  })
  @DisplayName("Should classify by label keywords")
  void shouldClassifyByLabel(String label, FieldType expected) {
    assertThat(classifier.classify(field(label, "", PatternKind.COLON_LABEL))).isEqualTo(expected);
  }

  @Test
  @DisplayName("Should prefer the signature rule over the date rule for a shared label")
  void shouldApplyRulesInOrder() {
    assertThat(classifier.classify(field("Signature and date", "", PatternKind.COLON_LABEL)))
        .isEqualTo(FieldType.SIGNATURE);
  }

  @Test
  @DisplayName("Should fall back to context when the label matches no rule")
  void shouldUseContext() {
    TemplateField field = field("Value", "Section 4: Manufacturer details", PatternKind.DOT_LEADER);

    assertThat(classifier.classify(field)).isEqualTo(FieldType.MANUFACTURER);
  }

  @Test
  @DisplayName("Should classify unlabelled signature lines as signatures")
  void shouldClassifySignatureLines() {
    TemplateField field =
        new TemplateField(
            "field-1", "Signature", PatternKind.SIGNATURE_LINE, 0, 0, 9, "", "", false);

    assertThat(classifier.classify(field)).isEqualTo(FieldType.SIGNATURE);
  }

  @Test
  @DisplayName("Should classify every field in place")
  void shouldClassifyAll() {
    List<TemplateField> fields =
        List.of(
            field("Model", "", PatternKind.COLON_LABEL),
            field("Remarks", "", PatternKind.COLON_LABEL));

    classifier.classifyAll(fields);

    assertThat(fields).extracting(TemplateField::getFieldType)
        .containsExactly(FieldType.MODEL_NUMBER, FieldType.GENERIC);
  }
}
