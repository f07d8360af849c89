package com.flamingo.ai.devicerag.service.template;

import static com.flamingo.ai.devicerag.service.template.TemplateTestFixtures.evidence;
import static com.flamingo.ai.devicerag.service.template.TemplateTestFixtures.field;
import static com.flamingo.ai.devicerag.service.template.TemplateTestFixtures.outcome;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.BatchInvoker;
import com.flamingo.ai.devicerag.service.generation.BatchItem;
import com.flamingo.ai.devicerag.service.generation.InvocationOptions;
import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.generation.ItemStatus;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalOutcome;
import com.flamingo.ai.devicerag.service.template.model.FieldType;
import com.flamingo.ai.devicerag.service.template.model.FillSource;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import com.flamingo.ai.devicerag.service.template.strategy.GeneratedValueStrategy;
import com.flamingo.ai.devicerag.service.template.strategy.LabelPatternStrategy;
import com.flamingo.ai.devicerag.service.template.strategy.TypeHeuristicStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FieldValueFiller Tests")
class FieldValueFillerTest {

  @Mock private BatchInvoker batchInvoker;

  private SimpleMeterRegistry meterRegistry;
  private FieldValueFiller filler;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    filler =
        new FieldValueFiller(
            batchInvoker,
            List.of(
                new GeneratedValueStrategy(),
                new LabelPatternStrategy(),
                new TypeHeuristicStrategy()),
            new RagConfig(),
            meterRegistry);
  }

  private static TemplateField withEvidence(
      String name, FieldType type, RetrievalOutcome evidence) {
    TemplateField field = field(name, type);
    field.setEvidence(evidence);
    return field;
  }

  @Test
  @DisplayName("Should fill from the generated value with the best evidence score")
  void shouldFillFromGeneratedValue() {
    TemplateField model =
        withEvidence(
            "Model",
            FieldType.MODEL_NUMBER,
            outcome(
                evidence("ifu.pdf", "Model PX-200", 0.9),
                evidence("ifu.pdf", "PX-200 specifications", 0.75),
                evidence("label.pdf", "REF PX-200", 0.72)));
    when(batchInvoker.invoke(anyList(), any(InvocationOptions.class)))
        .thenReturn(List.of(new ItemResult(0, "PX-200", ItemStatus.GENERATED)));

    filler.fill(List.of(model));

    assertThat(model.getValue()).isEqualTo("PX-200");
    assertThat(model.getFillSource()).isEqualTo(FillSource.GENERATED);
    assertThat(model.getConfidence()).isEqualTo(0.9);
    assertThat(model.getSources()).containsExactly("ifu.pdf", "label.pdf");
    assertThat(meterRegistry.counter("template.fields.filled", "source", "GENERATED").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fall back to evidence patterns with reduced confidence")
  void shouldFallBackWhenGenerationUnavailable() {
    TemplateField name =
        withEvidence(
            "Generic name",
            FieldType.PRODUCT_NAME,
            outcome(evidence("ifu.pdf", "Generic name: Pulse Oximeter", 0.9)));
    when(batchInvoker.invoke(anyList(), any(InvocationOptions.class)))
        .thenReturn(List.of(new ItemResult(0, null, ItemStatus.UNAVAILABLE)));

    filler.fill(List.of(name));

    assertThat(name.getValue()).isEqualTo("Pulse Oximeter");
    assertThat(name.getFillSource()).isEqualTo(FillSource.PATTERN);
    assertThat(name.getConfidence()).isCloseTo(0.72, within(1e-9));
  }

  @Test
  @DisplayName("Should leave a field missing when generation reports NOT_FOUND")
  void shouldRespectNotFound() {
    TemplateField name =
        withEvidence(
            "Generic name",
            FieldType.PRODUCT_NAME,
            outcome(evidence("ifu.pdf", "Generic name: Pulse Oximeter", 0.9)));
    when(batchInvoker.invoke(anyList(), any(InvocationOptions.class)))
        .thenReturn(List.of(new ItemResult(0, "NOT_FOUND", ItemStatus.GENERATED)));

    filler.fill(List.of(name));

    assertThat(name.isFilled()).isFalse();
    assertThat(name.getFillSource()).isNull();
    assertThat(meterRegistry.counter("template.fields.missing").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should send only fields with evidence, describing each with numbered evidence")
  @SuppressWarnings("unchecked")
  void shouldSendOnlyAnswerableFields() {
    TemplateField answerable =
        withEvidence(
            "Manufacturer",
            FieldType.MANUFACTURER,
            outcome(evidence("cert.pdf", "Manufacturer: Acme Medical", 0.8)));
    TemplateField unanswerable =
        withEvidence("Shelf life", FieldType.GENERIC, RetrievalOutcome.empty(List.of("q")));
    when(batchInvoker.invoke(anyList(), any(InvocationOptions.class)))
        .thenReturn(List.of(new ItemResult(0, "Acme Medical", ItemStatus.GENERATED)));

    filler.fill(List.of(answerable, unanswerable));

    ArgumentCaptor<List<BatchItem>> items = ArgumentCaptor.forClass(List.class);
    verify(batchInvoker).invoke(items.capture(), any(InvocationOptions.class));
    assertThat(items.getValue()).hasSize(1);
    assertThat(items.getValue().get(0).content())
        .startsWith("Field: Manufacturer\nType: MANUFACTURER\n")
        .contains("[1] Manufacturer: Acme Medical");
    assertThat(unanswerable.isFilled()).isFalse();
  }

  @Test
  @DisplayName("Should not call generation when no field has evidence")
  void shouldSkipWithoutEvidence() {
    TemplateField field = field("Model", FieldType.MODEL_NUMBER);

    filler.fill(List.of(field));

    verifyNoInteractions(batchInvoker);
    assertThat(field.isFilled()).isFalse();
  }
}
