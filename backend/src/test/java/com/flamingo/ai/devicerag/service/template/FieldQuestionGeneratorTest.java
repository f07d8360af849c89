package com.flamingo.ai.devicerag.service.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.BatchInvoker;
import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.generation.ItemStatus;
import com.flamingo.ai.devicerag.service.template.model.FieldType;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FieldQuestionGenerator Tests")
class FieldQuestionGeneratorTest {

  @Mock private BatchInvoker batchInvoker;

  private SimpleMeterRegistry meterRegistry;
  private FieldQuestionGenerator generator;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    generator = new FieldQuestionGenerator(batchInvoker, new RagConfig(), meterRegistry);
  }

  @Test
  @DisplayName("Should use generated questions after the field name")
  void shouldUseGeneratedQuestions() {
    TemplateField field = TemplateTestFixtures.field("Model", FieldType.MODEL_NUMBER);
    when(batchInvoker.invoke(anyList(), argThat(o -> o.singleBatch())))
        .thenReturn(
            List.of(
                new ItemResult(
                    0,
                    "1. What is the model number?\n- \"Which catalogue code is used?\"\n\n"
                        + "What is the model number?",
                    ItemStatus.GENERATED)));

    generator.generate(List.of(field));

    assertThat(field.getVariations())
        .containsExactly(
            "Model", "What is the model number?", "Which catalogue code is used?");
  }

  @Test
  @DisplayName("Should fall back to type questions when generation fails")
  void shouldFallBackToTypeQuestions() {
    TemplateField field = TemplateTestFixtures.field("Manufacturer", FieldType.MANUFACTURER);
    when(batchInvoker.invoke(anyList(), argThat(o -> o.singleBatch())))
        .thenReturn(List.of(new ItemResult(0, null, ItemStatus.UNAVAILABLE)));

    generator.generate(List.of(field));

    assertThat(field.getVariations())
        .containsExactly(
            "Manufacturer",
            "Who is the manufacturer of the device?",
            "Which company manufactures the device?",
            "What is the Manufacturer?");
    assertThat(meterRegistry.counter("template.questions.fallback").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should build generic fallback questions from the field name")
  void shouldBuildGenericFallback() {
    TemplateField field = TemplateTestFixtures.field("Sterilization method", FieldType.GENERIC);

    assertThat(generator.fallbackQuestions(field, 3))
        .containsExactly(
            "What is the Sterilization method?",
            "Find Sterilization method information",
            "Sterilization method details");
  }

  @Test
  @DisplayName("Should send all fields in a single call")
  void shouldSendOneCall() {
    TemplateField model = TemplateTestFixtures.field("Model", FieldType.MODEL_NUMBER);
    TemplateField date = TemplateTestFixtures.field("Date", FieldType.DATE);
    when(batchInvoker.invoke(anyList(), argThat(o -> o.singleBatch())))
        .thenReturn(
            List.of(
                new ItemResult(0, "q1", ItemStatus.GENERATED),
                new ItemResult(1, "q2", ItemStatus.CACHED)));

    generator.generate(List.of(model, date));

    verify(batchInvoker).invoke(argThat(items -> items.size() == 2), argThat(o -> true));
    assertThat(date.getVariations()).containsExactly("Date", "q2");
  }

  @Test
  @DisplayName("Should do nothing for an empty field list")
  void shouldSkipEmptyInput() {
    generator.generate(List.of());

    verifyNoInteractions(batchInvoker);
  }
}
