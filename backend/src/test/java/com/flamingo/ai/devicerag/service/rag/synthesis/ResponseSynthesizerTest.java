package com.flamingo.ai.devicerag.service.rag.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.domain.model.ContentType;
import com.flamingo.ai.devicerag.service.generation.BatchInvoker;
import com.flamingo.ai.devicerag.service.generation.InvocationOptions;
import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.generation.ItemStatus;
import com.flamingo.ai.devicerag.service.rag.search.ConfidenceTier;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalConfidenceService;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalOutcome;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalResult;
import com.flamingo.ai.devicerag.vectorstore.ChunkMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResponseSynthesizer Tests")
class ResponseSynthesizerTest {

  @Mock private BatchInvoker batchInvoker;

  private SimpleMeterRegistry meterRegistry;
  private ResponseSynthesizer synthesizer;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    synthesizer =
        new ResponseSynthesizer(
            batchInvoker,
            new RetrievalConfidenceService(ragConfig, meterRegistry),
            ragConfig,
            meterRegistry);
  }

  private static RetrievalResult evidence(String filename, String content, double score) {
    ConfidenceTier tier =
        score >= 0.80
            ? ConfidenceTier.CRITICAL
            : score >= 0.70 ? ConfidenceTier.HIGH : ConfidenceTier.ACCEPTABLE;
    ChunkMetadata metadata =
        new ChunkMetadata(
            "doc-" + filename,
            "device-1",
            filename,
            0,
            0,
            content.length(),
            content,
            0.9,
            0.5,
            List.of(),
            ContentType.TEXT);
    return new RetrievalResult(filename + "_0", metadata, score, score, tier);
  }

  private static RetrievalOutcome outcome(RetrievalResult... results) {
    return new RetrievalOutcome(List.of(results), List.of("q"), 0, List.of());
  }

  @Nested
  @DisplayName("Without evidence")
  class WithoutEvidence {

    @Test
    @DisplayName("Should return the not-found answer without calling generation")
    void shouldReturnNotFound() {
      SynthesizedAnswer answer = synthesizer.synthesize("What is the shelf life?", outcome());

      assertThat(answer.answer()).isEqualTo(ResponseSynthesizer.NOT_FOUND_ANSWER);
      assertThat(answer.citations()).isEmpty();
      assertThat(answer.qualityMetrics().generationMode())
          .isEqualTo(QualityMetrics.GenerationMode.NONE);
      assertThat(answer.qualityMetrics().evidenceCount()).isZero();
      assertThat(answer.qualityMetrics().label()).isEqualTo(QualityMetrics.Label.POOR);
      verifyNoInteractions(batchInvoker);
    }

    @Test
    @DisplayName("Should list covered topics in the not-found answer")
    void shouldListTopics() {
      RetrievalOutcome empty =
          new RetrievalOutcome(List.of(), List.of("q"), 4, List.of("sterilization", "labeling"));

      SynthesizedAnswer answer = synthesizer.synthesize("What is the shelf life?", empty);

      assertThat(answer.answer())
          .startsWith(ResponseSynthesizer.NOT_FOUND_ANSWER)
          .endsWith("information about: sterilization, labeling.");
    }
  }

  @Nested
  @DisplayName("With evidence")
  class WithEvidence {

    @Test
    @DisplayName("Should return the generated answer with numbered citations")
    void shouldReturnGeneratedAnswer() {
      when(batchInvoker.invokeSingle(anyString(), anyString(), any(InvocationOptions.class)))
          .thenReturn(
              new ItemResult(0, "  The manufacturer is Acme Medical [1].  ", ItemStatus.GENERATED));

      SynthesizedAnswer answer =
          synthesizer.synthesize(
              "Who makes the device?",
              outcome(
                  evidence("cert.pdf", "Manufacturer: Acme Medical", 0.91),
                  evidence("manual.pdf", "Acme Medical, Berlin", 0.74)));

      assertThat(answer.answer()).isEqualTo("The manufacturer is Acme Medical [1].");
      assertThat(answer.citations()).hasSize(2);
      assertThat(answer.citations().get(0).documentNumber()).isEqualTo(1);
      assertThat(answer.citations().get(0).filename()).isEqualTo("cert.pdf");
      assertThat(answer.citations().get(1).documentNumber()).isEqualTo(2);
      assertThat(answer.qualityMetrics().degraded()).isFalse();
      assertThat(answer.qualityMetrics().generationMode())
          .isEqualTo(QualityMetrics.GenerationMode.GENERATED);
      assertThat(answer.qualityMetrics().tierCounts())
          .containsEntry(ConfidenceTier.CRITICAL, 1)
          .containsEntry(ConfidenceTier.HIGH, 1);
    }

    @Test
    @DisplayName("Should number the evidence in the prompt")
    void shouldNumberEvidenceInPrompt() {
      when(batchInvoker.invokeSingle(anyString(), anyString(), any(InvocationOptions.class)))
          .thenReturn(new ItemResult(0, "answer", ItemStatus.GENERATED));

      synthesizer.synthesize(
          "Who makes the device?",
          outcome(
              evidence("cert.pdf", "Manufacturer: Acme Medical", 0.91),
              evidence("manual.pdf", "Acme Medical, Berlin", 0.74)));

      ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
      verify(batchInvoker).invokeSingle(eq("answer"), prompt.capture(), any());
      assertThat(prompt.getValue())
          .contains("[1] (source: cert.pdf")
          .contains("[2] (source: manual.pdf")
          .contains("Question: Who makes the device?");
    }

    @Test
    @DisplayName("Should quote the evidence when generation is unavailable")
    void shouldFallBackToExcerpts() {
      when(batchInvoker.invokeSingle(anyString(), anyString(), any(InvocationOptions.class)))
          .thenReturn(new ItemResult(0, null, ItemStatus.UNAVAILABLE));

      SynthesizedAnswer answer =
          synthesizer.synthesize(
              "Who makes the device?",
              outcome(evidence("cert.pdf", "Manufacturer:\n  Acme Medical", 0.91)));

      assertThat(answer.answer())
          .contains("[1] \"Manufacturer: Acme Medical\" (cert.pdf)");
      assertThat(answer.citations()).hasSize(1);
      assertThat(answer.qualityMetrics().degraded()).isTrue();
      assertThat(answer.qualityMetrics().generationMode())
          .isEqualTo(QualityMetrics.GenerationMode.EXTRACTIVE_FALLBACK);
      assertThat(meterRegistry.counter("rag.synthesis", "mode", "extractive").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should label strong, plentiful evidence as excellent")
    void shouldLabelExcellent() {
      when(batchInvoker.invokeSingle(anyString(), anyString(), any(InvocationOptions.class)))
          .thenReturn(new ItemResult(0, "answer", ItemStatus.CACHED));

      SynthesizedAnswer answer =
          synthesizer.synthesize(
              "q",
              outcome(
                  evidence("a.pdf", "one", 0.90),
                  evidence("b.pdf", "two", 0.85),
                  evidence("c.pdf", "three", 0.82)));

      assertThat(answer.qualityMetrics().label()).isEqualTo(QualityMetrics.Label.EXCELLENT);
    }
  }

  @Test
  @DisplayName("Should shorten long previews with an ellipsis")
  void shouldTruncatePreview() {
    assertThat(ResponseSynthesizer.preview("a  b\n c", 10)).isEqualTo("a b c");
    assertThat(ResponseSynthesizer.preview("abcdefghij", 4)).isEqualTo("abcd...");
    assertThat(ResponseSynthesizer.preview(null, 4)).isEmpty();
  }
}
