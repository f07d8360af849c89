package com.flamingo.ai.devicerag.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.rag.search.ConfidenceTier;
import com.flamingo.ai.devicerag.service.rag.search.MultiQueryRetriever;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalOutcome;
import com.flamingo.ai.devicerag.service.rag.synthesis.QualityMetrics;
import com.flamingo.ai.devicerag.service.rag.synthesis.ResponseSynthesizer;
import com.flamingo.ai.devicerag.service.rag.synthesis.SynthesizedAnswer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChatServiceImpl Tests")
class ChatServiceImplTest {

  @Mock private MultiQueryRetriever retriever;
  @Mock private ResponseSynthesizer synthesizer;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private ChatServiceImpl chatService;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    chatService = new ChatServiceImpl(retriever, synthesizer, ragConfig, meterRegistry);
  }

  private static SynthesizedAnswer answer(
      QualityMetrics.Label label, QualityMetrics.GenerationMode mode, boolean degraded) {
    return new SynthesizedAnswer(
        "answer",
        List.of(),
        new QualityMetrics(0, 0.0, Map.of(ConfidenceTier.HIGH, 0), label, mode, degraded));
  }

  @Test
  @DisplayName("Should retrieve within the device and synthesize from the outcome")
  void shouldRetrieveThenSynthesize() {
    RetrievalOutcome outcome = RetrievalOutcome.empty(List.of("q"));
    SynthesizedAnswer expected =
        answer(QualityMetrics.Label.GOOD, QualityMetrics.GenerationMode.GENERATED, false);
    when(retriever.retrieve("Who makes it?", List.of("earlier"), "device-1", 10))
        .thenReturn(outcome);
    when(synthesizer.synthesize("Who makes it?", outcome)).thenReturn(expected);

    SynthesizedAnswer result = chatService.chat("device-1", "Who makes it?", List.of("earlier"));

    assertThat(result).isSameAs(expected);
    assertThat(meterRegistry.counter("chat.answers", "label", "GOOD", "mode", "GENERATED").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should treat a missing history as empty")
  void shouldHandleNullHistory() {
    RetrievalOutcome outcome = RetrievalOutcome.empty(List.of("q"));
    when(retriever.retrieve("q", List.of(), "device-1", 10)).thenReturn(outcome);
    when(synthesizer.synthesize("q", outcome))
        .thenReturn(
            answer(
                QualityMetrics.Label.POOR,
                QualityMetrics.GenerationMode.EXTRACTIVE_FALLBACK,
                true));

    chatService.chat("device-1", "q", null);

    verify(retriever).retrieve("q", List.of(), "device-1", 10);
  }
}
