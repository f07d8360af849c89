package com.flamingo.ai.devicerag.service.rag.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.BatchInvoker;
import com.flamingo.ai.devicerag.service.generation.InvocationOptions;
import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.generation.ItemStatus;
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
@DisplayName("QueryExpansionServiceImpl Tests")
class QueryExpansionServiceImplTest {

  @Mock private BatchInvoker batchInvoker;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private QueryExpansionServiceImpl service;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getRetrieval().setVariationCount(3);
    meterRegistry = new SimpleMeterRegistry();
    service = new QueryExpansionServiceImpl(batchInvoker, ragConfig, meterRegistry);
  }

  @Nested
  @DisplayName("Expansion")
  class Expansion {

    @Test
    @DisplayName("Should put the original query first followed by generated phrasings")
    void shouldKeepOriginalFirst() {
      when(batchInvoker.invokeSingle(anyString(), anyString(), any(InvocationOptions.class)))
          .thenReturn(
              new ItemResult(
                  0,
                  "1. Which company makes the device?\n- \"Who produces the device?\"",
                  ItemStatus.GENERATED));

      List<String> variations = service.expand("Who is the manufacturer?", List.of());

      assertThat(variations)
          .containsExactly(
              "Who is the manufacturer?",
              "Which company makes the device?",
              "Who produces the device?");
    }

    @Test
    @DisplayName("Should drop duplicates of the original regardless of case")
    void shouldDeduplicateCaseInsensitively() {
      when(batchInvoker.invokeSingle(anyString(), anyString(), any(InvocationOptions.class)))
          .thenReturn(
              new ItemResult(
                  0, "WHO IS THE MANUFACTURER?\nName the device maker", ItemStatus.GENERATED));

      List<String> variations = service.expand("Who is the manufacturer?", List.of());

      assertThat(variations).hasSize(3);
      assertThat(variations.get(0)).isEqualTo("Who is the manufacturer?");
      assertThat(variations.get(1)).isEqualTo("Name the device maker");
      assertThat(variations).doesNotContain("WHO IS THE MANUFACTURER?");
    }

    @Test
    @DisplayName("Should fall back to heuristic phrasings when generation is unavailable")
    void shouldUseHeuristicsWhenUnavailable() {
      when(batchInvoker.invokeSingle(anyString(), anyString(), any(InvocationOptions.class)))
          .thenReturn(new ItemResult(0, null, ItemStatus.UNAVAILABLE));

      List<String> variations = service.expand("What is the device model?", List.of());

      assertThat(variations)
          .containsExactly(
              "What is the device model?",
              "Which is the device model?",
              "What is the product model");
      assertThat(
              meterRegistry
                  .counter("rag.query_expansion.fallback", "reason", "unavailable")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should include only the most recent history turns")
    void shouldWindowHistory() {
      ragConfig.getRetrieval().setHistoryWindow(2);
      when(batchInvoker.invokeSingle(anyString(), anyString(), any(InvocationOptions.class)))
          .thenReturn(new ItemResult(0, "alt one\nalt two", ItemStatus.GENERATED));

      service.expand("And its model?", List.of("turn 1", "turn 2", "turn 3"));

      ArgumentCaptor<String> content = ArgumentCaptor.forClass(String.class);
      verify(batchInvoker).invokeSingle(eq("q0"), content.capture(), any());
      assertThat(content.getValue())
          .contains("turn 2")
          .contains("turn 3")
          .doesNotContain("turn 1")
          .endsWith("Query: And its model?");
    }

    @Test
    @DisplayName("Should not call generation when a single variation is configured")
    void shouldSkipGenerationForSingleVariation() {
      ragConfig.getRetrieval().setVariationCount(1);

      assertThat(service.expand("query", List.of())).containsExactly("query");
      verifyNoInteractions(batchInvoker);
    }
  }

  @Nested
  @DisplayName("Heuristic variations")
  class HeuristicVariations {

    @Test
    @DisplayName("Should swap what and which")
    void shouldSwapQuestionWord() {
      assertThat(service.heuristicVariations("Which standard applies?"))
          .contains("What standard applies?");
    }

    @Test
    @DisplayName("Should substitute domain synonyms")
    void shouldSubstituteSynonyms() {
      assertThat(service.heuristicVariations("manufacturer address"))
          .contains("maker address", "producer address");
    }

    @Test
    @DisplayName("Should always add lookup phrasings")
    void shouldAddLookupPhrasings() {
      assertThat(service.heuristicVariations("What is the intended use?"))
          .contains("Find information about is the intended use", "Details on is the intended use");
    }
  }
}
