package com.flamingo.ai.devicerag.service.rag.synthesis;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.BatchInvoker;
import com.flamingo.ai.devicerag.service.generation.InvocationOptions;
import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.rag.search.ConfidenceTier;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalConfidenceService;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalOutcome;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalResult;
import dev.langchain4j.model.input.PromptTemplate;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns ranked evidence into a grounded answer with citations.
 *
 * <p>Without evidence no generation call is made and a fixed not-found answer lists the topics the
 * documents do cover. When generation is unavailable the answer quotes the evidence instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseSynthesizer {

  static final String PURPOSE = "answer";

  static final String NOT_FOUND_ANSWER =
      "This specific information is not available in the provided documents.";

  private static final String INSTRUCTIONS =
      "You are a regulatory documentation assistant for medical devices.";

  private static final PromptTemplate ANSWER_TEMPLATE =
      PromptTemplate.from(
          "Answer the question using only the numbered evidence below.\n"
              + "Rules:\n"
              + "- Use only facts stated in the evidence. Do not add outside knowledge.\n"
              + "- After every claim, cite its evidence number in square brackets, for example"
              + " [1] or [2][3].\n"
              + "- If the evidence does not contain the answer, say so explicitly and name what"
              + " is missing.\n\n"
              + "Evidence:\n{{evidence}}\n\n"
              + "Question: {{question}}");

  private static final int EXCERPT_LENGTH = 300;

  private final BatchInvoker batchInvoker;
  private final RetrievalConfidenceService confidenceService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.synthesize", description = "Time to synthesize an answer")
  public SynthesizedAnswer synthesize(String query, RetrievalOutcome outcome) {
    List<RetrievalResult> evidence =
        outcome.results().stream().filter(r -> r.tier() != ConfidenceTier.REJECTED).toList();

    if (evidence.isEmpty()) {
      meterRegistry.counter("rag.synthesis", "mode", "not_found").increment();
      log.info("No usable evidence for query, returning not-found answer");
      return new SynthesizedAnswer(
          notFoundAnswer(outcome.topics()),
          List.of(),
          metrics(evidence, QualityMetrics.GenerationMode.NONE, false));
    }

    List<Citation> citations = citations(evidence);
    String prompt =
        ANSWER_TEMPLATE
            .apply(Map.of("evidence", formatEvidence(evidence), "question", query))
            .text();
    RagConfig.Generation generation = ragConfig.getGeneration();
    ItemResult result =
        batchInvoker.invokeSingle(
            "answer",
            prompt,
            InvocationOptions.of(
                PURPOSE,
                INSTRUCTIONS,
                generation.getFactualTemperature(),
                generation.getMaxTokens()));

    if (result.isSuccess()) {
      meterRegistry.counter("rag.synthesis", "mode", "generated").increment();
      return new SynthesizedAnswer(
          result.value().strip(),
          citations,
          metrics(evidence, QualityMetrics.GenerationMode.GENERATED, false));
    }

    log.warn("Answer generation failed ({}), answering with excerpts", result.status());
    meterRegistry.counter("rag.synthesis", "mode", "extractive").increment();
    return new SynthesizedAnswer(
        extractiveAnswer(evidence),
        citations,
        metrics(evidence, QualityMetrics.GenerationMode.EXTRACTIVE_FALLBACK, true));
  }

  String notFoundAnswer(List<String> topics) {
    if (topics.isEmpty()) {
      return NOT_FOUND_ANSWER;
    }
    return NOT_FOUND_ANSWER
        + " However, the documents contain information about: "
        + String.join(", ", topics)
        + ".";
  }

  private List<Citation> citations(List<RetrievalResult> evidence) {
    int previewLength = ragConfig.getSynthesis().getPreviewLength();
    List<Citation> citations = new ArrayList<>(evidence.size());
    for (int i = 0; i < evidence.size(); i++) {
      RetrievalResult result = evidence.get(i);
      citations.add(
          new Citation(
              i + 1,
              result.filename(),
              result.chunkId(),
              result.documentId(),
              result.compositeScore(),
              result.tier(),
              preview(result.content(), previewLength)));
    }
    return citations;
  }

  private static String formatEvidence(List<RetrievalResult> evidence) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < evidence.size(); i++) {
      RetrievalResult result = evidence.get(i);
      sb.append('[')
          .append(i + 1)
          .append("] (source: ")
          .append(result.filename())
          .append(", confidence: ")
          .append(result.tier())
          .append(")\n")
          .append(result.content())
          .append("\n\n");
    }
    return sb.toString().strip();
  }

  private static String extractiveAnswer(List<RetrievalResult> evidence) {
    StringBuilder sb =
        new StringBuilder(
            "An answer could not be generated right now. Relevant excerpts from the documents:\n");
    for (int i = 0; i < evidence.size(); i++) {
      RetrievalResult result = evidence.get(i);
      sb.append("\n[")
          .append(i + 1)
          .append("] \"")
          .append(preview(result.content(), EXCERPT_LENGTH))
          .append("\" (")
          .append(result.filename())
          .append(')');
    }
    return sb.toString();
  }

  static String preview(String content, int length) {
    String flattened = content == null ? "" : content.replaceAll("\\s+", " ").strip();
    if (flattened.length() <= length) {
      return flattened;
    }
    return flattened.substring(0, length) + "...";
  }

  private QualityMetrics metrics(
      List<RetrievalResult> evidence, QualityMetrics.GenerationMode mode, boolean degraded) {
    RagConfig.Synthesis synthesis = ragConfig.getSynthesis();
    double average =
        evidence.stream().mapToDouble(RetrievalResult::compositeScore).average().orElse(0.0);
    QualityMetrics.Label label;
    if (average >= synthesis.getExcellentAverage()
        && evidence.size() >= synthesis.getExcellentMinCount()) {
      label = QualityMetrics.Label.EXCELLENT;
    } else if (average >= synthesis.getGoodAverage()) {
      label = QualityMetrics.Label.GOOD;
    } else {
      label = QualityMetrics.Label.POOR;
    }
    return new QualityMetrics(
        evidence.size(), average, confidenceService.countByTier(evidence), label, mode, degraded);
  }
}
