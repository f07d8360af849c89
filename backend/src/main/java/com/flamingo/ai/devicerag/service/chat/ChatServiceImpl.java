package com.flamingo.ai.devicerag.service.chat;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.rag.search.MultiQueryRetriever;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalOutcome;
import com.flamingo.ai.devicerag.service.rag.synthesis.ResponseSynthesizer;
import com.flamingo.ai.devicerag.service.rag.synthesis.SynthesizedAnswer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of ChatService: multi-query retrieval followed by citation-bound synthesis. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  private final MultiQueryRetriever retriever;
  private final ResponseSynthesizer synthesizer;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chat.answer", description = "Time to answer a chat message")
  public SynthesizedAnswer chat(String deviceId, String message, List<String> history) {
    List<String> turns = history == null ? List.of() : history;
    log.info("Chat request for device {} ({} history turns)", deviceId, turns.size());

    RetrievalOutcome outcome =
        retriever.retrieve(message, turns, deviceId, ragConfig.getRetrieval().getFinalCount());
    log.debug(
        "Retrieved {} results ({} rejected) for device {}",
        outcome.results().size(),
        outcome.rejectedCount(),
        deviceId);

    SynthesizedAnswer answer = synthesizer.synthesize(message, outcome);
    meterRegistry
        .counter(
            "chat.answers",
            "label",
            answer.qualityMetrics().label().name(),
            "mode",
            answer.qualityMetrics().generationMode().name())
        .increment();
    if (answer.qualityMetrics().degraded()) {
      log.warn("Answer for device {} was produced without generation", deviceId);
    }
    return answer;
  }
}
