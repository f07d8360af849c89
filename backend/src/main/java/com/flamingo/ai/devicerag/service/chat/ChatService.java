package com.flamingo.ai.devicerag.service.chat;

import com.flamingo.ai.devicerag.service.rag.synthesis.SynthesizedAnswer;
import java.util.List;

/** Answers questions about a device from its ingested documents. */
public interface ChatService {

  /**
   * Answers a question with citations to the device's documents.
   *
   * @param deviceId device whose documents are searched
   * @param message the user's question
   * @param history earlier conversation turns, oldest first; may be empty
   * @return the answer, its citations and quality metrics
   */
  SynthesizedAnswer chat(String deviceId, String message, List<String> history);
}
