package com.flamingo.ai.devicerag.api.dto.response;

import com.flamingo.ai.devicerag.service.rag.synthesis.Citation;
import com.flamingo.ai.devicerag.service.rag.synthesis.QualityMetrics;
import com.flamingo.ai.devicerag.service.rag.synthesis.SynthesizedAnswer;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chat answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

  private String response;
  private List<Citation> sources;
  private QualityMetrics qualityMetrics;

  public static ChatResponse from(SynthesizedAnswer answer) {
    return ChatResponse.builder()
        .response(answer.answer())
        .sources(answer.citations())
        .qualityMetrics(answer.qualityMetrics())
        .build();
  }
}
