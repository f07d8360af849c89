package com.flamingo.ai.devicerag.api.dto.response;

import com.flamingo.ai.devicerag.domain.model.Document;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private String id;
  private String deviceId;
  private String filename;
  private int chunkCount;
  private int rejectedChunkCount;
  private boolean processed;
  private Instant ingestedAt;

  public static DocumentResponse from(Document document) {
    return DocumentResponse.builder()
        .id(document.id())
        .deviceId(document.deviceId())
        .filename(document.filename())
        .chunkCount(document.chunkIds().size())
        .rejectedChunkCount(document.rejectedChunkCount())
        .processed(document.processed())
        .ingestedAt(document.ingestedAt())
        .build();
  }
}
