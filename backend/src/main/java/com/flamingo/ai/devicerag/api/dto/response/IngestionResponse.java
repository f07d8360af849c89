package com.flamingo.ai.devicerag.api.dto.response;

import com.flamingo.ai.devicerag.service.document.DocumentService.IngestionOutcome;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a multi-file upload: the ingested documents and the files that failed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

  private List<DocumentResponse> documents;
  private List<FailedFile> failures;

  /** A file that could not be ingested. */
  public record FailedFile(String filename, String error) {}

  public static IngestionResponse from(List<IngestionOutcome> outcomes) {
    return IngestionResponse.builder()
        .documents(
            outcomes.stream()
                .filter(IngestionOutcome::isSuccess)
                .map(o -> DocumentResponse.from(o.document()))
                .toList())
        .failures(
            outcomes.stream()
                .filter(o -> !o.isSuccess())
                .map(o -> new FailedFile(o.filename(), o.error().getMessage()))
                .toList())
        .build();
  }
}
