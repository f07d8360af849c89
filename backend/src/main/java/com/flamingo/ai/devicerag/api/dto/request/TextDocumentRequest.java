package com.flamingo.ai.devicerag.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a document given as plain text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextDocumentRequest {

  @NotBlank(message = "Filename is required")
  private String filename;

  @NotBlank(message = "Text is required")
  private String text;
}
