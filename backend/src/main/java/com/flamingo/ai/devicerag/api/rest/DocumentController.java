package com.flamingo.ai.devicerag.api.rest;

import com.flamingo.ai.devicerag.api.dto.request.TextDocumentRequest;
import com.flamingo.ai.devicerag.api.dto.response.DocumentResponse;
import com.flamingo.ai.devicerag.api.dto.response.IngestionResponse;
import com.flamingo.ai.devicerag.exception.DocumentProcessingException;
import com.flamingo.ai.devicerag.service.document.DocumentService;
import com.flamingo.ai.devicerag.service.document.DocumentService.IngestionOutcome;
import com.flamingo.ai.devicerag.service.document.SourceDocument;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for per-device document management. */
@RestController
@RequestMapping("/devices/{deviceId}/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /**
   * Ingests one or more uploaded files in parallel. Files that fail are listed in the response; if
   * every file fails, the first failure is returned as the error.
   */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestionResponse> uploadDocuments(
      @PathVariable String deviceId, @RequestParam("file") List<MultipartFile> files) {
    List<SourceDocument> sources = new ArrayList<>(files.size());
    for (MultipartFile file : files) {
      sources.add(toSource(deviceId, file));
    }
    List<IngestionOutcome> outcomes = documentService.ingestAll(sources);
    if (outcomes.stream().noneMatch(IngestionOutcome::isSuccess)) {
      throw outcomes.get(0).error();
    }
    return ResponseEntity.status(HttpStatus.CREATED).body(IngestionResponse.from(outcomes));
  }

  /** Ingests a document given as plain text. */
  @PostMapping(value = "/text", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentResponse> ingestText(
      @PathVariable String deviceId, @Valid @RequestBody TextDocumentRequest request) {
    SourceDocument source =
        new SourceDocument(
            deviceId,
            request.getFilename(),
            MediaType.TEXT_PLAIN_VALUE,
            request.getText().getBytes(StandardCharsets.UTF_8));
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(DocumentResponse.from(documentService.ingest(source)));
  }

  /** Lists the device's documents. */
  @GetMapping
  public ResponseEntity<List<DocumentResponse>> listDocuments(@PathVariable String deviceId) {
    return ResponseEntity.ok(
        documentService.listDocuments(deviceId).stream().map(DocumentResponse::from).toList());
  }

  /** Gets a document by ID. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(
      @PathVariable String deviceId, @PathVariable String documentId) {
    return ResponseEntity.ok(
        DocumentResponse.from(documentService.getDocument(deviceId, documentId)));
  }

  /** Deletes a document and its vectors. */
  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(
      @PathVariable String deviceId, @PathVariable String documentId) {
    documentService.deleteDocument(deviceId, documentId);
    return ResponseEntity.noContent().build();
  }

  private static SourceDocument toSource(String deviceId, MultipartFile file) {
    try {
      return new SourceDocument(
          deviceId, file.getOriginalFilename(), file.getContentType(), file.getBytes());
    } catch (IOException e) {
      throw new DocumentProcessingException(
          file.getOriginalFilename(), "Failed to read upload", e);
    }
  }
}
