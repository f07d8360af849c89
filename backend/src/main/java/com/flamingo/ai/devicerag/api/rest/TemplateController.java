package com.flamingo.ai.devicerag.api.rest;

import com.flamingo.ai.devicerag.exception.TemplateParseException;
import com.flamingo.ai.devicerag.service.template.TemplateFillService;
import com.flamingo.ai.devicerag.service.template.model.TemplateAnalysis;
import com.flamingo.ai.devicerag.service.template.model.TemplateFillResult;
import com.flamingo.ai.devicerag.service.template.output.FilledTemplateStore;
import com.flamingo.ai.devicerag.service.template.output.StoredTemplate;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for template analysis, filling and output download. */
@RestController
@RequiredArgsConstructor
public class TemplateController {

  private final TemplateFillService templateFillService;
  private final FilledTemplateStore filledTemplateStore;

  /** Reports which template fields the device's documents can fill. */
  @PostMapping(
      value = "/devices/{deviceId}/templates/analyze",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<TemplateAnalysis> analyze(
      @PathVariable String deviceId, @RequestParam("file") MultipartFile file) {
    return ResponseEntity.ok(
        templateFillService.analyze(
            deviceId, file.getOriginalFilename(), file.getContentType(), read(file)));
  }

  /** Fills a template and stores the output. */
  @PostMapping(
      value = "/devices/{deviceId}/templates/fill",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<TemplateFillResult> fill(
      @PathVariable String deviceId, @RequestParam("file") MultipartFile file) {
    return ResponseEntity.ok(
        templateFillService.fill(
            deviceId, file.getOriginalFilename(), file.getContentType(), read(file)));
  }

  /** Downloads a filled template in the format it was uploaded in, or as text. */
  @GetMapping("/templates/output/{reference}")
  public ResponseEntity<byte[]> download(@PathVariable String reference) {
    StoredTemplate stored = filledTemplateStore.resolve(reference);
    byte[] content = filledTemplateStore.read(reference);
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(stored.outputFilename(), StandardCharsets.UTF_8)
                .build()
                .toString())
        .contentType(MediaType.parseMediaType(stored.mediaType()))
        .body(content);
  }

  private static byte[] read(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new TemplateParseException(file.getOriginalFilename(), "Failed to read upload", e);
    }
  }
}
