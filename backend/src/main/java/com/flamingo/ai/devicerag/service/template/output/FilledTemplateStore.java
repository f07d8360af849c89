package com.flamingo.ai.devicerag.service.template.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.exception.FilledTemplateNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stores filled templates under the configured output directory.
 *
 * <p>Each output is written as {@code {reference}_{name}{extension}} next to a
 * {@code {reference}.json} manifest that records its media type. References are random UUIDs,
 * so a reference can never resolve outside the directory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FilledTemplateStore {

  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Writes a filled template.
   *
   * @return the output reference
   */
  public String store(String deviceId, String filename, RenderedTemplate output) {
    String reference = UUID.randomUUID().toString();
    String outputFilename = reference + "_" + baseName(filename) + output.extension();
    StoredTemplate manifest =
        new StoredTemplate(
            reference, deviceId, filename, outputFilename, output.mediaType(), clock.instant());
    try {
      Path dir = Files.createDirectories(outputDir());
      Files.write(dir.resolve(outputFilename), output.content());
      objectMapper.writeValue(dir.resolve(reference + ".json").toFile(), manifest);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to store filled template " + filename, e);
    }
    log.info("Stored filled template {} as {}", filename, outputFilename);
    return reference;
  }

  /** Looks up a stored output's manifest. */
  public StoredTemplate resolve(String reference) {
    Path manifest = outputDir().resolve(validated(reference) + ".json");
    if (!Files.isRegularFile(manifest)) {
      throw new FilledTemplateNotFoundException(reference);
    }
    try {
      return objectMapper.readValue(manifest.toFile(), StoredTemplate.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read manifest for " + reference, e);
    }
  }

  /** Reads a stored output's content. */
  public byte[] read(String reference) {
    StoredTemplate stored = resolve(reference);
    Path file = outputDir().resolve(stored.outputFilename());
    if (!Files.isRegularFile(file)) {
      throw new FilledTemplateNotFoundException(reference);
    }
    try {
      return Files.readAllBytes(file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read filled template " + reference, e);
    }
  }

  private Path outputDir() {
    return Path.of(ragConfig.getTemplate().getOutputDir());
  }

  private static String validated(String reference) {
    try {
      return UUID.fromString(reference).toString();
    } catch (IllegalArgumentException e) {
      throw new FilledTemplateNotFoundException(reference);
    }
  }

  static String baseName(String filename) {
    String name = filename == null ? "template" : Path.of(filename).getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot > 0) {
      name = name.substring(0, dot);
    }
    name = name.replaceAll("[^A-Za-z0-9._-]+", "_");
    return name.isEmpty() ? "template" : name;
  }
}
