package com.flamingo.ai.devicerag.service.document;

import com.flamingo.ai.devicerag.domain.model.Document;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** In-memory registry of ingested documents, keyed by device and then document id. */
@Component
public class DocumentRegistry {

  private final Map<String, Map<String, Document>> documentsByDevice = new ConcurrentHashMap<>();

  /**
   * Stable id for a file within a device. Uploading the same file name again yields the same id,
   * which makes the upload a re-ingestion.
   */
  public String documentIdFor(String deviceId, String filename) {
    return UUID.nameUUIDFromBytes((deviceId + "/" + filename).getBytes(StandardCharsets.UTF_8))
        .toString();
  }

  public void save(Document document) {
    documentsByDevice
        .computeIfAbsent(document.deviceId(), d -> new ConcurrentHashMap<>())
        .put(document.id(), document);
  }

  public Optional<Document> find(String deviceId, String documentId) {
    Map<String, Document> documents = documentsByDevice.get(deviceId);
    return documents == null ? Optional.empty() : Optional.ofNullable(documents.get(documentId));
  }

  /** Documents of a device, oldest first. */
  public List<Document> list(String deviceId) {
    Map<String, Document> documents = documentsByDevice.get(deviceId);
    if (documents == null) {
      return List.of();
    }
    return documents.values().stream()
        .sorted(Comparator.comparing(Document::ingestedAt).thenComparing(Document::id))
        .collect(Collectors.toList());
  }

  public Optional<Document> remove(String deviceId, String documentId) {
    Map<String, Document> documents = documentsByDevice.get(deviceId);
    return documents == null ? Optional.empty() : Optional.ofNullable(documents.remove(documentId));
  }
}
