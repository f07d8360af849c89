package com.flamingo.ai.devicerag.vectorstore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Process-local {@link VectorStore} keeping one map per namespace and scoring by cosine
 * similarity. Used for local runs without Elasticsearch.
 */
@Service
@ConditionalOnProperty(name = "rag.vector-store.type", havingValue = "memory")
@Slf4j
public class InMemoryVectorStore implements VectorStore {

  private final Map<String, Map<String, VectorRecord>> namespaces = new ConcurrentHashMap<>();

  @Override
  public void upsert(List<VectorRecord> records, String namespace) {
    Map<String, VectorRecord> partition =
        namespaces.computeIfAbsent(namespace, key -> new ConcurrentHashMap<>());
    for (VectorRecord record : records) {
      partition.put(record.chunkId(), record);
    }
    log.debug("Upserted {} vectors into namespace {}", records.size(), namespace);
  }

  @Override
  public List<VectorMatch> query(List<Float> embedding, String namespace, int topK) {
    Map<String, VectorRecord> partition = namespaces.get(namespace);
    if (partition == null || embedding.isEmpty()) {
      return List.of();
    }
    List<VectorMatch> matches = new ArrayList<>();
    for (VectorRecord record : partition.values()) {
      double score = Math.max(0.0, cosine(embedding, record.embedding()));
      matches.add(new VectorMatch(record.chunkId(), score, record.metadata()));
    }
    return matches.stream()
        .sorted(
            Comparator.comparingDouble(VectorMatch::score)
                .reversed()
                .thenComparing(VectorMatch::chunkId))
        .limit(topK)
        .collect(Collectors.toList());
  }

  @Override
  public void deleteDocument(String documentId, String namespace) {
    Map<String, VectorRecord> partition = namespaces.get(namespace);
    if (partition != null) {
      partition.values().removeIf(r -> documentId.equals(r.metadata().documentId()));
    }
  }

  static double cosine(List<Float> a, List<Float> b) {
    int size = Math.min(a.size(), b.size());
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < size; i++) {
      dot += a.get(i) * b.get(i);
      normA += a.get(i) * a.get(i);
      normB += b.get(i) * b.get(i);
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
