package com.flamingo.ai.devicerag.service.rag;

import com.flamingo.ai.devicerag.config.RagConfig;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts keyword metadata from chunk text, and merges keywords into topic lists for answers that
 * have to describe what the documents cover.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentMetadataExtractor {

  private final RagConfig ragConfig;

  // Common English stop words
  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even",
          "per", "via", "use", "used", "using", "page");

  /**
   * Extracts the top keywords from content by log-normalized term frequency. Ties are broken
   * alphabetically so the result is stable for identical input.
   *
   * @param content the text content
   * @param topN maximum number of keywords
   * @return keywords, most significant first
   */
  public List<String> extractKeywords(String content, int topN) {
    if (content == null || content.isBlank()) {
      return List.of();
    }

    List<String> tokens =
        tokenize(content.toLowerCase(Locale.ROOT)).stream()
            .filter(t -> !STOP_WORDS.contains(t))
            .collect(Collectors.toList());
    if (tokens.isEmpty()) {
      return List.of();
    }

    Map<String, Integer> tf = new HashMap<>();
    for (String token : tokens) {
      tf.merge(token, 1, Integer::sum);
    }

    Map<String, Double> scores = new HashMap<>();
    int totalTokens = tokens.size();
    for (Map.Entry<String, Integer> entry : tf.entrySet()) {
      String term = entry.getKey();
      int freq = entry.getValue();
      if (term.length() < 3 || term.chars().allMatch(Character::isDigit)) {
        continue;
      }

      double tfScore = 1 + Math.log(freq);
      double lengthBonus = term.length() >= 6 ? 1.2 : 1.0;
      // Penalty for very common terms (appear in > 10% of tokens)
      double frequency = (double) freq / totalTokens;
      double frequencyPenalty = frequency > 0.1 && totalTokens > 20 ? 0.5 : 1.0;

      scores.put(term, tfScore * lengthBonus * frequencyPenalty);
    }

    return scores.entrySet().stream()
        .sorted(
            Map.Entry.<String, Double>comparingByValue()
                .reversed()
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(topN)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  /**
   * Extracts keywords with default count from configuration.
   *
   * @param content the text content
   * @return list of keywords
   */
  public List<String> extractKeywords(String content) {
    return extractKeywords(content, ragConfig.getMetadata().getMaxKeywords());
  }

  /**
   * Merges keyword lists into a topic list ordered by how many lists mention each keyword.
   *
   * @param keywordLists keyword lists, one per chunk
   * @param limit maximum number of topics
   * @return topics, most widespread first
   */
  public List<String> mergeTopics(Collection<List<String>> keywordLists, int limit) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (List<String> keywords : keywordLists) {
      for (String keyword : keywords) {
        counts.merge(keyword, 1, Integer::sum);
      }
    }
    return counts.entrySet().stream()
        .sorted(
            Comparator.comparing(Map.Entry<String, Integer>::getValue)
                .reversed()
                .thenComparing(Map.Entry::getKey))
        .limit(limit)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  private List<String> tokenize(String text) {
    // \\p{L} = any Unicode letter, \\p{N} = any Unicode number
    String[] words = text.split("[^\\p{L}\\p{N}']+");
    return Arrays.stream(words)
        .map(w -> w.replaceAll("^'+|'+$", "")) // Remove leading/trailing apostrophes
        .filter(w -> w.length() >= 2)
        .collect(Collectors.toList());
  }
}
