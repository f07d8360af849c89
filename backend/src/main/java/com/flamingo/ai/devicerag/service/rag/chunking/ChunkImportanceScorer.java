package com.flamingo.ai.devicerag.service.rag.chunking;

import com.flamingo.ai.devicerag.config.RagConfig;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Scores how likely a chunk is to carry facts a template or question needs: domain keywords,
 * identifiers such as model or certificate numbers, and named entities.
 */
@Component
@RequiredArgsConstructor
public class ChunkImportanceScorer {

  /** Tokens mixing upper-case letters and digits, e.g. OPO-101 or SN2024/17. */
  private static final Pattern IDENTIFIER =
      Pattern.compile(
          "\\b(?=[A-Z0-9/-]*\\d)(?=[A-Z0-9/-]*[A-Z])[A-Z0-9]{2,}(?:[-/][A-Z0-9]+)*\\b");

  private static final Pattern ENTITY =
      Pattern.compile(
          "\\b[A-Z][\\w&]+(?:\\s+[A-Z][\\w&]+)*\\s+(?:Inc|Ltd|LLC|GmbH|Corp|Corporation|Co|Pvt"
              + "|Limited|AG|SA)\\b\\.?"
              + "|\\b(?:Dr|Mr|Mrs|Ms|Prof)\\.?\\s+[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?"
              + "|\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)+\\b");

  private final RagConfig ragConfig;

  /** Word-bounded patterns compiled for one keyword list. */
  private record KeywordPatterns(List<String> keywords, List<Pattern> patterns) {}

  private volatile KeywordPatterns keywordPatterns;

  /** Importance in [0, 1] together with entities per word. */
  public record Importance(double score, double entityDensity) {}

  public Importance score(String text) {
    if (text == null || text.isBlank()) {
      return new Importance(0.0, 0.0);
    }
    String lower = text.toLowerCase(Locale.ROOT);
    int words = text.strip().split("\\s+").length;

    int keywordHits = 0;
    for (Pattern keyword : keywordPatterns()) {
      if (keyword.matcher(lower).find()) {
        keywordHits++;
      }
    }
    int identifiers = count(IDENTIFIER, text);
    int entities = count(ENTITY, text);

    double score =
        0.4 * Math.min(1.0, keywordHits / 3.0)
            + 0.3 * Math.min(1.0, identifiers / 2.0)
            + 0.3 * Math.min(1.0, entities / 3.0);
    return new Importance(Math.min(1.0, score), (double) entities / Math.max(1, words));
  }

  /** Patterns for the configured keywords, recompiled only when the list changes. */
  List<Pattern> keywordPatterns() {
    List<String> keywords = ragConfig.getChunking().getDomainKeywords();
    KeywordPatterns current = keywordPatterns;
    if (current == null || !current.keywords().equals(keywords)) {
      List<Pattern> patterns =
          keywords.stream()
              .map(k -> Pattern.compile("\\b" + Pattern.quote(k.toLowerCase(Locale.ROOT)) + "\\b"))
              .toList();
      current = new KeywordPatterns(List.copyOf(keywords), patterns);
      keywordPatterns = current;
    }
    return current.patterns();
  }

  private static int count(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
