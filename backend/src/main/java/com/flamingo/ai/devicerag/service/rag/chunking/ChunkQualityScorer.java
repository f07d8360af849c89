package com.flamingo.ai.devicerag.service.rag.chunking;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scores how usable a span of extracted text is, in [0, 1].
 *
 * <p>The score is the product of four factors: printable-character ratio, encoding-artifact
 * density, word-shape distribution and sentence structure. Clean prose scores 1.0; text with
 * replacement characters, {@code (cid:n)} glyph references or mojibake falls towards 0.
 */
@Component
public class ChunkQualityScorer {

  private static final Pattern ARTIFACT =
      Pattern.compile(
          "\\uFFFD|\\(cid:\\d+\\)"
              + "|[\\u00C2\\u00C3][\\u0080-\\u00BF]|\\u00E2\\u20AC"
              + "|[^\\p{L}\\p{N}\\s._=\\-]{4,}");
  private static final char REPLACEMENT_CHAR = '\uFFFD';
  private static final Pattern SENTENCE_MARK = Pattern.compile("[.!?:;]");
  private static final String COMMON_PUNCTUATION =
      ".,;:!?'\"()[]{}-/%&@#*+=<>_|~^`\\" + "\u00B0\u00B1\u00B5\u00A7$\u20AC\u00A3";

  public double score(String text) {
    if (text == null) {
      return 0.0;
    }
    String content = text.strip();
    if (content.isEmpty()) {
      return 0.0;
    }
    String[] words = content.split("\\s+");

    double printable = printableFactor(content);
    double artifacts = 1.0 - artifactPenalty(content, words.length);
    double shape = wordShapeFactor(words);
    double structure = structureFactor(content, words.length);

    return clamp(printable * artifacts * shape * structure);
  }

  private double printableFactor(String content) {
    int printable = 0;
    int total = 0;
    for (int i = 0; i < content.length(); i++) {
      char c = content.charAt(i);
      total++;
      if (c == REPLACEMENT_CHAR) {
        continue;
      }
      if (Character.isLetterOrDigit(c)
          || Character.isWhitespace(c)
          || COMMON_PUNCTUATION.indexOf(c) >= 0) {
        printable++;
      }
    }
    double ratio = (double) printable / total;
    return clamp((ratio - 0.5) / 0.45);
  }

  private double artifactPenalty(String content, int wordCount) {
    Matcher matcher = ARTIFACT.matcher(content);
    int matches = 0;
    while (matcher.find()) {
      matches++;
    }
    double density = (double) matches / Math.max(1, wordCount);
    return Math.min(1.0, density * 5);
  }

  private double wordShapeFactor(String[] words) {
    int counted = 0;
    int totalLength = 0;
    int singleChar = 0;
    int overlong = 0;
    for (String word : words) {
      String core = word.replaceAll("[^\\p{L}\\p{N}]", "");
      if (core.isEmpty()) {
        continue;
      }
      counted++;
      totalLength += core.length();
      if (core.length() == 1) {
        singleChar++;
      }
      if (core.length() > 25) {
        overlong++;
      }
    }
    if (counted == 0) {
      return 0.0;
    }
    double average = (double) totalLength / counted;
    double factor = 1.0;
    if (average < 2.5 || average > 12) {
      factor *= 0.5;
    }
    factor *= 1.0 - Math.max(0, (double) singleChar / counted - 0.3);
    factor *= 1.0 - Math.min(1.0, 2.0 * overlong / counted);
    return clamp(factor);
  }

  private double structureFactor(String content, int wordCount) {
    if (SENTENCE_MARK.matcher(content).find() || content.indexOf('\n') >= 0) {
      return 1.0;
    }
    return wordCount < 8 ? 0.9 : 0.6;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
