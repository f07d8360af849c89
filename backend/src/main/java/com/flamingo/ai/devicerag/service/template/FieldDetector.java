package com.flamingo.ai.devicerag.service.template;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.template.model.PatternKind;
import com.flamingo.ai.devicerag.service.template.model.TemplateBlock;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds fillable spots in template text.
 *
 * <p>Rules run per line in a fixed order and the first rule to match a span claims it; later
 * rules skip spans that overlap a claimed one. Order: missing markers, bracket placeholders,
 * colon labels with nothing after the colon, underline runs, dot leaders, date tokens.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FieldDetector {

  static final Pattern MISSING_MARKER =
      Pattern.compile(
          "\\[\\s*(?:MISSING|TO BE FILLED|TO BE COMPLETED|TBD|TBC|FILL IN"
              + "|INSERT[^\\]\\n]{0,40})\\s*]"
              + "|<\\s*(?:TBD|MISSING)\\s*>"
              + "|\\{\\s*(?:TBD|MISSING)\\s*}",
          Pattern.CASE_INSENSITIVE);
  static final Pattern BRACKET_PLACEHOLDER =
      Pattern.compile("\\[([^\\[\\]\\n]{1,60})]|\\{([^{}\\n]{1,60})}|<([^<>\\n]{1,60})>");
  static final Pattern COLON_LABEL = Pattern.compile("^\\s*(\\p{L}[^:\\n]{0,60}?)\\s*:(\\s*)$");
  static final Pattern UNDERLINE_RUN = Pattern.compile("(?<![/_])_{3,}(?![/_])");
  static final Pattern DOT_LEADER = Pattern.compile("\\.{4,}");
  static final Pattern DATE_TOKEN =
      Pattern.compile(
          "\\b(?:DD|MM)([/.-])(?:MM|DD)\\1(?:YYYY|YY)\\b"
              + "|\\bYYYY-MM-DD\\b"
              + "|(?<![_/])_{1,2}/_{1,2}/_{2,4}(?![_/])",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern LIST_NUMBERING = Pattern.compile("^(?:\\d{1,3}[.)]?|[a-z][.)])$");
  private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");
  private static final int MAX_LABEL_WORDS = 4;
  private static final int CONTEXT_LINES = 2;

  private final RagConfig ragConfig;

  /** One physical line of a block, located by block index and offset within the block text. */
  private record Line(int blockIndex, int offset, String text) {}

  /**
   * Detects fields in the blocks the content filter allows.
   *
   * @return fields in document order
   */
  public List<TemplateField> detect(
      List<TemplateBlock> blocks, TemplateContentFilter.Result filter) {
    List<Line> lines = splitLines(blocks);
    List<TemplateField> fields = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    for (int i = 0; i < lines.size(); i++) {
      Line line = lines.get(i);
      if (!filter.isDetectable(line.blockIndex()) || line.text().isBlank()) {
        continue;
      }
      for (Candidate candidate : detectInLine(line.text())) {
        String name = nameFor(candidate, line.text(), lines, i);
        int start = line.offset() + candidate.start();
        String key = name.toLowerCase(Locale.ROOT) + "@" + line.blockIndex() + ":" + start;
        if (!seen.add(key)) {
          continue;
        }
        fields.add(
            new TemplateField(
                "field-" + (fields.size() + 1),
                name,
                candidate.kind(),
                line.blockIndex(),
                start,
                line.offset() + candidate.end(),
                candidate.matched(),
                context(lines, i),
                candidate.label() != null));
      }
    }
    log.debug("Detected {} fields in {} lines", fields.size(), lines.size());
    return fields;
  }

  /** A matched span within one line. {@code label} is the text naming it, when there is any. */
  record Candidate(
      PatternKind kind, int start, int end, String matched, String label, String hint) {}

  List<Candidate> detectInLine(String line) {
    List<Candidate> candidates = new ArrayList<>();

    Matcher marker = MISSING_MARKER.matcher(line);
    while (marker.find()) {
      claim(
          candidates,
          line,
          PatternKind.MISSING_MARKER,
          marker.start(),
          marker.end(),
          strip(marker.group()));
    }

    Matcher bracket = BRACKET_PLACEHOLDER.matcher(line);
    while (bracket.find()) {
      String content = firstNonNull(bracket.group(1), bracket.group(2), bracket.group(3)).strip();
      if (!HAS_LETTER.matcher(content).find()) {
        continue;
      }
      claim(
          candidates,
          line,
          PatternKind.BRACKET_PLACEHOLDER,
          bracket.start(),
          bracket.end(),
          content);
    }

    Matcher colon = COLON_LABEL.matcher(line);
    if (colon.matches()) {
      claim(candidates, line, PatternKind.COLON_LABEL, colon.start(2), colon.end(2), null);
    }

    int signatureRun = ragConfig.getTemplate().getSignatureRunLength();
    Matcher underline = UNDERLINE_RUN.matcher(line);
    while (underline.find()) {
      String label = labelBefore(line, underline.start());
      PatternKind kind =
          underline.end() - underline.start() >= signatureRun && label == null
              ? PatternKind.SIGNATURE_LINE
              : PatternKind.UNDERLINE_SHORT;
      claim(candidates, line, kind, underline.start(), underline.end(), null);
    }

    Matcher dots = DOT_LEADER.matcher(line);
    while (dots.find()) {
      claim(candidates, line, PatternKind.DOT_LEADER, dots.start(), dots.end(), null);
    }

    Matcher date = DATE_TOKEN.matcher(line);
    while (date.find()) {
      claim(candidates, line, PatternKind.DATE_TOKEN, date.start(), date.end(), null);
    }

    candidates.sort((a, b) -> Integer.compare(a.start(), b.start()));
    return candidates;
  }

  private static void claim(
      List<Candidate> candidates, String line, PatternKind kind, int start, int end, String hint) {
    for (Candidate existing : candidates) {
      boolean overlaps =
          start < existing.end() && existing.start() < end
              || start == end && start >= existing.start() && start <= existing.end();
      if (overlaps) {
        return;
      }
    }
    candidates.add(
        new Candidate(
            kind, start, end, line.substring(start, end), labelBefore(line, start), hint));
  }

  /**
   * Last one to four words before {@code start} on the line, ignoring a trailing colon or dash and
   * anything before an earlier colon, cell separator or tab. Null when no word with a letter is
   * found.
   */
  static String labelBefore(String line, int start) {
    String prefix = line.substring(0, start);
    int separator = Math.max(prefix.lastIndexOf('|'), prefix.lastIndexOf('\t'));
    prefix = prefix.substring(separator + 1).replaceAll("[\\s:\\-]+$", "");
    int colon = prefix.lastIndexOf(':');
    if (colon >= 0) {
      prefix = prefix.substring(colon + 1);
    }
    List<String> words = new ArrayList<>();
    for (String token : prefix.strip().split("\\s+")) {
      if (!token.isEmpty() && HAS_LETTER.matcher(token).find() && !token.matches(".*_{2,}.*")) {
        words.add(token);
      } else if (!token.isEmpty()) {
        words.clear();
      }
    }
    while (!words.isEmpty() && LIST_NUMBERING.matcher(words.get(0)).matches()) {
      words.remove(0);
    }
    if (words.isEmpty()) {
      return null;
    }
    List<String> last = words.subList(Math.max(0, words.size() - MAX_LABEL_WORDS), words.size());
    return String.join(" ", last).replaceAll("^[\\p{Punct}&&[^(]]+|[\\p{Punct}&&[^.)]]+$", "");
  }

  private String nameFor(Candidate candidate, String line, List<Line> lines, int lineIndex) {
    if (candidate.kind() == PatternKind.COLON_LABEL) {
      Matcher colon = COLON_LABEL.matcher(line);
      if (colon.matches()) {
        return colon.group(1).strip();
      }
    }
    if (candidate.label() != null && !candidate.label().isBlank()) {
      return candidate.label();
    }
    return switch (candidate.kind()) {
      case SIGNATURE_LINE -> "Signature";
      case DATE_TOKEN -> "Date";
      case BRACKET_PLACEHOLDER -> candidate.hint();
      default -> {
        String previous = previousLabelLine(lines, lineIndex);
        if (previous != null) {
          yield previous;
        }
        yield candidate.hint() != null ? candidate.hint() : "Field";
      }
    };
  }

  /** The previous non-blank line when it reads like a short label. */
  private static String previousLabelLine(List<Line> lines, int lineIndex) {
    for (int i = lineIndex - 1; i >= 0; i--) {
      String text = lines.get(i).text().strip();
      if (text.isEmpty()) {
        continue;
      }
      String label = text.replaceAll("[\\s:]+$", "");
      if (HAS_LETTER.matcher(label).find() && label.split("\\s+").length <= 6) {
        return label;
      }
      return null;
    }
    return null;
  }

  private static String context(List<Line> lines, int index) {
    int from = Math.max(0, index - CONTEXT_LINES);
    int to = Math.min(lines.size(), index + CONTEXT_LINES + 1);
    StringBuilder sb = new StringBuilder();
    for (int i = from; i < to; i++) {
      String text = lines.get(i).text().strip();
      if (!text.isEmpty()) {
        if (sb.length() > 0) {
          sb.append('\n');
        }
        sb.append(text);
      }
    }
    return sb.toString();
  }

  private static List<Line> splitLines(List<TemplateBlock> blocks) {
    List<Line> lines = new ArrayList<>();
    for (TemplateBlock block : blocks) {
      String text = block.text();
      int offset = 0;
      for (String part : text.split("\n", -1)) {
        lines.add(new Line(block.index(), offset, part));
        offset += part.length() + 1;
      }
    }
    return lines;
  }

  private static String strip(String marker) {
    return marker.substring(1, marker.length() - 1).strip();
  }

  private static String firstNonNull(String... values) {
    for (String value : values) {
      if (value != null) {
        return value;
      }
    }
    return "";
  }
}
