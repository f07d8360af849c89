package com.flamingo.ai.devicerag.service.template;

import com.flamingo.ai.devicerag.service.template.model.TemplateBlock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides which template blocks take part in field detection.
 *
 * <p>The table of contents is located first; content starts at the first block after it that is
 * not itself filtered. Before that point, TOC entries, page-number or navigation lines and lines
 * repeated at least three times (running headers and footers) are excluded. Nothing after the
 * content start is excluded. Blocks are never removed from the document.
 */
@Component
@Slf4j
public class TemplateContentFilter {

  static final int REPEAT_THRESHOLD = 3;

  private static final Pattern TOC_HEADING =
      Pattern.compile("^(?:table\\s+of\\s+)?contents?$", Pattern.CASE_INSENSITIVE);
  private static final Pattern DOT_LEADER_ENTRY =
      Pattern.compile("^.*\\S.*(?:\\.{4,}|\\t)\\s*\\d{1,4}$");
  private static final Pattern NUMBERED_HEADING_ENTRY =
      Pattern.compile("^\\d{1,2}(?:\\.\\d{1,2})*\\.?\\s+\\p{L}.*?\\s+\\d{1,4}$");
  private static final Pattern PAGE_OR_NAVIGATION =
      Pattern.compile(
          "^(?:page\\s+)?\\d{1,4}(?:\\s*(?:of|/)\\s*\\d{1,4})?$"
              + "|^-\\s*\\d{1,4}\\s*-$"
              + "|^(?:back\\s+to\\s+top|next\\s+page|previous\\s+page|continued)$",
          Pattern.CASE_INSENSITIVE);

  /** Which blocks may contain fields. */
  public record Result(int contentStart, Set<Integer> excluded) {

    public Result {
      excluded = Set.copyOf(excluded);
    }

    public boolean isDetectable(int blockIndex) {
      return !excluded.contains(blockIndex);
    }
  }

  public Result filter(List<TemplateBlock> blocks) {
    Set<String> repeated = repeatedLines(blocks);

    int tocStart = locateToc(blocks);

    int tocEnd = tocStart;
    if (tocStart >= 0) {
      for (int i = tocStart + 1; i < blocks.size(); i++) {
        String text = blocks.get(i).text().strip();
        if (text.isEmpty() || isTocEntry(text) || PAGE_OR_NAVIGATION.matcher(text).matches()) {
          tocEnd = i;
        } else {
          break;
        }
      }
    }

    int contentStart = blocks.size();
    for (int i = Math.max(0, tocEnd + 1); i < blocks.size(); i++) {
      String text = blocks.get(i).text().strip();
      if (!text.isEmpty() && !isFiltered(text, repeated)) {
        contentStart = i;
        break;
      }
    }

    Set<Integer> excluded = new HashSet<>();
    for (int i = 0; i < contentStart; i++) {
      String text = blocks.get(i).text().strip();
      boolean inToc = tocStart >= 0 && i >= tocStart && i <= tocEnd;
      if (inToc || isFiltered(text, repeated)) {
        excluded.add(i);
      }
    }
    log.debug(
        "Template content starts at block {} (toc {}..{}), {} blocks excluded",
        contentStart,
        tocStart,
        tocEnd,
        excluded.size());
    return new Result(contentStart, excluded);
  }

  /** First TOC heading, or else the first run of at least two consecutive TOC entries. */
  private static int locateToc(List<TemplateBlock> blocks) {
    for (TemplateBlock block : blocks) {
      if (TOC_HEADING.matcher(block.text().strip()).matches()) {
        return block.index();
      }
    }
    for (int i = 0; i + 1 < blocks.size(); i++) {
      if (isTocEntry(blocks.get(i).text().strip())
          && isTocEntry(blocks.get(i + 1).text().strip())) {
        return i;
      }
    }
    return -1;
  }

  private boolean isFiltered(String text, Set<String> repeated) {
    return isTocEntry(text)
        || TOC_HEADING.matcher(text).matches()
        || PAGE_OR_NAVIGATION.matcher(text).matches()
        || repeated.contains(normalize(text));
  }

  static boolean isTocEntry(String text) {
    return DOT_LEADER_ENTRY.matcher(text).matches()
        || NUMBERED_HEADING_ENTRY.matcher(text).matches();
  }

  private static Set<String> repeatedLines(List<TemplateBlock> blocks) {
    Map<String, Integer> counts = new HashMap<>();
    for (TemplateBlock block : blocks) {
      String key = normalize(block.text());
      if (!key.isEmpty()) {
        counts.merge(key, 1, Integer::sum);
      }
    }
    Set<String> repeated = new HashSet<>();
    counts.forEach(
        (line, count) -> {
          if (count >= REPEAT_THRESHOLD) {
            repeated.add(line);
          }
        });
    return repeated;
  }

  private static String normalize(String text) {
    return text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
