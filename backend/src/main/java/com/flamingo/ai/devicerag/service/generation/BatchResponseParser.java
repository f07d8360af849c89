package com.flamingo.ai.devicerag.service.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds batched prompts and splits batched responses back into per-item answers.
 *
 * <p>Each item is introduced by an {@code [[ITEM n]]} marker, and the model is asked to answer
 * under the same markers. A batch of one is sent without markers and its raw text is the answer.
 */
@Component
public class BatchResponseParser {

  private static final Pattern ITEM_MARKER =
      Pattern.compile("\\[\\[\\s*ITEM\\s+(\\d{1,4})\\s*]]");
  private static final Pattern NUMBERED_LINE =
      Pattern.compile("^\\s*(\\d{1,4})[.):]\\s+(.*)$");

  public String buildPrompt(String instructions, List<BatchItem> batch) {
    if (batch.size() == 1) {
      return instructions + "\n\n" + batch.get(0).content();
    }
    StringBuilder prompt = new StringBuilder(instructions);
    prompt
        .append("\n\nYou will receive ")
        .append(batch.size())
        .append(" numbered items. Handle each item independently.\n")
        .append("Begin each answer with the marker [[ITEM n]] on its own line, where n is the")
        .append(" item number, then the answer. Answer every item, in order, and write nothing")
        .append(" before the first marker.\n");
    for (int i = 0; i < batch.size(); i++) {
      prompt.append("\n[[ITEM ").append(i + 1).append("]]\n").append(batch.get(i).content());
      prompt.append('\n');
    }
    return prompt.toString();
  }

  /**
   * Splits a response into exactly {@code expected} answers.
   *
   * @return the answers in item order, or empty when the response does not map onto the items
   */
  public Optional<List<String>> parse(String response, int expected) {
    if (response == null || response.isBlank()) {
      return Optional.empty();
    }
    if (expected == 1) {
      String text = ITEM_MARKER.matcher(response).replaceAll("").strip();
      return text.isEmpty() ? Optional.empty() : Optional.of(List.of(text));
    }
    Optional<List<String>> byMarker = parseMarkers(response, expected);
    if (byMarker.isPresent()) {
      return byMarker;
    }
    return parseNumberedLines(response, expected);
  }

  private Optional<List<String>> parseMarkers(String response, int expected) {
    Matcher matcher = ITEM_MARKER.matcher(response);
    TreeMap<Integer, String> answers = new TreeMap<>();
    int previousNumber = -1;
    int previousEnd = -1;
    while (matcher.find()) {
      if (previousNumber > 0) {
        answers.putIfAbsent(
            previousNumber, response.substring(previousEnd, matcher.start()).strip());
      }
      previousNumber = Integer.parseInt(matcher.group(1));
      previousEnd = matcher.end();
    }
    if (previousNumber > 0) {
      answers.putIfAbsent(previousNumber, response.substring(previousEnd).strip());
    }
    return complete(answers, expected);
  }

  private Optional<List<String>> parseNumberedLines(String response, int expected) {
    TreeMap<Integer, String> answers = new TreeMap<>();
    for (String line : response.split("\\R")) {
      Matcher matcher = NUMBERED_LINE.matcher(line);
      if (matcher.matches()) {
        answers.putIfAbsent(Integer.parseInt(matcher.group(1)), matcher.group(2).strip());
      }
    }
    return complete(answers, expected);
  }

  private Optional<List<String>> complete(TreeMap<Integer, String> answers, int expected) {
    if (answers.size() != expected
        || answers.firstKey() != 1
        || answers.lastKey() != expected) {
      return Optional.empty();
    }
    List<String> ordered = new ArrayList<>(answers.values());
    return Optional.of(List.copyOf(ordered));
  }
}
