package com.flamingo.ai.devicerag.service.rag.query;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.BatchInvoker;
import com.flamingo.ai.devicerag.service.generation.InvocationOptions;
import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.generation.ItemStatus;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class QueryExpansionServiceImpl implements QueryExpansionService {

  static final String PURPOSE = "query-expansion";

  private static final String INSTRUCTIONS_TEMPLATE =
      "You rewrite search queries used to retrieve passages from medical device documentation"
          + " (certificates, manuals, labels, declarations).\n"
          + "For the query, write %d alternative phrasings that keep its meaning but use different"
          + " wording or domain terms such as device, product, equipment, model or manufacturer.\n"
          + "Write one phrasing per line, with no numbering, quotes or commentary.";

  private static final Pattern LIST_PREFIX =
      Pattern.compile("^\\s*(?:[-*\\u2022]|\\d{1,2}[.)])\\s*");
  private static final Pattern LEADING_WH =
      Pattern.compile("^(what|which)\\b\\s*", Pattern.CASE_INSENSITIVE);
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[?.!\\s]+$");

  private static final Map<Pattern, List<String>> DOMAIN_SYNONYMS = new LinkedHashMap<>();

  static {
    DOMAIN_SYNONYMS.put(word("device"), List.of("product", "equipment", "system"));
    DOMAIN_SYNONYMS.put(word("manufacturer"), List.of("maker", "producer"));
  }

  private final BatchInvoker batchInvoker;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.query_expansion", description = "Time to expand a query")
  public List<String> expand(String query, List<String> history) {
    int count = ragConfig.getRetrieval().getVariationCount();
    if (count <= 1) {
      return List.of(query);
    }
    String content = withHistory(query, history);
    InvocationOptions options = options(count).withFallback(item -> heuristicText(query));
    ItemResult result = batchInvoker.invokeSingle("q0", content, options);
    return assemble(query, result, count);
  }

  @Override
  public List<String> heuristicVariations(String query) {
    String core = TRAILING_PUNCTUATION.matcher(query.strip()).replaceAll("");
    List<String> variations = new ArrayList<>();

    Matcher wh = LEADING_WH.matcher(core);
    if (wh.find()) {
      String swapped = wh.group(1).equalsIgnoreCase("what") ? "Which" : "What";
      variations.add(swapped + " " + core.substring(wh.end()) + "?");
    }

    for (Map.Entry<Pattern, List<String>> entry : DOMAIN_SYNONYMS.entrySet()) {
      Pattern word = entry.getKey();
      if (word.matcher(core).find()) {
        for (String synonym : entry.getValue()) {
          variations.add(word.matcher(core).replaceAll(synonym));
        }
      }
    }

    String subject = LEADING_WH.matcher(core).replaceFirst("");
    variations.add("Find information about " + subject);
    variations.add("Details on " + subject);
    return variations;
  }

  private InvocationOptions options(int count) {
    RagConfig.Generation generation = ragConfig.getGeneration();
    return InvocationOptions.of(
        PURPOSE,
        String.format(INSTRUCTIONS_TEMPLATE, count - 1),
        generation.getExpansionTemperature(),
        generation.getMaxTokens());
  }

  private String withHistory(String query, List<String> history) {
    if (history == null || history.isEmpty()) {
      return "Query: " + query;
    }
    int window = ragConfig.getRetrieval().getHistoryWindow();
    List<String> recent = history.subList(Math.max(0, history.size() - window), history.size());
    return "Conversation context (most recent last):\n"
        + String.join("\n", recent)
        + "\n\nQuery: "
        + query;
  }

  private static Pattern word(String word) {
    return Pattern.compile("\\b" + word + "\\b", Pattern.CASE_INSENSITIVE);
  }

  private String heuristicText(String query) {
    return String.join("\n", heuristicVariations(query));
  }

  /** Original first, then generated lines, then heuristics until {@code count} is reached. */
  private List<String> assemble(String query, ItemResult result, int count) {
    Map<String, String> unique = new LinkedHashMap<>();
    unique.put(key(query), query);

    if (result.value() != null) {
      if (result.status() == ItemStatus.FALLBACK) {
        meterRegistry.counter("rag.query_expansion.fallback", "reason", "parse").increment();
      }
      addLines(unique, result.value(), count);
    } else {
      log.warn("Query expansion failed ({}), using heuristic variations", result.status());
      String reason = result.status().name().toLowerCase(Locale.ROOT);
      meterRegistry.counter("rag.query_expansion.fallback", "reason", reason).increment();
    }
    for (String heuristic : heuristicVariations(query)) {
      if (unique.size() >= count) {
        break;
      }
      unique.putIfAbsent(key(heuristic), heuristic);
    }
    return List.copyOf(unique.values());
  }

  private void addLines(Map<String, String> unique, String text, int count) {
    int maxLength = ragConfig.getRetrieval().getMaxQueryLength();
    for (String line : text.split("\\R")) {
      if (unique.size() >= count) {
        return;
      }
      String cleaned = LIST_PREFIX.matcher(line).replaceFirst("").strip();
      cleaned = cleaned.replaceAll("^[\"']+|[\"']+$", "").strip();
      if (cleaned.isEmpty() || cleaned.length() > maxLength || cleaned.startsWith("[[")) {
        continue;
      }
      unique.putIfAbsent(key(cleaned), cleaned);
    }
  }

  private static String key(String variation) {
    return variation.strip().toLowerCase(Locale.ROOT);
  }
}
