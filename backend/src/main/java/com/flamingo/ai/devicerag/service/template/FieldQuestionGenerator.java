package com.flamingo.ai.devicerag.service.template;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.BatchInvoker;
import com.flamingo.ai.devicerag.service.generation.BatchItem;
import com.flamingo.ai.devicerag.service.generation.InvocationOptions;
import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.template.model.FieldType;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes search questions for template fields with one generation call covering all fields. A
 * field's search variations are its label followed by its questions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FieldQuestionGenerator {

  static final String PURPOSE = "field-questions";

  private static final String INSTRUCTIONS_TEMPLATE =
      "You prepare document searches for filling a medical device regulatory template.\n"
          + "For each template field, write up to %d short questions that would find the field's"
          + " value in the device documentation. Write one question per line, with no numbering"
          + " or commentary.";

  private static final Map<FieldType, List<String>> TYPE_QUESTIONS = new EnumMap<>(FieldType.class);

  static {
    TYPE_QUESTIONS.put(
        FieldType.PRODUCT_NAME,
        List.of(
            "What is the product name of the device?",
            "What is the trade name or brand name of the device?"));
    TYPE_QUESTIONS.put(
        FieldType.MANUFACTURER,
        List.of(
            "Who is the manufacturer of the device?",
            "Which company manufactures the device?"));
    TYPE_QUESTIONS.put(
        FieldType.DOCUMENT_NUMBER,
        List.of("What is the document number?", "What is the document reference number?"));
    TYPE_QUESTIONS.put(
        FieldType.MODEL_NUMBER,
        List.of(
            "What is the model number of the device?",
            "What is the catalogue or part number of the device?"));
    TYPE_QUESTIONS.put(
        FieldType.DATE, List.of("When was the document issued?", "What is the date of approval?"));
    TYPE_QUESTIONS.put(
        FieldType.SIGNATURE,
        List.of("Who signed the document?", "Who is the authorized signatory?"));
    TYPE_QUESTIONS.put(FieldType.GENERIC, List.of());
  }

  private final BatchInvoker batchInvoker;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Sets the search variations of every field.
   *
   * @param fields classified fields; updated in place
   */
  public void generate(List<TemplateField> fields) {
    if (fields.isEmpty()) {
      return;
    }
    int maxQuestions = ragConfig.getTemplate().getMaxQuestionsPerField();
    List<BatchItem> items = new ArrayList<>(fields.size());
    for (TemplateField field : fields) {
      items.add(new BatchItem(field.getId(), describe(field)));
    }
    RagConfig.Generation generation = ragConfig.getGeneration();
    InvocationOptions options =
        InvocationOptions.of(
                PURPOSE,
                String.format(INSTRUCTIONS_TEMPLATE, maxQuestions),
                generation.getExpansionTemperature(),
                generation.getMaxTokens())
            .inSingleBatch();
    List<ItemResult> results = batchInvoker.invoke(items, options);

    for (int i = 0; i < fields.size(); i++) {
      TemplateField field = fields.get(i);
      ItemResult result = results.get(i);
      List<String> questions;
      if (result.isSuccess()) {
        questions = parseQuestions(result.value(), maxQuestions);
      } else {
        log.debug("No generated questions for '{}' ({})", field.getName(), result.status());
        meterRegistry.counter("template.questions.fallback").increment();
        questions = List.of();
      }
      if (questions.isEmpty()) {
        questions = fallbackQuestions(field, maxQuestions);
      }
      field.setVariations(variations(field, questions));
    }
  }

  /** Type templates, then the generic "What is", "Find" and "details" phrasings. */
  List<String> fallbackQuestions(TemplateField field, int maxQuestions) {
    List<String> candidates = new ArrayList<>(TYPE_QUESTIONS.get(field.getFieldType()));
    candidates.add("What is the " + field.getName() + "?");
    candidates.add("Find " + field.getName() + " information");
    candidates.add(field.getName() + " details");
    return dedupe(candidates).stream().limit(maxQuestions).toList();
  }

  private static String describe(TemplateField field) {
    return "Field: "
        + field.getName()
        + "\nType: "
        + field.getFieldType()
        + "\nContext:\n"
        + field.getContext();
  }

  private static List<String> parseQuestions(String text, int maxQuestions) {
    List<String> questions = new ArrayList<>();
    for (String line : text.split("\\R")) {
      String cleaned =
          line.replaceFirst("^\\s*(?:[-*]|\\d{1,2}[.)])\\s*", "")
              .replaceAll("^[\"']+|[\"']+$", "")
              .strip();
      if (!cleaned.isEmpty()) {
        questions.add(cleaned);
      }
    }
    return dedupe(questions).stream().limit(maxQuestions).toList();
  }

  private static List<String> variations(TemplateField field, List<String> questions) {
    List<String> all = new ArrayList<>();
    all.add(field.getName());
    all.addAll(questions);
    return dedupe(all);
  }

  private static List<String> dedupe(List<String> values) {
    Map<String, String> unique = new LinkedHashMap<>();
    for (String value : values) {
      unique.putIfAbsent(value.strip().toLowerCase(Locale.ROOT), value.strip());
    }
    return List.copyOf(unique.values());
  }
}
