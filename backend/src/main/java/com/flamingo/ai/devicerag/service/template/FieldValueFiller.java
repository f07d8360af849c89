package com.flamingo.ai.devicerag.service.template;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.BatchInvoker;
import com.flamingo.ai.devicerag.service.generation.BatchItem;
import com.flamingo.ai.devicerag.service.generation.InvocationOptions;
import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalResult;
import com.flamingo.ai.devicerag.service.template.model.FieldType;
import com.flamingo.ai.devicerag.service.template.model.FillSource;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import com.flamingo.ai.devicerag.service.template.strategy.FillContext;
import com.flamingo.ai.devicerag.service.template.strategy.GeneratedValueStrategy;
import com.flamingo.ai.devicerag.service.template.strategy.StrategyResult;
import com.flamingo.ai.devicerag.service.template.strategy.ValueExtractionStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts field values from retrieved evidence.
 *
 * <p>Fields with acceptable evidence are sent to the generative service in batches; each field
 * then runs through the {@link ValueExtractionStrategy} chain, which stops at the first definitive
 * result. Fields without evidence are left unfilled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FieldValueFiller {

  static final String PURPOSE = "field-fill";

  private static final String INSTRUCTIONS =
      "You extract values for a medical device regulatory template from device documentation.\n"
          + "For each item, answer with the field value only, copied from the numbered evidence."
          + " Do not explain. Do not guess. If the evidence does not contain the value, answer"
          + " exactly "
          + GeneratedValueStrategy.NOT_FOUND
          + ".";

  private static final Map<FieldType, String> TYPE_INSTRUCTIONS = new EnumMap<>(FieldType.class);

  static {
    TYPE_INSTRUCTIONS.put(FieldType.PRODUCT_NAME, "Give the product or trade name of the device.");
    TYPE_INSTRUCTIONS.put(FieldType.MANUFACTURER, "Give the legal manufacturer's company name.");
    TYPE_INSTRUCTIONS.put(
        FieldType.DOCUMENT_NUMBER, "Give the document or reference number exactly as written.");
    TYPE_INSTRUCTIONS.put(
        FieldType.MODEL_NUMBER, "Give the model or catalogue number exactly as written.");
    TYPE_INSTRUCTIONS.put(FieldType.DATE, "Give the date exactly as written in the evidence.");
    TYPE_INSTRUCTIONS.put(
        FieldType.SIGNATURE, "Give the name of the person who signed or approved the document.");
    TYPE_INSTRUCTIONS.put(FieldType.GENERIC, "Give the value of the field in a few words.");
  }

  private final BatchInvoker batchInvoker;
  private final List<ValueExtractionStrategy> strategies;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Fills every field that has evidence. Fields without a value keep {@code value == null}.
   *
   * @param fields fields whose evidence has been retrieved; updated in place
   */
  public void fill(List<TemplateField> fields) {
    List<TemplateField> answerable = new ArrayList<>();
    for (TemplateField field : fields) {
      if (field.getEvidence() != null && !field.getEvidence().isEmpty()) {
        answerable.add(field);
      }
    }
    if (answerable.isEmpty()) {
      log.info("No template field has acceptable evidence; nothing to fill");
      return;
    }

    Map<String, ItemResult> generated = generate(answerable);
    double fallbackFactor = ragConfig.getTemplate().getFallbackConfidenceFactor();
    for (TemplateField field : answerable) {
      FillContext context =
          new FillContext(field, field.getEvidence().results(), generated.get(field.getId()));
      StrategyResult result = runChain(context);
      if (result.status() != StrategyResult.Status.FOUND) {
        log.debug("No value for field '{}' ({})", field.getName(), result.status());
        meterRegistry.counter("template.fields.missing").increment();
        continue;
      }
      double best = field.getEvidence().bestScore();
      field.setValue(result.value());
      field.setFillSource(result.source());
      field.setConfidence(result.source() == FillSource.GENERATED ? best : best * fallbackFactor);
      field.setSources(
          field.getEvidence().results().stream()
              .map(RetrievalResult::filename)
              .distinct()
              .toList());
      meterRegistry
          .counter("template.fields.filled", "source", result.source().name())
          .increment();
    }
  }

  private Map<String, ItemResult> generate(List<TemplateField> fields) {
    List<BatchItem> items = new ArrayList<>(fields.size());
    for (TemplateField field : fields) {
      items.add(new BatchItem(field.getId(), describe(field)));
    }
    RagConfig.Generation generation = ragConfig.getGeneration();
    InvocationOptions options =
        InvocationOptions.of(
            PURPOSE,
            INSTRUCTIONS,
            generation.getExtractionTemperature(),
            generation.getMaxTokens());
    List<ItemResult> results = batchInvoker.invoke(items, options);
    Map<String, ItemResult> byField = new HashMap<>();
    for (int i = 0; i < fields.size(); i++) {
      byField.put(fields.get(i).getId(), results.get(i));
    }
    return byField;
  }

  private StrategyResult runChain(FillContext context) {
    for (ValueExtractionStrategy strategy : strategies) {
      StrategyResult result = strategy.extract(context);
      if (result.isDefinitive()) {
        return result;
      }
    }
    return StrategyResult.skipped();
  }

  static String describe(TemplateField field) {
    StringBuilder sb = new StringBuilder();
    sb.append("Field: ").append(field.getName()).append('\n');
    sb.append("Type: ").append(field.getFieldType()).append('\n');
    sb.append("Instruction: ").append(TYPE_INSTRUCTIONS.get(field.getFieldType())).append('\n');
    sb.append("Evidence:\n");
    List<RetrievalResult> evidence = field.getEvidence().results();
    for (int i = 0; i < evidence.size(); i++) {
      sb.append('[')
          .append(i + 1)
          .append("] ")
          .append(evidence.get(i).content().strip())
          .append('\n');
    }
    return sb.toString();
  }
}
