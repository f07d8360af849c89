package com.flamingo.ai.devicerag.service.template;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.exception.TemplateParseException;
import com.flamingo.ai.devicerag.service.rag.search.MultiQueryRetriever;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalOutcome;
import com.flamingo.ai.devicerag.service.template.model.FieldAnalysis;
import com.flamingo.ai.devicerag.service.template.model.FieldReport;
import com.flamingo.ai.devicerag.service.template.model.TemplateAnalysis;
import com.flamingo.ai.devicerag.service.template.model.TemplateDocument;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import com.flamingo.ai.devicerag.service.template.model.TemplateFillResult;
import com.flamingo.ai.devicerag.service.template.model.TemplateJob;
import com.flamingo.ai.devicerag.service.template.model.TemplateJobState;
import com.flamingo.ai.devicerag.service.template.output.FilledTemplateStore;
import com.flamingo.ai.devicerag.service.template.output.RenderedTemplate;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs template jobs through their states: parse and filter the template, detect and classify
 * fields, generate questions, retrieve evidence per field, fill values and write them back.
 *
 * <p>Only a template that cannot be parsed ends a job in ERROR; an unavailable generative service
 * degrades individual fields instead.
 */
@Service
@Slf4j
public class TemplateFillService {

  private final TemplateParser parser;
  private final TemplateContentFilter contentFilter;
  private final FieldDetector fieldDetector;
  private final FieldClassifier fieldClassifier;
  private final FieldQuestionGenerator questionGenerator;
  private final MultiQueryRetriever retriever;
  private final FieldValueFiller valueFiller;
  private final TemplateReconstructor reconstructor;
  private final FilledTemplateStore store;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor fieldExecutor;

  public TemplateFillService(
      TemplateParser parser,
      TemplateContentFilter contentFilter,
      FieldDetector fieldDetector,
      FieldClassifier fieldClassifier,
      FieldQuestionGenerator questionGenerator,
      MultiQueryRetriever retriever,
      FieldValueFiller valueFiller,
      TemplateReconstructor reconstructor,
      FilledTemplateStore store,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("templateFieldExecutor") Executor fieldExecutor) {
    this.parser = parser;
    this.contentFilter = contentFilter;
    this.fieldDetector = fieldDetector;
    this.fieldClassifier = fieldClassifier;
    this.questionGenerator = questionGenerator;
    this.retriever = retriever;
    this.valueFiller = valueFiller;
    this.reconstructor = reconstructor;
    this.store = store;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.fieldExecutor = fieldExecutor;
  }

  /**
   * Fills a template from the device's documents and stores the result.
   *
   * @throws TemplateParseException if the template cannot be parsed
   */
  @Timed(value = "template.fill", description = "Time to fill a template")
  public TemplateFillResult fill(
      String deviceId, String filename, String mimeType, byte[] content) {
    TemplateJob job = new TemplateJob(deviceId, filename);
    log.info("Template job {}: filling {} for device {}", job.getId(), filename, deviceId);
    try {
      prepare(job, mimeType, content);

      valueFiller.fill(job.getFields());
      job.transitionTo(TemplateJobState.FILLED);

      RenderedTemplate output = reconstructor.render(job.getDocument(), job.getFields());
      job.setDocument(reconstructor.reconstruct(job.getDocument(), job.getFields()));
      job.transitionTo(TemplateJobState.RECONSTRUCTED);

      job.setOutputReference(store.store(deviceId, filename, output));
      job.transitionTo(TemplateJobState.DONE);
    } catch (RuntimeException e) {
      fail(job, e);
      throw e;
    }

    TemplateFillResult result = toResult(job);
    meterRegistry.counter("template.jobs", "operation", "fill", "outcome", "done").increment();
    log.info(
        "Template job {}: filled {} of {} fields, output {}",
        job.getId(),
        result.filledFields().size(),
        job.getFields().size(),
        job.getOutputReference());
    return result;
  }

  /**
   * Reports which fields could be filled without generating values.
   *
   * @throws TemplateParseException if the template cannot be parsed
   */
  @Timed(value = "template.analyze", description = "Time to analyze a template")
  public TemplateAnalysis analyze(
      String deviceId, String filename, String mimeType, byte[] content) {
    TemplateJob job = new TemplateJob(deviceId, filename);
    log.info("Template job {}: analyzing {} for device {}", job.getId(), filename, deviceId);
    try {
      prepare(job, mimeType, content);
    } catch (RuntimeException e) {
      fail(job, e);
      throw e;
    }
    Map<String, FieldAnalysis> analysis = new LinkedHashMap<>();
    Map<TemplateField, String> names = uniqueNames(job.getFields());
    for (TemplateField field : job.getFields()) {
      analysis.put(names.get(field), FieldAnalysis.of(field));
    }
    meterRegistry.counter("template.jobs", "operation", "analyze", "outcome", "done").increment();
    return new TemplateAnalysis(job.getId(), analysis);
  }

  /** Runs a job from RAW through RETRIEVED. */
  private void prepare(TemplateJob job, String mimeType, byte[] content) {
    TemplateDocument document = parser.parse(job.getFilename(), mimeType, content);
    job.setDocument(document);

    TemplateContentFilter.Result filter = contentFilter.filter(document.blocks());
    job.transitionTo(TemplateJobState.FILTERED);

    job.setFields(fieldDetector.detect(document.blocks(), filter));
    job.transitionTo(TemplateJobState.FIELDS_DETECTED);
    log.debug("Template job {}: {} fields detected", job.getId(), job.getFields().size());

    fieldClassifier.classifyAll(job.getFields());
    job.transitionTo(TemplateJobState.FIELDS_CLASSIFIED);

    questionGenerator.generate(job.getFields());
    job.transitionTo(TemplateJobState.QUESTIONS_GENERATED);

    retrieveEvidence(job);
    job.transitionTo(TemplateJobState.RETRIEVED);
  }

  private void retrieveEvidence(TemplateJob job) {
    int evidencePerField = ragConfig.getTemplate().getEvidencePerField();
    List<CompletableFuture<Void>> futures = new ArrayList<>();
    for (TemplateField field : job.getFields()) {
      futures.add(
          CompletableFuture.supplyAsync(
                  () ->
                      retriever.search(
                          field.getVariations(), job.getDeviceId(), evidencePerField),
                  fieldExecutor)
              .exceptionally(
                  ex -> {
                    log.warn(
                        "Template job {}: retrieval failed for field '{}': {}",
                        job.getId(),
                        field.getName(),
                        ex.getMessage());
                    return RetrievalOutcome.empty(field.getVariations());
                  })
              .thenAccept(field::setEvidence));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
  }

  private void fail(TemplateJob job, RuntimeException e) {
    job.fail(e.getMessage());
    meterRegistry
        .counter(
            "template.jobs",
            "operation",
            "any",
            "outcome",
            e instanceof TemplateParseException ? "parse_error" : "error")
        .increment();
    if (e instanceof TemplateParseException) {
      log.warn("Template job {}: {} could not be parsed", job.getId(), job.getFilename());
    } else {
      log.error("Template job {}: failed for {}", job.getId(), job.getFilename(), e);
    }
  }

  private TemplateFillResult toResult(TemplateJob job) {
    Map<TemplateField, String> names = uniqueNames(job.getFields());
    Map<String, String> filled = new LinkedHashMap<>();
    List<String> missing = new ArrayList<>();
    List<FieldReport> reports = new ArrayList<>();
    for (TemplateField field : job.getFields()) {
      String name = names.get(field);
      if (field.isFilled()) {
        filled.put(name, field.getValue());
      } else {
        missing.add(name);
      }
      reports.add(FieldReport.of(name, field));
    }
    return new TemplateFillResult(
        job.getId(), filled, List.copyOf(missing), job.getOutputReference(), reports);
  }

  /** Field names, with " (2)", " (3)" and so on appended to repeats. */
  static Map<TemplateField, String> uniqueNames(List<TemplateField> fields) {
    Map<TemplateField, String> names = new HashMap<>();
    Map<String, Integer> counts = new HashMap<>();
    for (TemplateField field : fields) {
      int count = counts.merge(field.getName(), 1, Integer::sum);
      names.put(field, count == 1 ? field.getName() : field.getName() + " (" + count + ")");
    }
    return names;
  }
}
