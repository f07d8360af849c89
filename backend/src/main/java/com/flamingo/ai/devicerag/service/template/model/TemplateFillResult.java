package com.flamingo.ai.devicerag.service.template.model;

import java.util.List;
import java.util.Map;

/**
 * Result of filling a template.
 *
 * @param jobId id of the fill run, for log correlation
 * @param filledFields field name to value, in template order
 * @param missingFields names of fields left unfilled, in template order
 * @param outputReference reference of the stored filled template
 * @param fields detailed per-field outcomes
 */
public record TemplateFillResult(
    String jobId,
    Map<String, String> filledFields,
    List<String> missingFields,
    String outputReference,
    List<FieldReport> fields) {}
