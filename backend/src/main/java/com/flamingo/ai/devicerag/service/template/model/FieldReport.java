package com.flamingo.ai.devicerag.service.template.model;

import java.util.List;

/**
 * Per-field outcome of a fill run.
 *
 * @param name unique field name within the template
 * @param value filled value, or null when the field is missing
 * @param confidence best evidence score, scaled down for fallback sources
 * @param fillSource how the value was obtained, or null when missing
 * @param sources distinct filenames of the evidence
 */
public record FieldReport(
    String id,
    String name,
    FieldType fieldType,
    PatternKind patternKind,
    String value,
    double confidence,
    FillSource fillSource,
    List<String> sources) {

  public static FieldReport of(String name, TemplateField field) {
    return new FieldReport(
        field.getId(),
        name,
        field.getFieldType(),
        field.getPatternKind(),
        field.getValue(),
        field.getConfidence(),
        field.getFillSource(),
        field.getSources());
  }
}
