package com.flamingo.ai.devicerag.service.template.model;

import com.flamingo.ai.devicerag.service.rag.search.RetrievalResult;

/**
 * Whether a field could be filled from the device's documents.
 *
 * @param canFill true when evidence at the acceptable tier or above exists
 * @param confidence best composite evidence score
 * @param sourceCount number of distinct documents providing evidence
 * @param fieldType classified type of the field
 */
public record FieldAnalysis(
    boolean canFill, double confidence, int sourceCount, FieldType fieldType) {

  public static FieldAnalysis of(TemplateField field) {
    if (field.getEvidence() == null || field.getEvidence().isEmpty()) {
      return new FieldAnalysis(false, 0.0, 0, field.getFieldType());
    }
    int sources =
        (int)
            field.getEvidence().results().stream()
                .map(RetrievalResult::documentId)
                .distinct()
                .count();
    return new FieldAnalysis(true, field.getEvidence().bestScore(), sources, field.getFieldType());
  }
}
