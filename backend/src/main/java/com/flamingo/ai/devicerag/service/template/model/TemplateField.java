package com.flamingo.ai.devicerag.service.template.model;

import com.flamingo.ai.devicerag.service.rag.search.RetrievalOutcome;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * A fillable spot in a template. Detection sets the position and pattern; later job steps set the
 * type, questions, evidence and value.
 */
@Getter
public class TemplateField {

  private final String id;
  private final String name;
  private final PatternKind patternKind;
  private final int blockIndex;
  private final int start;
  private final int end;

  /** Text matched by the detection rule, e.g. the underline run or the bracket. */
  private final String matchedText;

  /** Up to two lines either side of the field. */
  private final String context;

  /** True when the name came from label text next to the field. */
  private final boolean labelled;

  @Setter private FieldType fieldType = FieldType.GENERIC;
  @Setter private List<String> variations = List.of();
  @Setter private RetrievalOutcome evidence;
  @Setter private String value;
  @Setter private double confidence;
  @Setter private FillSource fillSource;
  @Setter private List<String> sources = List.of();

  public TemplateField(
      String id,
      String name,
      PatternKind patternKind,
      int blockIndex,
      int start,
      int end,
      String matchedText,
      String context,
      boolean labelled) {
    this.id = id;
    this.name = name;
    this.patternKind = patternKind;
    this.blockIndex = blockIndex;
    this.start = start;
    this.end = end;
    this.matchedText = matchedText;
    this.context = context;
    this.labelled = labelled;
  }

  public boolean isFilled() {
    return value != null;
  }

  public int width() {
    return end - start;
  }

  @Override
  public String toString() {
    return "TemplateField{" + id + " '" + name + "' " + patternKind + " @" + blockIndex + ":"
        + start + "}";
  }
}
