package com.flamingo.ai.devicerag.service.template.model;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/** State of one template fill run. Owns its fields and is discarded when the run ends. */
@Getter
@Slf4j
public class TemplateJob {

  private final String id = UUID.randomUUID().toString();
  private final String deviceId;
  private final String filename;
  private TemplateJobState state = TemplateJobState.RAW;

  @Setter private TemplateDocument document;
  @Setter private List<TemplateField> fields = new ArrayList<>();
  @Setter private String outputReference;
  private String failureReason;

  public TemplateJob(String deviceId, String filename) {
    this.deviceId = deviceId;
    this.filename = filename;
  }

  /**
   * Moves to the next state.
   *
   * @throws IllegalStateException if {@code next} does not follow the current state
   */
  public void transitionTo(TemplateJobState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Template job " + id + " cannot move from " + state + " to " + next);
    }
    log.debug("Template job {} ({}): {} -> {}", id, filename, state, next);
    state = next;
  }

  public void fail(String reason) {
    if (state == TemplateJobState.ERROR || state == TemplateJobState.DONE) {
      return;
    }
    failureReason = reason;
    transitionTo(TemplateJobState.ERROR);
  }
}
