package com.flamingo.ai.devicerag.exception;

/** Exception thrown when a filled template output reference does not resolve. */
public class FilledTemplateNotFoundException extends RuntimeException {

  private final String reference;

  public FilledTemplateNotFoundException(String reference) {
    super("Filled template not found: " + reference);
    this.reference = reference;
  }

  public String getReference() {
    return reference;
  }
}
