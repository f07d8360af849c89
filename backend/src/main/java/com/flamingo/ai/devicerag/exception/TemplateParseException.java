package com.flamingo.ai.devicerag.exception;

/**
 * Exception thrown when a template document cannot be parsed into blocks. Fatal for the fill job
 * that hit it: no partial output is produced.
 */
public class TemplateParseException extends RuntimeException {

  private final String filename;
  private final String userMessage;

  public TemplateParseException(String filename, String message, Throwable cause) {
    super(message, cause);
    this.filename = filename;
    this.userMessage = "The template could not be read. Please check the file format.";
  }

  public TemplateParseException(String filename, String message) {
    super(message);
    this.filename = filename;
    this.userMessage = "The template could not be read. Please check the file format.";
  }

  public String getFilename() {
    return filename;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
