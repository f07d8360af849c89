package com.flamingo.ai.devicerag.exception;

/** Exception thrown when a document is not registered for a device. */
public class DocumentNotFoundException extends RuntimeException {

  private final String deviceId;
  private final String documentId;

  public DocumentNotFoundException(String deviceId, String documentId) {
    super("Document not found: " + documentId + " (device " + deviceId + ")");
    this.deviceId = deviceId;
    this.documentId = documentId;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
