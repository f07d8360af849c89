package com.flamingo.ai.devicerag.service.template.model;

/** Semantic type of a template field. */
public enum FieldType {
  PRODUCT_NAME,
  MANUFACTURER,
  DOCUMENT_NUMBER,
  MODEL_NUMBER,
  DATE,
  SIGNATURE,
  GENERIC
}
