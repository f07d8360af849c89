package com.flamingo.ai.devicerag.service.document;

/**
 * Raw upload to ingest for one device.
 *
 * @param deviceId device namespace
 * @param filename original file name, used to recognise re-ingestion
 * @param mimeType declared content type; may be null
 * @param content raw bytes
 */
public record SourceDocument(String deviceId, String filename, String mimeType, byte[] content) {}
