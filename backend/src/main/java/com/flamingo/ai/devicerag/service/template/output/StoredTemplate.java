package com.flamingo.ai.devicerag.service.template.output;

import java.time.Instant;

/**
 * Manifest of a stored filled template.
 *
 * @param reference opaque output reference returned to the caller
 * @param deviceId device the template was filled for
 * @param filename name of the uploaded template
 * @param outputFilename name of the stored output file
 * @param mediaType media type the output is served with
 * @param createdAt time the output was written
 */
public record StoredTemplate(
    String reference,
    String deviceId,
    String filename,
    String outputFilename,
    String mediaType,
    Instant createdAt) {}
