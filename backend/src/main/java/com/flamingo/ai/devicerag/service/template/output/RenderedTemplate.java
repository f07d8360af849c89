package com.flamingo.ai.devicerag.service.template.output;

/**
 * A filled template ready to be stored.
 *
 * @param content file content
 * @param extension file extension including the dot
 * @param mediaType media type the file is served with
 */
public record RenderedTemplate(byte[] content, String extension, String mediaType) {}
