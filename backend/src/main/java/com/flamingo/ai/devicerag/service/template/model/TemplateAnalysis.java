package com.flamingo.ai.devicerag.service.template.model;

import java.util.Map;

/** Field name to analysis, in template order. */
public record TemplateAnalysis(String jobId, Map<String, FieldAnalysis> fieldAnalysis) {}
