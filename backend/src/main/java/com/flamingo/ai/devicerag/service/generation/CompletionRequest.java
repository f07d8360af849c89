package com.flamingo.ai.devicerag.service.generation;

/** A single prompt sent to the completion service. */
public record CompletionRequest(String prompt, double temperature, int maxTokens) {}
