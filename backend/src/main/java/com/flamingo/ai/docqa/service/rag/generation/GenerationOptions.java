package com.flamingo.ai.docqa.service.rag.generation;

/** Sampling parameters for one completion. */
public record GenerationOptions(double temperature, int maxTokens) {}
