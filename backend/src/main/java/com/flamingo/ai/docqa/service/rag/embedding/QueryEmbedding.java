package com.flamingo.ai.docqa.service.rag.embedding;

/** Embedding of a user question and the model that produced it. */
public record QueryEmbedding(String modelId, int dimension, boolean degraded, float[] vector) {}
