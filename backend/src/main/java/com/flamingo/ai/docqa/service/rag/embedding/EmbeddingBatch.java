package com.flamingo.ai.docqa.service.rag.embedding;

import java.util.List;

/** Vectors for one embed call, all produced by the same provider. */
public record EmbeddingBatch(
    String modelId, int dimension, boolean degraded, List<float[]> vectors) {}
