package com.flamingo.ai.docqa.service.store;

import java.util.UUID;

/** Which embedding model and dimension produced the stored vectors of one document. */
public record DocumentEmbeddingInfo(UUID documentId, String modelId, int dimension) {}
