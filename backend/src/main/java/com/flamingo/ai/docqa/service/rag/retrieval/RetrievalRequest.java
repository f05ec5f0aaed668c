package com.flamingo.ai.docqa.service.rag.retrieval;

import com.flamingo.ai.docqa.service.rag.embedding.QueryEmbedding;
import java.util.UUID;

/**
 * One retrieval call.
 *
 * @param documentId restricts retrieval to one document, or {@code null}
 */
public record RetrievalRequest(
    String ownerId, String query, QueryEmbedding queryEmbedding, int topK, UUID documentId) {}
