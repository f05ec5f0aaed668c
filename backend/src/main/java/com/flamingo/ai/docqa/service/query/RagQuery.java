package com.flamingo.ai.docqa.service.query;

import com.flamingo.ai.docqa.service.rag.generation.ConversationTurn;
import java.util.List;
import java.util.UUID;

/**
 * A question asked by one owner.
 *
 * @param topK number of passages to retrieve; {@code null} uses the configured default
 * @param documentId restricts retrieval to one document, or {@code null}
 * @param temperature sampling temperature, or {@code null} for the configured default
 * @param maxTokens completion limit, or {@code null} for the configured default
 */
public record RagQuery(
    String ownerId,
    String query,
    Integer topK,
    UUID documentId,
    List<ConversationTurn> history,
    Double temperature,
    Integer maxTokens) {

  public RagQuery {
    history = history == null ? List.of() : List.copyOf(history);
  }

  public static RagQuery of(String ownerId, String query) {
    return new RagQuery(ownerId, query, null, null, List.of(), null, null);
  }
}
