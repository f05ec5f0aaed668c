package com.flamingo.ai.docqa.service.document;

import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of indexing one document.
 *
 * @param indexedChunks chunks written to the vector and lexical indexes
 * @param failures chunks skipped because they could not be embedded
 * @param embeddingModelId model that produced the vectors, or {@code null} if none were produced
 */
public record IngestionResult(
    UUID documentId,
    DocumentStatus status,
    int indexedChunks,
    List<ChunkFailure> failures,
    String embeddingModelId,
    boolean degraded) {

  public IngestionResult {
    failures = List.copyOf(failures);
  }
}
