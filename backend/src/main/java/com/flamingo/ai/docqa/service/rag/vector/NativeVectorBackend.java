package com.flamingo.ai.docqa.service.rag.vector;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import java.util.List;
import java.util.UUID;

/**
 * An approximate nearest-neighbour engine holding a copy of the chunk vectors.
 *
 * <p>Implementations must apply the owner filter (and the document filter when given) inside the
 * engine, before ranking.
 */
public interface NativeVectorBackend {

  /** Replaces all vectors of a document. */
  void upsert(String ownerId, UUID documentId, List<ChunkRecord> chunks);

  /**
   * Finds the nearest chunks produced by the given embedding model.
   *
   * @param documentId restricts the search to one document, or {@code null} for all
   */
  List<NativeVectorHit> search(
      String ownerId, String modelId, float[] queryVector, int k, UUID documentId);

  void deleteDocument(String ownerId, UUID documentId);
}
