package com.flamingo.ai.docqa.service.store;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/** Durable chunk storage. Every read is scoped to one owner. */
public interface ChunkStore {

  /**
   * Replaces every chunk of a document in one unit of work. Readers observe either the previous
   * set or the new one.
   *
   * @return false, with nothing written, when the owner's document no longer exists
   */
  boolean replaceDocument(String ownerId, UUID documentId, List<ChunkRecord> chunks);

  List<ChunkRecord> findByOwner(String ownerId);

  List<ChunkRecord> findByDocument(String ownerId, UUID documentId);

  List<ChunkRecord> findByIds(String ownerId, Collection<String> chunkIds);

  boolean hasChunks(String ownerId, UUID documentId);

  void deleteDocument(String ownerId, UUID documentId);

  List<DocumentEmbeddingInfo> embeddingInfo(String ownerId);
}
