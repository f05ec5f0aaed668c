package com.flamingo.ai.docqa.service.store;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import com.flamingo.ai.docqa.domain.repository.ChunkRecordRepository;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** {@link ChunkStore} backed by the relational database. */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaChunkStore implements ChunkStore {

  private final ChunkRecordRepository chunkRecordRepository;
  private final DocumentRepository documentRepository;

  @Override
  @Transactional
  public boolean replaceDocument(String ownerId, UUID documentId, List<ChunkRecord> chunks) {
    for (ChunkRecord chunk : chunks) {
      if (!ownerId.equals(chunk.getOwnerId()) || !documentId.equals(chunk.getDocumentId())) {
        throw new IllegalArgumentException(
            "Chunk " + chunk.getId() + " does not belong to document " + documentId);
      }
    }
    // serialises with deleteDocument, which takes the same row lock first
    if (documentRepository.lockByIdAndOwnerId(documentId, ownerId).isEmpty()) {
      log.info("Document {} no longer exists, discarding {} chunks", documentId, chunks.size());
      return false;
    }
    int removed = chunkRecordRepository.deleteByOwnerAndDocument(ownerId, documentId);
    chunkRecordRepository.saveAll(chunks);
    log.debug(
        "Replaced chunks of document {}: removed {}, inserted {}",
        documentId,
        removed,
        chunks.size());
    return true;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChunkRecord> findByOwner(String ownerId) {
    return chunkRecordRepository.findByOwnerIdOrderByDocumentIdAscChunkIndexAsc(ownerId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChunkRecord> findByDocument(String ownerId, UUID documentId) {
    return chunkRecordRepository.findByOwnerIdAndDocumentIdOrderByChunkIndexAsc(
        ownerId, documentId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChunkRecord> findByIds(String ownerId, Collection<String> chunkIds) {
    if (chunkIds.isEmpty()) {
      return List.of();
    }
    return chunkRecordRepository.findByOwnerIdAndIdIn(ownerId, chunkIds);
  }

  @Override
  @Transactional(readOnly = true)
  public boolean hasChunks(String ownerId, UUID documentId) {
    return chunkRecordRepository.countByOwnerIdAndDocumentId(ownerId, documentId) > 0;
  }

  @Override
  @Transactional
  public void deleteDocument(String ownerId, UUID documentId) {
    int removed = chunkRecordRepository.deleteByOwnerAndDocument(ownerId, documentId);
    log.debug("Deleted {} chunks of document {}", removed, documentId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<DocumentEmbeddingInfo> embeddingInfo(String ownerId) {
    return chunkRecordRepository.findEmbeddingFingerprints(ownerId).stream()
        .map(
            f ->
                new DocumentEmbeddingInfo(
                    f.getDocumentId(),
                    f.getModelId(),
                    f.getDimension() == null ? 0 : f.getDimension()))
        .toList();
  }
}
