package com.flamingo.ai.docqa.domain.repository;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for stored chunks. Every finder is scoped by owner. */
@Repository
public interface ChunkRecordRepository extends JpaRepository<ChunkRecord, String> {

  List<ChunkRecord> findByOwnerIdOrderByDocumentIdAscChunkIndexAsc(String ownerId);

  List<ChunkRecord> findByOwnerIdAndDocumentIdOrderByChunkIndexAsc(
      String ownerId, UUID documentId);

  List<ChunkRecord> findByOwnerIdAndIdIn(String ownerId, Collection<String> ids);

  long countByOwnerIdAndDocumentId(String ownerId, UUID documentId);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM ChunkRecord c WHERE c.ownerId = :ownerId AND c.documentId = :documentId")
  int deleteByOwnerAndDocument(
      @Param("ownerId") String ownerId, @Param("documentId") UUID documentId);

  /** Distinct embedding model and dimension per document of an owner. */
  @Query(
      "SELECT DISTINCT c.documentId AS documentId, c.embeddingModelId AS modelId, "
          + "c.embeddingDimension AS dimension FROM ChunkRecord c WHERE c.ownerId = :ownerId")
  List<EmbeddingFingerprint> findEmbeddingFingerprints(@Param("ownerId") String ownerId);

  /** Projection describing which model produced a document's vectors. */
  interface EmbeddingFingerprint {
    UUID getDocumentId();

    String getModelId();

    Integer getDimension();
  }
}
