package com.flamingo.ai.docqa.domain.repository;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  List<Document> findByOwnerIdOrderByUploadedAtDesc(String ownerId);

  Optional<Document> findByIdAndOwnerId(UUID id, String ownerId);

  List<Document> findByOwnerIdAndStatus(String ownerId, DocumentStatus status);

  /** Loads the document and holds a write lock on its row until the transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT d FROM Document d WHERE d.id = :id AND d.ownerId = :ownerId")
  Optional<Document> lockByIdAndOwnerId(@Param("id") UUID id, @Param("ownerId") String ownerId);
}
