package com.flamingo.ai.docqa.domain.entity;

import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A text document owned by a single user. */
@Entity
@Table(name = "documents", indexes = @Index(name = "idx_documents_owner", columnList = "owner_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false)
  private String ownerId;

  @Column(nullable = false)
  private String name;

  /** Extracted plain text; pages are separated by form feeds. */
  @Column(columnDefinition = "TEXT")
  private String rawText;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.UPLOADING;

  private Integer chunkCount;

  /** Chunks that could not be embedded during the last indexing run. */
  private Integer failedChunkCount;

  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    if (uploadedAt == null) {
      uploadedAt = LocalDateTime.now();
    }
  }

  public void startProcessing() {
    this.status = DocumentStatus.PROCESSING;
    this.processingError = null;
  }

  /** Marks the document as indexed. */
  public void markReady(int chunkCount, int failedChunkCount) {
    this.status = DocumentStatus.READY;
    this.chunkCount = chunkCount;
    this.failedChunkCount = failedChunkCount;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(String errorMessage) {
    this.status = DocumentStatus.ERROR;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }
}
