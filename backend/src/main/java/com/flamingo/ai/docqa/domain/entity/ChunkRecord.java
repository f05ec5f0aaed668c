package com.flamingo.ai.docqa.domain.entity;

import com.flamingo.ai.docqa.domain.converter.FloatArrayConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One embedded slice of a document.
 *
 * <p>Identity is {@code (ownerId, documentId, chunkIndex)}; {@link #id} is the derived string form
 * {@code <documentId>_<chunkIndex>}. Chunks are written only by replacing a document's full set.
 */
@Entity
@Table(
    name = "chunks",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_chunks_owner_document_index",
            columnNames = {"owner_id", "document_id", "chunk_index"}),
    indexes = @Index(name = "idx_chunks_owner", columnList = "owner_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChunkRecord {

  @Id private String id;

  @Column(name = "owner_id", nullable = false)
  private String ownerId;

  @Column(name = "document_id", nullable = false)
  private UUID documentId;

  @Column(name = "chunk_index", nullable = false)
  private int chunkIndex;

  private String documentName;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String text;

  @Convert(converter = FloatArrayConverter.class)
  @Column(columnDefinition = "TEXT")
  private float[] embedding;

  private String embeddingModelId;

  private int embeddingDimension;

  /** 1-based page the chunk starts on. */
  private int page;

  /** Character offset of the chunk in the normalised document text. */
  private int charOffset;

  public static String chunkId(UUID documentId, int chunkIndex) {
    return documentId + "_" + chunkIndex;
  }
}
