package com.flamingo.ai.docqa.service.document;

import com.flamingo.ai.docqa.domain.entity.Document;
import java.util.List;
import java.util.UUID;

/** Service interface for document management. Every operation is scoped to one owner. */
public interface DocumentService {

  /**
   * Stores a text document and schedules its indexing.
   *
   * @param ownerId the owner
   * @param name display name used in citations
   * @param text extracted plain text, pages separated by form feeds
   * @return the stored document, status {@code UPLOADING}
   */
  Document createDocument(String ownerId, String name, String text);

  /**
   * Gets a document by ID.
   *
   * @throws com.flamingo.ai.docqa.exception.DocumentNotFoundException if the owner has no such
   *     document
   */
  Document getDocument(String ownerId, UUID documentId);

  /** Lists the owner's documents, newest first. */
  List<Document> getDocuments(String ownerId);

  /** Deletes a document together with its chunks and vectors. */
  void deleteDocument(String ownerId, UUID documentId);

  /** Re-indexes a document synchronously. */
  IngestionResult reindexDocument(String ownerId, UUID documentId);

  /** Re-indexes the owner's documents that were embedded by the degraded fallback. */
  List<IngestionResult> reembedDegraded(String ownerId);
}
