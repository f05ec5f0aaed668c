package com.flamingo.ai.docqa.service.document;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import com.flamingo.ai.docqa.exception.DocumentNotFoundException;
import com.flamingo.ai.docqa.exception.RagValidationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/** Implementation of the DocumentService. */
@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final int MAX_TEXT_CHARS = 5_000_000;

  private final DocumentRepository documentRepository;
  private final DocumentIngestionService ingestionService;
  private final MeterRegistry meterRegistry;

  public DocumentServiceImpl(
      DocumentRepository documentRepository,
      @Lazy DocumentIngestionService ingestionService,
      MeterRegistry meterRegistry) {
    this.documentRepository = documentRepository;
    this.ingestionService = ingestionService;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Transactional
  @Timed(value = "document.create", description = "Time to store a document")
  public Document createDocument(String ownerId, String name, String text) {
    validate(ownerId, name, text);
    log.info("Storing document '{}' for owner {}", name, ownerId);

    Document saved =
        documentRepository.save(
            Document.builder().ownerId(ownerId).name(name.trim()).rawText(text).build());
    meterRegistry.counter("document.created").increment();

    // Index AFTER the transaction commits so the background thread can see the row
    final UUID documentId = saved.getId();
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, starting indexing for document: {}", documentId);
              ingestionService.indexDocumentAsync(ownerId, documentId);
            }
          });
    } else {
      log.debug("No active transaction, indexing document directly: {}", documentId);
      ingestionService.indexDocumentAsync(ownerId, documentId);
    }

    log.info("Document '{}' stored with ID: {}", name, documentId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(String ownerId, UUID documentId) {
    return documentRepository
        .findByIdAndOwnerId(documentId, ownerId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Document> getDocuments(String ownerId) {
    return documentRepository.findByOwnerIdOrderByUploadedAtDesc(ownerId);
  }

  @Override
  @Transactional
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(String ownerId, UUID documentId) {
    // same row lock as the chunk replace, so an in-flight indexing run cannot re-add chunks
    Document document =
        documentRepository
            .lockByIdAndOwnerId(documentId, ownerId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));

    ingestionService.deleteIndex(ownerId, documentId);

    documentRepository.delete(document);
    meterRegistry.counter("document.deleted").increment();

    log.info("Deleted document: {}", documentId);
  }

  @Override
  public IngestionResult reindexDocument(String ownerId, UUID documentId) {
    log.info("Re-indexing document {} for owner {}", documentId, ownerId);
    return ingestionService.indexDocument(ownerId, documentId);
  }

  @Override
  public List<IngestionResult> reembedDegraded(String ownerId) {
    return ingestionService.reembedDegraded(ownerId);
  }

  private void validate(String ownerId, String name, String text) {
    if (ownerId == null || ownerId.isBlank()) {
      throw new RagValidationException("Owner id is required");
    }
    if (name == null || name.isBlank()) {
      throw new RagValidationException("Document name is required");
    }
    if (text == null) {
      throw new RagValidationException("Document text is required");
    }
    if (text.length() > MAX_TEXT_CHARS) {
      throw new RagValidationException(
          "Document text exceeds the maximum of " + MAX_TEXT_CHARS + " characters");
    }
  }
}
