package com.flamingo.ai.docqa.service.document;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import com.flamingo.ai.docqa.exception.DocumentNotFoundException;
import com.flamingo.ai.docqa.exception.DocumentProcessingException;
import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.exception.TransientProviderException;
import com.flamingo.ai.docqa.service.rag.chunking.TextChunk;
import com.flamingo.ai.docqa.service.rag.chunking.TextChunker;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingBatch;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docqa.service.rag.embedding.HashEmbeddingProvider;
import com.flamingo.ai.docqa.service.rag.embedding.QueryEmbedding;
import com.flamingo.ai.docqa.service.rag.lexical.LexicalIndexService;
import com.flamingo.ai.docqa.service.rag.vector.VectorIndexService;
import com.flamingo.ai.docqa.service.store.ChunkStore;
import com.flamingo.ai.docqa.service.store.DocumentEmbeddingInfo;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Chunks, embeds and indexes documents.
 *
 * <p>Indexing always replaces the document's complete chunk set. If embedding the whole document
 * fails, chunks are retried one by one and those that still fail are reported in the result
 * instead of aborting the document.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  private final DocumentRepository documentRepository;
  private final ChunkStore chunkStore;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final VectorIndexService vectorIndexService;
  private final LexicalIndexService lexicalIndexService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Indexes a freshly stored document in the background. */
  @Async("documentProcessingExecutor")
  public void indexDocumentAsync(String ownerId, UUID documentId) {
    try {
      indexDocument(ownerId, documentId);
    } catch (DocumentNotFoundException e) {
      log.info("Document {} was deleted before background indexing finished", documentId);
    } catch (RuntimeException e) {
      // status and error are already on the document
      log.error("Background indexing of document {} failed: {}", documentId, e.getMessage(), e);
    }
  }

  /**
   * Indexes one document synchronously.
   *
   * @return the indexing outcome; status {@link DocumentStatus#ERROR} when no chunk could be
   *     embedded
   * @throws DocumentNotFoundException if the owner has no such document, including one deleted
   *     while it was being indexed
   * @throws DocumentProcessingException if indexing fails as a whole
   */
  @Timed(value = "document.index", description = "Time to index a document")
  public IngestionResult indexDocument(String ownerId, UUID documentId) {
    Document document =
        documentRepository
            .findByIdAndOwnerId(documentId, ownerId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    document.startProcessing();
    documentRepository.save(document);

    try {
      IngestionResult result = index(document);
      meterRegistry.counter("document.index", "status", result.status().name()).increment();
      return result;
    } catch (DocumentNotFoundException e) {
      throw discarded(documentId, e);
    } catch (RuntimeException e) {
      if (!documentRepository.existsById(documentId)) {
        throw discarded(documentId, e);
      }
      log.error("Failed to index document {}: {}", documentId, e.getMessage(), e);
      meterRegistry.counter("document.index", "status", DocumentStatus.ERROR.name()).increment();
      document.markFailed(e.getMessage());
      documentRepository.save(document);
      if (e instanceof DocumentProcessingException) {
        throw e;
      }
      throw new DocumentProcessingException(documentId, e.getMessage(), e);
    }
  }

  private IngestionResult index(Document document) {
    UUID documentId = document.getId();
    String ownerId = document.getOwnerId();
    List<TextChunk> chunks =
        textChunker.chunk(
            document.getRawText(),
            ragConfig.getChunking().getSize(),
            ragConfig.getChunking().getOverlap());
    log.info("Document {} split into {} chunks", documentId, chunks.size());

    if (chunks.isEmpty()) {
      if (!vectorIndexService.upsert(ownerId, documentId, List.of())) {
        throw new DocumentNotFoundException(documentId);
      }
      lexicalIndexService.invalidate(ownerId);
      document.markReady(0, 0);
      documentRepository.save(document);
      return new IngestionResult(documentId, DocumentStatus.READY, 0, List.of(), null, false);
    }

    List<ChunkRecord> records = new ArrayList<>(chunks.size());
    List<ChunkFailure> failures = new ArrayList<>();
    try {
      EmbeddingBatch batch = embeddingService.embed(chunks.stream().map(TextChunk::text).toList());
      for (int i = 0; i < chunks.size(); i++) {
        records.add(toRecord(document, chunks.get(i), batch, i));
      }
    } catch (TransientProviderException | ProviderUnavailableException e) {
      log.warn(
          "Embedding document {} as a whole failed, retrying {} chunks individually: {}",
          documentId,
          chunks.size(),
          e.getMessage());
      embedIndividually(document, chunks, records, failures);
    }

    if (records.isEmpty()) {
      String error =
          "None of the "
              + chunks.size()
              + " chunks could be embedded: "
              + failures.get(0).message();
      document.markFailed(error);
      documentRepository.save(document);
      log.error("Document {} not indexed: {}", documentId, error);
      return new IngestionResult(documentId, DocumentStatus.ERROR, 0, failures, null, false);
    }

    if (!vectorIndexService.upsert(ownerId, documentId, records)) {
      throw new DocumentNotFoundException(documentId);
    }
    lexicalIndexService.invalidate(ownerId);
    document.markReady(records.size(), failures.size());
    documentRepository.save(document);

    String modelId = records.get(0).getEmbeddingModelId();
    boolean degraded =
        records.stream()
            .anyMatch(r -> HashEmbeddingProvider.MODEL_ID.equals(r.getEmbeddingModelId()));
    if (!failures.isEmpty()) {
      meterRegistry.counter("document.chunks.failed").increment(failures.size());
      log.warn("Document {} indexed with {} failed chunks", documentId, failures.size());
    }
    log.info(
        "Indexed document {} for owner {}: {} chunks with {}{}",
        documentId,
        ownerId,
        records.size(),
        modelId,
        degraded ? " (degraded)" : "");
    return new IngestionResult(
        documentId, DocumentStatus.READY, records.size(), failures, modelId, degraded);
  }

  private void embedIndividually(
      Document document,
      List<TextChunk> chunks,
      List<ChunkRecord> records,
      List<ChunkFailure> failures) {
    for (TextChunk chunk : chunks) {
      try {
        EmbeddingBatch single = embeddingService.embed(List.of(chunk.text()));
        records.add(toRecord(document, chunk, single, 0));
      } catch (TransientProviderException | ProviderUnavailableException e) {
        log.warn(
            "Chunk {} of document {} could not be embedded: {}",
            chunk.index(),
            document.getId(),
            e.getMessage());
        failures.add(new ChunkFailure(chunk.index(), e.getMessage()));
      }
    }
  }

  private DocumentNotFoundException discarded(UUID documentId, RuntimeException cause) {
    log.info("Document {} was deleted while being indexed, results discarded", documentId);
    meterRegistry.counter("document.index", "status", "DISCARDED").increment();
    return cause instanceof DocumentNotFoundException notFound
        ? notFound
        : new DocumentNotFoundException(documentId);
  }

  /** Removes a document's vectors and drops it from the owner's lexical index. */
  public void deleteIndex(String ownerId, UUID documentId) {
    vectorIndexService.deleteDocument(ownerId, documentId);
    lexicalIndexService.invalidate(ownerId);
  }

  /**
   * Re-indexes, synchronously, the owner's documents that cannot take part in similarity scoring
   * with this query embedding: stale vectors, and ready documents whose chunks are missing.
   *
   * @return the number of documents re-indexed
   */
  @Timed(value = "document.ensureIndexed", description = "Time to bring stale documents up to date")
  public int ensureIndexed(String ownerId, QueryEmbedding queryEmbedding) {
    Set<UUID> pending =
        new LinkedHashSet<>(vectorIndexService.findStaleDocuments(ownerId, queryEmbedding));
    for (Document document :
        documentRepository.findByOwnerIdAndStatus(ownerId, DocumentStatus.READY)) {
      Integer expected = document.getChunkCount();
      if (expected != null && expected > 0 && !chunkStore.hasChunks(ownerId, document.getId())) {
        pending.add(document.getId());
      }
    }
    if (pending.isEmpty()) {
      return 0;
    }

    log.info(
        "Re-indexing {} documents of owner {} before answering (query model {})",
        pending.size(),
        ownerId,
        queryEmbedding.modelId());
    int reindexed = 0;
    for (UUID documentId : pending) {
      try {
        indexDocument(ownerId, documentId);
        reindexed++;
      } catch (DocumentNotFoundException | DocumentProcessingException e) {
        log.warn(
            "Document {} could not be re-indexed, answering without it: {}",
            documentId,
            e.getMessage());
      }
    }
    meterRegistry.counter("document.reindexed.on_query").increment(reindexed);
    return reindexed;
  }

  /** Re-indexes every document of the owner that holds vectors from the hash fallback. */
  @Timed(value = "document.reembedDegraded", description = "Time to re-embed degraded documents")
  public List<IngestionResult> reembedDegraded(String ownerId) {
    Set<UUID> degraded = new LinkedHashSet<>();
    for (DocumentEmbeddingInfo info : chunkStore.embeddingInfo(ownerId)) {
      if (HashEmbeddingProvider.MODEL_ID.equals(info.modelId())) {
        degraded.add(info.documentId());
      }
    }
    log.info("Re-embedding {} degraded documents for owner {}", degraded.size(), ownerId);
    List<IngestionResult> results = new ArrayList<>(degraded.size());
    for (UUID documentId : degraded) {
      results.add(indexDocument(ownerId, documentId));
    }
    return results;
  }

  private static ChunkRecord toRecord(
      Document document, TextChunk chunk, EmbeddingBatch batch, int position) {
    return ChunkRecord.builder()
        .id(ChunkRecord.chunkId(document.getId(), chunk.index()))
        .ownerId(document.getOwnerId())
        .documentId(document.getId())
        .documentName(document.getName())
        .chunkIndex(chunk.index())
        .text(chunk.text())
        .embedding(batch.vectors().get(position))
        .embeddingModelId(batch.modelId())
        .embeddingDimension(batch.dimension())
        .page(chunk.page())
        .charOffset(chunk.charOffset())
        .build();
  }
}
