package com.flamingo.ai.docqa.service.rag.retrieval;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.exception.TransientProviderException;
import com.flamingo.ai.docqa.service.rag.chunking.TextChunk;
import com.flamingo.ai.docqa.service.rag.chunking.TextChunker;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingBatch;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docqa.service.rag.embedding.QueryEmbedding;
import com.flamingo.ai.docqa.service.rag.fusion.Candidate;
import com.flamingo.ai.docqa.service.rag.fusion.ReciprocalRankFusion;
import com.flamingo.ai.docqa.service.rag.lexical.LexicalIndexService;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.rag.vector.SemanticSearchResult;
import com.flamingo.ai.docqa.service.rag.vector.VectorIndexService;
import com.flamingo.ai.docqa.service.rag.vector.VectorMath;
import com.flamingo.ai.docqa.service.store.DocumentStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks the retrieval tiers until one yields a confident result.
 *
 * <ol>
 *   <li>Semantic search (native or brute force, whichever the vector index is using) fused with
 *       BM25.
 *   <li>If step 1 ran on the native backend: brute-force similarity fused with BM25.
 *   <li>Free-text shortlist of documents, chunked and embedded on the fly, ranked by cosine.
 * </ol>
 *
 * A tier is accepted when its top candidate's cosine similarity reaches {@code
 * rag.retrieval.confidence-threshold}. If none is accepted, the first non-empty pool is returned
 * flagged low-confidence; if every pool is empty the result is {@link RetrievalTier#EMPTY}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalOrchestrator {

  private final VectorIndexService vectorIndexService;
  private final LexicalIndexService lexicalIndexService;
  private final ReciprocalRankFusion fusion;
  private final DocumentStore documentStore;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.retrieval", description = "Time to retrieve candidates")
  public RetrievalResult retrieve(RetrievalRequest request) {
    RagConfig.Retrieval config = ragConfig.getRetrieval();
    int poolSize = request.topK() * Math.max(1, config.getCandidatesMultiplier());
    SemanticSearchResult semantic =
        vectorIndexService.search(
            request.ownerId(), request.queryEmbedding(), poolSize, request.documentId());
    List<ScoredChunk> lexical =
        lexicalIndexService.search(
            request.ownerId(), request.query(), poolSize, request.documentId());
    RetrievalTier firstTier =
        semantic.usedNative() ? RetrievalTier.NATIVE_VECTOR : RetrievalTier.LOCAL_SIMILARITY;
    Attempt first = new Attempt(firstTier, fusion.fuse(semantic.hits(), lexical));
    if (accepted(first, request)) {
      return finish(first, request, false);
    }
    Attempt fallback = first.candidates().isEmpty() ? null : first;

    if (semantic.usedNative()) {
      List<ScoredChunk> local =
          vectorIndexService.searchLocal(
              request.ownerId(), request.queryEmbedding(), poolSize, request.documentId());
      Attempt second = new Attempt(RetrievalTier.LOCAL_SIMILARITY, fusion.fuse(local, lexical));
      if (accepted(second, request)) {
        return finish(second, request, false);
      }
      if (fallback == null && !second.candidates().isEmpty()) {
        fallback = second;
      }
    }

    Attempt third =
        new Attempt(RetrievalTier.LEXICAL_PREFILTER_RECOMPUTE, prefilterAndRecompute(request));
    if (accepted(third, request)) {
      return finish(third, request, false);
    }
    if (fallback == null && !third.candidates().isEmpty()) {
      fallback = third;
    }

    if (fallback != null) {
      log.info(
          "No retrieval tier cleared threshold {} for owner {}; returning low-confidence {} pool",
          config.getConfidenceThreshold(),
          request.ownerId(),
          fallback.tier());
      return finish(fallback, request, true);
    }
    log.info("No candidates found in any tier for owner {}", request.ownerId());
    meterRegistry.counter("rag.retrieval.tier", "tier", RetrievalTier.EMPTY.name()).increment();
    return RetrievalResult.empty();
  }

  private boolean accepted(Attempt attempt, RetrievalRequest request) {
    double threshold = ragConfig.getRetrieval().getConfidenceThreshold();
    if (attempt.candidates().isEmpty()) {
      log.info(
          "Tier {} produced no candidates for owner {}, escalating",
          attempt.tier(),
          request.ownerId());
      return false;
    }
    Double similarity = attempt.candidates().get(0).getSemanticScore();
    if (similarity == null || similarity < threshold) {
      log.info(
          "Tier {} top candidate similarity {} below threshold {} for owner {}, escalating",
          attempt.tier(),
          similarity,
          threshold,
          request.ownerId());
      return false;
    }
    return true;
  }

  private RetrievalResult finish(Attempt attempt, RetrievalRequest request, boolean lowConfidence) {
    List<Candidate> top =
        attempt.candidates().subList(0, Math.min(request.topK(), attempt.candidates().size()));
    log.info(
        "Retrieved {} candidates for owner {} via {}{}",
        top.size(),
        request.ownerId(),
        attempt.tier(),
        lowConfidence ? " (low confidence)" : "");
    meterRegistry.counter("rag.retrieval.tier", "tier", attempt.tier().name()).increment();
    return new RetrievalResult(attempt.tier(), List.copyOf(top), lowConfidence);
  }

  /** Last tier: re-chunk and embed the documents a free-text search considers relevant. */
  private List<Candidate> prefilterAndRecompute(RetrievalRequest request) {
    List<Document> documents =
        request.documentId() == null
            ? documentStore.freeTextSearch(
                request.ownerId(),
                request.query(),
                ragConfig.getRetrieval().getPrefilterDocumentLimit())
            : documentStore.get(request.ownerId(), request.documentId()).stream().toList();
    if (documents.isEmpty()) {
      return List.of();
    }
    log.debug(
        "Recomputing similarity over {} shortlisted documents for owner {}",
        documents.size(),
        request.ownerId());

    QueryEmbedding query = request.queryEmbedding();
    List<ScoredChunk> scored = new ArrayList<>();
    for (Document document : documents) {
      if (!request.ownerId().equals(document.getOwnerId())) {
        continue;
      }
      List<TextChunk> chunks =
          textChunker.chunk(
              document.getRawText(),
              ragConfig.getChunking().getSize(),
              ragConfig.getChunking().getOverlap());
      if (chunks.isEmpty()) {
        continue;
      }
      EmbeddingBatch batch;
      try {
        batch = embeddingService.embed(chunks.stream().map(TextChunk::text).toList());
      } catch (TransientProviderException | ProviderUnavailableException e) {
        log.warn(
            "Could not embed shortlisted document {} for recompute: {}",
            document.getId(),
            e.getMessage());
        continue;
      }
      if (!batch.modelId().equals(query.modelId()) || batch.dimension() != query.dimension()) {
        log.warn(
            "Shortlisted document {} embedded with {} but query used {}, skipping",
            document.getId(),
            batch.modelId(),
            query.modelId());
        continue;
      }
      for (int i = 0; i < chunks.size(); i++) {
        ChunkRecord transientChunk = toChunk(document, chunks.get(i), batch, i);
        scored.add(
            new ScoredChunk(
                transientChunk, VectorMath.cosine(query.vector(), batch.vectors().get(i))));
      }
    }
    scored.sort(
        Comparator.comparingDouble(ScoredChunk::score)
            .reversed()
            .thenComparing(ScoredChunk::chunkId));
    int poolSize =
        request.topK() * Math.max(1, ragConfig.getRetrieval().getCandidatesMultiplier());
    return fusion.fuse(scored.subList(0, Math.min(poolSize, scored.size())), List.of());
  }

  private static ChunkRecord toChunk(
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

  private record Attempt(RetrievalTier tier, List<Candidate> candidates) {}
}
