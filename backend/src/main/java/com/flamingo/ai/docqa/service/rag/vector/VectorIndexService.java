package com.flamingo.ai.docqa.service.rag.vector;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import com.flamingo.ai.docqa.service.rag.embedding.QueryEmbedding;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.store.ChunkStore;
import com.flamingo.ai.docqa.service.store.DocumentEmbeddingInfo;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Semantic index over stored chunk vectors.
 *
 * <p>The chunk store is the source of truth. When a native backend is configured it receives a
 * copy of every vector and serves searches until its first failure; after that the service stays
 * on brute-force cosine similarity over the owner's stored chunks for the rest of the process.
 */
@Service
@Slf4j
public class VectorIndexService {

  private static final Comparator<ScoredChunk> BY_SCORE =
      Comparator.comparingDouble(ScoredChunk::score)
          .reversed()
          .thenComparing(ScoredChunk::chunkId);

  private final ChunkStore chunkStore;
  private final Optional<NativeVectorBackend> nativeBackend;
  private final MeterRegistry meterRegistry;
  private final AtomicBoolean nativeAvailable;

  public VectorIndexService(
      ChunkStore chunkStore,
      Optional<NativeVectorBackend> nativeBackend,
      MeterRegistry meterRegistry) {
    this.chunkStore = chunkStore;
    this.nativeBackend = nativeBackend;
    this.meterRegistry = meterRegistry;
    this.nativeAvailable = new AtomicBoolean(nativeBackend.isPresent());
  }

  /**
   * Replaces every vector of a document. Chunks must already carry their embeddings.
   *
   * @return false when the document was deleted meanwhile; nothing is written then
   */
  public boolean upsert(String ownerId, UUID documentId, List<ChunkRecord> chunks) {
    if (!chunkStore.replaceDocument(ownerId, documentId, chunks)) {
      return false;
    }
    if (isNativeAvailable()) {
      try {
        nativeBackend.get().upsert(ownerId, documentId, chunks);
      } catch (RuntimeException e) {
        tripNative("upsert", e);
      }
    }
    log.debug("Upserted {} vectors for document {}", chunks.size(), documentId);
    return true;
  }

  /**
   * Searches with the native backend while it is healthy, otherwise by brute force.
   *
   * @param documentId restricts the search to one document, or {@code null}
   */
  @Timed(value = "vector.search", description = "Time for semantic search")
  public SemanticSearchResult search(
      String ownerId, QueryEmbedding query, int k, UUID documentId) {
    if (isNativeAvailable()) {
      try {
        List<ScoredChunk> hits = searchNative(ownerId, query, k, documentId);
        meterRegistry.counter("vector.search", "mode", "native").increment();
        return new SemanticSearchResult(hits, true);
      } catch (RuntimeException e) {
        tripNative("search", e);
      }
    }
    return new SemanticSearchResult(searchLocal(ownerId, query, k, documentId), false);
  }

  /**
   * Brute-force cosine similarity over the owner's stored chunks. Vectors from another embedding
   * model are skipped.
   */
  public List<ScoredChunk> searchLocal(
      String ownerId, QueryEmbedding query, int k, UUID documentId) {
    List<ChunkRecord> corpus =
        documentId == null
            ? chunkStore.findByOwner(ownerId)
            : chunkStore.findByDocument(ownerId, documentId);

    List<ScoredChunk> scored = new ArrayList<>();
    int skipped = 0;
    for (ChunkRecord chunk : corpus) {
      if (!comparable(chunk, query)) {
        skipped++;
        continue;
      }
      scored.add(new ScoredChunk(chunk, VectorMath.cosine(query.vector(), chunk.getEmbedding())));
    }
    if (skipped > 0) {
      log.debug(
          "Skipped {} of {} chunks not embedded with {}", skipped, corpus.size(), query.modelId());
    }
    meterRegistry.counter("vector.search", "mode", "local").increment();
    return scored.stream().sorted(BY_SCORE).limit(Math.max(0, k)).toList();
  }

  /** Removes every vector of a document. */
  public void deleteDocument(String ownerId, UUID documentId) {
    chunkStore.deleteDocument(ownerId, documentId);
    if (isNativeAvailable()) {
      try {
        nativeBackend.get().deleteDocument(ownerId, documentId);
      } catch (RuntimeException e) {
        tripNative("delete", e);
      }
    }
  }

  /**
   * Documents whose stored vectors cannot be compared with the query and should be re-indexed:
   * a different dimension, or a different model while the query comes from a non-degraded one.
   */
  public List<UUID> findStaleDocuments(String ownerId, QueryEmbedding query) {
    Set<UUID> stale = new LinkedHashSet<>();
    for (DocumentEmbeddingInfo info : chunkStore.embeddingInfo(ownerId)) {
      boolean dimensionMismatch = info.dimension() != query.dimension();
      boolean replaceable = !query.degraded() && !query.modelId().equals(info.modelId());
      if (dimensionMismatch || replaceable) {
        stale.add(info.documentId());
      }
    }
    return List.copyOf(stale);
  }

  public boolean isNativeAvailable() {
    return nativeAvailable.get();
  }

  private List<ScoredChunk> searchNative(
      String ownerId, QueryEmbedding query, int k, UUID documentId) {
    List<NativeVectorHit> hits =
        nativeBackend.get().search(ownerId, query.modelId(), query.vector(), k, documentId);
    Map<String, ChunkRecord> byId =
        chunkStore.findByIds(ownerId, hits.stream().map(NativeVectorHit::chunkId).toList()).stream()
            .collect(Collectors.toMap(ChunkRecord::getId, Function.identity()));

    List<ScoredChunk> scored = new ArrayList<>(hits.size());
    for (NativeVectorHit hit : hits) {
      ChunkRecord chunk = byId.get(hit.chunkId());
      if (chunk == null) {
        log.debug(
            "Native hit {} has no stored chunk for owner {}, ignoring", hit.chunkId(), ownerId);
        continue;
      }
      scored.add(new ScoredChunk(chunk, hit.similarity()));
    }
    scored.sort(BY_SCORE);
    return scored;
  }

  private static boolean comparable(ChunkRecord chunk, QueryEmbedding query) {
    return chunk.getEmbedding() != null
        && query.modelId().equals(chunk.getEmbeddingModelId())
        && chunk.getEmbedding().length == query.vector().length;
  }

  private void tripNative(String operation, RuntimeException e) {
    if (nativeAvailable.compareAndSet(true, false)) {
      log.error(
          "Native vector backend failed during {}, using brute-force similarity from now on: {}",
          operation,
          e.getMessage(),
          e);
      meterRegistry.counter("vector.native.tripped").increment();
    }
  }
}
