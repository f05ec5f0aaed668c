package com.flamingo.ai.docqa.service.rag.lexical;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.store.ChunkStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-owner BM25 indexes, built lazily from the owner's stored chunks.
 *
 * <p>Each owner has a generation counter. {@link #invalidate(String)} bumps it, and a cached index
 * is only served while its generation is current, so a build racing with a corpus change is never
 * reused.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LexicalIndexService {

  private final ChunkStore chunkStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  private final Map<String, CachedIndex> cache = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();

  /**
   * BM25 search over one owner's chunks.
   *
   * @param documentId restricts results to one document, or {@code null}
   */
  @Timed(value = "lexical.search", description = "Time for BM25 search")
  public List<ScoredChunk> search(String ownerId, String query, int k, UUID documentId) {
    return indexFor(ownerId).search(query, k, documentId);
  }

  /** Marks the owner's index stale after chunks were added, replaced or removed. */
  public void invalidate(String ownerId) {
    generation(ownerId).incrementAndGet();
    cache.remove(ownerId);
    log.debug("Invalidated lexical index for owner {}", ownerId);
  }

  Bm25Index indexFor(String ownerId) {
    AtomicLong generation = generation(ownerId);
    long current = generation.get();
    CachedIndex cached = cache.get(ownerId);
    if (cached != null && cached.generation() == current) {
      return cached.index();
    }

    Bm25Index index =
        Bm25Index.build(
            chunkStore.findByOwner(ownerId),
            ragConfig.getLexical().getK1(),
            ragConfig.getLexical().getB());
    meterRegistry.counter("lexical.index.builds").increment();
    if (generation.get() == current) {
      cache.put(ownerId, new CachedIndex(current, index));
    }
    log.debug("Built lexical index for owner {} over {} chunks", ownerId, index.size());
    return index;
  }

  private AtomicLong generation(String ownerId) {
    return generations.computeIfAbsent(ownerId, id -> new AtomicLong());
  }

  private record CachedIndex(long generation, Bm25Index index) {}
}
