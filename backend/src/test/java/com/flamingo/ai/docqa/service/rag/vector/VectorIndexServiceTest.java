package com.flamingo.ai.docqa.service.rag.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import com.flamingo.ai.docqa.service.rag.embedding.QueryEmbedding;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.store.InMemoryChunkStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VectorIndexServiceTest {

  private static final String MODEL = "text-embedding-3-small";
  private static final UUID DOC_1 = UUID.fromString("00000000-0000-0000-0000-000000000001");
  private static final UUID DOC_2 = UUID.fromString("00000000-0000-0000-0000-000000000002");

  private InMemoryChunkStore chunkStore;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    chunkStore = new InMemoryChunkStore();
    meterRegistry = new SimpleMeterRegistry();
  }

  private static ChunkRecord chunk(
      String owner, UUID documentId, int index, String model, float... vector) {
    return ChunkRecord.builder()
        .id(ChunkRecord.chunkId(documentId, index))
        .ownerId(owner)
        .documentId(documentId)
        .documentName("doc-" + index)
        .chunkIndex(index)
        .text("chunk " + index)
        .embedding(vector)
        .embeddingModelId(model)
        .embeddingDimension(vector.length)
        .build();
  }

  private static QueryEmbedding query(float... vector) {
    return new QueryEmbedding(MODEL, vector.length, false, vector);
  }

  private void seed(VectorIndexService service) {
    service.upsert(
        "alice",
        DOC_1,
        List.of(
            chunk("alice", DOC_1, 0, MODEL, 1, 0, 0),
            chunk("alice", DOC_1, 1, MODEL, 0.7f, 0.7f, 0),
            chunk("alice", DOC_1, 2, MODEL, 0, 0, 1)));
    service.upsert("bob", DOC_2, List.of(chunk("bob", DOC_2, 0, MODEL, 1, 0, 0)));
  }

  @Nested
  @DisplayName("Brute-force search")
  class LocalSearch {

    @Test
    void shouldRankByCosineSimilarity() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
      seed(service);

      SemanticSearchResult result = service.search("alice", query(1, 0.1f, 0), 2, null);

      assertThat(result.usedNative()).isFalse();
      assertThat(result.hits())
          .extracting(ScoredChunk::chunkId)
          .containsExactly(ChunkRecord.chunkId(DOC_1, 0), ChunkRecord.chunkId(DOC_1, 1));
    }

    @Test
    @DisplayName("should never return another owner's chunk")
    void shouldIsolateOwners() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
      seed(service);

      List<ScoredChunk> hits = service.searchLocal("bob", query(1, 0, 0), 10, null);

      assertThat(hits).hasSize(1);
      assertThat(hits).allSatisfy(h -> assertThat(h.chunk().getOwnerId()).isEqualTo("bob"));
    }

    @Test
    void shouldReturnEmpty_whenOwnerHasNoChunks() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);

      assertThat(service.search("nobody", query(1, 0, 0), 5, null).hits()).isEmpty();
    }

    @Test
    void shouldSkipChunks_fromAnotherEmbeddingModel() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
      service.upsert(
          "alice",
          DOC_1,
          List.of(
              chunk("alice", DOC_1, 0, "hash-fallback-v1", 1, 0, 0),
              chunk("alice", DOC_1, 1, MODEL, 0, 1, 0)));

      List<ScoredChunk> hits = service.searchLocal("alice", query(1, 0, 0), 10, null);

      assertThat(hits).extracting(ScoredChunk::chunkId).containsExactly(DOC_1 + "_1");
    }

    @Test
    void shouldRestrictToDocument_whenDocumentIdGiven() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
      service.upsert("alice", DOC_1, List.of(chunk("alice", DOC_1, 0, MODEL, 1, 0)));
      service.upsert("alice", DOC_2, List.of(chunk("alice", DOC_2, 0, MODEL, 1, 0)));

      List<ScoredChunk> hits = service.searchLocal("alice", query(1, 0), 10, DOC_2);

      assertThat(hits).extracting(h -> h.chunk().getDocumentId()).containsOnly(DOC_2);
    }

    @Test
    void shouldReplaceAllVectors_whenDocumentUpsertedAgain() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
      seed(service);

      service.upsert("alice", DOC_1, List.of(chunk("alice", DOC_1, 0, MODEL, 0, 1, 0)));

      assertThat(chunkStore.findByDocument("alice", DOC_1)).hasSize(1);
    }
  }

  @Nested
  @DisplayName("Native backend")
  class Native {

    @Test
    void shouldServeFromNativeBackend_whenHealthy() {
      NativeVectorBackend backend = mock(NativeVectorBackend.class);
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.of(backend), meterRegistry);
      seed(service);
      when(backend.search(eq("alice"), eq(MODEL), any(), anyInt(), any()))
          .thenReturn(List.of(new NativeVectorHit(ChunkRecord.chunkId(DOC_1, 2), 0.9)));

      SemanticSearchResult result = service.search("alice", query(0, 0, 1), 5, null);

      assertThat(result.usedNative()).isTrue();
      assertThat(result.hits()).extracting(ScoredChunk::score).containsExactly(0.9);
    }

    @Test
    @DisplayName("should fall back to brute force for good once the backend fails")
    void shouldTripBreaker_whenNativeSearchFails() {
      NativeVectorBackend backend = mock(NativeVectorBackend.class);
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.of(backend), meterRegistry);
      seed(service);
      when(backend.search(anyString(), anyString(), any(), anyInt(), any()))
          .thenThrow(new IllegalStateException("connection refused"));

      SemanticSearchResult first = service.search("alice", query(1, 0, 0), 1, null);
      SemanticSearchResult second = service.search("alice", query(1, 0, 0), 1, null);

      assertThat(first.usedNative()).isFalse();
      assertThat(first.hits())
          .extracting(ScoredChunk::chunkId)
          .containsExactly(ChunkRecord.chunkId(DOC_1, 0));
      assertThat(second.usedNative()).isFalse();
      assertThat(service.isNativeAvailable()).isFalse();
      verify(backend, times(1)).search(anyString(), anyString(), any(), anyInt(), any());
      assertThat(meterRegistry.counter("vector.native.tripped").count()).isEqualTo(1.0);
    }

    @Test
    void shouldKeepStoredChunks_whenNativeUpsertFails() {
      NativeVectorBackend backend = mock(NativeVectorBackend.class);
      doThrow(new IllegalStateException("down"))
          .when(backend)
          .upsert(anyString(), any(), any());
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.of(backend), meterRegistry);

      service.upsert("alice", DOC_1, List.of(chunk("alice", DOC_1, 0, MODEL, 1, 0)));

      assertThat(chunkStore.hasChunks("alice", DOC_1)).isTrue();
      assertThat(service.isNativeAvailable()).isFalse();
    }

    @Test
    void shouldSkipNativeWrite_whenDocumentNoLongerExists() {
      NativeVectorBackend backend = mock(NativeVectorBackend.class);
      InMemoryChunkStore store = new InMemoryChunkStore((owner, id) -> !DOC_1.equals(id));
      VectorIndexService service =
          new VectorIndexService(store, Optional.of(backend), meterRegistry);

      boolean written =
          service.upsert("alice", DOC_1, List.of(chunk("alice", DOC_1, 0, MODEL, 1, 0)));

      assertThat(written).isFalse();
      assertThat(store.size()).isZero();
      verify(backend, never()).upsert(anyString(), any(), any());
    }
  }

  @Nested
  @DisplayName("Stale detection")
  class Stale {

    @Test
    void shouldFlagDocuments_whenDimensionDiffers() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
      service.upsert("alice", DOC_1, List.of(chunk("alice", DOC_1, 0, MODEL, 1, 0)));
      service.upsert("alice", DOC_2, List.of(chunk("alice", DOC_2, 0, MODEL, 1, 0, 0)));

      assertThat(service.findStaleDocuments("alice", query(1, 0, 0))).containsExactly(DOC_1);
    }

    @Test
    void shouldFlagDegradedDocuments_whenQueryUsesRealModel() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
      service.upsert(
          "alice", DOC_1, List.of(chunk("alice", DOC_1, 0, "hash-fallback-v1", 1, 0, 0)));

      assertThat(service.findStaleDocuments("alice", query(1, 0, 0))).containsExactly(DOC_1);
    }

    @Test
    void shouldNotFlagRealVectors_whenQueryIsDegraded() {
      VectorIndexService service =
          new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
      service.upsert("alice", DOC_1, List.of(chunk("alice", DOC_1, 0, MODEL, 1, 0, 0)));
      QueryEmbedding degraded =
          new QueryEmbedding("hash-fallback-v1", 3, true, new float[] {1, 0, 0});

      assertThat(service.findStaleDocuments("alice", degraded)).isEmpty();
    }
  }
}
