package com.flamingo.ai.docqa.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import com.flamingo.ai.docqa.service.rag.vector.NativeVectorBackend;
import com.flamingo.ai.docqa.service.rag.vector.NativeVectorHit;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * {@link NativeVectorBackend} on an Elasticsearch {@code dense_vector} index with cosine
 * similarity. Owner, model and document filters run inside the kNN query.
 */
@Component
@ConditionalOnProperty(prefix = "rag.vector", name = "native-enabled", havingValue = "true")
@Slf4j
public class ElasticsearchVectorBackend implements NativeVectorBackend {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int vectorDimensions;
  private final int numCandidates;

  public ElasticsearchVectorBackend(
      ElasticsearchClient elasticsearchClient, RagConfig ragConfig, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = ragConfig.getVector().getIndexName();
    this.vectorDimensions = ragConfig.getEmbedding().getDimensions();
    this.numCandidates = ragConfig.getVector().getNumCandidates();
  }

  @PostConstruct
  public void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
      if (!exists) {
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(indexProperties())));
        elasticsearchClient.indices().create(request);
        log.info("Created Elasticsearch index: {}", indexName);
      }
    } catch (IOException | RuntimeException e) {
      // searches will fail and trip the brute-force fallback
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
    }
  }

  Map<String, Property> indexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // ownerId, documentId and modelId must be keyword type for exact term filters
    properties.put("ownerId", Property.of(p -> p.keyword(k -> k)));
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("embeddingModelId", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "elasticsearch.upsert", description = "Time to replace a document's vectors")
  public void upsert(String ownerId, UUID documentId, List<ChunkRecord> chunks) {
    deleteDocument(ownerId, documentId);
    if (chunks.isEmpty()) {
      return;
    }
    try {
      BulkRequest.Builder bulk = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (ChunkRecord chunk : chunks) {
        Map<String, Object> source = toSource(chunk);
        bulk.operations(
            op -> op.index(idx -> idx.index(indexName).id(chunk.getId()).document(source)));
      }
      BulkResponse response = elasticsearchClient.bulk(bulk.build());
      if (response.errors()) {
        meterRegistry.counter("elasticsearch.index.errors").increment();
        throw new IllegalStateException(
            "Bulk indexing into " + indexName + " reported errors for document " + documentId);
      }
      meterRegistry.counter("elasticsearch.indexed").increment(chunks.size());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to index vectors of document " + documentId, e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for kNN search")
  public List<NativeVectorHit> search(
      String ownerId, String modelId, float[] queryVector, int k, UUID documentId) {
    List<Query> filters = new ArrayList<>();
    filters.add(term("ownerId", ownerId));
    filters.add(term("embeddingModelId", modelId));
    if (documentId != null) {
      filters.add(term("documentId", documentId.toString()));
    }
    List<Float> vector = new ArrayList<>(queryVector.length);
    for (float v : queryVector) {
      vector.add(v);
    }
    int candidates = Math.max(numCandidates, k);

    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        kn ->
                            kn.field("embedding")
                                .queryVector(vector)
                                .k(k)
                                .numCandidates(candidates)
                                .filter(f -> f.bool(b -> b.filter(filters))))
                    .source(src -> src.fetch(false))
                    .size(k));
    try {
      // _source is not fetched; only ids and scores are read
      SearchResponse<Void> response = elasticsearchClient.search(request, Void.class);
      List<NativeVectorHit> hits = new ArrayList<>();
      for (Hit<Void> hit : response.hits().hits()) {
        if (hit.score() != null) {
          // cosine _score is (1 + cos) / 2
          hits.add(new NativeVectorHit(hit.id(), 2.0 * hit.score() - 1.0));
        }
      }
      log.debug("kNN search for owner {} returned {} hits", ownerId, hits.size());
      return hits;
    } catch (IOException e) {
      throw new UncheckedIOException("Vector search failed on " + indexName, e);
    }
  }

  @Override
  public void deleteDocument(String ownerId, UUID documentId) {
    try {
      elasticsearchClient.deleteByQuery(
          d ->
              d.index(indexName)
                  .query(
                      q ->
                          q.bool(
                              b ->
                                  b.filter(term("ownerId", ownerId))
                                      .filter(term("documentId", documentId.toString())))));
      log.debug("Deleted vectors of document {} from {}", documentId, indexName);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete vectors of document " + documentId, e);
    }
  }

  private static Query term(String field, String value) {
    return Query.of(q -> q.term(t -> t.field(field).value(value)));
  }

  private static Map<String, Object> toSource(ChunkRecord chunk) {
    Map<String, Object> source = new HashMap<>();
    source.put("ownerId", chunk.getOwnerId());
    source.put("documentId", chunk.getDocumentId().toString());
    source.put("embeddingModelId", chunk.getEmbeddingModelId());
    source.put("chunkIndex", chunk.getChunkIndex());
    source.put("embedding", chunk.getEmbedding());
    return source;
  }
}
