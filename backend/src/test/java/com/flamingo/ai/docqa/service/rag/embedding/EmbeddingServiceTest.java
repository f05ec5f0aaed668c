package com.flamingo.ai.docqa.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.exception.TransientProviderException;
import com.flamingo.ai.docqa.service.rag.provider.ProviderRetryExecutor;
import dev.langchain4j.exception.HttpException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EmbeddingServiceTest {

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private ProviderRetryExecutor retryExecutor;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getEmbedding().setBatchSize(2);
    ragConfig.getEmbedding().setMaxConcurrentBatches(2);
    ragConfig.getEmbedding().setMaxCharsPerText(20);
    ragConfig.getRetry().setMaxAttempts(2);
    ragConfig.getRetry().setInitialIntervalMs(1);
    meterRegistry = new SimpleMeterRegistry();
    retryExecutor = new ProviderRetryExecutor(ragConfig.getRetry(), meterRegistry);
  }

  private EmbeddingService service(Executor executor, EmbeddingProvider... providers) {
    return new EmbeddingService(
        List.of(providers), retryExecutor, executor, ragConfig, meterRegistry);
  }

  /** Encodes the text length so output order can be checked. */
  static class StubProvider implements EmbeddingProvider {
    final String modelId;
    final Function<List<String>, RuntimeException> failure;
    final List<List<String>> calls = Collections.synchronizedList(new ArrayList<>());

    StubProvider(String modelId, Function<List<String>, RuntimeException> failure) {
      this.modelId = modelId;
      this.failure = failure;
    }

    @Override
    public String modelId() {
      return modelId;
    }

    @Override
    public int dimension() {
      return 2;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
      calls.add(texts);
      RuntimeException error = failure.apply(texts);
      if (error != null) {
        throw error;
      }
      List<float[]> vectors = new ArrayList<>();
      for (String text : texts) {
        vectors.add(new float[] {text.length(), 1});
      }
      return vectors;
    }
  }

  @Nested
  @DisplayName("Batching")
  class Batching {

    @Test
    void shouldPreserveInputOrder_whenBatchesRunConcurrently() {
      ExecutorService pool = Executors.newFixedThreadPool(4);
      try {
        StubProvider primary = new StubProvider("primary", texts -> null);
        List<String> texts = List.of("a", "bb", "ccc", "dddd", "eeeee", "ffffff", "ggggggg");

        EmbeddingBatch batch = service(pool, primary).embed(texts);

        assertThat(batch.modelId()).isEqualTo("primary");
        assertThat(batch.degraded()).isFalse();
        assertThat(batch.vectors()).hasSize(7);
        for (int i = 0; i < texts.size(); i++) {
          assertThat(batch.vectors().get(i)[0]).isEqualTo((float) texts.get(i).length());
        }
        assertThat(primary.calls).hasSize(4);
        assertThat(primary.calls).allSatisfy(call -> assertThat(call).hasSizeLessThanOrEqualTo(2));
      } finally {
        pool.shutdownNow();
      }
    }

    @Test
    void shouldTruncateLongInputs() {
      StubProvider primary = new StubProvider("primary", texts -> null);

      EmbeddingBatch batch = service(Runnable::run, primary).embed(List.of("x".repeat(50)));

      assertThat(primary.calls.get(0).get(0)).hasSize(20);
      assertThat(batch.vectors().get(0)[0]).isEqualTo(20f);
    }

    @Test
    void shouldReturnEmptyBatch_whenNoTexts() {
      StubProvider primary = new StubProvider("primary", texts -> null);

      EmbeddingBatch batch = service(Runnable::run, primary).embed(List.of());

      assertThat(batch.vectors()).isEmpty();
      assertThat(primary.calls).isEmpty();
    }
  }

  @Nested
  @DisplayName("Provider fallback")
  class Fallback {

    @Test
    void shouldFallBackToNextProvider_whenPrimaryUnavailable() {
      StubProvider primary =
          new StubProvider("primary", texts -> new HttpException(404, "model not found"));
      StubProvider secondary = new StubProvider("secondary", texts -> null);

      EmbeddingBatch batch =
          service(Runnable::run, primary, secondary).embed(List.of("one", "two", "three"));

      assertThat(batch.modelId()).isEqualTo("secondary");
      assertThat(batch.vectors()).hasSize(3);
    }

    @Test
    void shouldUseHashFallback_whenEveryRemoteProviderUnavailable() {
      StubProvider primary = new StubProvider("primary", texts -> new HttpException(401, "no"));
      HashEmbeddingProvider hash = new HashEmbeddingProvider(2);

      EmbeddingBatch batch = service(Runnable::run, primary, hash).embed(List.of("paris"));

      assertThat(batch.degraded()).isTrue();
      assertThat(batch.modelId()).isEqualTo(HashEmbeddingProvider.MODEL_ID);
      assertThat(meterRegistry.counter("embedding.requests.degraded").count()).isEqualTo(1.0);
    }

    @Test
    void shouldPropagateTransientFailure_whenRetriesExhausted() {
      StubProvider primary = new StubProvider("primary", texts -> new HttpException(503, "busy"));
      HashEmbeddingProvider hash = new HashEmbeddingProvider(2);

      assertThatThrownBy(() -> service(Runnable::run, primary, hash).embed(List.of("paris")))
          .isInstanceOf(TransientProviderException.class);
      assertThat(primary.calls).hasSize(2);
    }

    @Test
    void shouldThrowUnavailable_whenNoProviderCanServe() {
      StubProvider primary = new StubProvider("primary", texts -> new HttpException(404, "gone"));

      assertThatThrownBy(() -> service(Runnable::run, primary).embed(List.of("paris")))
          .isInstanceOf(ProviderUnavailableException.class);
    }

    @Test
    void shouldRejectChain_whenDegradedProviderIsNotLast() {
      HashEmbeddingProvider hash = new HashEmbeddingProvider(2);
      StubProvider primary = new StubProvider("primary", texts -> null);

      assertThatThrownBy(() -> service(Runnable::run, hash, primary))
          .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectWrongDimension_fromProvider() {
      EmbeddingProvider broken =
          new StubProvider("broken", texts -> null) {
            @Override
            public int dimension() {
              return 3;
            }
          };

      assertThatThrownBy(() -> service(Runnable::run, broken).embed(List.of("paris")))
          .isInstanceOf(ProviderUnavailableException.class);
    }
  }

  @Test
  void shouldEmbedQueryWithProviderDetails() {
    StubProvider primary = new StubProvider("primary", texts -> null);

    QueryEmbedding query = service(Runnable::run, primary).embedQuery("hello");

    assertThat(query.modelId()).isEqualTo("primary");
    assertThat(query.dimension()).isEqualTo(2);
    assertThat(query.vector()).containsExactly(5f, 1f);
  }
}
