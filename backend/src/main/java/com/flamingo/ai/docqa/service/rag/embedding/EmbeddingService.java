package com.flamingo.ai.docqa.service.rag.embedding;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.service.rag.provider.ProviderRetryExecutor;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Generates embeddings through an ordered chain of providers.
 *
 * <p>Inputs are embedded in batches, a bounded number at a time, and reassembled in input order.
 * Rate limits and transient errors are retried by {@link ProviderRetryExecutor}; when those retries
 * run out the failure propagates. A provider that is unavailable hands the whole input to the next
 * provider, so one call never mixes vectors from different models.
 */
@Service
@Slf4j
public class EmbeddingService {

  private final List<EmbeddingProvider> providers;
  private final ProviderRetryExecutor retryExecutor;
  private final Executor embeddingExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      List<EmbeddingProvider> providers,
      ProviderRetryExecutor retryExecutor,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    if (providers.isEmpty()) {
      throw new IllegalStateException("At least one embedding provider must be configured");
    }
    for (int i = 0; i < providers.size() - 1; i++) {
      if (providers.get(i).degraded()) {
        throw new IllegalStateException(
            "Degraded embedding provider "
                + providers.get(i).modelId()
                + " must be the last in the chain");
      }
    }
    this.providers = List.copyOf(providers);
    this.retryExecutor = retryExecutor;
    this.embeddingExecutor = embeddingExecutor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    log.info(
        "Embedding provider chain: {}",
        this.providers.stream().map(EmbeddingProvider::modelId).toList());
  }

  /**
   * Embeds texts, preserving order.
   *
   * @param texts passages to embed
   * @return the vectors and the provider that produced them
   */
  @Timed(value = "embedding.embed", description = "Time to embed a list of texts")
  public EmbeddingBatch embed(List<String> texts) {
    if (texts.isEmpty()) {
      EmbeddingProvider first = providers.get(0);
      return new EmbeddingBatch(first.modelId(), first.dimension(), first.degraded(), List.of());
    }
    List<String> prepared = truncate(texts);

    ProviderUnavailableException lastFailure = null;
    for (EmbeddingProvider provider : providers) {
      try {
        List<float[]> vectors = embedWith(provider, prepared);
        if (provider.degraded()) {
          log.warn(
              "Embedded {} texts with degraded provider {}; vectors will need re-embedding",
              texts.size(),
              provider.modelId());
          meterRegistry.counter("embedding.requests.degraded").increment();
        }
        meterRegistry
            .counter("embedding.requests.success", "model", provider.modelId())
            .increment();
        return new EmbeddingBatch(
            provider.modelId(), provider.dimension(), provider.degraded(), vectors);
      } catch (ProviderUnavailableException e) {
        log.warn(
            "Embedding provider {} unavailable, falling back: {}",
            provider.modelId(),
            e.getMessage());
        meterRegistry
            .counter("embedding.requests.failure", "model", provider.modelId())
            .increment();
        lastFailure = e;
      }
    }
    throw new ProviderUnavailableException(
        "embedding", "No embedding provider could serve the request", lastFailure);
  }

  /** Embeds a single question. */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  public QueryEmbedding embedQuery(String query) {
    EmbeddingBatch batch = embed(List.of(query));
    return new QueryEmbedding(
        batch.modelId(), batch.dimension(), batch.degraded(), batch.vectors().get(0));
  }

  private List<float[]> embedWith(EmbeddingProvider provider, List<String> texts) {
    int batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());
    int window = Math.max(1, ragConfig.getEmbedding().getMaxConcurrentBatches());
    List<List<String>> batches = Lists.partition(texts, batchSize);
    log.debug(
        "Embedding {} texts with {} in {} batches of up to {}",
        texts.size(),
        provider.modelId(),
        batches.size(),
        batchSize);

    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int from = 0; from < batches.size(); from += window) {
      List<CompletableFuture<List<float[]>>> inFlight = new ArrayList<>();
      for (List<String> batch : batches.subList(from, Math.min(from + window, batches.size()))) {
        inFlight.add(
            CompletableFuture.supplyAsync(() -> embedBatch(provider, batch), embeddingExecutor));
      }
      for (CompletableFuture<List<float[]>> future : inFlight) {
        vectors.addAll(join(future));
      }
    }
    return vectors;
  }

  private List<float[]> embedBatch(EmbeddingProvider provider, List<String> batch) {
    List<float[]> vectors = retryExecutor.execute(provider.modelId(), () -> provider.embed(batch));
    if (vectors.size() != batch.size()) {
      throw new ProviderUnavailableException(
          provider.modelId(),
          "Returned " + vectors.size() + " vectors for " + batch.size() + " inputs");
    }
    for (float[] vector : vectors) {
      if (vector.length != provider.dimension()) {
        throw new ProviderUnavailableException(
            provider.modelId(),
            "Returned a " + vector.length + "-dim vector, expected " + provider.dimension());
      }
    }
    return vectors;
  }

  private List<String> truncate(List<String> texts) {
    int maxChars = ragConfig.getEmbedding().getMaxCharsPerText();
    List<String> prepared = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i) == null ? "" : texts.get(i);
      if (text.length() > maxChars) {
        log.warn(
            "Text {} too long for embedding, truncating from {} chars to {} chars",
            i,
            text.length(),
            maxChars);
        text = text.substring(0, maxChars);
      }
      prepared.add(text);
    }
    return prepared;
  }

  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }
}
