package com.flamingo.ai.docqa.service.rag.provider;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.exception.TransientProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs a provider call under a resilience4j {@link Retry} with exponential backoff and jitter on
 * rate limits and transient errors.
 *
 * <p>Attempts are capped by {@code rag.retry.max-attempts} and the summed wait by {@code
 * rag.retry.max-total-delay-ms}. Failures classified as {@link ProviderErrorType#UNAVAILABLE} are
 * never retried and surface as {@link ProviderUnavailableException}. An interrupted caller, or one
 * whose abort condition holds, stops retrying.
 */
@Component
@Slf4j
public class ProviderRetryExecutor {

  private final IntervalFunction intervalFunction;
  private final int maxAttempts;
  private final long maxTotalDelayMs;
  private final MeterRegistry meterRegistry;

  @Autowired
  public ProviderRetryExecutor(RagConfig ragConfig, MeterRegistry meterRegistry) {
    this(ragConfig.getRetry(), meterRegistry);
  }

  public ProviderRetryExecutor(RagConfig.Retry retry, MeterRegistry meterRegistry) {
    this.intervalFunction =
        IntervalFunction.ofExponentialRandomBackoff(
            retry.getInitialIntervalMs(),
            retry.getMultiplier(),
            retry.getRandomizationFactor(),
            retry.getMaxIntervalMs());
    this.maxAttempts = Math.max(1, retry.getMaxAttempts());
    this.maxTotalDelayMs = retry.getMaxTotalDelayMs();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Executes the call, retrying retryable failures.
   *
   * @param provider label used in logs, metrics and exceptions (for example a model id)
   * @param call the provider call
   * @return the call's result
   * @throws TransientProviderException when attempts or the delay budget run out
   * @throws ProviderUnavailableException when the provider cannot serve the call
   */
  public <T> T execute(String provider, Supplier<T> call) {
    return execute(provider, call, () -> false);
  }

  /**
   * Executes the call, retrying retryable failures until {@code abort} returns true.
   *
   * @param abort checked before each retry, for example a caller's deadline
   */
  public <T> T execute(String provider, Supplier<T> call, BooleanSupplier abort) {
    DelayBudget budget = new DelayBudget(abort);
    Retry retry = Retry.of(provider, retryConfig(budget));
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              log.warn(
                  "Provider {} call failed, attempt {}/{}, retrying in {}ms: {}",
                  provider,
                  event.getNumberOfRetryAttempts(),
                  maxAttempts,
                  event.getWaitInterval().toMillis(),
                  event.getLastThrowable() == null
                      ? null
                      : event.getLastThrowable().getMessage());
              meterRegistry.counter("provider.calls.retried", "provider", provider).increment();
            });

    try {
      return Retry.decorateSupplier(retry, call).get();
    } catch (RuntimeException e) {
      ProviderErrorType type = ProviderErrorClassifier.classify(e);
      if (!type.retryable()) {
        meterRegistry.counter("provider.calls.unavailable", "provider", provider).increment();
        if (e instanceof ProviderUnavailableException) {
          throw e;
        }
        throw new ProviderUnavailableException(provider, e.getMessage(), e);
      }
      meterRegistry.counter("provider.calls.exhausted", "provider", provider).increment();
      boolean rateLimited = type == ProviderErrorType.RATE_LIMITED;
      if (budget.exhausted) {
        throw new TransientProviderException(
            provider,
            "Provider " + provider + " retry budget of " + maxTotalDelayMs + "ms exhausted",
            rateLimited,
            e);
      }
      throw new TransientProviderException(
          provider,
          "Provider "
              + provider
              + " failed after "
              + budget.failures
              + " attempts: "
              + e.getMessage(),
          rateLimited,
          e);
    }
  }

  private RetryConfig retryConfig(DelayBudget budget) {
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .retryOnException(budget)
        .intervalBiFunction((attempt, outcome) -> budget.nextDelay)
        .build();
  }

  /**
   * Per-call retry state. The predicate draws the next backoff before resilience4j asks for it, so
   * a wait that would overrun the budget ends the retries instead of sleeping.
   */
  private final class DelayBudget implements Predicate<Throwable> {

    private final BooleanSupplier abort;
    private int failures;
    private long sleptMs;
    private long nextDelay;
    private boolean exhausted;

    private DelayBudget(BooleanSupplier abort) {
      this.abort = abort;
    }

    @Override
    public boolean test(Throwable error) {
      failures++;
      if (!ProviderErrorClassifier.classify(error).retryable()
          || failures >= maxAttempts
          || Thread.currentThread().isInterrupted()
          || abort.getAsBoolean()) {
        return false;
      }
      long delay = intervalFunction.apply(failures);
      if (sleptMs + delay > maxTotalDelayMs) {
        exhausted = true;
        return false;
      }
      nextDelay = delay;
      sleptMs += delay;
      return true;
    }
  }
}
