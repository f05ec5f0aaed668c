package com.flamingo.ai.docqa.service.rag.provider;

/** How a failed provider call should be handled. */
public enum ProviderErrorType {
  /** Throttled by the provider; retry with backoff. */
  RATE_LIMITED,

  /** Timeout, 5xx or connection trouble; retry with backoff. */
  TRANSIENT,

  /** Unknown model, missing access or a rejected request; move on to the next provider. */
  UNAVAILABLE;

  public boolean retryable() {
    return this != UNAVAILABLE;
  }
}
