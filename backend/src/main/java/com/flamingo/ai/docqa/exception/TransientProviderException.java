package com.flamingo.ai.docqa.exception;

/**
 * A provider call failed in a way that may succeed on retry (rate limit, timeout, 5xx).
 *
 * <p>Thrown after the retry budget is spent so the caller sees the last underlying failure.
 */
public class TransientProviderException extends RuntimeException {

  private final String provider;
  private final boolean rateLimited;

  public TransientProviderException(String provider, String message, Throwable cause) {
    this(provider, message, false, cause);
  }

  public TransientProviderException(
      String provider, String message, boolean rateLimited, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.rateLimited = rateLimited;
  }

  public String getProvider() {
    return provider;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }
}
