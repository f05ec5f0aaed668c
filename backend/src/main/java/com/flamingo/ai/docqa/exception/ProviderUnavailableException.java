package com.flamingo.ai.docqa.exception;

/** A provider or model cannot serve the request at all (unknown model, no access, outage). */
public class ProviderUnavailableException extends RuntimeException {

  private final String provider;

  public ProviderUnavailableException(String provider, String message) {
    super(message);
    this.provider = provider;
  }

  public ProviderUnavailableException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
