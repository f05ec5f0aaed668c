package com.flamingo.ai.docqa.exception;

/** Invalid caller input. Never retried. */
public class RagValidationException extends RuntimeException {

  public RagValidationException(String message) {
    super(message);
  }

  public String getUserMessage() {
    return getMessage();
  }
}
