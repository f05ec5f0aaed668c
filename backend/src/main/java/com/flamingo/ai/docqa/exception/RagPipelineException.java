package com.flamingo.ai.docqa.exception;

/**
 * A query could not be answered after every retry and fallback was exhausted.
 *
 * <p>The message carries the detail for logs; callers only ever see {@link #getUserMessage()}.
 */
public class RagPipelineException extends RuntimeException {

  private final String userMessage;

  public RagPipelineException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Unable to answer the question right now. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
