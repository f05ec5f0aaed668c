package com.flamingo.ai.docqa.exception;

/** Two vectors of different length were compared. */
public class DimensionMismatchException extends RuntimeException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super("Embedding dimension mismatch: expected " + expected + " but got " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
