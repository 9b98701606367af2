package com.flamingo.ai.chunx.exception;

/** Exception thrown when an embedding backend returns a result that breaks its call contract. */
public class EmbeddingContractException extends RuntimeException {

  private final int expected;
  private final int actual;

  public EmbeddingContractException(int expected, int actual) {
    super("Embedding backend returned " + actual + " vectors for " + expected + " inputs");
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
