package com.flamingo.ai.chunx.exception;

/** Exception thrown when a request names a chunking strategy that does not exist. */
public class UnknownStrategyException extends RuntimeException {

  private final String strategy;

  public UnknownStrategyException(String strategy) {
    super("Unknown chunking strategy: " + strategy);
    this.strategy = strategy;
  }

  public String getStrategy() {
    return strategy;
  }
}
