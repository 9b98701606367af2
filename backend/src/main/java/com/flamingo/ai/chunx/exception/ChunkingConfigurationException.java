package com.flamingo.ai.chunx.exception;

/** Exception thrown when chunking options are out of range or contradict each other. */
public class ChunkingConfigurationException extends RuntimeException {

  private final String option;

  public ChunkingConfigurationException(String option, String message) {
    super(option + ": " + message);
    this.option = option;
  }

  public String getOption() {
    return option;
  }

  public String getUserMessage() {
    return getMessage();
  }
}
