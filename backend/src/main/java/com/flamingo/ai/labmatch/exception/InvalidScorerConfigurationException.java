package com.flamingo.ai.labmatch.exception;

/** Exception thrown when a scorer configuration violates its weight invariants. */
public class InvalidScorerConfigurationException extends RuntimeException {

  private final String group;
  private final String userMessage;

  public InvalidScorerConfigurationException(String group, String message) {
    super(message);
    this.group = group;
    this.userMessage = "Invalid scoring configuration: " + message;
  }

  public String getGroup() {
    return group;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
