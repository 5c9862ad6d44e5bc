package com.flamingo.ai.labmatch.exception;

/** Exception thrown when the embedding model cannot produce vectors. */
public class EmbeddingUnavailableException extends RuntimeException {

  private final String userMessage;

  public EmbeddingUnavailableException(String message) {
    super(message);
    this.userMessage = "Semantic matching is temporarily unavailable. Please try again.";
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Semantic matching is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
