package com.flamingo.ai.labmatch.exception;

/**
 * Exception thrown when a corpus snapshot cannot be built. The previously active snapshot stays
 * in service.
 */
public class CorpusReloadException extends RuntimeException {

  private final String userMessage;

  public CorpusReloadException(String message) {
    super(message);
    this.userMessage = "Corpus reload rejected; the previous corpus is still active.";
  }

  public CorpusReloadException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Corpus reload rejected; the previous corpus is still active.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
