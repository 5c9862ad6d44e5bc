package com.flamingo.ai.labmatch.domain.model;

/** A single free-text research interest statement. */
public record Query(String text) {

  public Query {
    text = text == null ? "" : text.trim();
  }

  public static Query of(String text) {
    return new Query(text);
  }

  public boolean isBlank() {
    return text.isEmpty();
  }
}
