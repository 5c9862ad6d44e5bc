package com.flamingo.ai.labmatch.exception;

/** Exception thrown when a request names a scorer preset that does not exist. */
public class UnknownPresetException extends RuntimeException {

  private final String presetName;

  public UnknownPresetException(String presetName) {
    super("Unknown scorer preset: " + presetName);
    this.presetName = presetName;
  }

  public String getPresetName() {
    return presetName;
  }
}
