package com.flamingo.ai.evomemory.exception;

/** Exception thrown when a caller supplies a value that must not be persisted. */
public class NeuronValidationException extends RuntimeException {

  private final String field;

  public NeuronValidationException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
