package com.flamingo.ai.evomemory.exception;

/** Exception thrown when the neuron or rule storage fails. Never retried internally. */
public class StorageException extends RuntimeException {

  private final String operation;

  public StorageException(String operation, Throwable cause) {
    super("Storage operation failed: " + operation, cause);
    this.operation = operation;
  }

  public StorageException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
