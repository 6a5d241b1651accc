package com.flamingo.ai.dossier.exception;

/** Exception thrown when a column config or input list cannot be loaded or fails validation. */
public class DossierConfigException extends RuntimeException {

  private final String field;
  private final String userMessage;

  public DossierConfigException(String field, String detail) {
    super("Invalid config schema for '" + field + "': " + detail);
    this.field = field;
    this.userMessage = getMessage();
  }

  public DossierConfigException(String field, String message, Throwable cause) {
    super(message, cause);
    this.field = field;
    this.userMessage = message;
  }

  public String getField() {
    return field;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
