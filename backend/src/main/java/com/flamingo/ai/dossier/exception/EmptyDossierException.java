package com.flamingo.ai.dossier.exception;

/** Exception thrown when cleaning and filtering leave nothing in the working dossier. */
public class EmptyDossierException extends RuntimeException {

  private final String userMessage;

  public EmptyDossierException(String message) {
    super(message);
    this.userMessage = "NO INCLUDED THREADS/SEGMENTS - CHECK FILTERS/KEYWORDS/PATTERNS";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
