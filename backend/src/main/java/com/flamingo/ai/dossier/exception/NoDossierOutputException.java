package com.flamingo.ai.dossier.exception;

import java.util.List;

/** Exception thrown when none of the requested output formats could be rendered. */
public class NoDossierOutputException extends RuntimeException {

  private final List<String> failures;

  public NoDossierOutputException(List<String> failures) {
    super("No dossier output was produced. Failures: " + String.join("; ", failures));
    this.failures = List.copyOf(failures);
  }

  public List<String> getFailures() {
    return failures;
  }

  public String getUserMessage() {
    return "No dossier output was produced. Check requested formats.";
  }
}
