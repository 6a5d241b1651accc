package com.flamingo.ai.dossier.domain.model;

/**
 * A tool or UI fragment moved out of the working body into the appendix.
 *
 * @param label artifact kind, e.g. {@code Search Fragment}
 * @param snippet the matched text, truncated
 */
public record Artifact(String label, String snippet) {

  /** Appendix form: {@code [label] snippet...}. */
  public String render() {
    return "[" + label + "] " + snippet + "...";
  }
}
