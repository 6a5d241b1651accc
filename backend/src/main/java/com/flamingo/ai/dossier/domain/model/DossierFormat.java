package com.flamingo.ai.dossier.domain.model;

import java.util.Locale;

/** Output variants a build can produce. */
public enum DossierFormat {
  /** Raw narrative, plus the working variant when splitting. */
  TXT,
  /** Markdown transcript with per-message timestamps. */
  MD,
  /** Markdown transcript flattened to plain text. */
  PLAIN;

  public static DossierFormat fromValue(String value) {
    try {
      return valueOf(value.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException("Unknown dossier format: " + value, e);
    }
  }

  /** Lowercase wire value, e.g. {@code txt}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
