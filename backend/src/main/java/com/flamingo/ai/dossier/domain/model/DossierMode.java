package com.flamingo.ai.dossier.domain.model;

import java.util.Locale;

/** Whether a dossier prints whole conversations or only topic excerpts. */
public enum DossierMode {
  FULL,
  EXCERPTS;

  /** Parses {@code full} / {@code excerpts}, case-insensitively; {@code null} means full. */
  public static DossierMode fromValue(String value) {
    if (value == null || value.isBlank()) {
      return FULL;
    }
    return switch (value.strip().toLowerCase(Locale.ROOT)) {
      case "full" -> FULL;
      case "excerpts" -> EXCERPTS;
      default -> throw new IllegalArgumentException("Unknown dossier mode: " + value);
    };
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
