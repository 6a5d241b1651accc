package com.flamingo.ai.dossier.service.input;

import java.util.ArrayList;
import java.util.List;

/** Parses deliverable header patterns: one per line, blank lines ignored. */
public final class DeliverablePatternsParser {

  private DeliverablePatternsParser() {}

  public static List<String> parse(String text) {
    List<String> patterns = new ArrayList<>();
    if (text == null) {
      return patterns;
    }
    for (String line : text.split("\\R")) {
      String trimmed = line.strip();
      if (!trimmed.isEmpty()) {
        patterns.add(trimmed);
      }
    }
    return patterns;
  }
}
