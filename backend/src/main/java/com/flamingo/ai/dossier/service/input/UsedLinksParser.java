package com.flamingo.ai.dossier.service.input;

import java.util.LinkedHashSet;
import java.util.Set;

/** Parses used-link lists: one URL per line, blank lines and {@code #} comments ignored. */
public final class UsedLinksParser {

  private UsedLinksParser() {}

  public static Set<String> parse(String text) {
    Set<String> links = new LinkedHashSet<>();
    if (text == null) {
      return links;
    }
    for (String line : text.split("\\R")) {
      String trimmed = line.strip();
      if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
        links.add(trimmed);
      }
    }
    return links;
  }
}
