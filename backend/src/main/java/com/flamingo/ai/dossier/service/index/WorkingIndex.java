package com.flamingo.ai.dossier.service.index;

import java.util.List;

/**
 * Navigation front matter for a working dossier.
 *
 * @param index rendered index text, placed first in the working dossier
 * @param coverage coverage audit lines (tagged index only), joined by newlines on assembly
 * @param warnings non-fatal findings such as short-tag collisions
 */
public record WorkingIndex(String index, List<String> coverage, List<String> warnings) {

  public WorkingIndex {
    coverage = List.copyOf(coverage);
    warnings = List.copyOf(warnings);
  }

  public static WorkingIndex of(String index) {
    return new WorkingIndex(index, List.of(), List.of());
  }

  public boolean hasCoverage() {
    return !coverage.isEmpty();
  }
}
