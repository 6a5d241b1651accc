package com.flamingo.ai.dossier.domain.model;

/**
 * Result of counting appendix header occurrences in a working dossier.
 *
 * @param expected {@code 1} when artifacts were quarantined, {@code 0} otherwise
 * @param headerCount occurrences of the full appendix header literal
 * @param researchLogCount occurrences of the {@code RESEARCH LOG & TOOL ARTIFACTS} token
 */
public record AppendixIntegrity(int expected, int headerCount, int researchLogCount) {

  public boolean isIntact() {
    return headerCount == expected && researchLogCount == expected;
  }
}
