package com.flamingo.ai.dossier.domain.model;

import java.util.List;

/**
 * Text variants produced by one dossier build. Variants that were not requested, or whose
 * rendering failed, are {@code null}; failures are listed in {@code warnings}.
 *
 * @param raw unmodified narrative with table of contents and sources registry
 * @param working cleaned, indexed variant (only when splitting)
 * @param markdown markdown transcript
 * @param plain markdown transcript flattened to plain text
 * @param artifactsFound whether any artifact was quarantined into the appendix
 * @param integrity appendix header counts for the working variant, {@code null} without one
 * @param warnings non-fatal problems (format failures, integrity mismatches)
 */
public record DossierResult(
    String raw,
    String working,
    String markdown,
    String plain,
    boolean artifactsFound,
    AppendixIntegrity integrity,
    List<String> warnings) {

  public DossierResult {
    warnings = List.copyOf(warnings);
  }
}
