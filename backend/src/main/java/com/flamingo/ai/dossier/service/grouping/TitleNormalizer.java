package com.flamingo.ai.dossier.service.grouping;

import java.util.regex.Pattern;

/** Title and message-text normalization shared by grouping and reconciliation. */
public final class TitleNormalizer {

  private static final Pattern BRANCH_MARKER =
      Pattern.compile("^\\s*Branch\\s*[·\\-:]\\s*", Pattern.CASE_INSENSITIVE);

  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private TitleNormalizer() {}

  /**
   * Strips a leading {@code Branch ·}, {@code Branch -} or {@code Branch:} marker and normalizes
   * whitespace. {@code null} becomes the empty string.
   */
  public static String baseTitle(String title) {
    String stripped = BRANCH_MARKER.matcher(title == null ? "" : title.strip()).replaceFirst("");
    return normalizeText(stripped);
  }

  /** Trims and collapses every whitespace run to a single space. */
  public static String normalizeText(String text) {
    if (text == null) {
      return "";
    }
    return WHITESPACE_RUN.matcher(text.strip()).replaceAll(" ");
  }
}
