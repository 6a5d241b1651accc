package com.flamingo.ai.dossier.service.cleaning;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects appendix header lines regardless of punctuation, soft hyphens or spacing: the line is
 * reduced to its ASCII letters, uppercased, and must contain both {@code APPENDIX} and {@code
 * RESEARCHLOGTOOLARTIFACTS}.
 */
public final class AppendixHeaders {

  private static final Pattern NON_LETTERS = Pattern.compile("[^A-Za-z]");

  static final Pattern HEADER_LITERAL =
      Pattern.compile(
          "APPENDIX:\\s*RESEARCH LOG & TOOL ARTIFACTS\\s*", Pattern.CASE_INSENSITIVE);

  private static final Pattern MARKER =
      Pattern.compile(
          "(?:APPENDIX:\\s*)?RESEARCH LOG & TOOL ARTIFACTS", Pattern.CASE_INSENSITIVE);

  private AppendixHeaders() {}

  public static boolean isHeaderLine(String line) {
    String letters = NON_LETTERS.matcher(line).replaceAll("").toUpperCase(Locale.ROOT);
    return letters.contains("APPENDIX") && letters.contains("RESEARCHLOGTOOLARTIFACTS");
  }

  /**
   * Removes the appendix header and the bare {@code RESEARCH LOG & TOOL ARTIFACTS} token from a
   * single-line label such as a conversation title.
   */
  public static String scrubLabel(String label) {
    return TextPatterns.collapseSpaces(MARKER.matcher(label).replaceAll("")).strip();
  }
}
