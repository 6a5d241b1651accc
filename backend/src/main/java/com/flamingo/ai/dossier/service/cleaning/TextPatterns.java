package com.flamingo.ai.dossier.service.cleaning;

import java.util.regex.Pattern;

/** Regexes and helpers shared by several cleaning stages. */
final class TextPatterns {

  static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");
  static final Pattern DOUBLE_SPACES = Pattern.compile(" {2,}");
  static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B-\\u200F\\u2060\\uFEFF]");
  static final Pattern JSON_TOOL_CALL_LABEL =
      Pattern.compile("\\[\\s*JSON\\s*/\\s*Tool\\s*Call\\s*\\]", Pattern.CASE_INSENSITIVE);

  private TextPatterns() {}

  static String collapseNewlines(String text) {
    return EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
  }

  static String collapseSpaces(String text) {
    return DOUBLE_SPACES.matcher(text).replaceAll(" ");
  }

  static String removeZeroWidth(String text) {
    return ZERO_WIDTH.matcher(text).replaceAll("");
  }

  static String removeAll(Pattern pattern, String text) {
    return pattern.matcher(text).replaceAll("");
  }
}
