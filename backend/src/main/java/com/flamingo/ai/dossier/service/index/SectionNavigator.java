package com.flamingo.ai.dossier.service.index;

import java.util.regex.Pattern;

/** Builds the {@code ### Sections} navigation list shared by both index flavours. */
final class SectionNavigator {

  private static final Pattern NUMBERED = Pattern.compile("^\\d+\\.");
  private static final Pattern LEADING_HASHES = Pattern.compile("^#+");
  private static final Pattern LEADING_EQUALS = Pattern.compile("^=+");
  private static final String SELF = "WORKING INDEX";

  private SectionNavigator() {}

  /**
   * Lists every header-like line of {@code body} as {@code NN. Line ~i: header}. Numbering counts
   * every header-like line, including blank separators and the index's own header, which are not
   * listed.
   */
  static String sections(String body) {
    StringBuilder sb = new StringBuilder("### Sections\n\n");
    String[] lines = body.split("\n", -1);
    int sectionNum = 0;
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      if (!line.startsWith("##") && !line.startsWith("===") && !NUMBERED.matcher(line).find()) {
        continue;
      }
      sectionNum++;
      String header = headerText(line);
      if (!header.isEmpty() && !SELF.equals(header)) {
        sb.append(String.format("  %02d. Line ~%d: %s\n", sectionNum, i, header));
      }
    }
    return sb.append("\n---\n\n").toString();
  }

  static String headerText(String line) {
    String header = LEADING_HASHES.matcher(line.strip()).replaceFirst("").strip();
    return LEADING_EQUALS.matcher(header).replaceFirst("").strip();
  }
}
