package com.flamingo.ai.dossier.service.cleaning;

import java.util.Arrays;
import java.util.stream.Collectors;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Drops a pre-existing appendix so the assembler's appendix is the only one: everything from the
 * first appendix header line onward is cut, then any stray header line left elsewhere is removed.
 */
@Component
@Order(4)
public class AppendixStripStage implements CleaningStage {

  @Override
  public String name() {
    return "appendix-strip";
  }

  @Override
  public String apply(String text, CleaningContext context) {
    return removeHeaderLines(stripExistingAppendix(text));
  }

  static String stripExistingAppendix(String text) {
    String[] lines = text.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      if (AppendixHeaders.isHeaderLine(lines[i])) {
        return String.join("\n", Arrays.copyOfRange(lines, 0, i)).stripTrailing();
      }
    }
    return text;
  }

  static String removeHeaderLines(String text) {
    return Arrays.stream(text.split("\n", -1))
        .filter(line -> !AppendixHeaders.isHeaderLine(line))
        .collect(Collectors.joining("\n"));
  }
}
