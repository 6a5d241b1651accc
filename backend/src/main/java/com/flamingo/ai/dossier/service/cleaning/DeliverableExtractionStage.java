package com.flamingo.ai.dossier.service.cleaning;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Keeps only deliverable sections: a line containing any pattern (case-insensitive) opens a
 * section, following non-blank lines join it, and a blank line after at least one content line
 * closes it. Everything outside a section is dropped.
 */
@Component
@Order(6)
public class DeliverableExtractionStage implements CleaningStage {

  static final List<String> DEFAULT_PATTERNS =
      List.of("##", "constraint", "draft", "decision", "output", "result", "deliverable");

  @Override
  public String name() {
    return "deliverables";
  }

  @Override
  public String apply(String text, CleaningContext context) {
    if (context.patterns() == null) {
      return text;
    }
    List<String> patterns =
        context.patterns().isEmpty() ? DEFAULT_PATTERNS : context.patterns();
    return extract(text, patterns);
  }

  static String extract(String text, List<String> patterns) {
    List<String> needles =
        patterns.stream().map(pattern -> pattern.toLowerCase(Locale.ROOT)).toList();

    List<String> deliverables = new ArrayList<>();
    List<String> section = new ArrayList<>();
    boolean inSection = false;

    for (String line : text.split("\n", -1)) {
      String lower = line.toLowerCase(Locale.ROOT);
      if (needles.stream().anyMatch(lower::contains)) {
        deliverables.addAll(section);
        section = new ArrayList<>();
        section.add(line);
        inSection = true;
      } else if (inSection) {
        if (!line.isBlank()) {
          section.add(line);
        } else if (section.size() > 1) {
          deliverables.addAll(section);
          section = new ArrayList<>();
          inSection = false;
        }
      }
    }
    deliverables.addAll(section);
    return String.join("\n", deliverables);
  }
}
