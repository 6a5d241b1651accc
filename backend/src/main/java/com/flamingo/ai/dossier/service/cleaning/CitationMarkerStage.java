package com.flamingo.ai.dossier.service.cleaning;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Removes inline citation markup: {@code <citeturn…>} tags, {@code <navlist>} blocks, bare
 * {@code turnNnewsN} tokens, lone {@code [n]} brackets and {@code 【…】} phantom markers.
 */
@Component
@Order(2)
public class CitationMarkerStage implements CleaningStage {

  private static final List<Pattern> MARKERS =
      List.of(
          Pattern.compile("<citeturn[^>]*>", Pattern.CASE_INSENSITIVE),
          Pattern.compile("<navlist>.*?</navlist>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bturn\\d+news\\d+\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("(?:\\[\\d+\\])+(?!\\S)"),
          Pattern.compile("【[^】]*†[^】]*】"),
          Pattern.compile("【[^】]*】"),
          Pattern.compile("\\[REF REMOVED\\]", Pattern.CASE_INSENSITIVE));

  @Override
  public String name() {
    return "citation-markers";
  }

  @Override
  public String apply(String text, CleaningContext context) {
    String result = text;
    for (Pattern marker : MARKERS) {
      result = TextPatterns.removeAll(marker, result);
    }
    result = TextPatterns.collapseSpaces(result);
    return TextPatterns.collapseNewlines(result).strip();
  }
}
