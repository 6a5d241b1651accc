package com.flamingo.ai.dossier.service.cleaning;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Strips chat UI markup: angle-bracket tags, private-use glyphs and the spans they bound,
 * non-printing characters, pasted {@code APPENDIX: RESEARCH LOG & TOOL ARTIFACTS} headers,
 * leftover {@code turn…} citation tokens and long {@code =} separator lines that would read as
 * appendix dividers.
 *
 * <p>Non-printing characters go first so that a soft hyphen cannot hide a token from the later
 * patterns on one pass and expose it on the next. The literal header is removed here so that a
 * pasted copy in an early message never truncates the rest of the body in {@link
 * AppendixStripStage}.
 */
@Component
@Order(3)
public class MarkupSanitizerStage implements CleaningStage {

  private static final List<Pattern> MARKUP =
      List.of(
          Pattern.compile("[\\u00AD\\uFFFD\\uFFFE]"),
          Pattern.compile("</?[a-zA-Z][^>]*/?>\\s*"),
          Pattern.compile("<span[^>]*>.*?</span>", Pattern.DOTALL),
          AppendixHeaders.HEADER_LITERAL,
          Pattern.compile("[\\uE000-\\uF8FF].*?[\\uE000-\\uF8FF]", Pattern.DOTALL),
          Pattern.compile("[\\uE000-\\uF8FF]"),
          Pattern.compile(
              "(?:cite)?turn\\d+(?:search|news|view|file)\\w*", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bciteturn\\d+\\w+\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^={60,}.*?$", Pattern.MULTILINE));

  @Override
  public String name() {
    return "markup-sanitizer";
  }

  @Override
  public String apply(String text, CleaningContext context) {
    String result = text;
    for (Pattern pattern : MARKUP) {
      result = TextPatterns.removeAll(pattern, result);
    }
    result = TextPatterns.collapseSpaces(result);
    return TextPatterns.collapseNewlines(result).strip();
  }
}
