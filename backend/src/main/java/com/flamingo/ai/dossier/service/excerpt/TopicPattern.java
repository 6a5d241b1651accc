package com.flamingo.ai.dossier.service.excerpt;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Builds the case-insensitive alternation used to find topic mentions. */
public final class TopicPattern {

  private static final Pattern NEVER_MATCHES = Pattern.compile("(?!)");

  private TopicPattern() {}

  /**
   * Quotes each non-blank topic and joins them with {@code |}. With no usable topic the returned
   * pattern never matches.
   */
  public static Pattern compile(List<String> topics) {
    if (topics == null) {
      return NEVER_MATCHES;
    }
    String alternation =
        topics.stream()
            .filter(topic -> topic != null && !topic.isBlank())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    if (alternation.isEmpty()) {
      return NEVER_MATCHES;
    }
    return Pattern.compile(alternation, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
