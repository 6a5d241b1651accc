package com.flamingo.ai.dossier.service.cleaning;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Removes tool-call JSON, tool markers, tool status lines, leaked instruction blocks and similar
 * technical noise from the transcript.
 */
@Component
@Order(1)
public class ToolNoiseStage implements CleaningStage {

  static final List<String> TOOL_KEYS =
      List.of(
          "search_query",
          "tool_call",
          "function",
          "action",
          "open",
          "click",
          "find",
          "screenshot",
          "response_length",
          "file_path",
          "command",
          "terminal",
          "browser",
          "task_violates_safety_guidelines",
          "updates",
          "comments",
          "title",
          "prompt");

  private static final List<String> SAFETY_KEYS =
      List.of("task_violates_safety_guidelines", "updates", "comments");

  private static final Pattern TOOL_STATUS =
      Pattern.compile("(?:Successfully created|Successfully updated|Failed with error).*?\n");

  private static final Pattern META_INSTRUCTION =
      Pattern.compile(
          "^[^\n]*(?:Make sure to|remember to|don't forget to).*?$",
          Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

  private static final List<Pattern> INSTRUCTION_BLOCKS =
      List.of(
          block("How to invoke the file_search tool"),
          block("How to handle results from file_search"),
          block("Tool usage instructions"));

  private static final Pattern TRUNCATION_NOTICE =
      Pattern.compile(
          "^The file is too long and its contents have been truncated\\..*?$",
          Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

  private static final Pattern TOOL_JSON =
      Pattern.compile(
          "\\{\\s*['\"]?(?:" + String.join("|", TOOL_KEYS) + ")['\"]?.*?\\}", Pattern.DOTALL);

  private static final Pattern TOOL_CALL_MARKER =
      Pattern.compile("\\[tool_call:.*?\\]", Pattern.DOTALL);

  private static final Pattern TOOL_INVOCATION_LINE =
      Pattern.compile("^\\s*(?:\\*\\*)?tool\\s*\\(.*", Pattern.MULTILINE);

  private static final Pattern TOOL_COMMAND_LINE =
      Pattern.compile("^\\s*(?:\\*\\*)?tool\\s+\\w+.*", Pattern.MULTILINE);

  @Override
  public String name() {
    return "tool-noise";
  }

  @Override
  public String apply(String text, CleaningContext context) {
    String result = TextPatterns.removeAll(TOOL_STATUS, text);
    result = TextPatterns.removeAll(META_INSTRUCTION, result);
    for (Pattern block : INSTRUCTION_BLOCKS) {
      result = TextPatterns.removeAll(block, result);
    }
    result = TextPatterns.removeAll(TRUNCATION_NOTICE, result);
    result = TextPatterns.removeAll(TOOL_JSON, result);
    result = TextPatterns.removeAll(TOOL_CALL_MARKER, result);
    result = TextPatterns.removeAll(TOOL_INVOCATION_LINE, result);
    result = TextPatterns.removeAll(TOOL_COMMAND_LINE, result);
    result = dropNoiseLines(result);
    return TextPatterns.collapseNewlines(result).strip();
  }

  private static String dropNoiseLines(String text) {
    String[] lines = text.split("\n", -1);
    List<String> kept = new ArrayList<>(lines.length);
    for (String line : lines) {
      String normalized = TextPatterns.removeZeroWidth(line.strip());
      if (TextPatterns.JSON_TOOL_CALL_LABEL.matcher(normalized).find()) {
        continue;
      }
      if (normalized.startsWith("{") && TOOL_KEYS.stream().anyMatch(normalized::contains)) {
        continue;
      }
      if (SAFETY_KEYS.stream()
          .anyMatch(
              key -> normalized.contains("\"" + key + "\"") || normalized.contains("'" + key + "'"))) {
        continue;
      }
      kept.add(line);
    }
    return String.join("\n", kept);
  }

  /** A {@code ## <heading>} block running up to the next level-2 heading or end of text. */
  private static Pattern block(String heading) {
    return Pattern.compile(
        "^##\\s+" + Pattern.quote(heading) + ".*?(?=^##\\s|\\z)",
        Pattern.DOTALL | Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
  }
}
