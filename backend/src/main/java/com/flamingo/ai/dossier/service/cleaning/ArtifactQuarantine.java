package com.flamingo.ai.dossier.service.cleaning;

import com.flamingo.ai.dossier.config.DossierConfig;
import com.flamingo.ai.dossier.domain.model.Artifact;
import com.flamingo.ai.dossier.service.render.DossierLayout;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Moves tool and UI leftovers out of the working body.
 *
 * <p>Each line is tested against the artifact patterns in order. JSON and tool-call matches are
 * dropped without a trace. Other matches longer than the configured minimum are recorded as
 * {@link Artifact}s (snippet truncated) and their line is removed; shorter matches leave the line
 * in place. Stray appendix header lines are always removed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ArtifactQuarantine {

  static final String JSON_TOOL_CALL = "JSON/Tool Call";

  private static final List<ArtifactPattern> PATTERNS =
      List.of(
          new ArtifactPattern(Pattern.compile("\\[Search Query].*"), "Search Fragment"),
          new ArtifactPattern(Pattern.compile("\\[JSON/Tool Call].*"), JSON_TOOL_CALL),
          new ArtifactPattern(Pattern.compile("\\{\".*?}"), JSON_TOOL_CALL),
          new ArtifactPattern(Pattern.compile("\\[Image.*?]"), "Image Reference"),
          new ArtifactPattern(Pattern.compile("\\[GPT Model.*?]"), "Model Info"),
          new ArtifactPattern(Pattern.compile("\\[Citation Widget.*?]"), "Citation Widget"));

  private final DossierConfig dossierConfig;

  /** Cleaned text plus the artifacts removed from it, in document order. */
  public record Quarantined(String text, List<Artifact> artifacts) {}

  public Quarantined quarantine(String text) {
    int snippetLength = dossierConfig.getCleaning().getSnippetLength();
    int minLength = dossierConfig.getCleaning().getMinArtifactLength();

    List<Artifact> artifacts = new ArrayList<>();
    List<String> kept = new ArrayList<>();

    for (String line : text.split("\n", -1)) {
      String normalized = TextPatterns.removeZeroWidth(line);
      if (AppendixHeaders.isHeaderLine(normalized)
          || TextPatterns.JSON_TOOL_CALL_LABEL.matcher(normalized).find()) {
        continue;
      }
      if (!isArtifact(normalized, snippetLength, minLength, artifacts)) {
        kept.add(line);
      }
    }

    List<Artifact> reportable = artifacts.stream().filter(ArtifactQuarantine::reportable).toList();
    if (!reportable.isEmpty()) {
      log.debug("Quarantined {} artifacts", reportable.size());
    }
    return new Quarantined(String.join("\n", kept), reportable);
  }

  private static boolean isArtifact(
      String line, int snippetLength, int minLength, List<Artifact> artifacts) {
    for (ArtifactPattern pattern : PATTERNS) {
      Matcher matcher = pattern.regex().matcher(line);
      if (!matcher.find()) {
        continue;
      }
      String match = matcher.group();
      String snippet = match.length() > snippetLength ? match.substring(0, snippetLength) : match;
      if (AppendixHeaders.isHeaderLine(snippet) || JSON_TOOL_CALL.equals(pattern.label())) {
        return true;
      }
      if (match.length() > minLength) {
        artifacts.add(new Artifact(pattern.label(), snippet));
        return true;
      }
    }
    return false;
  }

  /** Artifacts echoing the appendix header or tool-call labels never reach the appendix. */
  private static boolean reportable(Artifact artifact) {
    String rendered = artifact.render();
    return !rendered.contains("APPENDIX: RESEARCH LOG")
        && !rendered.contains(DossierLayout.RESEARCH_LOG_TOKEN)
        && !rendered.contains(JSON_TOOL_CALL);
  }

  private record ArtifactPattern(Pattern regex, String label) {}
}
