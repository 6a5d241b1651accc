package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.domain.model.DossierMode;
import com.flamingo.ai.dossier.service.excerpt.TopicPattern;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-build rendering inputs, passed explicitly to every renderer.
 *
 * @param topics topic strings, used for the header label and excerpt matching
 * @param exportRoot where the conversations came from (display only)
 * @param mode full transcript or excerpts
 * @param topicPattern compiled topic alternation
 * @param context excerpt window half-width
 */
public record RenderContext(
    List<String> topics, String exportRoot, DossierMode mode, Pattern topicPattern, int context) {

  public RenderContext {
    topics = topics == null ? List.of() : List.copyOf(topics);
    exportRoot = exportRoot == null ? "" : exportRoot;
  }

  public static RenderContext of(
      List<String> topics, String exportRoot, DossierMode mode, int context) {
    return new RenderContext(topics, exportRoot, mode, TopicPattern.compile(topics), context);
  }

  public boolean excerpts() {
    return mode == DossierMode.EXCERPTS;
  }

  /** Topics joined with {@code ", "}. */
  public String topicLabel() {
    return String.join(", ", topics);
  }
}
