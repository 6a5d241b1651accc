package com.flamingo.ai.dossier.service.cleaning;

import java.util.List;
import java.util.Set;

/**
 * Inputs of the cleaning stages for one build.
 *
 * @param dedup whether long repeated paragraphs are collapsed
 * @param minBlockSize paragraphs shorter than this are always kept by deduplication
 * @param patterns deliverable header patterns; {@code null} disables extraction, empty selects
 *     the defaults
 * @param usedLinks URLs already cited in drafts, or {@code null}
 */
public record CleaningContext(
    boolean dedup, int minBlockSize, List<String> patterns, Set<String> usedLinks) {

  public CleaningContext {
    patterns = patterns == null ? null : List.copyOf(patterns);
    usedLinks = usedLinks == null ? null : Set.copyOf(usedLinks);
  }

  /** Dedup on, default block size, no deliverable extraction, no used links. */
  public static CleaningContext defaults() {
    return new CleaningContext(true, 200, null, null);
  }
}
