package com.flamingo.ai.dossier.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/**
 * Immutable options for a single dossier build.
 *
 * @param mode full transcript or topic excerpts
 * @param context messages kept on each side of an excerpt hit
 * @param dedup whether long repeated paragraphs are collapsed in the working variant
 * @param split whether the cleaned working variant is produced
 * @param patterns deliverable header patterns; {@code null} disables deliverable extraction, an
 *     empty list selects the default patterns
 * @param usedLinks URLs already cited in drafts; {@code null} when not supplied
 * @param columnConfig optional column configuration driving tags and the control layer
 * @param formats requested output variants
 */
@Builder(toBuilder = true)
public record BuildOptions(
    DossierMode mode,
    int context,
    boolean dedup,
    boolean split,
    List<String> patterns,
    Set<String> usedLinks,
    ColumnConfig columnConfig,
    Set<DossierFormat> formats) {

  public BuildOptions {
    if (context < 0) {
      throw new IllegalArgumentException("context must be >= 0");
    }
    mode = mode == null ? DossierMode.FULL : mode;
    patterns = patterns == null ? null : List.copyOf(patterns);
    usedLinks = usedLinks == null ? null : Set.copyOf(usedLinks);
    formats =
        formats == null || formats.isEmpty()
            ? Set.of(DossierFormat.TXT)
            : Set.copyOf(EnumSet.copyOf(formats));
  }

  /** Defaults: full mode, no context, dedup on, no split, TXT only. */
  public static BuildOptions defaults() {
    return BuildOptions.builder().dedup(true).build();
  }
}
