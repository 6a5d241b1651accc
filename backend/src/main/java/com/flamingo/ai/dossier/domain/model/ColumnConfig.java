package com.flamingo.ai.dossier.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-specific configuration: thread filters and tags, segment scoring knobs and the control
 * layer printed at the top of the working dossier.
 *
 * <p>Instances are produced by {@link com.flamingo.ai.dossier.service.input.ColumnConfigLoader},
 * which rejects unknown keys and mistyped values before binding.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ColumnConfig(
    String columnName,
    String columnObjective,
    ThreadFilters threadFilters,
    SegmentScoring segmentScoring,
    @JsonProperty("op_v2_constraints") List<String> opV2Constraints,
    String dossierContract,
    ControlLayerSections controlLayerSections,
    List<String> searchTerms) {

  public ColumnConfig {
    threadFilters = threadFilters == null ? ThreadFilters.empty() : threadFilters;
    controlLayerSections =
        controlLayerSections == null ? ControlLayerSections.empty() : controlLayerSections;
    opV2Constraints = opV2Constraints == null ? List.of() : List.copyOf(opV2Constraints);
    searchTerms = searchTerms == null ? List.of() : List.copyOf(searchTerms);
  }

  /** Include buckets (in declaration order) and exclude terms matched against thread titles. */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ThreadFilters(Map<String, List<String>> include, List<String> exclude) {

    public ThreadFilters {
      include =
          include == null
              ? Map.of()
              : Collections.unmodifiableMap(new LinkedHashMap<>(include));
      exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public static ThreadFilters empty() {
      return new ThreadFilters(null, null);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SegmentScoring(
      List<String> mechanismTerms,
      List<String> bridgingTerms,
      Integer contextWindow,
      Double minScore) {}

  /** Free-text sections rendered into the control layer front matter; all optional. */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ControlLayerSections(
      String scopeRouter,
      List<String> doNotRepeatRules,
      String mechanismFocus,
      String evidenceVsInference,
      List<String> stressTests) {

    public static ControlLayerSections empty() {
      return new ControlLayerSections(null, null, null, null, null);
    }
  }
}
