package com.flamingo.ai.dossier.service.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.dossier.domain.model.ColumnConfig;
import com.flamingo.ai.dossier.exception.DossierConfigException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads and validates column configuration JSON.
 *
 * <p>Validation runs on the JSON tree before binding: unknown keys are rejected at every level,
 * values must have the declared JSON type, include bucket names must be non-blank, and numeric
 * scoring knobs must be non-negative. Every failure raises {@link DossierConfigException} naming
 * the offending field path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ColumnConfigLoader {

  private static final Set<String> TOP_LEVEL_KEYS =
      Set.of(
          "column_name",
          "column_objective",
          "thread_filters",
          "segment_scoring",
          "op_v2_constraints",
          "dossier_contract",
          "control_layer_sections",
          "search_terms");
  private static final Set<String> THREAD_FILTER_KEYS = Set.of("include", "exclude");
  private static final Set<String> SEGMENT_SCORING_KEYS =
      Set.of("mechanism_terms", "bridging_terms", "context_window", "min_score");
  private static final Set<String> CONTROL_LAYER_KEYS =
      Set.of(
          "scope_router",
          "do_not_repeat_rules",
          "mechanism_focus",
          "evidence_vs_inference",
          "stress_tests");

  private final ObjectMapper objectMapper;

  public ColumnConfig load(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new DossierConfigException("config", "Config file not found: " + path, null);
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(Files.readString(path));
    } catch (IOException e) {
      throw new DossierConfigException("config", "Error loading config: " + e.getMessage(), e);
    }
    log.debug("Loaded column config from {}", path);
    return load(root);
  }

  public ColumnConfig load(JsonNode root) {
    validate(root);
    try {
      return objectMapper.treeToValue(root, ColumnConfig.class);
    } catch (JsonProcessingException e) {
      throw new DossierConfigException(
          "root", "Error binding config: " + e.getOriginalMessage(), e);
    }
  }

  void validate(JsonNode config) {
    if (config == null || !config.isObject()) {
      throw new DossierConfigException("root", "expected a JSON object");
    }
    requireKeys(config, TOP_LEVEL_KEYS, "root");

    for (String key : List.of("column_name", "column_objective", "dossier_contract")) {
      requireStringIfPresent(config, key, key);
    }
    requireStringListIfPresent(config, "search_terms", "search_terms");
    requireStringListIfPresent(config, "op_v2_constraints", "op_v2_constraints");

    if (config.has("thread_filters")) {
      validateThreadFilters(config.get("thread_filters"));
    }
    if (config.has("segment_scoring")) {
      validateSegmentScoring(config.get("segment_scoring"));
    }
    if (config.has("control_layer_sections")) {
      validateControlLayer(config.get("control_layer_sections"));
    }
  }

  private static void validateThreadFilters(JsonNode filters) {
    requireObject(filters, "thread_filters");
    requireKeys(filters, THREAD_FILTER_KEYS, "thread_filters");

    if (filters.has("include")) {
      JsonNode include = filters.get("include");
      requireObject(include, "thread_filters.include");
      Iterator<Map.Entry<String, JsonNode>> buckets = include.fields();
      while (buckets.hasNext()) {
        Map.Entry<String, JsonNode> bucket = buckets.next();
        if (bucket.getKey().isBlank()) {
          throw new DossierConfigException(
              "thread_filters.include", "bucket names must be non-empty strings");
        }
        requireStringList(bucket.getValue(), "thread_filters.include." + bucket.getKey());
      }
    }
    requireStringListIfPresent(filters, "exclude", "thread_filters.exclude");
  }

  private static void validateSegmentScoring(JsonNode scoring) {
    requireObject(scoring, "segment_scoring");
    requireKeys(scoring, SEGMENT_SCORING_KEYS, "segment_scoring");
    requireStringListIfPresent(scoring, "mechanism_terms", "segment_scoring.mechanism_terms");
    requireStringListIfPresent(scoring, "bridging_terms", "segment_scoring.bridging_terms");

    if (scoring.has("context_window")) {
      JsonNode window = scoring.get("context_window");
      if (!window.isIntegralNumber()) {
        throw new DossierConfigException("segment_scoring.context_window", "expected an integer");
      }
      if (window.asLong() < 0) {
        throw new DossierConfigException("segment_scoring.context_window", "must be >= 0");
      }
    }
    if (scoring.has("min_score")) {
      JsonNode minScore = scoring.get("min_score");
      if (!minScore.isNumber()) {
        throw new DossierConfigException("segment_scoring.min_score", "expected a number");
      }
      if (minScore.asDouble() < 0.0) {
        throw new DossierConfigException("segment_scoring.min_score", "must be >= 0");
      }
    }
  }

  private static void validateControlLayer(JsonNode sections) {
    requireObject(sections, "control_layer_sections");
    requireKeys(sections, CONTROL_LAYER_KEYS, "control_layer_sections");
    for (String key : List.of("scope_router", "mechanism_focus", "evidence_vs_inference")) {
      requireStringIfPresent(sections, key, "control_layer_sections." + key);
    }
    requireStringListIfPresent(
        sections, "do_not_repeat_rules", "control_layer_sections.do_not_repeat_rules");
    requireStringListIfPresent(sections, "stress_tests", "control_layer_sections.stress_tests");
  }

  private static void requireKeys(JsonNode node, Set<String> allowed, String field) {
    List<String> unknown = new ArrayList<>();
    node.fieldNames()
        .forEachRemaining(
            name -> {
              if (!allowed.contains(name)) {
                unknown.add(name);
              }
            });
    if (!unknown.isEmpty()) {
      Collections.sort(unknown);
      throw new DossierConfigException(field, "unknown key(s): " + String.join(", ", unknown));
    }
  }

  private static void requireObject(JsonNode node, String field) {
    if (!node.isObject()) {
      throw new DossierConfigException(field, "expected an object");
    }
  }

  private static void requireStringIfPresent(JsonNode parent, String key, String field) {
    if (parent.has(key) && !parent.get(key).isTextual()) {
      throw new DossierConfigException(field, "expected a string");
    }
  }

  private static void requireStringListIfPresent(JsonNode parent, String key, String field) {
    if (parent.has(key)) {
      requireStringList(parent.get(key), field);
    }
  }

  private static void requireStringList(JsonNode node, String field) {
    if (!node.isArray()) {
      throw new DossierConfigException(field, "expected a list of strings");
    }
    for (JsonNode item : node) {
      if (!item.isTextual()) {
        throw new DossierConfigException(field, "expected a list of strings");
      }
    }
  }
}
