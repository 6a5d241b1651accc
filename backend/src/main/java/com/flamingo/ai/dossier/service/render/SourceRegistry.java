package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.domain.model.Source;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates sources for one document, keyed by URL. The first label seen for a URL wins,
 * whichever message or branch contributed it.
 */
public class SourceRegistry {

  private final Map<String, Source> byUrl = new LinkedHashMap<>();

  public void addAll(List<Source> sources) {
    for (Source source : sources) {
      byUrl.putIfAbsent(source.url(), source);
    }
  }

  public boolean isEmpty() {
    return byUrl.isEmpty();
  }

  /** Entries ordered by label, then URL. */
  public List<Source> entries() {
    return byUrl.values().stream()
        .sorted(Comparator.comparing(Source::label).thenComparing(Source::url))
        .toList();
  }

  /** Renders the framed {@code SOURCES REGISTRY} block, or an empty string when no sources. */
  public String render() {
    if (byUrl.isEmpty()) {
      return "";
    }
    StringBuilder out = new StringBuilder(DossierLayout.REGISTRY_OPENING);
    int number = 1;
    for (Source source : entries()) {
      out.append('[')
          .append(number++)
          .append("] ")
          .append(source.label())
          .append("\n    ")
          .append(source.url())
          .append("\n\n");
    }
    return out.toString();
  }
}
