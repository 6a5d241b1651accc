package com.flamingo.ai.dossier.service.cleaning;

import com.flamingo.ai.dossier.domain.model.Source;
import com.flamingo.ai.dossier.service.render.DossierLayout;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Re-emits the sources registry grouped into {@link SourceCategory} buckets.
 *
 * <p>The registry is found by its {@code =}-framed {@code SOURCES REGISTRY} heading and runs to
 * the end of the text. Entries are alphabetized by label inside each bucket and renumbered
 * across the whole registry. Text without a registry is returned unchanged.
 */
@Component
@Order(7)
@Slf4j
public class SourceRegistryStage implements CleaningStage {

  private static final Pattern ENTRY = Pattern.compile("\\[(\\d+)]\\s+(.+?)\\n\\s+(https?://\\S+)");

  @Override
  public String name() {
    return "source-registry";
  }

  @Override
  public String apply(String text, CleaningContext context) {
    int start = RegistryBlock.locate(text);
    if (start < 0) {
      return text;
    }

    List<Source> sources = parseEntries(text.substring(start));
    if (sources.isEmpty()) {
      return text;
    }

    Map<SourceCategory, List<Source>> buckets = new EnumMap<>(SourceCategory.class);
    for (Source source : sources) {
      SourceCategory category =
          SourceCategory.classify(source.url(), source.label(), context.usedLinks());
      buckets.computeIfAbsent(category, c -> new ArrayList<>()).add(source);
    }

    StringBuilder section = new StringBuilder(DossierLayout.REGISTRY_OPENING);
    int number = 1;
    for (Map.Entry<SourceCategory, List<Source>> bucket : buckets.entrySet()) {
      section.append(bucket.getKey().heading()).append(":\n\n");
      List<Source> sorted = new ArrayList<>(bucket.getValue());
      sorted.sort(Comparator.comparing(source -> source.label().toLowerCase(Locale.ROOT)));
      for (Source source : sorted) {
        section
            .append('[')
            .append(number++)
            .append("] ")
            .append(source.label())
            .append("\n    ")
            .append(source.url())
            .append("\n\n");
      }
      section.append('\n');
    }

    log.debug("Reorganized {} sources into {} categories", sources.size(), buckets.size());
    return text.substring(0, start) + section;
  }

  static List<Source> parseEntries(String registry) {
    Map<String, Source> byUrl = new LinkedHashMap<>();
    Matcher matcher = ENTRY.matcher(registry);
    while (matcher.find()) {
      String label = matcher.group(2).strip();
      String url = matcher.group(3).strip();
      byUrl.putIfAbsent(url, new Source(url, label));
    }
    return List.copyOf(byUrl.values());
  }
}
