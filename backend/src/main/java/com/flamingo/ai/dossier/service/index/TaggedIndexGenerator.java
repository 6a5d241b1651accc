package com.flamingo.ai.dossier.service.index;

import com.flamingo.ai.dossier.domain.model.ColumnConfig;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.service.render.DossierLayout;
import com.flamingo.ai.dossier.service.render.TimestampFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Generates the index used when a column configuration is present: every selected conversation
 * listed chronologically with the short tag of its matching include bucket, followed by the
 * section navigation list and a coverage audit of tag counts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaggedIndexGenerator {

  static final String TITLE = "PRIORITY THREADS (with category tags)";
  static final String COVERAGE_TITLE = "COVERAGE AUDIT";

  private final TimestampFormatter timestampFormatter;

  public WorkingIndex generate(
      String body, List<ConversationItem> conversations, ColumnConfig config) {
    if (conversations.isEmpty()) {
      return new WorkingIndex("", List.of(), List.of());
    }
    ColumnConfig.ThreadFilters filters =
        config == null ? ColumnConfig.ThreadFilters.empty() : config.threadFilters();

    List<TaggedThread> threads = new ArrayList<>();
    Map<String, Integer> tagCounts = new TreeMap<>();
    for (ConversationItem item : conversations) {
      ThreadFilter.Match match = ThreadFilter.match(item.title(), filters);
      String tag = ShortTag.of(match.included() ? match.bucket() : null);
      threads.add(new TaggedThread(item, tag));
      tagCounts.merge(tag, 1, Integer::sum);
    }
    threads.sort(Comparator.comparingDouble(thread -> thread.item().createTime()));

    StringBuilder sb = new StringBuilder(TITLE).append('\n');
    sb.append(DossierLayout.DELIMITER).append('\n');
    for (TaggedThread thread : threads) {
      ConversationItem item = thread.item();
      sb.append('[')
          .append(thread.tag())
          .append("] ")
          .append(IndexTitle.of(item))
          .append("\n  ID: ")
          .append(item.id())
          .append(" | Created: ")
          .append(timestampFormatter.format(item.createTime()))
          .append("\n\n");
    }
    sb.append(SectionNavigator.sections(body));

    List<String> coverage = new ArrayList<>();
    coverage.add("\n" + DossierLayout.DELIMITER);
    coverage.add(COVERAGE_TITLE);
    coverage.add(DossierLayout.DELIMITER);
    coverage.add("Included threads (total): " + threads.size());
    tagCounts.forEach((tag, count) -> coverage.add("  - [" + tag + "]: " + count));
    coverage.add("");

    return new WorkingIndex(sb.toString(), coverage, tagCollisions(filters));
  }

  /** Buckets whose names reduce to the same short tag; their counts are merged in the audit. */
  List<String> tagCollisions(ColumnConfig.ThreadFilters filters) {
    Map<String, TreeSet<String>> bucketsByTag = new LinkedHashMap<>();
    for (String bucket : filters.include().keySet()) {
      bucketsByTag.computeIfAbsent(ShortTag.of(bucket), tag -> new TreeSet<>()).add(bucket);
    }
    List<String> warnings = new ArrayList<>();
    bucketsByTag.forEach(
        (tag, buckets) -> {
          if (buckets.size() > 1) {
            log.warn("Short tag [{}] is shared by buckets {}", tag, buckets);
            warnings.add("Short tag [" + tag + "] is shared by buckets " + buckets);
          }
        });
    return warnings;
  }

  private record TaggedThread(ConversationItem item, String tag) {}
}
