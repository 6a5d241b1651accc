package com.flamingo.ai.dossier.service.grouping;

import com.flamingo.ai.dossier.domain.model.ConversationGroup;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Clusters conversation items into root + branch groups by their base title.
 *
 * <p>Within a bucket items are ordered by creation time; the earliest becomes the root. Buckets
 * are ordered by their root's creation time. Both sorts are stable, so items with equal
 * timestamps keep their input order.
 */
@Service
@Slf4j
public class GroupBuilder {

  public List<ConversationGroup> build(List<ConversationItem> items) {
    Map<String, List<ConversationItem>> buckets = new LinkedHashMap<>();
    for (ConversationItem item : items) {
      buckets.computeIfAbsent(groupKey(item), k -> new ArrayList<>()).add(item);
    }

    List<ConversationGroup> groups = new ArrayList<>(buckets.size());
    for (Map.Entry<String, List<ConversationItem>> entry : buckets.entrySet()) {
      List<ConversationItem> bucket = entry.getValue();
      bucket.sort(Comparator.comparingDouble(ConversationItem::createTime));
      groups.add(
          new ConversationGroup(entry.getKey(), bucket.get(0), bucket.subList(1, bucket.size())));
    }
    groups.sort(Comparator.comparingDouble(group -> group.root().createTime()));

    log.debug("Grouped {} conversations into {} threads", items.size(), groups.size());
    return groups;
  }

  static String groupKey(ConversationItem item) {
    if (item.baseTitle() != null && !item.baseTitle().isEmpty()) {
      return item.baseTitle();
    }
    if (item.title() != null && !item.title().isEmpty()) {
      return item.title();
    }
    return item.id() == null ? "" : item.id();
  }
}
