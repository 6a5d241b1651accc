package com.flamingo.ai.dossier.domain.model;

import com.flamingo.ai.dossier.service.grouping.TitleNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A normalized conversation record ready for grouping.
 *
 * <p>The base title is always derived from {@code title} with any leading branch marker removed,
 * so that "Branch · Trip" and "Trip" land in the same group.
 *
 * @param id conversation identifier
 * @param title display title (may be empty)
 * @param createTime epoch seconds; {@code 0} when unknown
 * @param messages messages in chronological order
 */
public record ConversationItem(
    String id, String title, double createTime, List<Message> messages) {

  public ConversationItem {
    title = title == null ? "" : title;
    messages = List.copyOf(messages);
  }

  /**
   * Creates an item, flattening the title and sorting messages by timestamp. The sort is
   * stable, so messages sharing a timestamp keep their export order.
   */
  public static ConversationItem of(
      String id, String title, double createTime, List<Message> messages) {
    String safeTitle = title == null ? "" : title.replace('\t', ' ').replace('\n', ' ').strip();
    List<Message> sorted = new ArrayList<>(messages == null ? List.of() : messages);
    sorted.sort(Comparator.comparingDouble(Message::timestamp));
    return new ConversationItem(id, safeTitle, createTime, sorted);
  }

  /** Title without branch marker, whitespace-normalized; the grouping key. */
  public String baseTitle() {
    return TitleNormalizer.baseTitle(title);
  }

  /** Title for display, falling back to {@code Untitled}. */
  public String displayTitle() {
    return title.isEmpty() ? "Untitled" : title;
  }
}
