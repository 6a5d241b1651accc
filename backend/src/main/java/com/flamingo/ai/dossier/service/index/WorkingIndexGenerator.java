package com.flamingo.ai.dossier.service.index;

import com.flamingo.ai.dossier.config.DossierConfig;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.service.render.DossierLayout;
import com.flamingo.ai.dossier.service.render.TimestampFormatter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Generates the plain working index: a timeline of the most recent conversations, priority
 * threads scored by title keywords, topics and recency, and the section navigation list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkingIndexGenerator {

  static final List<String> PRIORITY_KEYWORDS =
      List.of(
          "draft", "decision", "deliverable", "output", "final", "review", "summary", "analysis");

  private static final double SECONDS_PER_DAY = 86_400d;

  private final DossierConfig dossierConfig;
  private final TimestampFormatter timestampFormatter;
  private final Clock clock;

  public WorkingIndex generate(
      String body, List<ConversationItem> conversations, List<String> topics) {
    StringBuilder sb = new StringBuilder(DossierLayout.WORKING_INDEX_HEADER).append("\n\n");
    if (!conversations.isEmpty()) {
      appendTimeline(sb, conversations);
      if (topics != null && !topics.isEmpty()) {
        appendPriorityThreads(sb, conversations, topics);
      }
    }
    sb.append(SectionNavigator.sections(body));
    return WorkingIndex.of(sb.toString());
  }

  private void appendTimeline(StringBuilder sb, List<ConversationItem> conversations) {
    sb.append("### Timeline\n\n");
    conversations.stream()
        .sorted(Comparator.comparingDouble(ConversationItem::createTime).reversed())
        .limit(dossierConfig.getIndex().getTimelineLimit())
        .forEach(
            item ->
                sb.append("  - ")
                    .append(timestampFormatter.formatDate(item.createTime()))
                    .append(": ")
                    .append(IndexTitle.of(item))
                    .append(" (ID: ")
                    .append(shortId(item.id()))
                    .append(")\n"));
    sb.append('\n');
  }

  private void appendPriorityThreads(
      StringBuilder sb, List<ConversationItem> conversations, List<String> topics) {
    sb.append("### Priority Threads (Read These First)\n\n");
    List<Scored> scored = new ArrayList<>();
    for (ConversationItem item : conversations) {
      double score = score(item, topics);
      if (score > 0) {
        scored.add(new Scored(item, score));
      }
    }
    scored.sort(Comparator.comparingDouble(Scored::score).reversed());

    int rank = 1;
    for (Scored entry : scored.subList(0, Math.min(scored.size(), limit()))) {
      sb.append("  ")
          .append(rank++)
          .append(". [")
          .append(timestampFormatter.formatDate(entry.item().createTime()))
          .append("] ")
          .append(IndexTitle.of(entry.item()))
          .append('\n');
    }
    sb.append('\n');
  }

  /** Keyword hits +2 each, topic hits +3 each, plus a bonus shrinking with age inside the window. */
  double score(ConversationItem item, List<String> topics) {
    String title = item.title() == null ? "" : item.title().toLowerCase(Locale.ROOT);
    double score = 0;
    for (String keyword : PRIORITY_KEYWORDS) {
      if (title.contains(keyword)) {
        score += 2;
      }
    }
    for (String topic : topics) {
      if (topic != null && title.contains(topic.toLowerCase(Locale.ROOT))) {
        score += 3;
      }
    }
    if (item.createTime() != 0) {
      int window = dossierConfig.getIndex().getRecencyWindowDays();
      double nowSeconds = clock.millis() / 1000d;
      double daysAgo = (nowSeconds - item.createTime()) / SECONDS_PER_DAY;
      if (daysAgo < window) {
        score += (window - daysAgo) / 10;
      }
    }
    return score;
  }

  private int limit() {
    return dossierConfig.getIndex().getPriorityLimit();
  }

  static String shortId(String id) {
    if (id == null || id.isEmpty()) {
      return "unknown";
    }
    return id.substring(0, Math.min(8, id.length())) + "...";
  }

  private record Scored(ConversationItem item, double score) {}
}
