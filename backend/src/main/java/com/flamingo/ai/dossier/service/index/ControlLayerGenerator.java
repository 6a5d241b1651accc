package com.flamingo.ai.dossier.service.index;

import com.flamingo.ai.dossier.domain.model.ColumnConfig;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.service.render.DossierLayout;
import com.flamingo.ai.dossier.service.render.TimestampFormatter;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders the front matter placed above a working dossier built for a column: the control layer
 * sections from the column configuration and a completeness check over the selected
 * conversations.
 */
@Component
@RequiredArgsConstructor
public class ControlLayerGenerator {

  static final String COMPLETENESS_TITLE = "COMPLETENESS CHECK";

  private static final double RECENT_WINDOW_SECONDS = 7 * 86_400d;

  private final TimestampFormatter timestampFormatter;
  private final Clock clock;

  /** Control layer followed by the framed completeness check, ending with a blank line. */
  public String frontMatter(ColumnConfig config, List<ConversationItem> conversations) {
    return controlLayer(config)
        + COMPLETENESS_TITLE
        + "\n"
        + DossierLayout.DELIMITER
        + "\n"
        + completeness(conversations)
        + "\n"
        + DossierLayout.DELIMITER
        + "\n\n";
  }

  String controlLayer(ColumnConfig config) {
    String name = config.columnName() == null ? "Report" : config.columnName();
    StringBuilder sb = new StringBuilder();
    sb.append(DossierLayout.DELIMITER).append('\n');
    sb.append("CONTROL LAYER — ").append(name).append('\n');
    sb.append(DossierLayout.DELIMITER).append("\n\n");

    ColumnConfig.ControlLayerSections sections = config.controlLayerSections();
    appendText(sb, "SCOPE ROUTER", sections.scopeRouter());
    appendBullets(sb, "DO-NOT-REPEAT RULES", sections.doNotRepeatRules());
    appendText(sb, "MECHANISM FOCUS (from OP v2)", sections.mechanismFocus());
    appendText(sb, "EVIDENCE VS INFERENCE", sections.evidenceVsInference());
    appendBullets(sb, "STRESS TESTS", sections.stressTests());

    return sb.append(DossierLayout.DELIMITER).append('\n').toString();
  }

  String completeness(List<ConversationItem> conversations) {
    if (conversations.isEmpty()) {
      return "No conversations found.";
    }
    List<Double> dates =
        conversations.stream()
            .map(ConversationItem::createTime)
            .filter(createTime -> createTime != 0)
            .toList();
    if (dates.isEmpty()) {
      return "No date information available.";
    }

    double now = clock.millis() / 1000d;
    double latest = dates.stream().mapToDouble(Double::doubleValue).max().orElse(0);
    long recent = dates.stream().filter(date -> now - date < RECENT_WINDOW_SECONDS).count();

    return "Searched conversations up to "
        + timestampFormatter.formatDate(now)
        + ".\nLast relevant match: "
        + timestampFormatter.formatDate(latest)
        + ".\nRecent matches (< 7 days): "
        + recent
        + ".\nTotal conversations in dossier: "
        + conversations.size()
        + ".";
  }

  private static void appendText(StringBuilder sb, String heading, String text) {
    if (text == null) {
      return;
    }
    sb.append(heading).append("\n\n").append(text).append("\n\n");
  }

  private static void appendBullets(StringBuilder sb, String heading, List<String> items) {
    if (items == null) {
      return;
    }
    sb.append(heading).append("\n\n");
    items.forEach(item -> sb.append("• ").append(item).append('\n'));
    sb.append('\n');
  }
}
