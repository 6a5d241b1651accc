package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.domain.model.ConversationGroup;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Table of contents for the raw narrative. Line offsets are estimated from message counts and
 * are informational only.
 */
@Component
@RequiredArgsConstructor
public class TableOfContentsGenerator {

  /** Header block plus metadata takes roughly this many lines. */
  private static final int FIRST_SECTION_LINE = 10;

  private static final int SEPARATOR_LINES = 3;

  private final TimestampFormatter timestampFormatter;

  public String generate(List<ConversationGroup> groups) {
    StringBuilder toc = new StringBuilder("## TABLE OF CONTENTS\n");
    int line = FIRST_SECTION_LINE;

    for (ConversationGroup group : groups) {
      ConversationItem root = group.root();
      int branchCount = group.branches().size();

      toc.append("  Line ~").append(line).append(": ").append(root.displayTitle());
      if (branchCount > 0) {
        toc.append(" (+")
            .append(branchCount)
            .append(branchCount == 1 ? " branch)" : " branches)");
      }
      toc.append(" - ").append(timestampFormatter.formatDate(root.createTime())).append('\n');

      int estimated = Math.max(10, root.messages().size() / 3);
      for (ConversationItem branch : group.branches()) {
        estimated += Math.max(8, branch.messages().size() / 5);
      }
      line += estimated + SEPARATOR_LINES;
    }

    return toc.append('\n').toString();
  }
}
