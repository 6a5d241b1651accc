package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.domain.model.ConversationGroup;
import com.flamingo.ai.dossier.domain.model.Message;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Renders grouped conversations as a markdown transcript with per-message timestamps. */
@Service
@RequiredArgsConstructor
public class MarkdownRenderer {

  private final ThreadViewFactory threadViewFactory;
  private final TimestampFormatter timestampFormatter;
  private final Clock clock;

  public String render(List<ConversationGroup> groups, RenderContext context) {
    StringBuilder doc = new StringBuilder();
    doc.append("# Dossier: ").append(context.topicLabel()).append("\n\n");
    doc.append("- generated_at: ").append(timestampFormatter.format(clock.instant())).append('\n');
    doc.append("- export_root: ").append(context.exportRoot()).append('\n');
    doc.append("- mode: ").append(context.mode().value()).append("\n\n");
    doc.append("---\n\n");

    for (ConversationGroup group : groups) {
      ThreadView view = threadViewFactory.create(group, context);

      doc.append("## Thread: ").append(view.root().displayTitle()).append("\n\n");
      doc.append("- root_id: ").append(view.root().id()).append('\n');
      doc.append("- conversation_create_time: ")
          .append(timestampFormatter.format(view.root().createTime()))
          .append("\n\n");

      if (view.rootMessages().isEmpty()) {
        doc.append(
            context.excerpts()
                ? "_No matching excerpts in root conversation._\n\n"
                : "_No messages found._\n\n");
      } else {
        doc.append("### Root conversation\n\n");
        appendMessages(doc, view.rootMessages());
      }

      for (ThreadView.Branch branch : view.branches()) {
        doc.append("### Branch: ").append(branch.item().displayTitle()).append("\n\n");
        doc.append("- branch_id: ").append(branch.item().id()).append('\n');
        doc.append("- branch_conversation_create_time: ")
            .append(timestampFormatter.format(branch.item().createTime()))
            .append("\n\n");
        if (branch.messages().isEmpty()) {
          doc.append(
              context.excerpts()
                  ? "_No matching excerpts in this branch._\n\n"
                  : "_No new messages after trimming._\n\n");
        } else {
          appendMessages(doc, branch.messages());
        }
      }
      doc.append("---\n\n");
    }
    return doc.toString();
  }

  private void appendMessages(StringBuilder doc, List<Message> messages) {
    for (Message message : messages) {
      doc.append("**")
          .append(message.role())
          .append("** (")
          .append(timestampFormatter.format(message.timestamp()))
          .append(")\n\n")
          .append(message.text())
          .append("\n\n");
    }
  }
}
