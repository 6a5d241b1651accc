package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.domain.model.ConversationGroup;
import com.flamingo.ai.dossier.domain.model.Message;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Renders grouped conversations as the raw dossier narrative.
 *
 * <p>Layout: a header block, the table of contents, one numbered section per group (root
 * messages, then each branch's new messages under a {@code --- Branch N: title ---} marker) and
 * finally the sources registry collected from every printed message.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RawRenderer {

  private final ThreadViewFactory threadViewFactory;
  private final TableOfContentsGenerator tableOfContentsGenerator;
  private final SourceExtractor sourceExtractor;
  private final TimestampFormatter timestampFormatter;
  private final Clock clock;

  @Timed(value = "dossier.render.raw", description = "Time to render the raw dossier narrative")
  public String render(List<ConversationGroup> groups, RenderContext context) {
    StringBuilder out = new StringBuilder();
    String label = context.topics().isEmpty() ? "Dossier" : context.topicLabel();

    out.append("DOSSIER: ").append(label).append('\n');
    out.append("Generated: ").append(timestampFormatter.format(clock.instant())).append('\n');
    out.append("Source: ").append(context.exportRoot()).append('\n');
    out.append('\n');
    out.append(tableOfContentsGenerator.generate(groups));

    SourceRegistry registry = new SourceRegistry();
    int sectionNumber = 1;
    for (ConversationGroup group : groups) {
      ThreadView view = threadViewFactory.create(group, context);

      out.append('\n').append(DossierLayout.DELIMITER).append('\n');
      out.append(sectionNumber++).append(". ").append(view.root().displayTitle()).append('\n');
      out.append(DossierLayout.DELIMITER).append("\n\n");

      if (view.rootMessages().isEmpty()) {
        out.append(
            context.excerpts()
                ? "[No matching excerpts in root conversation.]\n\n"
                : "[No messages in root conversation.]\n\n");
      } else {
        appendMessages(out, view.rootMessages(), registry);
      }

      int branchNumber = 1;
      for (ThreadView.Branch branch : view.branches()) {
        out.append("\n--- Branch ")
            .append(branchNumber++)
            .append(": ")
            .append(branch.item().displayTitle())
            .append(" ---\n\n");
        if (branch.messages().isEmpty()) {
          out.append(
              context.excerpts()
                  ? "[No matching excerpts in this branch.]\n\n"
                  : "[No new messages in this branch.]\n\n");
        } else {
          appendMessages(out, branch.messages(), registry);
        }
      }
    }

    if (!registry.isEmpty()) {
      out.append('\n').append(registry.render());
    }

    log.debug("Rendered raw dossier: {} groups, {} chars", groups.size(), out.length());
    return out.toString();
  }

  private void appendMessages(StringBuilder out, List<Message> messages, SourceRegistry registry) {
    for (Message message : messages) {
      out.append(capitalize(message.role())).append(":\n\n").append(message.text()).append("\n\n");
      registry.addAll(sourceExtractor.extract(message.text()));
    }
  }

  static String capitalize(String role) {
    if (role.isEmpty()) {
      return role;
    }
    return role.substring(0, 1).toUpperCase(Locale.ROOT)
        + role.substring(1).toLowerCase(Locale.ROOT);
  }
}
