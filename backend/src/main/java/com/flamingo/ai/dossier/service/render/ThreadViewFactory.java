package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.domain.model.ConversationGroup;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.domain.model.Message;
import com.flamingo.ai.dossier.service.excerpt.Excerptor;
import com.flamingo.ai.dossier.service.grouping.BranchReconciler;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides which messages of a group get printed.
 *
 * <p>Branches are trimmed against the root's full message list first; in excerpt mode the root
 * and each trimmed branch are then narrowed to topic hits.
 */
@Component
@RequiredArgsConstructor
public class ThreadViewFactory {

  private final BranchReconciler branchReconciler;
  private final Excerptor excerptor;

  public ThreadView create(ConversationGroup group, RenderContext context) {
    ConversationItem root = group.root();
    List<Message> rootMessages = narrow(root.messages(), context);

    List<ThreadView.Branch> branches = new ArrayList<>(group.branches().size());
    for (ConversationItem branch : group.branches()) {
      List<Message> added = branchReconciler.reconcile(root.messages(), branch.messages());
      branches.add(new ThreadView.Branch(branch, narrow(added, context)));
    }
    return new ThreadView(root, rootMessages, List.copyOf(branches));
  }

  private List<Message> narrow(List<Message> messages, RenderContext context) {
    if (!context.excerpts()) {
      return messages;
    }
    return excerptor.excerpt(messages, context.topicPattern(), context.context());
  }
}
