package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.domain.model.Message;
import java.util.List;

/**
 * The messages a renderer prints for one group, after branch trimming and excerpting.
 *
 * @param root the root conversation
 * @param rootMessages root messages to print
 * @param branches each branch with the messages it contributes
 */
public record ThreadView(ConversationItem root, List<Message> rootMessages, List<Branch> branches) {

  public record Branch(ConversationItem item, List<Message> messages) {}
}
