package com.flamingo.ai.dossier.domain.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * A root conversation plus the branches forked from it.
 *
 * @param key the normalized base title shared by every item in the group
 * @param root earliest-created item
 * @param branches later items in ascending creation order (may be empty)
 */
public record ConversationGroup(String key, ConversationItem root, List<ConversationItem> branches) {

  public ConversationGroup {
    if (root == null) {
      throw new IllegalArgumentException("A conversation group needs a root item");
    }
    branches = List.copyOf(branches);
  }

  public List<ConversationItem> items() {
    return Stream.concat(Stream.of(root), branches.stream()).toList();
  }
}
