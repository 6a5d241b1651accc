package com.flamingo.ai.dossier.service.index;

import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.service.cleaning.AppendixHeaders;

/** Conversation titles as printed in index entries, with appendix header markers removed. */
final class IndexTitle {

  private IndexTitle() {}

  static String of(ConversationItem item) {
    String title = AppendixHeaders.scrubLabel(item.displayTitle());
    return title.isEmpty() ? "Untitled" : title;
  }
}
