package com.flamingo.ai.dossier.exception;

import java.util.List;

/** Exception thrown when the selected conversations cannot form a dossier. */
public class InvalidDossierRequestException extends RuntimeException {

  private final List<String> conversationIds;

  public InvalidDossierRequestException(String message) {
    this(message, List.of());
  }

  public InvalidDossierRequestException(String message, List<String> conversationIds) {
    super(
        conversationIds.isEmpty() ? message : message + ":\n" + String.join("\n", conversationIds));
    this.conversationIds = List.copyOf(conversationIds);
  }

  public List<String> getConversationIds() {
    return conversationIds;
  }
}
