package com.flamingo.ai.dossier.domain.model;

/**
 * A single chat turn extracted from a conversation export.
 *
 * @param timestamp epoch seconds; ordering key within a conversation
 * @param role author role as exported ({@code user}, {@code assistant}, {@code tool}, …)
 * @param text rendered message text, never {@code null}
 */
public record Message(double timestamp, String role, String text) {

  public Message {
    role = role == null || role.isBlank() ? "unknown" : role;
    text = text == null ? "" : text;
  }
}
