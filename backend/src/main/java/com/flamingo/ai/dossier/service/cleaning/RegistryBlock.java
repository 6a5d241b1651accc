package com.flamingo.ai.dossier.service.cleaning;

import com.flamingo.ai.dossier.service.render.DossierLayout;

/** Locates the framed sources registry block at the end of a dossier body. */
final class RegistryBlock {

  private RegistryBlock() {}

  /**
   * Start offset of the last {@code SOURCES REGISTRY} framing that begins a line, or {@code -1}.
   */
  static int locate(String text) {
    int index = text.lastIndexOf(DossierLayout.REGISTRY_OPENING);
    while (index > 0 && text.charAt(index - 1) != '\n') {
      index = text.lastIndexOf(DossierLayout.REGISTRY_OPENING, index - 1);
    }
    return index;
  }

  /** Body before the registry and the registry block itself (empty when absent). */
  record Split(String body, String registry) {}

  static Split split(String text) {
    int index = locate(text);
    if (index < 0) {
      return new Split(text, "");
    }
    return new Split(text.substring(0, index), text.substring(index));
  }

  /** Re-attaches a registry detached by {@link #split(String)}. */
  static String join(String body, String registry) {
    if (registry.isEmpty()) {
      return body;
    }
    String trimmed = body.stripTrailing();
    return trimmed.isEmpty() ? registry : trimmed + "\n\n" + registry;
  }
}
