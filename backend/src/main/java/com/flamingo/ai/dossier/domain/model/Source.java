package com.flamingo.ai.dossier.domain.model;

/**
 * A URL referenced by a rendered message.
 *
 * @param url the normalized URL (trailing punctuation removed)
 * @param label host plus path prefix, used for ordering and display
 */
public record Source(String url, String label) {}
