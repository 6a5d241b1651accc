package com.flamingo.ai.dossier.service.index;

import java.util.Locale;

/** Reduces include bucket names to the short tags shown in the tagged index. */
public final class ShortTag {

  public static final String OTHER = "OTHER";

  private static final int MAX_LENGTH = 10;

  private ShortTag() {}

  /**
   * First underscore-delimited token of {@code bucket}, uppercased and cut to ten characters, so
   * {@code primary_research} becomes {@code PRIMARY}. {@code OTHER} when no bucket matched or the
   * token is empty. Distinct buckets may share a tag.
   */
  public static String of(String bucket) {
    if (bucket == null || bucket.isEmpty()) {
      return OTHER;
    }
    String token = bucket.split("_", -1)[0].toUpperCase(Locale.ROOT);
    token = token.substring(0, Math.min(MAX_LENGTH, token.length()));
    return token.isEmpty() ? OTHER : token;
  }
}
