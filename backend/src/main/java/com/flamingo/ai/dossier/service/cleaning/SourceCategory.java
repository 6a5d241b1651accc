package com.flamingo.ai.dossier.service.cleaning;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Priority buckets of the reorganized sources registry, in display order. Keyword buckets match
 * by substring against the lowercased URL or label.
 */
public enum SourceCategory {
  USED_IN_DRAFTS("**Used in Drafts**", List.of()),
  CANDIDATE(
      "**Candidates for Next Column**",
      List.of(
          "research",
          "analysis",
          "report",
          "study",
          "project",
          "draft",
          "document",
          "paper",
          "article",
          "summary")),
  LEGAL(
      "Legal Sources",
      List.of(".gov.br", ".senado", ".camara", "judicial", "legal", "court", "law")),
  MEDIA(
      "Media Sources",
      List.of(
          "news",
          "folha",
          "globo",
          "estadao",
          "uol",
          "bbc",
          "cnn",
          "press",
          "media",
          "jornalismo",
          "nytimes",
          "wsj",
          "reuters")),
  ECONOMIC(
      "Economic Sources",
      List.of(
          "economic",
          "financial",
          "trade",
          "economy",
          "banco",
          "bcb",
          "imf",
          "world bank",
          "commerce",
          "bloomberg",
          "forbes")),
  INTERNAL(
      "Internal Documents",
      List.of("note", "transcript", "internal", "memo", "meeting", "summary")),
  OTHER("Other Sources", List.of());

  private final String heading;
  private final List<String> keywords;

  SourceCategory(String heading, List<String> keywords) {
    this.heading = heading;
    this.keywords = keywords;
  }

  public String heading() {
    return heading;
  }

  /**
   * First bucket that claims the source: used links, then research candidates, then the domain
   * buckets, then {@link #OTHER}.
   */
  public static SourceCategory classify(String url, String label, Set<String> usedLinks) {
    if (usedLinks != null && usedLinks.contains(url)) {
      return USED_IN_DRAFTS;
    }
    String urlLower = url.toLowerCase(Locale.ROOT);
    String labelLower = label.toLowerCase(Locale.ROOT);
    for (SourceCategory category : values()) {
      if (category.matches(urlLower, labelLower)) {
        return category;
      }
    }
    return OTHER;
  }

  private boolean matches(String urlLower, String labelLower) {
    return keywords.stream().anyMatch(kw -> urlLower.contains(kw) || labelLower.contains(kw));
  }
}
