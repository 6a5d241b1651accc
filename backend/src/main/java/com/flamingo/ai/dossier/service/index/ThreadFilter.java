package com.flamingo.ai.dossier.service.index;

import com.flamingo.ai.dossier.domain.model.ColumnConfig;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Tests thread titles against a column's include buckets and exclude terms. */
public final class ThreadFilter {

  private ThreadFilter() {}

  /**
   * Outcome of matching one title.
   *
   * @param included whether an include bucket matched and no exclude term did
   * @param bucket name of the first matching include bucket, {@code null} otherwise
   */
  public record Match(boolean included, String bucket) {

    static final Match NONE = new Match(false, null);
  }

  /**
   * Exclude terms are checked first; then include buckets in declaration order, the first bucket
   * with a term contained in the title wins. Matching is case-insensitive substring matching.
   */
  public static Match match(String title, ColumnConfig.ThreadFilters filters) {
    if (title == null || title.isEmpty() || filters == null) {
      return Match.NONE;
    }
    String lower = title.toLowerCase(Locale.ROOT);
    for (String term : filters.exclude()) {
      if (lower.contains(term.toLowerCase(Locale.ROOT))) {
        return Match.NONE;
      }
    }
    for (Map.Entry<String, List<String>> bucket : filters.include().entrySet()) {
      for (String term : bucket.getValue()) {
        if (lower.contains(term.toLowerCase(Locale.ROOT))) {
          return new Match(true, bucket.getKey());
        }
      }
    }
    return Match.NONE;
  }
}
