package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.domain.model.Source;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Finds URLs in message text and derives a display label for each. */
@Component
public class SourceExtractor {

  private static final Pattern URL =
      Pattern.compile("https?://[^\\s)\\]}\"']*[^\\s)\\]}\"'.,;:!?]");

  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?'\"]$");

  private static final int PATH_LABEL_LENGTH = 50;
  private static final int FALLBACK_LABEL_LENGTH = 60;

  /** Returns the distinct URLs of {@code text} in order of first appearance. */
  public List<Source> extract(String text) {
    Set<String> seen = new LinkedHashSet<>();
    Matcher matcher = URL.matcher(text);
    while (matcher.find()) {
      seen.add(TRAILING_PUNCTUATION.matcher(matcher.group()).replaceFirst(""));
    }
    List<Source> sources = new ArrayList<>(seen.size());
    for (String url : seen) {
      sources.add(new Source(url, label(url)));
    }
    return sources;
  }

  static String label(String url) {
    try {
      URI uri = new URI(url);
      String authority = uri.getRawAuthority();
      if (authority == null) {
        return truncate(url, FALLBACK_LABEL_LENGTH);
      }
      String path = uri.getRawPath() == null ? "" : uri.getRawPath();
      return authority + truncate(path, PATH_LABEL_LENGTH);
    } catch (URISyntaxException e) {
      return truncate(url, FALLBACK_LABEL_LENGTH);
    }
  }

  private static String truncate(String value, int max) {
    return value.length() > max ? value.substring(0, max) : value;
  }
}
