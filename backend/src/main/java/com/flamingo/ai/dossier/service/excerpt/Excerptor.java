package com.flamingo.ai.dossier.service.excerpt;

import com.flamingo.ai.dossier.domain.model.Message;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Narrows a message sequence to the messages mentioning a topic plus surrounding context.
 *
 * <p>For every hit at index {@code i} the window {@code [i - context, i + context]} is kept,
 * clamped to the list bounds. Windows are merged and returned in original order. No hit yields an
 * empty list; the caller prints a placeholder.
 */
@Service
public class Excerptor {

  public List<Message> excerpt(List<Message> messages, Pattern pattern, int context) {
    if (context < 0) {
      throw new IllegalArgumentException("context must be >= 0, got " + context);
    }
    if (messages.isEmpty()) {
      return List.of();
    }

    boolean[] keep = new boolean[messages.size()];
    boolean anyHit = false;
    for (int i = 0; i < messages.size(); i++) {
      if (pattern.matcher(messages.get(i).text()).find()) {
        anyHit = true;
        int from = Math.max(0, i - context);
        int to = (int) Math.min(messages.size() - 1L, (long) i + context);
        for (int j = from; j <= to; j++) {
          keep[j] = true;
        }
      }
    }
    if (!anyHit) {
      return List.of();
    }

    List<Message> result = new ArrayList<>();
    for (int i = 0; i < keep.length; i++) {
      if (keep[i]) {
        result.add(messages.get(i));
      }
    }
    return List.copyOf(result);
  }
}
