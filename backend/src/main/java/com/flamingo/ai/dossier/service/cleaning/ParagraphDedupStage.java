package com.flamingo.ai.dossier.service.cleaning;

import com.flamingo.ai.dossier.service.grouping.TitleNormalizer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Drops repeated long paragraphs, such as a transcript pasted twice.
 *
 * <p>Paragraphs are blank-line delimited. Those shorter than the minimum block size are always
 * kept; longer ones are keyed by the SHA-256 of their whitespace-normalized text and only the
 * first occurrence survives. The key is stable across runs and JVMs.
 */
@Component
@Order(5)
public class ParagraphDedupStage implements CleaningStage {

  @Override
  public String name() {
    return "paragraph-dedup";
  }

  @Override
  public String apply(String text, CleaningContext context) {
    if (!context.dedup()) {
      return text;
    }
    return deduplicate(text, context.minBlockSize());
  }

  static String deduplicate(String text, int minBlockSize) {
    String[] paragraphs = text.split("\n\n", -1);
    Set<String> seen = new HashSet<>();
    List<String> kept = new ArrayList<>(paragraphs.length);

    for (String paragraph : paragraphs) {
      if (paragraph.length() < minBlockSize) {
        kept.add(paragraph);
      } else if (seen.add(fingerprint(paragraph))) {
        kept.add(paragraph);
      }
    }
    return String.join("\n\n", kept);
  }

  static String fingerprint(String paragraph) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash =
          digest.digest(TitleNormalizer.normalizeText(paragraph).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
