package com.flamingo.ai.dossier.service.render;

import java.util.regex.Pattern;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.springframework.stereotype.Service;

/** Flattens the markdown transcript to plain text for word-processor style exports. */
@Service
public class PlainTextRenderer {

  private static final Parser PARSER = Parser.builder().build();
  private static final TextContentRenderer TEXT_RENDERER = TextContentRenderer.builder().build();

  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");

  public String render(String markdown) {
    String normalized = markdown.replace("\r\n", "\n").replace('\r', '\n');
    Node document = PARSER.parse(normalized);
    String text = TEXT_RENDERER.render(document);
    return EXCESS_NEWLINES.matcher(text).replaceAll("\n\n").strip() + "\n";
  }
}
