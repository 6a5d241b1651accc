package com.flamingo.ai.dossier.service.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dossier.config.DossierConfig;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.domain.model.DossierMode;
import com.flamingo.ai.dossier.domain.model.Message;
import com.flamingo.ai.dossier.service.excerpt.Excerptor;
import com.flamingo.ai.dossier.service.grouping.BranchReconciler;
import com.flamingo.ai.dossier.service.grouping.GroupBuilder;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MarkdownRenderer and PlainTextRenderer Tests")
class MarkdownRendererTest {

  private MarkdownRenderer markdownRenderer;
  private PlainTextRenderer plainTextRenderer;
  private String markdown;

  @BeforeEach
  void setUp() {
    markdownRenderer =
        new MarkdownRenderer(
            new ThreadViewFactory(new BranchReconciler(), new Excerptor()),
            new TimestampFormatter(new DossierConfig()),
            Clock.fixed(Instant.parse("2024-03-31T12:00:00Z"), ZoneOffset.UTC));
    plainTextRenderer = new PlainTextRenderer();

    List<Message> messages =
        List.of(new Message(0, "user", "hi **there**"), new Message(0, "assistant", "hello"));
    markdown =
        markdownRenderer.render(
            new GroupBuilder()
                .build(
                    List.of(
                        ConversationItem.of("r1", "Trip", 0, messages),
                        ConversationItem.of("b1", "Branch · Trip", 0, messages))),
            RenderContext.of(List.of("trip", "beach"), "/exports", DossierMode.FULL, 0));
  }

  @Test
  @DisplayName("should render metadata, threads and messages")
  void shouldRenderThreadsAndMessages() {
    assertThat(markdown)
        .startsWith("# Dossier: trip, beach\n\n- generated_at: 2024-03-31T09:00:00-03:00\n")
        .contains("- mode: full\n")
        .contains("## Thread: Trip\n\n- root_id: r1\n")
        .contains("### Root conversation\n\n**user** ()\n\nhi **there**\n\n")
        .contains("### Branch: Branch · Trip\n\n- branch_id: b1\n")
        .contains("_No new messages after trimming._");
  }

  @Test
  @DisplayName("should flatten markdown to plain text")
  void shouldFlattenMarkdown() {
    String plain = plainTextRenderer.render(markdown);

    assertThat(plain)
        .contains("Dossier: trip, beach")
        .contains("hi there")
        .doesNotContain("hi **there**")
        .doesNotContain("\n\n\n")
        .endsWith("\n");
  }
}
