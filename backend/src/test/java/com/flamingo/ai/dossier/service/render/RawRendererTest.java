package com.flamingo.ai.dossier.service.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dossier.config.DossierConfig;
import com.flamingo.ai.dossier.domain.model.ConversationGroup;
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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RawRenderer Tests")
class RawRendererTest {

  private static final String DELIMITER = "=".repeat(70);

  private RawRenderer renderer;
  private GroupBuilder groupBuilder;

  @BeforeEach
  void setUp() {
    TimestampFormatter formatter = new TimestampFormatter(new DossierConfig());
    renderer =
        new RawRenderer(
            new ThreadViewFactory(new BranchReconciler(), new Excerptor()),
            new TableOfContentsGenerator(formatter),
            new SourceExtractor(),
            formatter,
            Clock.fixed(Instant.parse("2024-03-31T12:00:00Z"), ZoneOffset.UTC));
    groupBuilder = new GroupBuilder();
  }

  private String render(List<ConversationItem> items, RenderContext context) {
    List<ConversationGroup> groups = groupBuilder.build(items);
    return renderer.render(groups, context);
  }

  private static RenderContext full() {
    return RenderContext.of(List.of("trip"), "/exports", DossierMode.FULL, 0);
  }

  @Nested
  @DisplayName("Root and branch sections")
  class Sections {

    @Test
    @DisplayName("should print root messages and only the new branch messages")
    void shouldPrintOnlyNewBranchMessages_whenBranchExtendsRoot() {
      ConversationItem root =
          ConversationItem.of(
              "r1",
              "Trip",
              100,
              List.of(new Message(1, "user", "hi"), new Message(2, "assistant", "hello")));
      ConversationItem branch =
          ConversationItem.of(
              "b1",
              "Branch · Trip",
              200,
              List.of(
                  new Message(1, "user", "hi"),
                  new Message(2, "assistant", "hello"),
                  new Message(3, "user", "more")));

      String raw = render(List.of(branch, root), full());

      assertThat(raw)
          .contains(
              DELIMITER
                  + "\n1. Trip\n"
                  + DELIMITER
                  + "\n\nUser:\n\nhi\n\nAssistant:\n\nhello\n\n"
                  + "\n--- Branch 1: Branch · Trip ---\n\nUser:\n\nmore\n\n");
      String branchSection = raw.substring(raw.indexOf("--- Branch 1"));
      assertThat(branchSection).doesNotContain("hi").doesNotContain("hello");
    }

    @Test
    @DisplayName("should write the header and table of contents first")
    void shouldWriteHeaderAndToc() {
      ConversationItem root =
          ConversationItem.of("r1", "Trip", 0, List.of(new Message(1, "user", "hi")));

      String raw = render(List.of(root), full());

      assertThat(raw)
          .startsWith("DOSSIER: trip\nGenerated: 2024-03-31T09:00:00-03:00\nSource: /exports\n\n")
          .contains("## TABLE OF CONTENTS\n  Line ~10: Trip - Unknown\n");
    }

    @Test
    @DisplayName("should print placeholders for empty root and repeated branch")
    void shouldPrintPlaceholders_whenNothingToShow() {
      ConversationItem root = ConversationItem.of("r1", "Empty", 100, List.of());
      ConversationItem branch = ConversationItem.of("b1", "Branch: Empty", 200, List.of());

      String raw = render(List.of(root, branch), full());

      assertThat(raw)
          .contains("[No messages in root conversation.]")
          .contains("[No new messages in this branch.]");
    }

    @Test
    @DisplayName("should print excerpt placeholders in excerpt mode")
    void shouldPrintExcerptPlaceholders_whenNoTopicHit() {
      ConversationItem root =
          ConversationItem.of("r1", "Trip", 100, List.of(new Message(1, "user", "hi")));

      String raw =
          render(List.of(root), RenderContext.of(List.of("zebra"), "", DossierMode.EXCERPTS, 1));

      assertThat(raw)
          .contains("[No matching excerpts in root conversation.]")
          .doesNotContain("User:\n\nhi");
    }
  }

  @Nested
  @DisplayName("Sources registry")
  class Registry {

    @Test
    @DisplayName("should list a URL once when root and two branches cite it")
    void shouldDeduplicateSources_acrossRootAndBranches() {
      String url = "https://example.com/report";
      Message first = new Message(1, "user", "read " + url);
      ConversationItem root = ConversationItem.of("r1", "Trip", 100, List.of(first));
      ConversationItem branchOne =
          ConversationItem.of(
              "b1", "Branch · Trip", 200, List.of(first, new Message(2, "user", "again " + url)));
      ConversationItem branchTwo =
          ConversationItem.of(
              "b2",
              "Branch · Trip",
              300,
              List.of(first, new Message(2, "assistant", "also (" + url + ")")));

      String raw = render(List.of(root, branchOne, branchTwo), full());

      String registry = raw.substring(raw.indexOf("SOURCES REGISTRY"));
      assertThat(registry).isEqualTo(
          "SOURCES REGISTRY\n" + DELIMITER + "\n\n[1] example.com/report\n    " + url + "\n\n");
    }

    @Test
    @DisplayName("should omit the registry when no message has a URL")
    void shouldOmitRegistry_whenNoSources() {
      ConversationItem root =
          ConversationItem.of("r1", "Trip", 100, List.of(new Message(1, "user", "hi")));

      assertThat(render(List.of(root), full())).doesNotContain("SOURCES REGISTRY");
    }
  }
}
