package com.flamingo.ai.dossier.service.index;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dossier.config.DossierConfig;
import com.flamingo.ai.dossier.domain.model.ColumnConfig;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.service.render.TimestampFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TaggedIndexGenerator Tests")
class TaggedIndexGeneratorTest {

  private TaggedIndexGenerator generator;

  @BeforeEach
  void setUp() {
    generator = new TaggedIndexGenerator(new TimestampFormatter(new DossierConfig()));
  }

  private static ColumnConfig config(Map<String, List<String>> include, List<String> exclude) {
    return new ColumnConfig(
        "Column",
        null,
        new ColumnConfig.ThreadFilters(include, exclude),
        null,
        null,
        null,
        null,
        null);
  }

  private static Map<String, List<String>> buckets() {
    Map<String, List<String>> include = new LinkedHashMap<>();
    include.put("primary_research", List.of("budget"));
    include.put("media_watch", List.of("news"));
    return include;
  }

  @Nested
  @DisplayName("Tagged listing")
  class Listing {

    private final List<ConversationItem> conversations =
        List.of(
            ConversationItem.of("p1", "Budget plan", 200, List.of()),
            ConversationItem.of("m1", "News roundup", 100, List.of()),
            ConversationItem.of("s1", "Spam budget", 300, List.of()),
            ConversationItem.of("o1", "Other", 50, List.of()));

    @Test
    @DisplayName("should tag conversations and list them chronologically")
    void shouldTagAndSortChronologically() {
      WorkingIndex index =
          generator.generate("", conversations, config(buckets(), List.of("spam")));

      String text = index.index();
      assertThat(text).startsWith("PRIORITY THREADS (with category tags)\n" + "=".repeat(70) + "\n");
      assertThat(text.indexOf("[OTHER] Other\n  ID: o1 | Created: "))
          .isLessThan(text.indexOf("[MEDIA] News roundup\n  ID: m1 | Created: "));
      assertThat(text.indexOf("[MEDIA] News roundup"))
          .isLessThan(text.indexOf("[PRIMARY] Budget plan\n  ID: p1"));
      assertThat(text.indexOf("[PRIMARY] Budget plan"))
          .isLessThan(text.indexOf("[OTHER] Spam budget\n  ID: s1"));
      assertThat(text).contains("### Sections\n\n");
    }

    @Test
    @DisplayName("should report per-tag counts in the coverage audit")
    void shouldReportCoverage() {
      WorkingIndex index =
          generator.generate("", conversations, config(buckets(), List.of("spam")));

      assertThat(index.coverage())
          .containsExactly(
              "\n" + "=".repeat(70),
              "COVERAGE AUDIT",
              "=".repeat(70),
              "Included threads (total): 4",
              "  - [MEDIA]: 1",
              "  - [OTHER]: 2",
              "  - [PRIMARY]: 1",
              "");
      assertThat(index.warnings()).isEmpty();
    }

    @Test
    @DisplayName("should drop appendix header markers from printed titles")
    void shouldScrubAppendixHeader_whenTitleCarriesIt() {
      WorkingIndex index =
          generator.generate(
              "",
              List.of(
                  ConversationItem.of(
                      "p1", "Budget APPENDIX: RESEARCH LOG & TOOL ARTIFACTS", 200, List.of()),
                  ConversationItem.of("o1", "RESEARCH LOG & TOOL ARTIFACTS", 100, List.of())),
              config(buckets(), List.of()));

      assertThat(index.index())
          .contains("[PRIMARY] Budget\n  ID: p1")
          .contains("[OTHER] Untitled\n  ID: o1")
          .doesNotContain("ARTIFACTS");
    }

    @Test
    @DisplayName("should return nothing without conversations")
    void shouldReturnEmpty_whenNoConversations() {
      WorkingIndex index = generator.generate("body", List.of(), config(buckets(), List.of()));

      assertThat(index.index()).isEmpty();
      assertThat(index.hasCoverage()).isFalse();
    }
  }

  @Test
  @DisplayName("should flag buckets that share a short tag")
  void shouldFlagTagCollisions() {
    Map<String, List<String>> include = new LinkedHashMap<>();
    include.put("primary_research", List.of("budget"));
    include.put("primary_sources", List.of("archive"));

    WorkingIndex index =
        generator.generate(
            "",
            List.of(ConversationItem.of("p1", "Budget", 1, List.of())),
            config(include, List.of()));

    assertThat(index.warnings())
        .containsExactly("Short tag [PRIMARY] is shared by buckets [primary_research, primary_sources]");
  }

  @Nested
  @DisplayName("ShortTag and ThreadFilter")
  class Helpers {

    @Test
    @DisplayName("should derive short tags from bucket names")
    void shouldDeriveShortTags() {
      assertThat(ShortTag.of("primary_research")).isEqualTo("PRIMARY");
      assertThat(ShortTag.of("verylongbucketname")).isEqualTo("VERYLONGBU");
      assertThat(ShortTag.of("_leading")).isEqualTo("OTHER");
      assertThat(ShortTag.of(null)).isEqualTo("OTHER");
    }

    @Test
    @DisplayName("should apply exclude terms before include buckets")
    void shouldExcludeFirst() {
      ColumnConfig.ThreadFilters filters =
          new ColumnConfig.ThreadFilters(buckets(), List.of("spam"));

      assertThat(ThreadFilter.match("SPAM about budget", filters))
          .isEqualTo(new ThreadFilter.Match(false, null));
      assertThat(ThreadFilter.match("Budget and news", filters))
          .isEqualTo(new ThreadFilter.Match(true, "primary_research"));
      assertThat(ThreadFilter.match("Weather", filters))
          .isEqualTo(new ThreadFilter.Match(false, null));
      assertThat(ThreadFilter.match("", filters)).isEqualTo(new ThreadFilter.Match(false, null));
    }
  }
}
