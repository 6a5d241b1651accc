package com.flamingo.ai.dossier.service.cleaning;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dossier.service.render.DossierLayout;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Cleaning stage Tests")
class CleaningStagesTest {

  private static final CleaningContext DEFAULTS = CleaningContext.defaults();

  @Nested
  @DisplayName("ToolNoiseStage")
  class ToolNoise {

    private final ToolNoiseStage stage = new ToolNoiseStage();

    @Test
    @DisplayName("should remove inline tool-call JSON")
    void shouldRemoveToolJson() {
      String cleaned = stage.apply("Before\n{\"search_query\": \"trip plans\"}\nAfter", DEFAULTS);

      assertThat(cleaned).isEqualTo("Before\n\nAfter");
    }

    @Test
    @DisplayName("should remove tool status lines and labelled tool-call lines")
    void shouldRemoveStatusAndLabelledLines() {
      String cleaned =
          stage.apply(
              "Successfully created document\nKeep me\n[JSON/Tool Call] payload\nAnd me", DEFAULTS);

      assertThat(cleaned).isEqualTo("Keep me\nAnd me");
    }

    @Test
    @DisplayName("should remove leaked tool instruction blocks up to the next heading")
    void shouldRemoveInstructionBlocks() {
      String cleaned =
          stage.apply(
              "## Notes\nkeep\n## How to invoke the file_search tool\nsecret steps\n## Next\nstay",
              DEFAULTS);

      assertThat(cleaned).isEqualTo("## Notes\nkeep\n## Next\nstay");
    }

    @Test
    @DisplayName("should leave ordinary prose alone")
    void shouldKeepProse() {
      String prose = "We will open the file tomorrow and find the answer.";

      assertThat(stage.apply(prose, DEFAULTS)).isEqualTo(prose);
    }
  }

  @Nested
  @DisplayName("CitationMarkerStage")
  class CitationMarkers {

    private final CitationMarkerStage stage = new CitationMarkerStage();

    @Test
    @DisplayName("should remove lone numeric brackets")
    void shouldRemoveLoneBrackets() {
      assertThat(stage.apply("Plan the trip [1] please", DEFAULTS))
          .isEqualTo("Plan the trip please");
    }

    @Test
    @DisplayName("should remove cite tags and phantom markers")
    void shouldRemoveCiteTagsAndPhantomMarkers() {
      assertThat(stage.apply("Fact <citeturn0search1> here 【4†source】 done", DEFAULTS))
          .isEqualTo("Fact here done");
    }

    @Test
    @DisplayName("should remove a run of adjacent markers in one pass")
    void shouldRemoveAdjacentMarkersAtOnce() {
      String once = stage.apply("Rates rose [1][2] last year.", DEFAULTS);

      assertThat(once).isEqualTo("Rates rose last year.");
      assertThat(stage.apply(once, DEFAULTS)).isEqualTo(once);
    }

    @Test
    @DisplayName("should keep brackets glued to text")
    void shouldKeepGluedBrackets() {
      assertThat(stage.apply("values[0]x stay", DEFAULTS)).isEqualTo("values[0]x stay");
    }
  }

  @Nested
  @DisplayName("MarkupSanitizerStage")
  class MarkupSanitizer {

    private final MarkupSanitizerStage stage = new MarkupSanitizerStage();

    @Test
    @DisplayName("should drop long = separator lines")
    void shouldDropSeparatorLines() {
      String delimiter = DossierLayout.DELIMITER;

      assertThat(stage.apply(delimiter + "\n1. Trip\n" + delimiter + "\n\nText", DEFAULTS))
          .isEqualTo("1. Trip\n\nText");
    }

    @Test
    @DisplayName("should remove soft hyphens and tags")
    void shouldRemoveSoftHyphensAndTags() {
      assertThat(stage.apply("co\u00ADoperate <br/> now", DEFAULTS)).isEqualTo("cooperate now");
    }

    @Test
    @DisplayName("should remove a pasted appendix header but keep the text around it")
    void shouldRemovePastedAppendixHeader() {
      String delimiter = DossierLayout.DELIMITER;

      String cleaned =
          stage.apply(
              "I pasted my old dossier:\n"
                  + delimiter
                  + "\nappendix: research log & tool artifacts\n"
                  + delimiter
                  + "\n\nStill here",
              DEFAULTS);

      assertThat(cleaned).isEqualTo("I pasted my old dossier:\n\nStill here");
    }
  }

  @Nested
  @DisplayName("AppendixStripStage")
  class AppendixStrip {

    private final AppendixStripStage stage = new AppendixStripStage();

    @Test
    @DisplayName("should cut everything from the first appendix header")
    void shouldCutExistingAppendix() {
      String cleaned =
          stage.apply(
              "Body\n\nAPPENDIX: RESEARCH LOG & TOOL ARTIFACTS\n[Search Query] stale", DEFAULTS);

      assertThat(cleaned).isEqualTo("Body");
    }

    @Test
    @DisplayName("should scrub header markers from single-line labels")
    void shouldScrubLabels() {
      assertThat(AppendixHeaders.scrubLabel("Notes APPENDIX: RESEARCH LOG & TOOL ARTIFACTS v2"))
          .isEqualTo("Notes v2");
      assertThat(AppendixHeaders.scrubLabel("research log & tool artifacts")).isEmpty();
      assertThat(AppendixHeaders.scrubLabel("Trip")).isEqualTo("Trip");
    }

    @Test
    @DisplayName("should recognise headers written with other punctuation")
    void shouldDetectPunctuatedHeader() {
      assertThat(AppendixHeaders.isHeaderLine("Appendix — Research-Log & Tool Artifacts")).isTrue();
      assertThat(AppendixHeaders.isHeaderLine("Research log only")).isFalse();
    }
  }

  @Nested
  @DisplayName("ParagraphDedupStage")
  class ParagraphDedup {

    private final ParagraphDedupStage stage = new ParagraphDedupStage();

    @Test
    @DisplayName("should keep short repeated paragraphs")
    void shouldKeepShortRepeats() {
      String shortParagraph = "a".repeat(50);
      String text = shortParagraph + "\n\n" + shortParagraph;

      assertThat(stage.apply(text, DEFAULTS)).isEqualTo(text);
    }

    @Test
    @DisplayName("should keep only the first copy of a long paragraph")
    void shouldDropLongRepeats() {
      String longParagraph = "b".repeat(250);

      assertThat(stage.apply(longParagraph + "\n\nmiddle\n\n" + longParagraph, DEFAULTS))
          .isEqualTo(longParagraph + "\n\nmiddle");
    }

    @Test
    @DisplayName("should treat whitespace variants as the same paragraph")
    void shouldMatchWhitespaceVariants() {
      String words = "word ".repeat(60).strip();
      String spaced = words.replace(" ", "  ");

      assertThat(ParagraphDedupStage.fingerprint(words))
          .isEqualTo(ParagraphDedupStage.fingerprint(spaced));
    }

    @Test
    @DisplayName("should do nothing when dedup is off")
    void shouldSkip_whenDedupDisabled() {
      String longParagraph = "b".repeat(250);
      String text = longParagraph + "\n\n" + longParagraph;

      assertThat(stage.apply(text, new CleaningContext(false, 200, null, null))).isEqualTo(text);
    }
  }

  @Nested
  @DisplayName("DeliverableExtractionStage")
  class DeliverableExtraction {

    private final DeliverableExtractionStage stage = new DeliverableExtractionStage();

    @Test
    @DisplayName("should leave text untouched without patterns")
    void shouldSkip_whenPatternsNull() {
      assertThat(stage.apply("anything\n\nat all", DEFAULTS)).isEqualTo("anything\n\nat all");
    }

    @Test
    @DisplayName("should keep only sections opened by a pattern")
    void shouldKeepMatchingSections() {
      String text =
          "intro\n\nDecision: go\nbecause cheap\n\nchit chat\n\nfinal DECISION\n\nmore";
      CleaningContext context = new CleaningContext(true, 200, List.of("decision"), null);

      assertThat(stage.apply(text, context))
          .isEqualTo("Decision: go\nbecause cheap\nfinal DECISION\nmore");
    }

    @Test
    @DisplayName("should use the default patterns for an empty list")
    void shouldUseDefaults_whenPatternsEmpty() {
      CleaningContext context = new CleaningContext(true, 200, List.of(), null);

      assertThat(stage.apply("small talk\n\n## Draft\nthe text\n\nbye", context))
          .isEqualTo("## Draft\nthe text");
    }
  }

  @Nested
  @DisplayName("SourceRegistryStage")
  class SourceRegistry {

    private final SourceRegistryStage stage = new SourceRegistryStage();

    @Test
    @DisplayName("should bucket, alphabetize and renumber registry entries")
    void shouldReorganizeRegistry() {
      String text =
          "Body\n\n"
              + DossierLayout.REGISTRY_OPENING
              + "[1] news.example.com/story\n    https://news.example.com/story\n\n"
              + "[2] planalto.gov.br/lei\n    https://planalto.gov.br/lei\n\n"
              + "[3] zeta.org/x\n    https://zeta.org/x\n\n"
              + "[4] alpha.org/y\n    https://alpha.org/y\n\n";
      CleaningContext context =
          new CleaningContext(true, 200, null, Set.of("https://zeta.org/x"));

      assertThat(stage.apply(text, context))
          .isEqualTo(
              "Body\n\n"
                  + DossierLayout.REGISTRY_OPENING
                  + "**Used in Drafts**:\n\n[1] zeta.org/x\n    https://zeta.org/x\n\n\n"
                  + "Legal Sources:\n\n[2] planalto.gov.br/lei\n    https://planalto.gov.br/lei\n\n\n"
                  + "Media Sources:\n\n[3] news.example.com/story\n"
                  + "    https://news.example.com/story\n\n\n"
                  + "Other Sources:\n\n[4] alpha.org/y\n    https://alpha.org/y\n\n\n");
    }

    @Test
    @DisplayName("should leave text without a registry unchanged")
    void shouldSkip_whenNoRegistry() {
      assertThat(stage.apply("Body only", DEFAULTS)).isEqualTo("Body only");
    }
  }
}
