package com.flamingo.ai.dossier.service.assembly;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.dossier.domain.model.AppendixIntegrity;
import com.flamingo.ai.dossier.domain.model.Artifact;
import com.flamingo.ai.dossier.service.index.WorkingIndex;
import com.flamingo.ai.dossier.service.render.DossierLayout;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OutputAssembler Tests")
class OutputAssemblerTest {

  private static final String D = "=".repeat(70);

  private OutputAssembler assembler;

  @BeforeEach
  void setUp() {
    assembler = new OutputAssembler();
  }

  @Nested
  @DisplayName("Assembly")
  class Assembly {

    @Test
    @DisplayName("should place index before body without appendix when nothing was quarantined")
    void shouldOmitAppendix_whenNoArtifacts() {
      String out = assembler.assemble(WorkingIndex.of("INDEX\n"), "BODY", List.of());

      assertThat(out).isEqualTo("INDEX\n\nBODY");
    }

    @Test
    @DisplayName("should append coverage lines after the index")
    void shouldAppendCoverage() {
      WorkingIndex index = new WorkingIndex("INDEX\n", List.of("COVERAGE", "n: 1", ""), List.of());

      assertThat(assembler.assemble(index, "BODY", List.of()))
          .isEqualTo("INDEX\n\nCOVERAGE\nn: 1\n\nBODY");
    }

    @Test
    @DisplayName("should append a single framed appendix with rendered artifacts")
    void shouldAppendAppendix() {
      List<Artifact> artifacts =
          List.of(new Artifact("Image Reference", "[Image: x]"), new Artifact("Model Info", "m"));

      String out = assembler.assemble(WorkingIndex.of("I\n"), "BODY", artifacts);

      assertThat(out)
          .isEqualTo(
              "I\n\nBODY\n\n"
                  + D
                  + "\nAPPENDIX: RESEARCH LOG & TOOL ARTIFACTS\n"
                  + D
                  + "\n\n"
                  + OutputAssembler.APPENDIX_INTRO
                  + "[Image Reference] [Image: x]...\n\n[Model Info] m...");
      assertThat(assembler.check(out, true).isIntact()).isTrue();
    }

    @Test
    @DisplayName("should collapse an appendix header leaking from the body")
    void shouldCollapseLeakedHeader() {
      String body = "text\n" + DossierLayout.APPENDIX_HEADER + "\nmore";

      String out =
          assembler.assemble(WorkingIndex.of(""), body, List.of(new Artifact("Model Info", "m")));

      AppendixIntegrity integrity = assembler.check(out, true);
      assertThat(integrity.headerCount()).isEqualTo(1);
      assertThat(integrity.researchLogCount()).isEqualTo(1);
      assertThat(out).contains("[Model Info] m...").contains("more");
    }
  }

  @Nested
  @DisplayName("Integrity check")
  class Check {

    @Test
    @DisplayName("should expect no header when no artifacts were found")
    void shouldExpectZero_whenNoArtifacts() {
      AppendixIntegrity integrity = assembler.check("plain body", false);

      assertThat(integrity).isEqualTo(new AppendixIntegrity(0, 0, 0));
      assertThat(integrity.isIntact()).isTrue();
    }

    @Test
    @DisplayName("should report a missing header as not intact")
    void shouldReportMissingHeader() {
      AppendixIntegrity integrity = assembler.check("no appendix here", true);

      assertThat(integrity.expected()).isEqualTo(1);
      assertThat(integrity.isIntact()).isFalse();
    }

    @Test
    @DisplayName("should count bare research log tokens separately")
    void shouldCountTokens() {
      String text = DossierLayout.APPENDIX_HEADER + "\n" + DossierLayout.RESEARCH_LOG_TOKEN;

      AppendixIntegrity integrity = assembler.check(text, true);

      assertThat(integrity.headerCount()).isEqualTo(1);
      assertThat(integrity.researchLogCount()).isEqualTo(2);
      assertThat(integrity.isIntact()).isFalse();
    }
  }

  @Test
  @DisplayName("should keep the first header and strip later ones")
  void shouldDedupeHeader() {
    String h = DossierLayout.APPENDIX_HEADER;

    assertThat(OutputAssembler.dedupeAppendixHeader("a " + h + " b " + h + " c"))
        .isEqualTo("a " + h + " b  c");
    assertThat(OutputAssembler.dedupeAppendixHeader("nothing")).isEqualTo("nothing");
  }
}
