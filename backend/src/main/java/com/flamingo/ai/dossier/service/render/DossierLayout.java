package com.flamingo.ai.dossier.service.render;

/** Fixed textual conventions shared by the renderers, the cleaning stages and the assembler. */
public final class DossierLayout {

  /** 70 {@code =} characters framing the registry, group headers and the appendix. */
  public static final String DELIMITER = "=".repeat(70);

  public static final String SOURCES_REGISTRY = "SOURCES REGISTRY";

  public static final String APPENDIX_HEADER = "APPENDIX: RESEARCH LOG & TOOL ARTIFACTS";

  public static final String RESEARCH_LOG_TOKEN = "RESEARCH LOG & TOOL ARTIFACTS";

  public static final String WORKING_INDEX_HEADER = "## WORKING INDEX";

  /** Opening lines of the sources registry block, up to and including the blank line. */
  public static final String REGISTRY_OPENING =
      DELIMITER + "\n" + SOURCES_REGISTRY + "\n" + DELIMITER + "\n\n";

  private DossierLayout() {}
}
