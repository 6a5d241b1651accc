package com.flamingo.ai.dossier.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for dossier assembly and cleaning. */
@Configuration
@ConfigurationProperties(prefix = "dossier")
@Getter
@Setter
public class DossierConfig {

  /** Zone used for every rendered timestamp. */
  private String zoneId = "America/Sao_Paulo";

  private Cleaning cleaning = new Cleaning();
  private Excerpt excerpt = new Excerpt();
  private Index index = new Index();

  @Getter
  @Setter
  public static class Cleaning {
    /** Paragraphs shorter than this are never deduplicated (headers, short turns). */
    private int minBlockSize = 200;

    /** Maximum characters kept from a quarantined artifact. */
    private int snippetLength = 200;

    /** Artifact matches must be longer than this to be recorded in the appendix. */
    private int minArtifactLength = 20;
  }

  @Getter
  @Setter
  public static class Excerpt {
    private int maxContext = 200;
  }

  @Getter
  @Setter
  public static class Index {
    private int timelineLimit = 10;
    private int priorityLimit = 5;

    /** Conversations younger than this many days receive a recency bonus. */
    private int recencyWindowDays = 30;
  }
}
