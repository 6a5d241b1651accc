package com.flamingo.ai.dossier.api.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for building a dossier from exported conversations. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildDossierRequest {

  private List<String> topics;

  private String exportRoot;

  /** {@code full} or {@code excerpts}; defaults to full. */
  private String mode;

  @Min(value = 0, message = "Context must be at least 0")
  @Max(value = 200, message = "Context must not exceed 200")
  private Integer context;

  /** Defaults to {@code true}. */
  private Boolean dedup;

  private boolean split;

  /** Deliverable header patterns. {@code null} disables extraction, empty uses the defaults. */
  private List<String> patterns;

  /** Deliverable patterns, one per line; takes precedence over {@code patterns}. */
  private String patternsText;

  private List<String> usedLinks;

  /** Used links, one per line, {@code #} comments allowed; merged with {@code usedLinks}. */
  private String usedLinksText;

  /** Raw column configuration, validated before use. */
  private JsonNode columnConfig;

  /** Any of {@code txt}, {@code md}, {@code plain}; defaults to txt. */
  private List<String> formats;

  @NotEmpty(message = "At least one conversation is required")
  @Valid
  private List<ConversationRequest> conversations;

  /** One exported conversation. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ConversationRequest {

    @NotBlank(message = "Conversation id is required")
    private String id;

    private String title;

    /** Epoch seconds; missing means unknown. */
    private Double createTime;

    @Valid private List<MessageRequest> messages;
  }

  /** One message of a conversation. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class MessageRequest {

    private Double timestamp;

    private String role;

    private String text;
  }
}
