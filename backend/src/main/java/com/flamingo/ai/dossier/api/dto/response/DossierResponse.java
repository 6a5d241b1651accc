package com.flamingo.ai.dossier.api.dto.response;

import com.flamingo.ai.dossier.domain.model.AppendixIntegrity;
import com.flamingo.ai.dossier.domain.model.DossierResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO carrying the rendered dossier variants. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DossierResponse {

  private String raw;
  private String working;
  private String markdown;
  private String plain;
  private boolean artifactsFound;

  /** Appendix header occurrences in the working variant, {@code null} without one. */
  private Integer appendixHeaderCount;

  private List<String> warnings;

  /** Creates a DossierResponse from a build result. */
  public static DossierResponse from(DossierResult result) {
    AppendixIntegrity integrity = result.integrity();
    return DossierResponse.builder()
        .raw(result.raw())
        .working(result.working())
        .markdown(result.markdown())
        .plain(result.plain())
        .artifactsFound(result.artifactsFound())
        .appendixHeaderCount(integrity != null ? integrity.headerCount() : null)
        .warnings(result.warnings())
        .build();
  }
}
