package com.flamingo.ai.dossier.service.cleaning;

import com.flamingo.ai.dossier.domain.model.Artifact;
import java.util.List;

/**
 * Output of the cleaning pipeline.
 *
 * @param body cleaned working body, sources registry included
 * @param artifacts quarantined fragments in document order
 */
public record CleaningResult(String body, List<Artifact> artifacts) {

  public CleaningResult {
    artifacts = List.copyOf(artifacts);
  }

  public boolean hasArtifacts() {
    return !artifacts.isEmpty();
  }
}
