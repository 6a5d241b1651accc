package com.flamingo.ai.dossier.service.cleaning;

import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the cleaning stages, in their {@code @Order} order, over a raw dossier to produce the
 * working body.
 *
 * <p>The sources registry is detached before the body stages and re-attached before {@link
 * SourceRegistryStage}; separator stripping, lone {@code [n]} removal and deliverable extraction
 * would otherwise destroy the framing that stage relies on. Artifact quarantine runs last.
 */
@Service
@Slf4j
public class CleaningPipeline {

  private final List<CleaningStage> bodyStages;
  private final SourceRegistryStage sourceRegistryStage;
  private final ArtifactQuarantine artifactQuarantine;

  /**
   * Splits the ordered stages into the body stages and the trailing registry stage.
   *
   * @param stages every {@link CleaningStage} bean, injected in {@code @Order} order; the last one
   *     must be the {@link SourceRegistryStage}
   * @param artifactQuarantine runs after the stages
   */
  public CleaningPipeline(List<CleaningStage> stages, ArtifactQuarantine artifactQuarantine) {
    if (stages.isEmpty() || !(stages.get(stages.size() - 1) instanceof SourceRegistryStage)) {
      throw new IllegalStateException("Cleaning stages must end with the source registry stage");
    }
    this.bodyStages = List.copyOf(stages.subList(0, stages.size() - 1));
    this.sourceRegistryStage = (SourceRegistryStage) stages.get(stages.size() - 1);
    this.artifactQuarantine = artifactQuarantine;
  }

  /** Stage names in execution order, quarantine excluded. */
  public List<String> stageNames() {
    return Stream.concat(bodyStages.stream(), Stream.of(sourceRegistryStage))
        .map(CleaningStage::name)
        .toList();
  }

  @Timed(value = "dossier.clean", description = "Time to clean a raw dossier")
  public CleaningResult clean(String raw, CleaningContext context) {
    RegistryBlock.Split split = RegistryBlock.split(raw);

    String body = split.body();
    for (CleaningStage stage : bodyStages) {
      int before = body.length();
      body = stage.apply(body, context);
      log.debug("Stage {}: {} -> {} chars", stage.name(), before, body.length());
    }

    String working = sourceRegistryStage.apply(RegistryBlock.join(body, split.registry()), context);
    ArtifactQuarantine.Quarantined quarantined = artifactQuarantine.quarantine(working);
    return new CleaningResult(quarantined.text(), quarantined.artifacts());
  }
}
