package com.flamingo.ai.dossier.service.cleaning;

/**
 * One named, pure text transform of the working-dossier pipeline.
 *
 * <p>Implementations must be idempotent: applying a stage to its own output changes nothing.
 */
public interface CleaningStage {

  /** Short stable name, used in logs and metrics tags. */
  String name();

  String apply(String text, CleaningContext context);
}
