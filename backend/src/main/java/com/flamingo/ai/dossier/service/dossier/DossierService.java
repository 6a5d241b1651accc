package com.flamingo.ai.dossier.service.dossier;

import com.flamingo.ai.dossier.domain.model.BuildOptions;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.domain.model.DossierResult;
import java.util.List;

/**
 * Builds dossiers from selected conversations.
 *
 * <p>Conversations are grouped into roots and branches, rendered into the requested variants and,
 * when splitting, cleaned into an indexed working variant with a single trailing appendix.
 */
public interface DossierService {

  /**
   * Builds one dossier.
   *
   * @param conversations selected conversations; must be non-empty with unique IDs
   * @param topics topics used for the header, excerpting and priority scoring
   * @param exportRoot where the conversations came from, shown in the header
   * @param options build options
   * @return the rendered variants and any non-fatal warnings
   * @throws com.flamingo.ai.dossier.exception.InvalidDossierRequestException for an empty
   *     selection or duplicate IDs
   * @throws com.flamingo.ai.dossier.exception.EmptyDossierException when cleaning leaves nothing
   * @throws com.flamingo.ai.dossier.exception.NoDossierOutputException when no requested format
   *     could be rendered
   */
  DossierResult build(
      List<ConversationItem> conversations,
      List<String> topics,
      String exportRoot,
      BuildOptions options);
}
