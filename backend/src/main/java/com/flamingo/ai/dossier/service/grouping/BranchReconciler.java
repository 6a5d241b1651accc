package com.flamingo.ai.dossier.service.grouping;

import com.flamingo.ai.dossier.domain.model.Message;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Trims a branch down to the messages it adds on top of its root.
 *
 * <p>Messages are compared on role plus whitespace-normalized text, index by index, until the
 * first mismatch. The returned messages are the branch's originals (not normalized) from that
 * index onward. An edit to an early message breaks the shared prefix, so the whole branch is
 * printed again.
 */
@Service
public class BranchReconciler {

  public List<Message> reconcile(List<Message> root, List<Message> branch) {
    int shared = commonPrefixLength(root, branch);
    return List.copyOf(branch.subList(shared, branch.size()));
  }

  int commonPrefixLength(List<Message> a, List<Message> b) {
    int n = Math.min(a.size(), b.size());
    int i = 0;
    while (i < n && sameTurn(a.get(i), b.get(i))) {
      i++;
    }
    return i;
  }

  private static boolean sameTurn(Message a, Message b) {
    return Objects.equals(a.role(), b.role())
        && TitleNormalizer.normalizeText(a.text()).equals(TitleNormalizer.normalizeText(b.text()));
  }
}
