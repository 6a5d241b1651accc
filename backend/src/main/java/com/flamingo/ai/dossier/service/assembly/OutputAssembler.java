package com.flamingo.ai.dossier.service.assembly;

import com.flamingo.ai.dossier.domain.model.AppendixIntegrity;
import com.flamingo.ai.dossier.domain.model.Artifact;
import com.flamingo.ai.dossier.service.index.WorkingIndex;
import com.flamingo.ai.dossier.service.render.DossierLayout;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Concatenates the working dossier: index, coverage audit, cleaned body and, when artifacts were
 * quarantined, a single trailing appendix.
 */
@Component
@Slf4j
public class OutputAssembler {

  static final String APPENDIX_INTRO =
      "This section contains metadata, tool-call fragments, and provenance\n"
          + "information from the research extraction process.\n\n";

  public String assemble(WorkingIndex index, String body, List<Artifact> artifacts) {
    StringBuilder sb = new StringBuilder(index.index());
    if (index.hasCoverage()) {
      sb.append('\n').append(String.join("\n", index.coverage()));
    }
    sb.append('\n').append(body);
    if (!artifacts.isEmpty()) {
      sb.append(appendix(artifacts));
    }
    return dedupeAppendixHeader(sb.toString());
  }

  static String appendix(List<Artifact> artifacts) {
    StringBuilder sb = new StringBuilder("\n\n");
    sb.append(DossierLayout.DELIMITER).append('\n');
    sb.append(DossierLayout.APPENDIX_HEADER).append('\n');
    sb.append(DossierLayout.DELIMITER).append("\n\n");
    sb.append(APPENDIX_INTRO);
    sb.append(String.join("\n\n", artifacts.stream().map(Artifact::render).toList()));
    return sb.toString();
  }

  /**
   * Keeps the first appendix header marker and removes the marker token from everything after
   * it. Surrounding text is never dropped.
   */
  public static String dedupeAppendixHeader(String text) {
    String marker = DossierLayout.APPENDIX_HEADER;
    int first = text.indexOf(marker);
    if (first < 0) {
      return text;
    }
    int tail = first + marker.length();
    if (text.indexOf(marker, tail) < 0) {
      return text;
    }
    return text.substring(0, tail) + text.substring(tail).replace(marker, "");
  }

  /**
   * Counts appendix header occurrences in {@code text}. A mismatch against {@code expected} is
   * logged and reported, never thrown.
   */
  public AppendixIntegrity check(String text, boolean artifactsFound) {
    int expected = artifactsFound ? 1 : 0;
    AppendixIntegrity integrity =
        new AppendixIntegrity(
            expected,
            occurrences(text, DossierLayout.APPENDIX_HEADER),
            occurrences(text, DossierLayout.RESEARCH_LOG_TOKEN));
    if (artifactsFound && integrity.headerCount() != expected) {
      log.warn(
          "Appendix header appears {} times (expected {})", integrity.headerCount(), expected);
    }
    if (artifactsFound && integrity.researchLogCount() != expected) {
      log.warn(
          "'{}' appears {} times (expected {})",
          DossierLayout.RESEARCH_LOG_TOKEN,
          integrity.researchLogCount(),
          expected);
    }
    return integrity;
  }

  static int occurrences(String text, String token) {
    int count = 0;
    int from = text.indexOf(token);
    while (from >= 0) {
      count++;
      from = text.indexOf(token, from + token.length());
    }
    return count;
  }
}
