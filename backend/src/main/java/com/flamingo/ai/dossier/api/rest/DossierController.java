package com.flamingo.ai.dossier.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.dossier.api.dto.request.BuildDossierRequest;
import com.flamingo.ai.dossier.api.dto.response.DossierResponse;
import com.flamingo.ai.dossier.domain.model.BuildOptions;
import com.flamingo.ai.dossier.domain.model.ColumnConfig;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.domain.model.DossierFormat;
import com.flamingo.ai.dossier.domain.model.DossierMode;
import com.flamingo.ai.dossier.domain.model.DossierResult;
import com.flamingo.ai.dossier.domain.model.Message;
import com.flamingo.ai.dossier.service.dossier.DossierService;
import com.flamingo.ai.dossier.service.input.ColumnConfigLoader;
import com.flamingo.ai.dossier.service.input.DeliverablePatternsParser;
import com.flamingo.ai.dossier.service.input.UsedLinksParser;
import jakarta.validation.Valid;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for dossier builds. */
@RestController
@RequestMapping("/api/dossiers")
@RequiredArgsConstructor
public class DossierController {

  private final DossierService dossierService;
  private final ColumnConfigLoader columnConfigLoader;

  /** Builds a dossier from the conversations in the request body. */
  @PostMapping
  public ResponseEntity<DossierResponse> buildDossier(
      @Valid @RequestBody BuildDossierRequest request) {
    BuildOptions options = toOptions(request);
    List<ConversationItem> conversations =
        request.getConversations().stream().map(DossierController::toItem).toList();

    DossierResult result =
        dossierService.build(conversations, request.getTopics(), request.getExportRoot(), options);
    return ResponseEntity.ok(DossierResponse.from(result));
  }

  private BuildOptions toOptions(BuildDossierRequest request) {
    return BuildOptions.builder()
        .mode(DossierMode.fromValue(request.getMode()))
        .context(request.getContext() != null ? request.getContext() : 0)
        .dedup(request.getDedup() == null || request.getDedup())
        .split(request.isSplit())
        .patterns(patterns(request))
        .usedLinks(usedLinks(request))
        .columnConfig(columnConfig(request.getColumnConfig()))
        .formats(formats(request.getFormats()))
        .build();
  }

  private ColumnConfig columnConfig(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    return columnConfigLoader.load(node);
  }

  private static List<String> patterns(BuildDossierRequest request) {
    if (request.getPatternsText() != null) {
      return DeliverablePatternsParser.parse(request.getPatternsText());
    }
    return request.getPatterns();
  }

  private static Set<String> usedLinks(BuildDossierRequest request) {
    if (request.getUsedLinks() == null && request.getUsedLinksText() == null) {
      return null;
    }
    Set<String> links = new LinkedHashSet<>();
    if (request.getUsedLinks() != null) {
      request.getUsedLinks().stream()
          .filter(Objects::nonNull)
          .map(String::strip)
          .filter(link -> !link.isEmpty())
          .forEach(links::add);
    }
    links.addAll(UsedLinksParser.parse(request.getUsedLinksText()));
    return links;
  }

  private static Set<DossierFormat> formats(List<String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    Set<DossierFormat> formats = EnumSet.noneOf(DossierFormat.class);
    values.forEach(value -> formats.add(DossierFormat.fromValue(value)));
    return formats;
  }

  private static ConversationItem toItem(BuildDossierRequest.ConversationRequest conversation) {
    List<Message> messages =
        conversation.getMessages() == null
            ? List.of()
            : conversation.getMessages().stream()
                .map(
                    message ->
                        new Message(
                            message.getTimestamp() != null ? message.getTimestamp() : 0,
                            message.getRole(),
                            message.getText()))
                .toList();
    double createTime = conversation.getCreateTime() != null ? conversation.getCreateTime() : 0;
    return ConversationItem.of(
        conversation.getId(), conversation.getTitle(), createTime, messages);
  }
}
