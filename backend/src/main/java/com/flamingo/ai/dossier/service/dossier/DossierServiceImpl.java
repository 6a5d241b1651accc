package com.flamingo.ai.dossier.service.dossier;

import com.flamingo.ai.dossier.config.DossierConfig;
import com.flamingo.ai.dossier.domain.model.AppendixIntegrity;
import com.flamingo.ai.dossier.domain.model.BuildOptions;
import com.flamingo.ai.dossier.domain.model.ColumnConfig;
import com.flamingo.ai.dossier.domain.model.ConversationGroup;
import com.flamingo.ai.dossier.domain.model.ConversationItem;
import com.flamingo.ai.dossier.domain.model.DossierFormat;
import com.flamingo.ai.dossier.domain.model.DossierResult;
import com.flamingo.ai.dossier.exception.EmptyDossierException;
import com.flamingo.ai.dossier.exception.InvalidDossierRequestException;
import com.flamingo.ai.dossier.exception.NoDossierOutputException;
import com.flamingo.ai.dossier.service.assembly.OutputAssembler;
import com.flamingo.ai.dossier.service.cleaning.CleaningContext;
import com.flamingo.ai.dossier.service.cleaning.CleaningPipeline;
import com.flamingo.ai.dossier.service.cleaning.CleaningResult;
import com.flamingo.ai.dossier.service.grouping.GroupBuilder;
import com.flamingo.ai.dossier.service.index.ControlLayerGenerator;
import com.flamingo.ai.dossier.service.index.TaggedIndexGenerator;
import com.flamingo.ai.dossier.service.index.WorkingIndex;
import com.flamingo.ai.dossier.service.index.WorkingIndexGenerator;
import com.flamingo.ai.dossier.service.render.MarkdownRenderer;
import com.flamingo.ai.dossier.service.render.PlainTextRenderer;
import com.flamingo.ai.dossier.service.render.RawRenderer;
import com.flamingo.ai.dossier.service.render.RenderContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Default {@link DossierService} wiring grouping, rendering, cleaning, indexing and assembly. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DossierServiceImpl implements DossierService {

  private final DossierConfig dossierConfig;
  private final GroupBuilder groupBuilder;
  private final RawRenderer rawRenderer;
  private final MarkdownRenderer markdownRenderer;
  private final PlainTextRenderer plainTextRenderer;
  private final CleaningPipeline cleaningPipeline;
  private final WorkingIndexGenerator workingIndexGenerator;
  private final TaggedIndexGenerator taggedIndexGenerator;
  private final ControlLayerGenerator controlLayerGenerator;
  private final OutputAssembler outputAssembler;
  private final MeterRegistry meterRegistry;

  @Override
  public DossierResult build(
      List<ConversationItem> conversations,
      List<String> topics,
      String exportRoot,
      BuildOptions options) {
    validateSelection(conversations);
    validateContext(options.context());

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<ConversationGroup> groups = groupBuilder.build(conversations);
      RenderContext context =
          RenderContext.of(topics, exportRoot, options.mode(), options.context());
      log.info(
          "Building dossier: {} conversations in {} groups, mode={}, formats={}",
          conversations.size(),
          groups.size(),
          options.mode().value(),
          options.formats());

      List<String> warnings = new ArrayList<>();
      List<String> failures = new ArrayList<>();
      Set<DossierFormat> formats = options.formats();

      String raw = null;
      if (formats.contains(DossierFormat.TXT)) {
        raw = renderFormat(DossierFormat.TXT, () -> rawRenderer.render(groups, context), failures);
      }
      String markdown = null;
      if (formats.contains(DossierFormat.MD) || formats.contains(DossierFormat.PLAIN)) {
        DossierFormat label =
            formats.contains(DossierFormat.MD) ? DossierFormat.MD : DossierFormat.PLAIN;
        markdown = renderFormat(label, () -> markdownRenderer.render(groups, context), failures);
      }
      String plain = null;
      if (formats.contains(DossierFormat.PLAIN) && markdown != null) {
        String source = markdown;
        plain =
            renderFormat(DossierFormat.PLAIN, () -> plainTextRenderer.render(source), failures);
      }
      if (!formats.contains(DossierFormat.MD)) {
        markdown = null;
      }
      warnings.addAll(failures);

      if (raw == null && markdown == null && plain == null) {
        throw new NoDossierOutputException(failures);
      }

      String working = null;
      boolean artifactsFound = false;
      AppendixIntegrity integrity = null;
      if (options.split()) {
        if (raw == null) {
          warnings.add("Working variant skipped: it is derived from the txt output");
        } else {
          CleaningResult cleaned = cleaningPipeline.clean(raw, cleaningContext(options));
          artifactsFound = cleaned.hasArtifacts();
          working = assembleWorking(cleaned, conversations, topics, options, warnings);
          integrity = outputAssembler.check(working, artifactsFound);
          recordIntegrity(integrity, artifactsFound, warnings);
        }
      }

      return new DossierResult(
          raw, working, markdown, plain, artifactsFound, integrity, warnings);
    } finally {
      sample.stop(meterRegistry.timer("dossier.build", "mode", options.mode().value()));
    }
  }

  private String assembleWorking(
      CleaningResult cleaned,
      List<ConversationItem> conversations,
      List<String> topics,
      BuildOptions options,
      List<String> warnings) {
    if (cleaned.body().isBlank()) {
      throw new EmptyDossierException("Working dossier is empty after cleaning");
    }

    ColumnConfig config = options.columnConfig();
    String body = cleaned.body();
    WorkingIndex index;
    if (config != null) {
      body = controlLayerGenerator.frontMatter(config, conversations) + body;
      index = taggedIndexGenerator.generate(body, conversations, config);
    } else {
      index = workingIndexGenerator.generate(body, conversations, topics);
    }
    warnings.addAll(index.warnings());

    if (cleaned.hasArtifacts()) {
      meterRegistry.counter("dossier.artifacts.quarantined").increment(cleaned.artifacts().size());
    }
    log.debug(
        "Assembling working dossier: {} body chars, {} artifacts",
        body.length(),
        cleaned.artifacts().size());
    return outputAssembler.assemble(index, body, cleaned.artifacts());
  }

  private CleaningContext cleaningContext(BuildOptions options) {
    return new CleaningContext(
        options.dedup(),
        dossierConfig.getCleaning().getMinBlockSize(),
        options.patterns(),
        options.usedLinks());
  }

  private String renderFormat(
      DossierFormat format, Supplier<String> renderer, List<String> failures) {
    try {
      return renderer.get();
    } catch (RuntimeException e) {
      String name = format.value().toUpperCase(Locale.ROOT);
      log.warn("{} generation failed: {}", name, e.getMessage(), e);
      meterRegistry.counter("dossier.format.failures", "format", format.value()).increment();
      failures.add(name + " generation failed: " + e.getMessage());
      return null;
    }
  }

  private void recordIntegrity(
      AppendixIntegrity integrity, boolean artifactsFound, List<String> warnings) {
    if (!artifactsFound || integrity.isIntact()) {
      return;
    }
    meterRegistry.counter("dossier.integrity.warnings").increment();
    if (integrity.headerCount() != integrity.expected()) {
      warnings.add(
          "Appendix header appears "
              + integrity.headerCount()
              + " times (expected "
              + integrity.expected()
              + ")");
    }
    if (integrity.researchLogCount() != integrity.expected()) {
      warnings.add(
          "'RESEARCH LOG & TOOL ARTIFACTS' appears "
              + integrity.researchLogCount()
              + " times (expected "
              + integrity.expected()
              + ")");
    }
  }

  private static void validateSelection(List<ConversationItem> conversations) {
    if (conversations == null || conversations.isEmpty()) {
      throw new InvalidDossierRequestException("No conversations selected");
    }
    Set<String> seen = new HashSet<>();
    Set<String> duplicates = new LinkedHashSet<>();
    for (ConversationItem item : conversations) {
      if (item.id() == null || item.id().isBlank()) {
        throw new InvalidDossierRequestException("Conversation without an ID in selection");
      }
      if (!seen.add(item.id())) {
        duplicates.add(item.id());
      }
    }
    if (!duplicates.isEmpty()) {
      throw new InvalidDossierRequestException(
          "Duplicate conversation IDs in selection", List.copyOf(duplicates));
    }
  }

  private void validateContext(int context) {
    int max = dossierConfig.getExcerpt().getMaxContext();
    if (context > max) {
      throw new IllegalArgumentException("context must be between 0 and " + max);
    }
  }
}
