package dev.catananti.resumeengine.service.rendering;

import com.fasterxml.jackson.databind.JsonNode;
import dev.catananti.resumeengine.dto.RenderedAsset;
import dev.catananti.resumeengine.dto.RenderingError;
import dev.catananti.resumeengine.dto.SectionConfig;
import dev.catananti.resumeengine.dto.SectionVisibility;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.entity.SectionDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the processed sections from bound data and renders the document markup.
 * Sections without data, or hidden by the customization, are left out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentProcessingStage implements RenderingStage {

    /** Sections the customization does not mention follow the ones it orders. */
    private static final int UNORDERED_OFFSET = 1000;

    private final SectionViewFactory sectionViewFactory;
    private final MarkupRenderer markupRenderer;

    @Override
    public StageName name() {
        return StageName.CONTENT_PROCESSING;
    }

    @Override
    public Mono<Result> execute(RenderingContext context) {
        return Mono.fromCallable(() -> process(context))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(error -> {
                    log.warn("Content processing failed for template {}: {}", context.getTemplateId(), error.getMessage());
                    return Mono.just(Result.failed(RenderingError.recoverable(name().getKey(),
                            "CONTENT_PROCESSING_ERROR", "Content processing failed",
                            Map.of("error", String.valueOf(error.getMessage())))));
                });
    }

    private Result process(RenderingContext context) {
        Map<String, JsonNode> boundData = context.getBoundData();
        if (boundData == null) {
            throw new IllegalStateException("No bound data available for content processing");
        }

        ResumeTemplate template = context.getTemplate();
        SectionVisibility visibility = context.getCustomization()
                .map(TemplateCustomization::getSectionVisibility)
                .orElse(null);

        List<ProcessedSection> sections = new ArrayList<>();
        List<SectionDefinition> definitions = template.getSections();
        for (int i = 0; i < definitions.size(); i++) {
            SectionDefinition definition = definitions.get(i);
            JsonNode data = boundData.get(definition.getId());
            if (data == null || data.isNull()) {
                continue;
            }
            SectionConfig config = visibility == null ? null : visibility.get(definition.getId());
            if (config != null && !config.isVisible()) {
                continue;
            }
            int order = config != null ? config.getOrder() : UNORDERED_OFFSET + i;
            sections.add(new ProcessedSection(definition.getId(), definition.getName(), definition.getType(), data,
                    definition.getLayout(), definition.getStyling(), true, order));
        }
        sections.sort(Comparator.comparingInt(ProcessedSection::order));

        List<SectionView> views = sections.stream().map(sectionViewFactory::create).collect(Collectors.toList());
        String markup = markupRenderer.render(template, views, context.getFormat());

        List<RenderedAsset> assets = new ArrayList<>();
        if (template.getThumbnailUrl() != null) {
            assets.add(new RenderedAsset("image", template.getThumbnailUrl(), "thumbnail"));
        }

        log.debug("Content processing stage completed: {} sections, {} assets", sections.size(), assets.size());
        return new Result(sections, markup, assets, List.of());
    }

    public record Result(List<ProcessedSection> sections, String markup, List<RenderedAsset> assets,
                         List<RenderingError> errors) implements StageResult {

        static Result failed(RenderingError error) {
            return new Result(null, null, List.of(), List.of(error));
        }

        @Override
        public void applyTo(RenderingContext context) {
            if (markup == null) {
                return;
            }
            context.setSections(sections);
            context.setMarkup(markup);
            context.setAssets(new ArrayList<>(assets));
        }
    }
}
