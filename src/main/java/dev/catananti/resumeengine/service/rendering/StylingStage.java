package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.dto.ColorScheme;
import dev.catananti.resumeengine.dto.LayoutSettings;
import dev.catananti.resumeengine.dto.RenderingError;
import dev.catananti.resumeengine.dto.SectionConfig;
import dev.catananti.resumeengine.dto.SectionVisibility;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import dev.catananti.resumeengine.dto.TypographySettings;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.entity.TemplateLayout;
import dev.catananti.resumeengine.entity.TemplateStyling;
import dev.catananti.resumeengine.service.customization.ColorThemeService;
import dev.catananti.resumeengine.service.customization.LayoutService;
import dev.catananti.resumeengine.service.customization.StylesheetGenerator;
import dev.catananti.resumeengine.service.customization.TypographyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Generates the stylesheet: customization styles (falling back to the template's own styling),
 * per-section declarations and responsive rules.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StylingStage implements RenderingStage {

    private final StylesheetGenerator stylesheetGenerator;
    private final ColorThemeService colorThemeService;
    private final TypographyService typographyService;
    private final LayoutService layoutService;

    @Override
    public StageName name() {
        return StageName.STYLING;
    }

    @Override
    public Mono<Result> execute(RenderingContext context) {
        return Mono.fromCallable(() -> style(context))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(error -> {
                    log.warn("Styling failed for template {}: {}", context.getTemplateId(), error.getMessage());
                    return Mono.just(new Result(null, List.of(RenderingError.recoverable(name().getKey(),
                            "STYLING_ERROR", "Styling failed", Map.of("error", String.valueOf(error.getMessage()))))));
                });
    }

    private Result style(RenderingContext context) {
        if (context.getMarkup() == null) {
            throw new IllegalStateException("No processed content available for styling");
        }
        TemplateCustomization customization = effectiveCustomization(context);
        String css = Stream.of(
                        stylesheetGenerator.generate(customization),
                        sectionStylingCss(context.getSections()),
                        responsiveCss(context.getTemplate().getLayout()))
                .filter(part -> !part.isBlank())
                .collect(Collectors.joining("\n\n"));

        log.debug("Styling stage completed: {} characters of CSS", css.length());
        return new Result(css, List.of());
    }

    /**
     * Layers the render's customization over the template's styling over the defaults.
     * Colors are taken whole from the first layer that has them.
     */
    TemplateCustomization effectiveCustomization(RenderingContext context) {
        ResumeTemplate template = context.getTemplate();
        TemplateCustomization requested = context.getCustomization().orElseGet(TemplateCustomization::new);
        TemplateStyling styling = template.getStyling() != null ? template.getStyling() : new TemplateStyling();

        ColorScheme colors = requested.getColorScheme() != null ? requested.getColorScheme()
                : styling.getColors() != null ? styling.getColors()
                : colorThemeService.getPredefinedTheme(ColorThemeService.DEFAULT_THEME).orElseThrow();
        TypographySettings templateTypography = typographyService.merge(typographyService.defaultTypography(),
                styling.getTypography());
        TypographySettings typography = typographyService.merge(templateTypography, requested.getTypography());
        LayoutSettings layout = layoutService.defaultLayout()
                .merge(template.getLayout() != null ? template.getLayout().getSettings() : null)
                .merge(requested.getLayout());
        SectionVisibility visibility = requested.getSectionVisibility() != null ? requested.getSectionVisibility()
                : visibilityOf(context.getSections());

        return TemplateCustomization.builder()
                .templateId(template.getId())
                .colorScheme(colors)
                .typography(typography)
                .layout(layout)
                .sectionVisibility(visibility)
                .build();
    }

    private static SectionVisibility visibilityOf(List<ProcessedSection> sections) {
        Map<String, SectionConfig> configs = new LinkedHashMap<>();
        int order = 1;
        for (ProcessedSection section : sections) {
            configs.put(section.id(), SectionConfig.builder()
                    .id(section.id())
                    .name(section.name())
                    .visible(true)
                    .order(order++)
                    .build());
        }
        return new SectionVisibility(configs);
    }

    private static String sectionStylingCss(List<ProcessedSection> sections) {
        return sections.stream()
                .filter(section -> section.styling() != null && !section.styling().isEmpty())
                .map(section -> ".section-" + section.id() + " {\n" + section.styling().entrySet().stream()
                        .map(declaration -> "  " + declaration.getKey() + ": " + declaration.getValue() + ";")
                        .collect(Collectors.joining("\n")) + "\n}")
                .collect(Collectors.joining("\n\n"));
    }

    static String responsiveCss(TemplateLayout layout) {
        TemplateLayout breakpoints = layout != null ? layout : new TemplateLayout();
        return "/* Responsive styles */\n"
                + "@media (max-width: " + breakpoints.getMobileBreakpoint() + "px) {\n"
                + "  .resume-template {\n    padding: 1cm;\n    font-size: 14px;\n  }\n"
                + "  .contact-info {\n    flex-direction: column;\n    gap: 8px;\n  }\n"
                + "}\n"
                + "@media (max-width: " + breakpoints.getTabletBreakpoint() + "px) {\n"
                + "  .resume-template {\n    padding: 1.5cm;\n  }\n"
                + "}";
    }

    public record Result(String css, List<RenderingError> errors) implements StageResult {

        @Override
        public void applyTo(RenderingContext context) {
            if (css != null) {
                context.setCss(css);
            }
        }
    }
}
