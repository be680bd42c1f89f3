package dev.catananti.resumeengine.service.customization;

import dev.catananti.resumeengine.dto.ColorRole;
import dev.catananti.resumeengine.dto.ColorScheme;
import dev.catananti.resumeengine.dto.SectionConfig;
import dev.catananti.resumeengine.dto.SectionVisibility;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Assembles one stylesheet from a customization: colors, typography, layout, then section selectors.
 */
@Component
@RequiredArgsConstructor
public class StylesheetGenerator {

    private final TypographyService typographyService;
    private final LayoutService layoutService;

    public String generate(TemplateCustomization customization) {
        return "/* Resume Template Customization */\n"
                + generateColorCss(customization.getColorScheme()) + "\n\n"
                + typographyService.generateCss(customization.getTypography()) + "\n\n"
                + layoutService.generateCss(customization.getLayout()) + "\n\n"
                + "/* Section Visibility Styles */\n"
                + generateSectionCss(customization.getSectionVisibility());
    }

    public String generateColorCss(ColorScheme scheme) {
        StringBuilder css = new StringBuilder("/* Color Theme */\n:root {\n");
        for (ColorRole role : ColorRole.values()) {
            css.append("  --color-").append(role.getKey()).append(": ").append(scheme.get(role)).append(";\n");
        }
        css.append("}\n\n")
                .append(".resume-container {\n  color: var(--color-text);\n  background-color: var(--color-background);\n}\n\n")
                .append(".section-title {\n  color: var(--color-primary);\n  border-bottom: 2px solid var(--color-accent);\n}\n\n")
                .append(".item-title {\n  color: var(--color-secondary);\n}\n\n")
                .append(".accent-text {\n  color: var(--color-accent);\n}\n\n")
                .append(".contact-info {\n  color: var(--color-muted);\n  border-bottom: 1px solid var(--color-border);\n}\n\n")
                .append("a {\n  color: var(--color-link);\n}\n\n")
                .append(".highlight {\n  background-color: var(--color-highlight);\n}");
        return css.toString();
    }

    public String generateSectionCss(SectionVisibility visibility) {
        return visibility.getVisibleOrdered().stream()
                .map(SectionConfig::getId)
                .map(id -> ".resume-section[data-section=\"" + id + "\"] {\n  display: block;\n}\n\n"
                        + ".resume-section[data-section=\"" + id + "\"]:not(.visible) {\n  display: none;\n}")
                .collect(Collectors.joining("\n"));
    }
}
