package dev.catananti.resumeengine.service.customization;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates one {@link CustomizationEngine} per editing session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomizationEngineFactory {

    private final ColorThemeService colorThemeService;
    private final TypographyService typographyService;
    private final LayoutService layoutService;
    private final SectionVisibilityService sectionVisibilityService;
    private final StylesheetGenerator stylesheetGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CustomizationEngine create(ResumeTemplate baseTemplate) {
        log.info("Starting customization session for template {}", baseTemplate.getId());
        return new CustomizationEngine(baseTemplate, colorThemeService, typographyService, layoutService,
                sectionVisibilityService, stylesheetGenerator, objectMapper, clock);
    }
}
