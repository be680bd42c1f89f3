package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.dto.FontRoleSettings;
import dev.catananti.resumeengine.dto.OutputFormat;
import dev.catananti.resumeengine.dto.RenderingError;
import dev.catananti.resumeengine.dto.RenderingWarning;
import dev.catananti.resumeengine.dto.SectionConfig;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import dev.catananti.resumeengine.dto.TypographySettings;
import dev.catananti.resumeengine.entity.AtsOptimizationProfile;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.entity.SectionDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks template and resume identity, the requested format and the template's ATS profile.
 */
@Component
@Slf4j
public class ValidationStage implements RenderingStage {

    static final String INVALID_TEMPLATE = "INVALID_TEMPLATE";
    static final String INVALID_RESUME = "INVALID_RESUME";
    static final String INVALID_FORMAT = "INVALID_FORMAT";

    @Override
    public StageName name() {
        return StageName.VALIDATION;
    }

    @Override
    public Mono<Result> execute(RenderingContext context) {
        return Mono.fromSupplier(() -> validate(context))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Result validate(RenderingContext context) {
        String stage = name().getKey();
        List<RenderingError> errors = new ArrayList<>();
        List<RenderingWarning> warnings = new ArrayList<>();

        ResumeTemplate template = context.getTemplate();
        if (template == null || isBlank(template.getId())) {
            Map<String, Object> details = new HashMap<>();
            details.put("templateName", template == null ? null : template.getName());
            errors.add(RenderingError.fatal(stage, INVALID_TEMPLATE, "Invalid template structure", details));
        }
        if (context.getResumeData() == null || isBlank(context.getResumeData().getId())) {
            errors.add(RenderingError.fatal(stage, INVALID_RESUME, "Invalid resume data", Map.of()));
        }

        String requested = context.getOptions().getFormat();
        OutputFormat format = requested == null ? OutputFormat.HTML : OutputFormat.fromValue(requested).orElse(null);
        if (format == null) {
            warnings.add(new RenderingWarning(stage, INVALID_FORMAT,
                    "Unsupported format: " + requested + ", using html",
                    "Output format may not be as expected"));
            format = OutputFormat.HTML;
        }

        if (template != null && template.getAtsProfile() != null) {
            warnings.addAll(checkAtsProfile(template, context.getOptions().getCustomization()));
        }

        log.debug("Validation stage completed: {} errors, {} warnings", errors.size(), warnings.size());
        return new Result(errors, warnings, format);
    }

    private List<RenderingWarning> checkAtsProfile(ResumeTemplate template, TemplateCustomization customization) {
        String stage = name().getKey();
        AtsOptimizationProfile profile = template.getAtsProfile();
        List<RenderingWarning> warnings = new ArrayList<>();

        TypographySettings typography = customization != null ? customization.getTypography()
                : template.getStyling() != null ? template.getStyling().getTypography() : null;
        if (typography != null) {
            List<String> families = Stream.of(typography.getHeading(), typography.getBody(),
                            typography.getAccent(), typography.getMonospace())
                    .filter(Objects::nonNull)
                    .map(FontRoleSettings::getFontFamily)
                    .filter(Objects::nonNull)
                    .distinct()
                    .collect(Collectors.toList());
            for (String family : families) {
                if (profile.getProhibitedFonts().stream().anyMatch(family::equalsIgnoreCase)) {
                    warnings.add(new RenderingWarning(stage, "ATS_PROHIBITED_FONT",
                            "Font " + family + " is prohibited by the template's ATS profile",
                            "Applicant tracking systems may misread the document"));
                }
            }
        }

        List<String> required = profile.getRequiredSectionOrder();
        if (!required.isEmpty()) {
            List<String> actual = customization != null && customization.getSectionVisibility() != null
                    ? customization.getSectionVisibility().getVisibleOrdered().stream()
                        .map(SectionConfig::getId)
                        .collect(Collectors.toList())
                    : template.getSections().stream().map(SectionDefinition::getId).collect(Collectors.toList());
            List<String> relevant = actual.stream().filter(required::contains).collect(Collectors.toList());
            List<String> expected = required.stream().filter(relevant::contains).collect(Collectors.toList());
            if (!relevant.equals(expected)) {
                warnings.add(new RenderingWarning(stage, "ATS_SECTION_ORDER",
                        "Section order " + relevant + " differs from the ATS order " + expected,
                        "Applicant tracking systems may parse sections less reliably"));
            }
        }
        return warnings;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record Result(List<RenderingError> errors, List<RenderingWarning> warnings, OutputFormat format)
            implements StageResult {

        @Override
        public void applyTo(RenderingContext context) {
            context.setFormat(format);
        }
    }
}
