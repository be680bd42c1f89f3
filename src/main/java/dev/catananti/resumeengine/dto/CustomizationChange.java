package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Audit entry for one customization mutation.
 * <p>
 * Values are snapshots of the affected field: a {@link ColorScheme}, {@link TypographySettings},
 * {@link LayoutSettings} or {@link SectionVisibility}, or a whole {@link TemplateCustomization}
 * for role, reset and import changes.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustomizationChange(
        ChangeType type,
        String property,
        Object previousValue,
        Object newValue,
        Instant timestamp,
        Map<String, Object> metadata
) {
}
