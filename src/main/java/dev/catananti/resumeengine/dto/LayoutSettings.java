package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Page geometry. Also used as a partial override, where {@code null} fields are left unchanged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LayoutSettings {
    private Margins margins;
    private SectionSpacing sectionSpacing;
    /** Points between items of a section. */
    private Integer itemSpacing;
    private Double lineHeight;
    private Alignment alignment;
    private Map<String, SectionLayoutAdjustment> customSections;

    /**
     * Overlays the non-null fields of {@code override} onto a copy of this layout.
     */
    public LayoutSettings merge(LayoutSettings override) {
        LayoutSettings merged = copy();
        if (override == null) return merged;
        if (override.margins != null) merged.margins = override.margins.copy();
        if (override.sectionSpacing != null) merged.sectionSpacing = override.sectionSpacing.copy();
        if (override.itemSpacing != null) merged.itemSpacing = override.itemSpacing;
        if (override.lineHeight != null) merged.lineHeight = override.lineHeight;
        if (override.alignment != null) merged.alignment = override.alignment;
        if (override.customSections != null) merged.customSections = new LinkedHashMap<>(override.customSections);
        return merged;
    }

    public LayoutSettings copy() {
        LayoutSettings copy = toBuilder().build();
        copy.margins = margins != null ? margins.copy() : null;
        copy.sectionSpacing = sectionSpacing != null ? sectionSpacing.copy() : null;
        if (customSections != null) {
            Map<String, SectionLayoutAdjustment> sections = new LinkedHashMap<>();
            customSections.forEach((id, adjustment) -> sections.put(id, adjustment.toBuilder().build()));
            copy.customSections = sections;
        }
        return copy;
    }
}
