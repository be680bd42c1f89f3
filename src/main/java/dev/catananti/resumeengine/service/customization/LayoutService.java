package dev.catananti.resumeengine.service.customization;

import dev.catananti.resumeengine.dto.Alignment;
import dev.catananti.resumeengine.dto.ExperienceLevel;
import dev.catananti.resumeengine.dto.LayoutEfficiency;
import dev.catananti.resumeengine.dto.LayoutSettings;
import dev.catananti.resumeengine.dto.Margins;
import dev.catananti.resumeengine.dto.SectionLayoutAdjustment;
import dev.catananti.resumeengine.dto.SectionSpacing;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dev.catananti.resumeengine.util.CssUtils.number;

/**
 * Page geometry presets and the ATS bounds every layout is clamped into.
 */
@Service
public class LayoutService {

    public static final String DEFAULT_LAYOUT = "traditional";

    private static final double MIN_MARGIN = 0.5;
    private static final double MAX_MARGIN = 1.5;
    private static final int MIN_SECTION_SPACING = 6;
    private static final int MAX_SECTION_SPACING = 24;
    private static final int MIN_ITEM_SPACING = 2;
    private static final int MAX_ITEM_SPACING = 12;
    private static final double MIN_LINE_HEIGHT = 1.0;
    private static final double MAX_LINE_HEIGHT = 2.0;

    /** Letter page height in inches. */
    private static final double PAGE_HEIGHT = 11;
    private static final int CHARS_PER_LINE = 60;

    private static final Map<String, LayoutSettings> PRESETS = new LinkedHashMap<>();
    private static final Map<ExperienceLevel, LayoutSettings> EXPERIENCE_RECOMMENDATIONS = new LinkedHashMap<>();

    static {
        PRESETS.put("traditional", layout(0.75, 12, 8, 6, 1.15));
        PRESETS.put("modern", layout(0.5, 10, 6, 4, 1.3));
        PRESETS.put("compact", layout(0.5, 8, 4, 3, 1.1));
        PRESETS.put("spacious", layout(1.0, 16, 12, 8, 1.5));

        EXPERIENCE_RECOMMENDATIONS.put(ExperienceLevel.ENTRY, layout(1.0, 10, 6, 4, 1.3));
        EXPERIENCE_RECOMMENDATIONS.put(ExperienceLevel.MID, layout(0.75, 12, 8, 6, 1.2));
        EXPERIENCE_RECOMMENDATIONS.put(ExperienceLevel.SENIOR, layout(0.5, 8, 6, 4, 1.15));
        EXPERIENCE_RECOMMENDATIONS.put(ExperienceLevel.EXECUTIVE, layout(0.75, 16, 12, 8, 1.25));
    }

    private static LayoutSettings layout(double margin, int before, int after, int itemSpacing, double lineHeight) {
        return LayoutSettings.builder()
                .margins(Margins.uniform(margin))
                .sectionSpacing(new SectionSpacing(before, after))
                .itemSpacing(itemSpacing)
                .lineHeight(lineHeight)
                .alignment(Alignment.LEFT)
                .customSections(new LinkedHashMap<>())
                .build();
    }

    public Optional<LayoutSettings> getPredefinedLayout(String layoutId) {
        return Optional.ofNullable(PRESETS.get(layoutId)).map(LayoutSettings::copy);
    }

    public Map<String, LayoutSettings> getPredefinedLayouts() {
        Map<String, LayoutSettings> layouts = new LinkedHashMap<>();
        PRESETS.forEach((id, preset) -> layouts.put(id, preset.copy()));
        return layouts;
    }

    public LayoutSettings defaultLayout() {
        return PRESETS.get(DEFAULT_LAYOUT).copy();
    }

    /**
     * Default layout overlaid with {@code overrides}, every value clamped into ATS bounds.
     */
    public LayoutSettings createCustomLayout(LayoutSettings overrides) {
        LayoutSettings layout = defaultLayout().merge(overrides);
        Margins margins = layout.getMargins();
        layout.setMargins(new Margins(
                clamp(margins.getTop(), MIN_MARGIN, MAX_MARGIN),
                clamp(margins.getRight(), MIN_MARGIN, MAX_MARGIN),
                clamp(margins.getBottom(), MIN_MARGIN, MAX_MARGIN),
                clamp(margins.getLeft(), MIN_MARGIN, MAX_MARGIN)));
        layout.setSectionSpacing(new SectionSpacing(
                clamp(layout.getSectionSpacing().getBefore(), MIN_SECTION_SPACING, MAX_SECTION_SPACING),
                clamp(layout.getSectionSpacing().getAfter(), MIN_SECTION_SPACING, MAX_SECTION_SPACING)));
        layout.setItemSpacing(clamp(layout.getItemSpacing(), MIN_ITEM_SPACING, MAX_ITEM_SPACING));
        layout.setLineHeight(clamp(layout.getLineHeight(), MIN_LINE_HEIGHT, MAX_LINE_HEIGHT));
        return layout;
    }

    /**
     * Opens up short documents and tightens long ones.
     */
    public LayoutSettings adjustLayoutForContent(LayoutSettings layout, int contentLength) {
        LayoutSettings adjusted = layout.copy();
        SectionSpacing spacing = layout.getSectionSpacing();
        if (contentLength < 200) {
            adjusted.setSectionSpacing(new SectionSpacing(
                    Math.min(spacing.getBefore() + 4, MAX_SECTION_SPACING),
                    Math.min(spacing.getAfter() + 2, MAX_SECTION_SPACING)));
            adjusted.setItemSpacing(Math.min(layout.getItemSpacing() + 2, MAX_ITEM_SPACING));
            adjusted.setLineHeight(Math.min(layout.getLineHeight() + 0.1, MAX_LINE_HEIGHT));
        } else if (contentLength > 800) {
            adjusted.setSectionSpacing(new SectionSpacing(
                    Math.max(spacing.getBefore() - 2, MIN_SECTION_SPACING),
                    Math.max(spacing.getAfter() - 2, MIN_SECTION_SPACING)));
            adjusted.setItemSpacing(Math.max(layout.getItemSpacing() - 1, MIN_ITEM_SPACING));
            adjusted.setLineHeight(Math.max(layout.getLineHeight() - 0.05, MIN_LINE_HEIGHT));
        }
        return adjusted;
    }

    public LayoutEfficiency calculateLayoutEfficiency(LayoutSettings layout, int contentLength) {
        List<String> recommendations = new ArrayList<>();
        int readability = 0;
        int density = 0;
        int atsCompliance = 100;
        double lineHeight = layout.getLineHeight();
        int before = layout.getSectionSpacing().getBefore();
        int itemSpacing = layout.getItemSpacing();

        if (lineHeight >= 1.2 && lineHeight <= 1.5) {
            readability += 25;
        } else if (lineHeight >= 1.0 && lineHeight <= 1.8) {
            readability += 15;
        } else {
            readability += 5;
            recommendations.add("Consider using 1.2-1.5 line height for better readability");
        }

        if (before >= 8 && before <= 16) {
            readability += 25;
        } else {
            readability += 10;
            recommendations.add("Section spacing should be between 8-16 points");
        }

        if (itemSpacing >= 4 && itemSpacing <= 8) {
            readability += 25;
        } else {
            readability += 10;
            recommendations.add("Item spacing should be between 4-8 points");
        }

        double averageMargin = layout.getMargins().average();
        if (averageMargin >= 0.5 && averageMargin <= 1.0) {
            density += 50;
        } else if (averageMargin > 1.0 && averageMargin <= 1.25) {
            density += 30;
        } else {
            density += 10;
            recommendations.add("Margins should be between 0.5-1.0 inches for optimal density");
        }

        double expectedLines = (double) contentLength / CHARS_PER_LINE;
        double availableHeight = PAGE_HEIGHT - (layout.getMargins().getTop() + layout.getMargins().getBottom());
        long maxLines = (long) Math.floor(availableHeight * 72 / (lineHeight * 12));
        if (expectedLines <= maxLines * 0.8) {
            density += 25;
        } else if (expectedLines <= maxLines) {
            density += 15;
        } else {
            density += 5;
            recommendations.add("Consider reducing content or making layout more compact");
        }

        if (lineHeight < MIN_LINE_HEIGHT) atsCompliance -= 20;
        if (averageMargin < MIN_MARGIN) atsCompliance -= 20;
        if (before < MIN_SECTION_SPACING) atsCompliance -= 15;
        if (itemSpacing < MIN_ITEM_SPACING) atsCompliance -= 15;

        int total = (int) Math.round((readability + density) * 0.9 + atsCompliance * 0.1);
        return LayoutEfficiency.builder()
                .score(Math.min(100, total))
                .readabilityScore(readability)
                .densityScore(density)
                .atsCompliance(atsCompliance)
                .recommendations(recommendations)
                .build();
    }

    /**
     * Clamps into the narrower ranges parsers handle best and forces left alignment.
     */
    public LayoutSettings optimizeForAts(LayoutSettings layout) {
        LayoutSettings optimized = layout.copy();
        Margins margins = layout.getMargins();
        optimized.setLineHeight(clamp(layout.getLineHeight(), 1.0, 1.5));
        optimized.setMargins(new Margins(
                clamp(margins.getTop(), 0.5, 1.0),
                clamp(margins.getRight(), 0.5, 1.0),
                clamp(margins.getBottom(), 0.5, 1.0),
                clamp(margins.getLeft(), 0.5, 1.0)));
        optimized.setSectionSpacing(new SectionSpacing(
                clamp(layout.getSectionSpacing().getBefore(), 6, 16),
                clamp(layout.getSectionSpacing().getAfter(), 6, 16)));
        optimized.setItemSpacing(clamp(layout.getItemSpacing(), 2, 8));
        optimized.setAlignment(Alignment.LEFT);
        return optimized;
    }

    public LayoutSettings getExperienceBasedRecommendations(ExperienceLevel level) {
        LayoutSettings recommendation = EXPERIENCE_RECOMMENDATIONS.get(level);
        LayoutSettings copy = recommendation.copy();
        copy.setAlignment(null);
        copy.setCustomSections(null);
        return copy;
    }

    public SectionLayoutAdjustment createSectionAdjustment(String sectionId, Integer spacing, Alignment alignment,
                                                           String width, Integer columns, Integer priority) {
        return SectionLayoutAdjustment.builder()
                .sectionId(sectionId)
                .spacing(spacing)
                .alignment(alignment)
                .width(width)
                .columns(columns)
                .priority(priority)
                .visibility(true)
                .build();
    }

    public String generateCss(LayoutSettings layout) {
        Margins m = layout.getMargins();
        String margin = number(m.getTop()) + "in " + number(m.getRight()) + "in "
                + number(m.getBottom()) + "in " + number(m.getLeft()) + "in";
        String before = layout.getSectionSpacing().getBefore() + "pt";
        String after = layout.getSectionSpacing().getAfter() + "pt";
        int item = layout.getItemSpacing();
        String lineHeight = number(layout.getLineHeight());
        Alignment alignment = layout.getAlignment() != null ? layout.getAlignment() : Alignment.LEFT;

        StringBuilder css = new StringBuilder();
        css.append("/* Layout Styles */\n")
                .append(".resume-container {\n  margin: ").append(margin).append(";\n  line-height: ").append(lineHeight)
                .append(";\n  text-align: ").append(alignment.getCssValue()).append(";\n}\n\n")
                .append(".resume-section {\n  margin-top: ").append(before).append(";\n  margin-bottom: ").append(after).append(";\n}\n\n")
                .append(".resume-item {\n  margin-bottom: ").append(item).append("pt;\n}\n\n")
                .append(".section-title {\n  margin-bottom: ").append(Math.max(item - 2, 2)).append("pt;\n}\n\n")
                .append(".item-title {\n  margin-bottom: ").append(Math.max(item - 4, 1)).append("pt;\n}\n\n")
                .append(".contact-info {\n  margin-bottom: ").append(before).append(";\n}\n\n")
                .append(".two-column-layout {\n  display: flex;\n  gap: ").append(item * 2).append("pt;\n}\n\n")
                .append(".two-column-layout .sidebar {\n  flex: 0 0 35%;\n}\n\n")
                .append(".two-column-layout .main-content {\n  flex: 1;\n}\n\n")
                .append("@media print {\n")
                .append("  .resume-container {\n    margin: ").append(margin).append(";\n    line-height: ").append(lineHeight).append(";\n  }\n\n")
                .append("  .resume-section {\n    page-break-inside: avoid;\n    margin-top: ").append(before)
                .append(";\n    margin-bottom: ").append(after).append(";\n  }\n\n")
                .append("  .resume-item {\n    margin-bottom: ").append(item).append("pt;\n    page-break-inside: avoid;\n  }\n")
                .append("}");

        if (layout.getCustomSections() != null) {
            layout.getCustomSections().forEach((sectionId, adjustment) -> {
                css.append("\n\n.custom-section-").append(sectionId).append(" {\n");
                String spacing = adjustment.getSpacing() != null ? adjustment.getSpacing() + "pt" : null;
                css.append("  margin-top: ").append(spacing != null ? spacing : before).append(";\n");
                css.append("  margin-bottom: ").append(spacing != null ? spacing : after).append(";\n");
                if (adjustment.getAlignment() != null) {
                    css.append("  text-align: ").append(adjustment.getAlignment().getCssValue()).append(";\n");
                }
                if (adjustment.getWidth() != null) {
                    css.append("  width: ").append(adjustment.getWidth()).append(";\n");
                }
                css.append("}");
            });
        }
        return css.toString();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
