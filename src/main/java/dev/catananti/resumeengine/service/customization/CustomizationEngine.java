package dev.catananti.resumeengine.service.customization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.catananti.resumeengine.dto.ChangeType;
import dev.catananti.resumeengine.dto.ColorRole;
import dev.catananti.resumeengine.dto.ColorScheme;
import dev.catananti.resumeengine.dto.CustomizationAnalytics;
import dev.catananti.resumeengine.dto.CustomizationChange;
import dev.catananti.resumeengine.dto.ExperienceLevel;
import dev.catananti.resumeengine.dto.LayoutEfficiency;
import dev.catananti.resumeengine.dto.LayoutSettings;
import dev.catananti.resumeengine.dto.ReadabilityScore;
import dev.catananti.resumeengine.dto.SectionAnalytics;
import dev.catananti.resumeengine.dto.SectionVisibility;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import dev.catananti.resumeengine.dto.TypographySettings;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.exception.TemplateExportException;
import dev.catananti.resumeengine.exception.TemplateValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Customization state of one editing session.
 * <p>
 * Each mutating call validates through the owning module, applies the change, records it in a
 * bounded history and notifies listeners synchronously in subscription order.
 * Instances are single-writer: callers serialize access themselves.
 * </p>
 */
@Slf4j
public class CustomizationEngine {

    static final String VERSION = "1.0";
    static final int ESTIMATED_CONTENT_LENGTH = 500;
    private static final int MAX_RECOMMENDATIONS = 5;

    private final ResumeTemplate baseTemplate;
    private final ColorThemeService colorThemeService;
    private final TypographyService typographyService;
    private final LayoutService layoutService;
    private final SectionVisibilityService sectionVisibilityService;
    private final StylesheetGenerator stylesheetGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final String customizationId;
    private final Instant createdAt;
    private final ChangeHistory history = new ChangeHistory();
    private final Set<CustomizationListener> listeners = new LinkedHashSet<>();

    private ColorScheme colorScheme;
    private TypographySettings typography;
    private LayoutSettings layout;
    private SectionVisibility sectionVisibility;
    private Instant updatedAt;
    private int mutationCount;

    public CustomizationEngine(ResumeTemplate baseTemplate,
                               ColorThemeService colorThemeService,
                               TypographyService typographyService,
                               LayoutService layoutService,
                               SectionVisibilityService sectionVisibilityService,
                               StylesheetGenerator stylesheetGenerator,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.baseTemplate = baseTemplate;
        this.colorThemeService = colorThemeService;
        this.typographyService = typographyService;
        this.layoutService = layoutService;
        this.sectionVisibilityService = sectionVisibilityService;
        this.stylesheetGenerator = stylesheetGenerator;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.customizationId = "custom-" + UUID.randomUUID();
        this.createdAt = Instant.now(clock);
        this.updatedAt = createdAt;
        applyDefaults();
    }

    public TemplateCustomization getCurrentCustomization() {
        return TemplateCustomization.builder()
                .id(customizationId)
                .templateId(baseTemplate.getId())
                .name("Custom Resume")
                .colorScheme(colorScheme.copy())
                .typography(typography.copy())
                .layout(layout.copy())
                .sectionVisibility(sectionVisibility.copy())
                .metadata(TemplateCustomization.Metadata.builder()
                        .createdAt(createdAt)
                        .updatedAt(updatedAt)
                        .version(VERSION)
                        .changes(mutationCount)
                        .build())
                .build();
    }

    public void applyColorTheme(String themeId) {
        ColorScheme theme = colorThemeService.getPredefinedTheme(themeId)
                .orElseThrow(() -> new TemplateValidationException("Color theme '" + themeId + "' not found",
                        Map.of("themeId", String.valueOf(themeId))));
        ColorScheme previous = colorScheme.copy();
        colorScheme = colorThemeService.optimizeForAts(theme);
        commit(ChangeType.COLOR, "theme", previous, colorScheme.copy(), Map.of("themeId", themeId));
    }

    /**
     * Replaces one color role, then re-optimizes the whole scheme.
     *
     * @throws TemplateValidationException if the color is not ATS-safe
     */
    public void customizeColor(ColorRole role, String color) {
        if (!colorThemeService.isAtsSafe(color)) {
            throw new TemplateValidationException("Color '" + color + "' is not ATS-safe",
                    Map.of("color", String.valueOf(color), "property", role.getKey()));
        }
        ColorScheme previous = colorScheme.copy();
        colorScheme = colorThemeService.optimizeForAts(colorScheme.with(role, color));
        commit(ChangeType.COLOR, role.getKey(), previous, colorScheme.copy(), null);
    }

    public void applyFontCombination(String combinationName) {
        TypographySettings combination = typographyService.applyProfessionalCombination(combinationName);
        TypographySettings previous = typography.copy();
        typography = combination;
        commit(ChangeType.TYPOGRAPHY, "combination", previous, typography.copy(), Map.of("combination", combinationName));
    }

    public void customizeTypography(TypographySettings overrides) {
        TypographySettings previous = typography.copy();
        typography = typographyService.merge(typography, overrides);
        commit(ChangeType.TYPOGRAPHY, "settings", previous, typography.copy(), null);
    }

    public void applyLayoutPreset(String presetId) {
        LayoutSettings preset = layoutService.getPredefinedLayout(presetId)
                .orElseThrow(() -> new TemplateValidationException("Layout preset '" + presetId + "' not found",
                        Map.of("presetId", String.valueOf(presetId))));
        LayoutSettings previous = layout.copy();
        layout = layoutService.optimizeForAts(preset);
        commit(ChangeType.LAYOUT, "preset", previous, layout.copy(), Map.of("presetId", presetId));
    }

    public void customizeLayout(LayoutSettings overrides) {
        LayoutSettings previous = layout.copy();
        layout = layoutService.createCustomLayout(layout.merge(overrides));
        commit(ChangeType.LAYOUT, "settings", previous, layout.copy(), null);
    }

    public void toggleSection(String sectionId) {
        SectionVisibility updated = sectionVisibilityService.toggleSection(sectionId, sectionVisibility);
        SectionVisibility previous = sectionVisibility;
        sectionVisibility = updated;
        commit(ChangeType.SECTION, "visibility-" + sectionId, previous.copy(), updated.copy(), null);
    }

    public void reorderSections(List<String> sectionIds) {
        SectionVisibility updated = sectionVisibilityService.reorderSections(sectionIds, sectionVisibility);
        SectionVisibility previous = sectionVisibility;
        sectionVisibility = updated;
        commit(ChangeType.SECTION, "order", previous.copy(), updated.copy(), null);
    }

    /**
     * Role picks the visible sections; industry and experience level, when given,
     * adjust typography and layout.
     */
    public void applyRoleCustomization(String role, String industry, ExperienceLevel experienceLevel) {
        TemplateCustomization previous = getCurrentCustomization();

        sectionVisibility = sectionVisibilityService.optimizeForAts(sectionVisibilityService.getRoleSpecificSections(role));
        if (industry != null) {
            typography = typographyService.merge(typography, typographyService.getIndustryRecommendations(industry));
        }
        if (experienceLevel != null) {
            layout = layoutService.createCustomLayout(
                    layout.merge(layoutService.getExperienceBasedRecommendations(experienceLevel)));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("role", role);
        if (industry != null) metadata.put("industry", industry);
        if (experienceLevel != null) metadata.put("experienceLevel", experienceLevel.name().toLowerCase());
        commit(ChangeType.ROLE, "customization", previous, null, metadata);
    }

    /**
     * Restores the seeded defaults and starts a fresh history holding only the reset record.
     */
    public void resetToDefaults() {
        TemplateCustomization previous = getCurrentCustomization();
        applyDefaults();
        history.clear();
        commit(ChangeType.RESET, "all", previous, null, null);
    }

    /**
     * Replaces the four customization fields with those of an exported snapshot.
     * Unsafe or missing colors fall back to the default theme before ATS optimization; layout is
     * re-optimized, typography re-validated and sections normalized.
     *
     * @throws TemplateValidationException if the JSON is malformed or a core field is missing
     */
    public void importCustomization(String customizationJson) {
        JsonNode imported;
        try {
            imported = objectMapper.readTree(customizationJson);
        } catch (JsonProcessingException e) {
            throw new TemplateValidationException("Failed to import customization",
                    baseTemplate.getId(), null, Map.of("error", e.getOriginalMessage()), e);
        }

        List<String> missing = new ArrayList<>();
        for (String field : List.of("colorScheme", "typography", "layout", "sectionVisibility")) {
            if (imported == null || !imported.hasNonNull(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new TemplateValidationException("Invalid customization format",
                    Map.of("missingFields", missing));
        }

        ColorScheme importedColors;
        TypographySettings importedTypography;
        LayoutSettings importedLayout;
        SectionVisibility importedSections;
        try {
            importedColors = objectMapper.treeToValue(imported.get("colorScheme"), ColorScheme.class);
            importedTypography = objectMapper.treeToValue(imported.get("typography"), TypographySettings.class);
            importedLayout = objectMapper.treeToValue(imported.get("layout"), LayoutSettings.class);
            importedSections = objectMapper.treeToValue(imported.get("sectionVisibility"), SectionVisibility.class);
        } catch (JsonProcessingException e) {
            throw new TemplateValidationException("Failed to import customization",
                    baseTemplate.getId(), null, Map.of("error", e.getOriginalMessage()), e);
        }

        SectionVisibility normalizedSections = sectionVisibilityService.normalize(importedSections);
        TemplateCustomization previous = getCurrentCustomization();

        colorScheme = colorThemeService.optimizeForAts(colorThemeService.replaceUnsafeRoles(importedColors));
        typography = typographyService.createCustomTypography(importedTypography);
        layout = layoutService.optimizeForAts(layoutService.createCustomLayout(importedLayout));
        sectionVisibility = normalizedSections;
        commit(ChangeType.IMPORT, "customization", previous, null, null);
    }

    /**
     * Reverts the most recent change.
     *
     * @return {@code false} when there is nothing to undo or the last change was a reset
     *         (which clears the history instead)
     */
    public boolean undoLastChange() {
        var last = history.pop();
        if (last.isEmpty()) {
            return false;
        }
        CustomizationChange change = last.get();
        switch (change.type()) {
            case COLOR -> colorScheme = ((ColorScheme) change.previousValue()).copy();
            case TYPOGRAPHY -> typography = ((TypographySettings) change.previousValue()).copy();
            case LAYOUT -> layout = ((LayoutSettings) change.previousValue()).copy();
            case SECTION -> sectionVisibility = ((SectionVisibility) change.previousValue()).copy();
            case ROLE, IMPORT -> restore((TemplateCustomization) change.previousValue());
            case RESET -> {
                history.clear();
                log.debug("Reset cannot be undone; history cleared");
                return false;
            }
        }
        mutationCount++;
        updatedAt = Instant.now(clock);
        log.debug("Undid {} change on '{}'", change.type().getValue(), change.property());
        notifyListeners();
        return true;
    }

    public CustomizationAnalytics getAnalytics() {
        return getAnalytics(Map.of());
    }

    /**
     * Scores the current state against the given section content.
     */
    public CustomizationAnalytics getAnalytics(Map<String, JsonNode> content) {
        ReadabilityScore readability = typographyService.calculateReadabilityScore(typography);
        LayoutEfficiency efficiency = layoutService.calculateLayoutEfficiency(layout, ESTIMATED_CONTENT_LENGTH);
        SectionAnalytics sections = sectionVisibilityService.getSectionAnalytics(sectionVisibility, content);

        double atsScore = 100
                - Math.max(0, 100 - readability.getScore()) * 0.3
                - Math.max(0, 100 - efficiency.getAtsCompliance()) * 0.4
                - Math.max(0, 100 - sections.getAtsScore()) * 0.3;
        int overall = (int) Math.round(readability.getScore() * 0.3
                + efficiency.getScore() * 0.3
                + sections.getContentCompleteness() * 0.4);

        List<String> recommendations = new ArrayList<>();
        recommendations.addAll(readability.getRecommendations());
        recommendations.addAll(efficiency.getRecommendations());
        recommendations.addAll(sections.getRecommendations());

        List<String> strengths = new ArrayList<>();
        if (readability.getScore() >= 85) strengths.add("Excellent typography for readability");
        if (efficiency.getScore() >= 85) strengths.add("Well-optimized layout");
        if (sections.getContentCompleteness() >= 80) strengths.add("Comprehensive content coverage");
        if (atsScore >= 90) strengths.add("ATS-optimized formatting");

        List<String> warnings = new ArrayList<>();
        if (readability.getScore() < 70) warnings.add("Typography may need improvement for ATS systems");
        if (efficiency.getScore() < 70) warnings.add("Layout may not be optimal for ATS parsing");
        if (sections.getContentCompleteness() < 60) warnings.add("Consider adding more content sections");

        return CustomizationAnalytics.builder()
                .overallScore(overall)
                .atsScore((int) Math.round(atsScore))
                .readabilityScore(readability.getScore())
                .designScore(efficiency.getScore())
                .recommendations(recommendations.stream().limit(MAX_RECOMMENDATIONS).toList())
                .strengths(strengths)
                .warnings(warnings)
                .build();
    }

    /**
     * Current snapshot plus change history and base template id, as pretty-printed JSON.
     */
    public String exportCustomization() {
        ObjectNode export = objectMapper.valueToTree(getCurrentCustomization());
        export.set("changeHistory", objectMapper.valueToTree(history.toList()));
        export.put("baseTemplate", baseTemplate.getId());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new TemplateExportException("Failed to export customization", baseTemplate.getId(), null, e);
        }
    }

    public String generateCss() {
        return stylesheetGenerator.generate(getCurrentCustomization());
    }

    public void addListener(CustomizationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CustomizationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Oldest first.
     */
    public List<CustomizationChange> getChangeHistory() {
        return history.toList();
    }

    public ResumeTemplate getBaseTemplate() {
        return baseTemplate;
    }

    private void applyDefaults() {
        colorScheme = colorThemeService.getPredefinedTheme(ColorThemeService.DEFAULT_THEME).orElseThrow();
        typography = typographyService.defaultTypography();
        layout = layoutService.defaultLayout();
        sectionVisibility = sectionVisibilityService.createCustomVisibility(Map.of());
    }

    private void restore(TemplateCustomization snapshot) {
        colorScheme = snapshot.getColorScheme().copy();
        typography = snapshot.getTypography().copy();
        layout = snapshot.getLayout().copy();
        sectionVisibility = snapshot.getSectionVisibility().copy();
    }

    /**
     * Records the change and notifies listeners. A {@code null} new value means "the whole current snapshot".
     */
    private void commit(ChangeType type, String property, Object previousValue, Object newValue,
                        Map<String, Object> metadata) {
        mutationCount++;
        updatedAt = Instant.now(clock);
        Object recordedNew = newValue != null ? newValue : getCurrentCustomization();
        history.push(new CustomizationChange(type, property, previousValue, recordedNew, updatedAt, metadata));
        log.debug("Applied {} change on '{}' ({} in history)", type.getValue(), property, history.size());
        notifyListeners();
    }

    private void notifyListeners() {
        if (listeners.isEmpty()) {
            return;
        }
        TemplateCustomization snapshot = getCurrentCustomization();
        for (CustomizationListener listener : List.copyOf(listeners)) {
            try {
                listener.onCustomizationChanged(snapshot);
            } catch (RuntimeException e) {
                log.warn("Customization listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }
}
