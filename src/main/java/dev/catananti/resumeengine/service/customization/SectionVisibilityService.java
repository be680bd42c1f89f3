package dev.catananti.resumeengine.service.customization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.catananti.resumeengine.dto.SectionAnalytics;
import dev.catananti.resumeengine.dto.SectionConfig;
import dev.catananti.resumeengine.dto.SectionOverride;
import dev.catananti.resumeengine.dto.SectionValidationResult;
import dev.catananti.resumeengine.dto.SectionVisibility;
import dev.catananti.resumeengine.exception.TemplateValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which resume sections are shown and in what order.
 * <p>
 * Every operation returns a new {@link SectionVisibility}; inputs are never modified.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SectionVisibilityService {

    static final List<String> ATS_ORDER = List.of(
            "contact", "summary", "experience", "education", "skills", "certifications",
            "projects", "awards", "publications", "languages", "volunteer", "references");

    private static final List<String> IDEAL_PREFIX = List.of("contact", "summary", "experience", "education", "skills");
    private static final Set<String> ATS_KEY_SECTIONS = Set.of("contact", "experience", "education", "skills");

    private static final Map<String, SectionConfig> DEFAULT_SECTIONS = new LinkedHashMap<>();
    private static final Map<String, List<String>> ROLE_SECTIONS = new LinkedHashMap<>();

    static {
        section("contact", "Contact Information", true, true, 1, 1, 1,
                "Essential contact details for the employer to reach you");
        section("summary", "Professional Summary", true, false, 2, 1, 1,
                "Brief overview of your professional background and goals");
        section("experience", "Work Experience", true, true, 3, 1, 10,
                "Professional work history and achievements");
        section("education", "Education", true, false, 4, 1, 5,
                "Academic qualifications and certifications");
        section("skills", "Skills", true, false, 5, 1, 20,
                "Technical and professional skills");
        section("projects", "Projects", false, false, 6, 1, 10,
                "Notable projects and achievements");
        section("certifications", "Certifications", false, false, 7, 1, 10,
                "Professional certifications and licenses");
        section("awards", "Awards & Honors", false, false, 8, 1, 10,
                "Professional awards and recognition");
        section("publications", "Publications", false, false, 9, 1, 10,
                "Academic and professional publications");
        section("languages", "Languages", false, false, 10, 1, 10,
                "Language proficiency");
        section("volunteer", "Volunteer Experience", false, false, 11, 1, 10,
                "Volunteer work and community involvement");
        section("references", "References", false, false, 12, 0, 5,
                "Professional references");

        ROLE_SECTIONS.put("software-engineer", List.of("projects", "skills", "certifications"));
        ROLE_SECTIONS.put("designer", List.of("projects", "skills", "awards"));
        ROLE_SECTIONS.put("manager", List.of("summary", "skills", "awards", "certifications"));
        ROLE_SECTIONS.put("consultant", List.of("summary", "skills", "certifications", "publications"));
        ROLE_SECTIONS.put("academic", List.of("publications", "awards", "certifications"));
        ROLE_SECTIONS.put("healthcare", List.of("certifications", "skills", "education"));
        ROLE_SECTIONS.put("finance", List.of("certifications", "skills", "education"));
        ROLE_SECTIONS.put("sales", List.of("awards", "skills", "summary"));
        ROLE_SECTIONS.put("marketing", List.of("projects", "skills", "awards"));
        ROLE_SECTIONS.put("entry-level", List.of("education", "skills", "projects", "volunteer"));
    }

    private static void section(String id, String name, boolean visible, boolean required, int priority,
                                int minItems, int maxItems, String description) {
        DEFAULT_SECTIONS.put(id, SectionConfig.builder()
                .id(id)
                .name(name)
                .visible(visible)
                .required(required)
                .priority(priority)
                .order(priority)
                .minItems(minItems)
                .maxItems(maxItems)
                .description(description)
                .build());
    }

    private final ObjectMapper objectMapper;

    public SectionVisibility getDefaultSections() {
        return new SectionVisibility(new LinkedHashMap<>(DEFAULT_SECTIONS)).copy();
    }

    /**
     * Default catalog with required sections plus the role's recommended sections visible.
     */
    public SectionVisibility getRoleSpecificSections(String role) {
        List<String> recommended = role == null ? List.of() : ROLE_SECTIONS.getOrDefault(role.toLowerCase(), List.of());
        SectionVisibility visibility = getDefaultSections();
        visibility.getSections().values()
                .forEach(config -> config.setVisible(config.isRequired() || recommended.contains(config.getId())));
        return visibility;
    }

    /**
     * Applies visible/order overrides onto the default catalog.
     *
     * @throws TemplateValidationException if a required section would be hidden
     */
    public SectionVisibility createCustomVisibility(Map<String, SectionOverride> overrides) {
        SectionVisibility visibility = getDefaultSections();
        overrides.forEach((id, override) -> {
            SectionConfig config = visibility.get(id);
            if (config == null || override == null) {
                return;
            }
            if (override.visible() != null) config.setVisible(override.visible());
            if (override.order() != null) config.setOrder(override.order());
        });
        return normalize(visibility);
    }

    /**
     * Rejects hidden required sections and repairs duplicate orders among visible sections
     * by renumbering them 1..N in their current sort sequence.
     */
    public SectionVisibility normalize(SectionVisibility visibility) {
        SectionVisibility normalized = visibility.copy();
        List<String> hiddenRequired = normalized.getSections().values().stream()
                .filter(config -> config.isRequired() && !config.isVisible())
                .map(SectionConfig::getId)
                .toList();
        if (!hiddenRequired.isEmpty()) {
            throw new TemplateValidationException(
                    "Required sections cannot be hidden: " + String.join(", ", hiddenRequired),
                    Map.of("missingRequired", hiddenRequired));
        }

        List<SectionConfig> visible = normalized.getVisibleOrdered();
        Set<Integer> orders = new HashSet<>();
        boolean duplicates = visible.stream().anyMatch(config -> !orders.add(config.getOrder()));
        if (duplicates) {
            int order = 1;
            for (SectionConfig config : visible) {
                config.setOrder(order++);
            }
        }
        return normalized;
    }

    /**
     * @throws TemplateValidationException if the section is unknown, or required and currently visible
     */
    public SectionVisibility toggleSection(String sectionId, SectionVisibility current) {
        SectionConfig section = current.get(sectionId);
        if (section == null) {
            throw new TemplateValidationException("Section '" + sectionId + "' not found", Map.of("sectionId", sectionId));
        }
        if (section.isRequired() && section.isVisible()) {
            throw new TemplateValidationException("Required section '" + section.getName() + "' cannot be hidden",
                    Map.of("sectionId", sectionId));
        }
        SectionVisibility updated = current.copy();
        updated.get(sectionId).setVisible(!section.isVisible());
        return updated;
    }

    /**
     * Visible sections always hold orders 1..N and hidden ones the numbers after them. Within each
     * group the listed sections come first in the given sequence, the rest follow in their existing
     * relative order.
     *
     * @throws TemplateValidationException if any listed id is unknown
     */
    public SectionVisibility reorderSections(List<String> sectionIds, SectionVisibility current) {
        List<String> missing = sectionIds.stream().filter(id -> !current.contains(id)).toList();
        if (!missing.isEmpty()) {
            throw new TemplateValidationException("Sections not found: " + String.join(", ", missing),
                    Map.of("missingSections", missing));
        }

        SectionVisibility updated = current.copy();
        List<SectionConfig> sequence = new ArrayList<>();
        for (String id : new LinkedHashSet<>(sectionIds)) {
            sequence.add(updated.get(id));
        }
        updated.getOrdered().stream()
                .filter(config -> !sectionIds.contains(config.getId()))
                .forEach(sequence::add);

        int order = 1;
        for (SectionConfig config : sequence) {
            if (config.isVisible()) {
                config.setOrder(order++);
            }
        }
        for (SectionConfig config : sequence) {
            if (!config.isVisible()) {
                config.setOrder(order++);
            }
        }
        return updated;
    }

    public List<SectionConfig> getVisibleSections(SectionVisibility visibility) {
        return visibility.getVisibleOrdered();
    }

    public SectionValidationResult validateSectionContent(String sectionId, JsonNode content, SectionVisibility visibility) {
        SectionConfig section = visibility.get(sectionId);
        if (section == null) {
            return new SectionValidationResult(false, List.of("Section '" + sectionId + "' not found"), List.of());
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean present = content != null && !content.isNull() && !content.isMissingNode();

        if (section.isVisible()) {
            if (!present || isEmpty(content)) {
                errors.add("Visible section '" + section.getName() + "' has no content");
            }
            if (present && content.isArray()) {
                if (section.getMinItems() != null && content.size() < section.getMinItems()) {
                    errors.add("Section '" + section.getName() + "' requires at least " + section.getMinItems() + " items");
                }
                if (section.getMaxItems() != null && content.size() > section.getMaxItems()) {
                    warnings.add("Section '" + section.getName() + "' has more than " + section.getMaxItems()
                            + " items, consider reducing");
                }
            }
            if (present) {
                validateStructure(sectionId, content, errors, warnings);
            }
        }

        return new SectionValidationResult(errors.isEmpty(), errors, warnings);
    }

    private void validateStructure(String sectionId, JsonNode content, List<String> errors, List<String> warnings) {
        switch (sectionId) {
            case "contact" -> {
                if (content.isObject()) {
                    for (String field : List.of("name", "email", "phone")) {
                        if (isBlank(content.get(field))) {
                            errors.add("Contact information missing required field: " + field);
                        }
                    }
                }
            }
            case "experience" -> {
                if (content.isArray()) {
                    for (int i = 0; i < content.size(); i++) {
                        JsonNode item = content.get(i);
                        if (isBlank(item.get("title")) || isBlank(item.get("company"))) {
                            errors.add("Experience item " + (i + 1) + " missing title or company");
                        }
                        if (isBlank(item.get("startDate"))) {
                            warnings.add("Experience item " + (i + 1) + " missing start date");
                        }
                    }
                }
            }
            case "education" -> {
                if (content.isArray()) {
                    for (int i = 0; i < content.size(); i++) {
                        JsonNode item = content.get(i);
                        if (isBlank(item.get("institution")) || isBlank(item.get("degree"))) {
                            errors.add("Education item " + (i + 1) + " missing institution or degree");
                        }
                    }
                }
            }
            case "skills" -> {
                if (content.isArray() && content.size() < 3) {
                    warnings.add("Consider adding more skills to showcase your abilities");
                }
            }
            default -> {
                // no structural rules
            }
        }
    }

    /**
     * Puts sections into the canonical ATS sequence and makes the key sections visible.
     * Sections outside the canonical list keep their relative order after it.
     */
    public SectionVisibility optimizeForAts(SectionVisibility visibility) {
        SectionVisibility optimized = visibility.copy();
        List<SectionConfig> others = optimized.getOrdered().stream()
                .filter(config -> !ATS_ORDER.contains(config.getId()))
                .toList();

        int order = 1;
        for (String id : ATS_ORDER) {
            SectionConfig config = optimized.get(id);
            if (config != null) {
                config.setOrder(order++);
                if (ATS_KEY_SECTIONS.contains(id)) {
                    config.setVisible(true);
                }
            }
        }
        for (SectionConfig config : others) {
            config.setOrder(order++);
        }
        return optimized;
    }

    public SectionAnalytics getSectionAnalytics(SectionVisibility visibility, Map<String, JsonNode> content) {
        List<SectionConfig> all = new ArrayList<>(visibility.getSections().values());
        List<SectionConfig> visible = visibility.getVisibleOrdered();
        long required = all.stream().filter(SectionConfig::isRequired).count();
        long visibleRequired = visible.stream().filter(SectionConfig::isRequired).count();

        double contentScore = 0;
        for (SectionConfig section : visible) {
            JsonNode sectionContent = content.get(section.getId());
            if (sectionContent == null || sectionContent.isNull() || isEmpty(sectionContent)) {
                continue;
            }
            if (sectionContent.isArray()) {
                int minItems = section.getMinItems() != null ? section.getMinItems() : 0;
                contentScore += minItems == 0 ? 10 : Math.min(10, (double) sectionContent.size() / minItems * 10);
            } else {
                contentScore += 5;
            }
        }
        int maxContentScore = all.size() * 10;
        int completeness = maxContentScore == 0 ? 0 : (int) Math.round(contentScore / maxContentScore * 100);

        double requiredScore = required == 0 ? 40 : (double) visibleRequired / required * 40;
        double orderScore = calculateSectionOrderScore(visible) * 30;
        int atsScore = (int) Math.round(requiredScore + orderScore + completeness * 0.3);

        List<String> recommendations = new ArrayList<>();
        if (visibleRequired < required) {
            recommendations.add("Ensure all required sections are visible");
        }
        if (completeness < 80) {
            recommendations.add("Add more content to improve completeness");
        }
        if (visible.size() < 5) {
            recommendations.add("Consider showing more sections to showcase your qualifications");
        }
        if (visible.size() > 8) {
            recommendations.add("Consider hiding some sections to maintain focus");
        }

        return SectionAnalytics.builder()
                .totalSections(all.size())
                .visibleSections(visible.size())
                .requiredSections((int) required)
                .optionalSections(all.size() - (int) required)
                .contentCompleteness(completeness)
                .atsScore(atsScore)
                .recommendations(recommendations)
                .build();
    }

    /**
     * Fraction (0–1) of how closely the visible sections follow the ideal opening sequence.
     * Each ideal section is worth 20 points, less 5 per position away from its ideal slot.
     */
    double calculateSectionOrderScore(List<SectionConfig> visibleSections) {
        double score = 0;
        for (int i = 0; i < IDEAL_PREFIX.size(); i++) {
            String id = IDEAL_PREFIX.get(i);
            int idealOrder = i + 1;
            score += visibleSections.stream()
                    .filter(config -> config.getId().equals(id))
                    .findFirst()
                    .map(config -> Math.max(0, 20 - Math.abs(config.getOrder() - idealOrder) * 5))
                    .orElse(0);
        }
        return score / (IDEAL_PREFIX.size() * 20);
    }

    public String exportConfiguration(SectionVisibility visibility) {
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("version", "1.0");
        export.put("timestamp", Instant.now().toString());
        export.put("sections", visibility.getSections());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new TemplateValidationException("Failed to export section configuration",
                    null, null, Map.of("error", e.getOriginalMessage()), e);
        }
    }

    public SectionVisibility importConfiguration(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TemplateValidationException("Failed to parse configuration",
                    null, null, Map.of("error", e.getOriginalMessage()), e);
        }
        JsonNode sections = root == null ? null : root.get("sections");
        if (sections == null || !sections.isObject()) {
            throw new TemplateValidationException("Invalid configuration format");
        }

        Map<String, SectionOverride> overrides = new LinkedHashMap<>();
        ((ObjectNode) sections).fields().forEachRemaining(entry -> {
            JsonNode node = entry.getValue();
            Boolean visible = node.hasNonNull("visible") ? node.get("visible").asBoolean() : null;
            Integer order = node.hasNonNull("order") ? node.get("order").asInt() : null;
            overrides.put(entry.getKey(), new SectionOverride(visible, order));
        });
        log.debug("Importing section configuration with {} entries", overrides.size());
        return createCustomVisibility(overrides);
    }

    private static boolean isEmpty(JsonNode node) {
        if (node.isArray() || node.isObject()) {
            return node.isEmpty();
        }
        return node.isTextual() && node.asText().isBlank();
    }

    private static boolean isBlank(JsonNode node) {
        return node == null || node.isNull() || node.asText("").isBlank() && !node.isContainerNode();
    }
}
