package dev.catananti.resumeengine.service.rendering;

import com.fasterxml.jackson.databind.JsonNode;
import dev.catananti.resumeengine.entity.SectionLayout;
import dev.catananti.resumeengine.entity.SectionType;

import java.util.Map;

/**
 * A template section with its bound data, ready for markup generation.
 */
public record ProcessedSection(
        String id,
        String name,
        SectionType type,
        JsonNode data,
        SectionLayout layout,
        Map<String, String> styling,
        boolean visible,
        int order
) {
}
