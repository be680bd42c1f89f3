package dev.catananti.resumeengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Serializable aggregate of one editing session's style choices.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateCustomization {
    private String id;
    private String templateId;
    private String name;
    private ColorScheme colorScheme;
    private TypographySettings typography;
    private LayoutSettings layout;
    private SectionVisibility sectionVisibility;
    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private Instant createdAt;
        private Instant updatedAt;
        private String version;
        /** Number of mutations applied since the engine was created. */
        private int changes;
    }
}
