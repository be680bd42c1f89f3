package dev.catananti.resumeengine.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural definition of a resume template. Read-only input to the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeTemplate {
    private String id;
    private String name;
    @Builder.Default
    private String version = "1.0";
    private TemplateLayout layout;
    private TemplateStyling styling;
    @Builder.Default
    private List<SectionDefinition> sections = new ArrayList<>();
    private AtsOptimizationProfile atsProfile;
    /** Preview image shown in galleries, or {@code null}. */
    private String thumbnailUrl;
}
