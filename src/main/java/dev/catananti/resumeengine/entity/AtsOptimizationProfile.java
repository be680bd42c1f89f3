package dev.catananti.resumeengine.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the target applicant tracking systems tolerate for this template.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AtsOptimizationProfile {
    @Builder.Default
    private List<String> requiredSectionOrder = new ArrayList<>();
    /** Markup constructs the template must not emit, e.g. {@code table}, {@code img}. */
    @Builder.Default
    private List<String> prohibitedElements = new ArrayList<>();
    @Builder.Default
    private List<String> approvedFonts = new ArrayList<>();
    @Builder.Default
    private List<String> prohibitedFonts = new ArrayList<>();
    @Builder.Default
    private double minMargin = 0.5;
    @Builder.Default
    private double maxMargin = 1.0;
    private double targetKeywordDensity;
}
