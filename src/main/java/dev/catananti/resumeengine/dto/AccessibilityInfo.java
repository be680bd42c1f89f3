package dev.catananti.resumeengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WCAG contrast report for a foreground/background pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessibilityInfo {
    private double contrastRatio;
    private boolean wcagAA;
    private boolean wcagAAA;
    private String recommendation;
}
