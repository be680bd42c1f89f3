package dev.catananti.resumeengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomizationAnalytics {
    private int overallScore;
    private int atsScore;
    private int readabilityScore;
    private int designScore;
    /** At most five entries. */
    private List<String> recommendations;
    private List<String> strengths;
    private List<String> warnings;
}
