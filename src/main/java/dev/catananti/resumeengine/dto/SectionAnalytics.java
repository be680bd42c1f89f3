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
public class SectionAnalytics {
    private int totalSections;
    private int visibleSections;
    private int requiredSections;
    private int optionalSections;
    /** 0–100. */
    private int contentCompleteness;
    /** 0–100. */
    private int atsScore;
    private List<String> recommendations;
}
