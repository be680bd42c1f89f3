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
public class LayoutEfficiency {
    private int score;
    private int readabilityScore;
    private int densityScore;
    private int atsCompliance;
    private List<String> recommendations;
}
