package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Layout override for a single section.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SectionLayoutAdjustment {
    private String sectionId;
    private Integer spacing;
    private Alignment alignment;
    private String width;
    private Integer columns;
    private Integer priority;
    @Builder.Default
    private boolean visibility = true;
}
