package dev.catananti.resumeengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Visibility and ordering of one resume section.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SectionConfig {
    private String id;
    private String name;
    private boolean visible;
    private boolean required;
    private int priority;
    /** 1-based position, unique among visible sections. */
    private int order;
    private Integer minItems;
    private Integer maxItems;
    private String description;

    public SectionConfig copy() {
        return toBuilder().build();
    }
}
