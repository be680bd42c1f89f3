package dev.catananti.resumeengine.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One section slot of a template: its field schema and presentation defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionDefinition {
    private String id;
    private String name;
    private SectionType type;
    private boolean required;
    /**
     * Fields bound from each item (list sections) or from the section object.
     * Empty means the data is taken as is.
     */
    @Builder.Default
    private List<FieldDefinition> fields = new ArrayList<>();
    /** Sample text per field id, shown when a field has no data. */
    @Builder.Default
    private Map<String, String> placeholders = new LinkedHashMap<>();
    @Builder.Default
    private SectionLayout layout = new SectionLayout();
    /** Extra CSS declarations applied to the section, e.g. {@code border-top: 1px solid #e5e7eb}. */
    @Builder.Default
    private Map<String, String> styling = new LinkedHashMap<>();
}
