package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Section catalog state keyed by section id, in catalog order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SectionVisibility {
    private Map<String, SectionConfig> sections = new LinkedHashMap<>();

    public SectionConfig get(String id) {
        return sections.get(id);
    }

    public boolean contains(String id) {
        return sections.containsKey(id);
    }

    /**
     * Sections sorted by order; ties keep catalog order.
     */
    @JsonIgnore
    public List<SectionConfig> getOrdered() {
        return sections.values().stream()
                .sorted(Comparator.comparingInt(SectionConfig::getOrder))
                .toList();
    }

    @JsonIgnore
    public List<SectionConfig> getVisibleOrdered() {
        return getOrdered().stream().filter(SectionConfig::isVisible).toList();
    }

    public SectionVisibility copy() {
        Map<String, SectionConfig> copy = new LinkedHashMap<>();
        sections.forEach((id, config) -> copy.put(id, config.copy()));
        return new SectionVisibility(copy);
    }
}
