package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Font settings for one text role. Used both as a full value and as a partial override,
 * where {@code null} fields mean "keep the current value".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FontRoleSettings {
    private String fontFamily;
    private Integer fontWeight;
    /** Size in points keyed by role-specific size name (h1..h4, small/normal/large, base). */
    private Map<String, Double> fontSize;
    private Double lineHeight;
    private Double letterSpacing;

    public double size(String key) {
        if (fontSize == null) return 0;
        return fontSize.getOrDefault(key, 0.0);
    }

    /**
     * Overlays the non-null fields of {@code override}; size keys are merged one by one.
     */
    public FontRoleSettings merge(FontRoleSettings override) {
        FontRoleSettings merged = copy();
        if (override == null) return merged;
        if (override.fontFamily != null) merged.fontFamily = override.fontFamily;
        if (override.fontWeight != null) merged.fontWeight = override.fontWeight;
        if (override.fontSize != null) {
            Map<String, Double> sizes = merged.fontSize != null ? merged.fontSize : new LinkedHashMap<>();
            sizes.putAll(override.fontSize);
            merged.fontSize = sizes;
        }
        if (override.lineHeight != null) merged.lineHeight = override.lineHeight;
        if (override.letterSpacing != null) merged.letterSpacing = override.letterSpacing;
        return merged;
    }

    public FontRoleSettings copy() {
        return toBuilder()
                .fontSize(fontSize != null ? new LinkedHashMap<>(fontSize) : null)
                .build();
    }
}
