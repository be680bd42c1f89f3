package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Named palette; every role holds a {@code #rrggbb} color.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ColorScheme {
    private String name;
    private String primary;
    private String secondary;
    private String accent;
    private String background;
    private String text;
    private String muted;
    private String border;
    private String highlight;
    private String link;

    public String get(ColorRole role) {
        return switch (role) {
            case PRIMARY -> primary;
            case SECONDARY -> secondary;
            case ACCENT -> accent;
            case BACKGROUND -> background;
            case TEXT -> text;
            case MUTED -> muted;
            case BORDER -> border;
            case HIGHLIGHT -> highlight;
            case LINK -> link;
        };
    }

    /**
     * Returns a copy with one role replaced.
     */
    public ColorScheme with(ColorRole role, String color) {
        ColorScheme copy = copy();
        switch (role) {
            case PRIMARY -> copy.setPrimary(color);
            case SECONDARY -> copy.setSecondary(color);
            case ACCENT -> copy.setAccent(color);
            case BACKGROUND -> copy.setBackground(color);
            case TEXT -> copy.setText(color);
            case MUTED -> copy.setMuted(color);
            case BORDER -> copy.setBorder(color);
            case HIGHLIGHT -> copy.setHighlight(color);
            case LINK -> copy.setLink(color);
        }
        return copy;
    }

    @JsonIgnore
    public Map<ColorRole, String> asMap() {
        Map<ColorRole, String> colors = new EnumMap<>(ColorRole.class);
        for (ColorRole role : ColorRole.values()) {
            colors.put(role, get(role));
        }
        return colors;
    }

    public ColorScheme copy() {
        return toBuilder().build();
    }
}
