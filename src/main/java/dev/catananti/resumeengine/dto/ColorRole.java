package dev.catananti.resumeengine.dto;

import java.util.Arrays;

/**
 * Semantic color slots of a {@link ColorScheme}.
 */
public enum ColorRole {
    PRIMARY("primary"),
    SECONDARY("secondary"),
    ACCENT("accent"),
    BACKGROUND("background"),
    TEXT("text"),
    MUTED("muted"),
    BORDER("border"),
    HIGHLIGHT("highlight"),
    LINK("link");

    private final String key;

    ColorRole(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static ColorRole fromKey(String key) {
        return Arrays.stream(values())
                .filter(role -> role.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown color role: " + key));
    }
}
