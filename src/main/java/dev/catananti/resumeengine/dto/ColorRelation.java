package dev.catananti.resumeengine.dto;

import java.util.Arrays;

/**
 * Hue relationships used to derive harmonious palettes.
 */
public enum ColorRelation {
    ANALOGOUS(30),
    COMPLEMENTARY(180),
    TRIADIC(120),
    SPLIT_COMPLEMENTARY(150),
    TETRADIC(90);

    private final int hueOffset;

    ColorRelation(int hueOffset) {
        this.hueOffset = hueOffset;
    }

    public int getHueOffset() {
        return hueOffset;
    }

    /**
     * Accepts {@code split-complementary}, {@code split_complementary} or the constant name.
     */
    public static ColorRelation fromName(String name) {
        String normalized = name == null ? "" : name.trim().replace('-', '_');
        return Arrays.stream(values())
                .filter(relation -> relation.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown color relation: " + name));
    }
}
