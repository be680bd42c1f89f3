package dev.catananti.resumeengine.dto;

/**
 * Caller-supplied change to one catalog section; {@code null} keeps the catalog value.
 */
public record SectionOverride(Boolean visible, Integer order) {

    public static SectionOverride visible(boolean visible) {
        return new SectionOverride(visible, null);
    }

    public static SectionOverride order(int order) {
        return new SectionOverride(null, order);
    }
}
