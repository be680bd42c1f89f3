package dev.catananti.resumeengine.dto;

/**
 * Allow-listed font with its CSS fallback stack and a 0–100 readability rating.
 */
public record FontInfo(String name, String stack, FontCategory category, int readability) {
}
