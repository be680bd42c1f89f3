package dev.catananti.resumeengine.dto;

/**
 * Curated heading/body/accent family triple.
 */
public record FontCombination(String name, String heading, String body, String accent, String description) {
}
