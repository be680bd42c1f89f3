package dev.catananti.resumeengine.dto;

public enum ExperienceLevel {
    ENTRY,
    MID,
    SENIOR,
    EXECUTIVE;

    public static ExperienceLevel fromName(String name) {
        return valueOf(name.trim().toUpperCase());
    }
}
