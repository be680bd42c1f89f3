package dev.catananti.resumeengine.dto;

public enum FontRole {
    HEADING,
    BODY,
    ACCENT,
    MONOSPACE
}
