package dev.catananti.resumeengine.dto;

public record RenderingWarning(String stage, String code, String message, String impact) {
}
