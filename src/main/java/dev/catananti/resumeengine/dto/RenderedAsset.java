package dev.catananti.resumeengine.dto;

public record RenderedAsset(String type, String url, String name) {
}
