package dev.catananti.resumeengine.dto;

import java.util.List;

public record RenderedContent(String html, String css, String javascript, List<RenderedAsset> assets) {
}
