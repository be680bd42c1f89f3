package dev.catananti.resumeengine.dto;

public enum FontCategory {
    SERIF("serif"),
    SANS_SERIF("sans-serif"),
    MONOSPACE("monospace");

    private final String cssName;

    FontCategory(String cssName) {
        this.cssName = cssName;
    }

    public String getCssName() {
        return cssName;
    }
}
