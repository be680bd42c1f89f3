package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    @JsonValue
    public String getCssValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Alignment fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
