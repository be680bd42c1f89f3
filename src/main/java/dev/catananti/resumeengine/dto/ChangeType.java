package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeType {
    COLOR,
    TYPOGRAPHY,
    LAYOUT,
    SECTION,
    ROLE,
    RESET,
    IMPORT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
