package dev.catananti.resumeengine.dto;

import java.util.Arrays;
import java.util.Optional;

public enum OutputFormat {
    HTML("html"),
    PREVIEW("preview"),
    PRINT("print");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<OutputFormat> fromValue(String value) {
        return Arrays.stream(values()).filter(format -> format.value.equalsIgnoreCase(value)).findFirst();
    }
}
