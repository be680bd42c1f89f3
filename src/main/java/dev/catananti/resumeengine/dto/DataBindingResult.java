package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Outcome of mapping resume records onto template sections.
 *
 * @param data bound content keyed by section id
 */
public record DataBindingResult(
        boolean success,
        Map<String, JsonNode> data,
        List<BindingError> errors,
        List<BindingWarning> warnings,
        Metadata metadata
) {

    public static final String REQUIRED_FIELD_MISSING = "REQUIRED_FIELD_MISSING";
    public static final String FIELD_VALIDATION_ERROR = "FIELD_VALIDATION_ERROR";

    public record BindingError(String code, String message, String field, String section) {
    }

    public record BindingWarning(String message, String impact, String field, String section) {
    }

    /**
     * @param dataCompleteness percentage of declared fields that received a value
     */
    public record Metadata(int boundFields, int totalFields, int dataCompleteness) {
    }
}
