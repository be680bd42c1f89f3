package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error recorded by a pipeline stage. Non-recoverable errors abort the render.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RenderingError(String stage, String code, String message, Map<String, Object> details,
                             boolean recoverable) {

    public static RenderingError fatal(String stage, String code, String message, Map<String, Object> details) {
        return new RenderingError(stage, code, message, details, false);
    }

    public static RenderingError recoverable(String stage, String code, String message, Map<String, Object> details) {
        return new RenderingError(stage, code, message, details, true);
    }
}
