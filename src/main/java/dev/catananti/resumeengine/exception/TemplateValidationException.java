package dev.catananti.resumeengine.exception;

import java.util.Map;

/**
 * Input rejected by a validation rule. Never retried.
 */
public class TemplateValidationException extends TemplateEngineException {

    public TemplateValidationException(String message) {
        this(message, Map.of());
    }

    public TemplateValidationException(String message, Map<String, Object> details) {
        this(message, null, null, details, null);
    }

    public TemplateValidationException(String message, String templateId, String userId,
                                       Map<String, Object> details, Throwable cause) {
        super(TemplateErrorCode.VALIDATION_FAILED, message, templateId, userId, details, cause);
    }
}
