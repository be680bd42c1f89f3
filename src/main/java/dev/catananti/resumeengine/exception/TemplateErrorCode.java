package dev.catananti.resumeengine.exception;

import java.time.Duration;

/**
 * Closed set of failure kinds raised by the template engine.
 * Each kind maps to a fixed user-facing sentence and a retry policy.
 */
public enum TemplateErrorCode {

    TEMPLATE_NOT_FOUND("The requested template could not be found. It may have been deleted or moved.", false, 0),
    RENDER_FAILED("Failed to render the template. Please try again or contact support if the problem persists.", true, 1000),
    EXPORT_FAILED("Failed to export the template. Please check your internet connection and try again.", true, 1000),
    CUSTOMIZATION_INVALID("The customization settings are invalid. Please review your changes and try again.", false, 0),
    VALIDATION_FAILED("The template data is invalid. Please check all required fields and try again.", false, 0),
    PERMISSION_DENIED("You do not have permission to perform this action.", false, 0),
    RATE_LIMIT_EXCEEDED("Too many requests. Please wait a moment before trying again.", true, 5000),
    STORAGE_ERROR("Failed to save changes. Please try again.", true, 3000),
    NETWORK_ERROR("Network connection error. Please check your internet connection and try again.", true, 2000),
    PARSE_ERROR("Failed to process the template data. The template may be corrupted.", false, 0);

    private final String userMessage;
    private final boolean retryable;
    private final Duration retryDelay;

    TemplateErrorCode(String userMessage, boolean retryable, long retryDelayMs) {
        this.userMessage = userMessage;
        this.retryable = retryable;
        this.retryDelay = Duration.ofMillis(retryDelayMs);
    }

    public String getUserMessage() {
        return userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }
}
