package dev.catananti.resumeengine.exception;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type of every failure surfaced by the template engine.
 * <p>
 * The internal message is meant for logs; callers show {@link #getUserMessage()} to end users.
 * </p>
 */
public class TemplateEngineException extends RuntimeException {

    private final TemplateErrorCode code;
    private final String templateId;
    private final String userId;
    private final Map<String, Object> details;
    private final Instant timestamp;

    public TemplateEngineException(TemplateErrorCode code, String message) {
        this(code, message, null, null, Map.of(), null);
    }

    public TemplateEngineException(TemplateErrorCode code, String message, String templateId, String userId,
                                   Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.templateId = templateId;
        this.userId = userId;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.timestamp = Instant.now();
    }

    public TemplateErrorCode getCode() {
        return code;
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getUserId() {
        return userId;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Pipeline stage that raised the error, or {@code null} outside the rendering pipeline.
     */
    public String getStage() {
        Object stage = details.get("stage");
        return stage != null ? stage.toString() : null;
    }

    public String getUserMessage() {
        return code.getUserMessage();
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public Duration getRetryDelay() {
        return code.getRetryDelay();
    }

    /**
     * Translates any throwable into the engine taxonomy.
     * Engine exceptions pass through untouched; foreign ones are classified by their message.
     */
    public static TemplateEngineException from(Throwable error, String templateId, String userId) {
        if (error instanceof TemplateEngineException engineException) {
            return engineException;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        String lower = message.toLowerCase();
        Map<String, Object> details = Map.of("originalError", message);

        if (lower.contains("not found")) {
            return new TemplateNotFoundException(templateId, userId, details, error);
        }
        if (lower.contains("permission") || lower.contains("unauthorized")) {
            return new TemplatePermissionDeniedException(message, templateId, userId, error);
        }
        if (lower.contains("rate limit")) {
            return new RateLimitExceededException(message, templateId, userId, error);
        }
        if (lower.contains("network") || lower.contains("fetch") || lower.contains("connection")) {
            return new TemplateNetworkException(message, templateId, userId, error);
        }
        if (lower.contains("parse") || lower.contains("json")) {
            return new TemplateParseException(message, templateId, userId, error);
        }
        return new TemplateRenderingException(message, templateId, userId, details, error);
    }
}
