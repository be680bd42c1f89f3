package dev.catananti.resumeengine.exception;

import java.util.Map;

public class RateLimitExceededException extends TemplateEngineException {

    public RateLimitExceededException(String message) {
        this(message, null, null, null);
    }

    public RateLimitExceededException(String message, String templateId, String userId, Throwable cause) {
        super(TemplateErrorCode.RATE_LIMIT_EXCEEDED, message, templateId, userId, Map.of(), cause);
    }
}
