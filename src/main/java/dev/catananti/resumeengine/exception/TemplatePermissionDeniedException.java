package dev.catananti.resumeengine.exception;

import java.util.Map;

public class TemplatePermissionDeniedException extends TemplateEngineException {

    public TemplatePermissionDeniedException(String message) {
        this(message, null, null, null);
    }

    public TemplatePermissionDeniedException(String message, String templateId, String userId, Throwable cause) {
        super(TemplateErrorCode.PERMISSION_DENIED, message, templateId, userId, Map.of(), cause);
    }
}
