package dev.catananti.resumeengine.exception;

import java.util.Map;

public class TemplateStorageException extends TemplateEngineException {

    public TemplateStorageException(String message) {
        this(message, null, null, null);
    }

    public TemplateStorageException(String message, String templateId, String userId, Throwable cause) {
        super(TemplateErrorCode.STORAGE_ERROR, message, templateId, userId, Map.of(), cause);
    }
}
