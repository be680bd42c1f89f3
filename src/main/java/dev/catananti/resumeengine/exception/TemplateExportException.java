package dev.catananti.resumeengine.exception;

import java.util.Map;

public class TemplateExportException extends TemplateEngineException {

    public TemplateExportException(String message, String templateId, String userId, Throwable cause) {
        super(TemplateErrorCode.EXPORT_FAILED, message, templateId, userId, Map.of(), cause);
    }
}
