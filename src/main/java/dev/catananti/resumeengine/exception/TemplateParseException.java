package dev.catananti.resumeengine.exception;

import java.util.Map;

public class TemplateParseException extends TemplateEngineException {

    public TemplateParseException(String message) {
        this(message, null, null, null);
    }

    public TemplateParseException(String message, String templateId, String userId, Throwable cause) {
        super(TemplateErrorCode.PARSE_ERROR, message, templateId, userId, Map.of(), cause);
    }
}
