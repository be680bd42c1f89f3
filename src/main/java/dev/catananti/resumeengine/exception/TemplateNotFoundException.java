package dev.catananti.resumeengine.exception;

import java.util.Map;

public class TemplateNotFoundException extends TemplateEngineException {

    public TemplateNotFoundException(String templateId) {
        this(templateId, null, Map.of(), null);
    }

    public TemplateNotFoundException(String templateId, String userId, Map<String, Object> details, Throwable cause) {
        super(TemplateErrorCode.TEMPLATE_NOT_FOUND, "Template not found: " + templateId, templateId, userId, details, cause);
    }
}
