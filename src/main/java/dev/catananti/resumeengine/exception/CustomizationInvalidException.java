package dev.catananti.resumeengine.exception;

import java.util.Map;

public class CustomizationInvalidException extends TemplateEngineException {

    public CustomizationInvalidException(String message, Map<String, Object> details) {
        super(TemplateErrorCode.CUSTOMIZATION_INVALID, message, null, null, details, null);
    }
}
