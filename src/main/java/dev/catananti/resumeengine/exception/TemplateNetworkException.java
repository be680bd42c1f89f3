package dev.catananti.resumeengine.exception;

import java.util.Map;

public class TemplateNetworkException extends TemplateEngineException {

    public TemplateNetworkException(String message) {
        this(message, null, null, null);
    }

    public TemplateNetworkException(String message, String templateId, String userId, Throwable cause) {
        super(TemplateErrorCode.NETWORK_ERROR, message, templateId, userId, Map.of(), cause);
    }
}
