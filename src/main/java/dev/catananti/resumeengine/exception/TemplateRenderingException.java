package dev.catananti.resumeengine.exception;

import java.util.Map;

/**
 * Rendering failed for a reason other than invalid input. Retryable.
 */
public class TemplateRenderingException extends TemplateEngineException {

    public TemplateRenderingException(String message, String templateId, String userId,
                                      Map<String, Object> details, Throwable cause) {
        super(TemplateErrorCode.RENDER_FAILED, message, templateId, userId, details, cause);
    }
}
