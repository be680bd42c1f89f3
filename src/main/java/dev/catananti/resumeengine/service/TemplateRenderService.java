package dev.catananti.resumeengine.service;

import dev.catananti.resumeengine.dto.RenderedTemplate;
import dev.catananti.resumeengine.dto.RenderingOptions;
import dev.catananti.resumeengine.entity.ResumeData;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.service.customization.CustomizationEngine;
import dev.catananti.resumeengine.service.rendering.RenderingPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point for callers that want a render with transient failures retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateRenderService {

    private final RenderingPipeline renderingPipeline;
    private final TemplateErrorHandler errorHandler;

    public Mono<RenderedTemplate> render(ResumeTemplate template, ResumeData resume, RenderingOptions options) {
        String templateId = template == null ? null : template.getId();
        String userId = resume == null ? null : resume.getUserId();
        return errorHandler.execute(() -> renderingPipeline.render(template, resume, options), templateId, userId);
    }

    /**
     * Renders with the session's current customization snapshot.
     */
    public Mono<RenderedTemplate> render(CustomizationEngine session, ResumeData resume, RenderingOptions options) {
        RenderingOptions base = options != null ? options : RenderingOptions.defaults();
        log.debug("Rendering template {} with customization session state", session.getBaseTemplate().getId());
        return render(session.getBaseTemplate(), resume,
                base.toBuilder().customization(session.getCurrentCustomization()).build());
    }
}
