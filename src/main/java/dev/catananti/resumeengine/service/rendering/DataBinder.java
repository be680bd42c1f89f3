package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.dto.DataBindingResult;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import dev.catananti.resumeengine.entity.ResumeData;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import reactor.core.publisher.Mono;

/**
 * Maps resume records onto the sections a template declares.
 */
public interface DataBinder {

    /**
     * @param customization style choices of the render, or {@code null}; sections it hides are not bound
     */
    Mono<DataBindingResult> bind(ResumeTemplate template, ResumeData resume, TemplateCustomization customization);
}
