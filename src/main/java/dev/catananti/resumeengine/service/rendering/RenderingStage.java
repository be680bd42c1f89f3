package dev.catananti.resumeengine.service.rendering;

import reactor.core.publisher.Mono;

/**
 * One step of the rendering pipeline. Implementations read the context but never modify it;
 * the pipeline applies the returned result.
 */
public interface RenderingStage {

    StageName name();

    Mono<? extends StageResult> execute(RenderingContext context);
}
