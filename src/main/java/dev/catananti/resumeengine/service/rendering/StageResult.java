package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.dto.RenderingError;
import dev.catananti.resumeengine.dto.RenderingWarning;

import java.util.List;

/**
 * Typed output of a stage, applied to the context only when the stage succeeds.
 */
public interface StageResult {

    default List<RenderingError> errors() {
        return List.of();
    }

    default List<RenderingWarning> warnings() {
        return List.of();
    }

    /**
     * Stores this stage's artifacts in the context. Errors and warnings are copied by the pipeline.
     */
    void applyTo(RenderingContext context);
}
