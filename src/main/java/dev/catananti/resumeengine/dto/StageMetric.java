package dev.catananti.resumeengine.dto;

import java.time.Instant;

/**
 * Last observed duration of a pipeline stage and how many times it has run.
 */
public record StageMetric(long duration, Instant timestamp, long count) {
}
