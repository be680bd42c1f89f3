package dev.catananti.resumeengine.metrics;

import dev.catananti.resumeengine.dto.StageMetric;
import dev.catananti.resumeengine.service.rendering.StageName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-stage timings for the rendering pipeline, kept in memory and mirrored to Micrometer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RenderingMetrics {

    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, StageMetric> stageMetrics = new ConcurrentHashMap<>();

    private Counter renderCompletedCounter;
    private Counter renderFailedCounter;
    private Counter retryCounter;

    @PostConstruct
    public void init() {
        renderCompletedCounter = Counter.builder("template.render.completed")
                .description("Renders that produced output")
                .register(meterRegistry);
        renderFailedCounter = Counter.builder("template.render.failed")
                .description("Renders aborted by a required stage")
                .register(meterRegistry);
        retryCounter = Counter.builder("template.render.retries")
                .description("Retried template operations")
                .register(meterRegistry);
    }

    public void recordStage(StageName stage, long durationMs, boolean success) {
        stageMetrics.compute(stage.getKey(), (key, previous) -> new StageMetric(
                durationMs,
                clock.instant(),
                previous == null ? 1 : previous.count() + 1));
        Timer.builder("template.render.stage")
                .tag("stage", stage.getKey())
                .tag("status", success ? "success" : "failure")
                .register(meterRegistry)
                .record(Duration.ofMillis(durationMs));
    }

    public void incrementCompleted() {
        renderCompletedCounter.increment();
    }

    public void incrementFailed() {
        renderFailedCounter.increment();
    }

    public void incrementRetries() {
        retryCounter.increment();
    }

    /**
     * Snapshot keyed by stage name: last duration in ms, when it was recorded, and run count.
     */
    public Map<String, StageMetric> getPerformanceMetrics() {
        return new LinkedHashMap<>(new TreeMap<>(stageMetrics));
    }

    public void clear() {
        stageMetrics.clear();
        log.debug("Rendering performance metrics cleared");
    }
}
