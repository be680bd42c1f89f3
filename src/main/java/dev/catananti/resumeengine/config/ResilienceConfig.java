package dev.catananti.resumeengine.config;

import dev.catananti.resumeengine.service.rendering.StageName;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rendering timeouts and retry limits.
 *
 * <pre>
 * stage.execute(context)
 *         .timeout(resilience.stageTimeout(StageName.STYLING).orElse(fallback));
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration globalTimeout;
    private final Map<StageName, Duration> stageTimeouts;
    private final int retryMaxAttempts;

    public ResilienceConfig(
            @Value("${template-engine.rendering.global-timeout-ms:10000}") long globalTimeoutMs,
            @Value("${template-engine.rendering.stage-timeouts.validation:2000}") long validationMs,
            @Value("${template-engine.rendering.stage-timeouts.data-binding:5000}") long dataBindingMs,
            @Value("${template-engine.rendering.stage-timeouts.content-processing:3000}") long contentProcessingMs,
            @Value("${template-engine.rendering.stage-timeouts.styling:4000}") long stylingMs,
            @Value("${template-engine.rendering.stage-timeouts.optimization:2000}") long optimizationMs,
            @Value("${template-engine.rendering.stage-timeouts.output:3000}") long outputMs,
            @Value("${template-engine.retry.max-attempts:3}") int retryMaxAttempts
    ) {
        this.globalTimeout = Duration.ofMillis(globalTimeoutMs);
        Map<StageName, Duration> timeouts = new EnumMap<>(StageName.class);
        timeouts.put(StageName.VALIDATION, Duration.ofMillis(validationMs));
        timeouts.put(StageName.DATA_BINDING, Duration.ofMillis(dataBindingMs));
        timeouts.put(StageName.CONTENT_PROCESSING, Duration.ofMillis(contentProcessingMs));
        timeouts.put(StageName.STYLING, Duration.ofMillis(stylingMs));
        timeouts.put(StageName.OPTIMIZATION, Duration.ofMillis(optimizationMs));
        timeouts.put(StageName.OUTPUT, Duration.ofMillis(outputMs));
        this.stageTimeouts = Collections.unmodifiableMap(timeouts);
        this.retryMaxAttempts = Math.max(0, retryMaxAttempts);
        log.info("Template engine resilience configuration initialized (global timeout {}ms, max retries {})",
                globalTimeoutMs, this.retryMaxAttempts);
    }

    /**
     * Defaults matching the built-in stage timeouts, for use outside a Spring context.
     */
    public static ResilienceConfig defaults() {
        return new ResilienceConfig(10_000, 2000, 5000, 3000, 4000, 2000, 3000, 3);
    }

    /**
     * Configured timeout for a stage; empty when it is unset or not positive.
     */
    public Optional<Duration> stageTimeout(StageName stage) {
        return Optional.ofNullable(stageTimeouts.get(stage))
                .filter(timeout -> !timeout.isZero() && !timeout.isNegative());
    }
}
