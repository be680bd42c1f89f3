package dev.catananti.resumeengine.service;

import dev.catananti.resumeengine.config.ResilienceConfig;
import dev.catananti.resumeengine.dto.RetryStats;
import dev.catananti.resumeengine.exception.TemplateEngineException;
import dev.catananti.resumeengine.metrics.RenderingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Retries template operations that fail with a retryable error, waiting the error's delay between
 * attempts. Attempts are counted per (template, user) in the shared {@link RetryAttemptRegistry}
 * and cleared once the operation succeeds or gives up.
 */
@Service
@Slf4j
public class TemplateErrorHandler {

    private final RetryAttemptRegistry attempts;
    private final RenderingMetrics metrics;
    private volatile int maxRetries;

    public TemplateErrorHandler(RetryAttemptRegistry attempts, ResilienceConfig resilience, RenderingMetrics metrics) {
        this.attempts = attempts;
        this.metrics = metrics;
        this.maxRetries = resilience.getRetryMaxAttempts();
    }

    /**
     * Subscribes to the operation, re-subscribing on retryable failures.
     *
     * @param operation supplies a fresh attempt each time it is called
     * @return the first successful result, or the last failure as a {@link TemplateEngineException}
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> operation, String templateId, String userId) {
        return Mono.defer(operation)
                .doOnSuccess(result -> {
                    int previous = attempts.get(templateId, userId);
                    if (previous > 0) {
                        log.info("Template operation succeeded after {} retries: template={}, user={}",
                                previous, templateId, userId);
                    }
                    attempts.clear(templateId, userId);
                })
                .onErrorResume(error -> handleError(TemplateEngineException.from(error, templateId, userId),
                        operation, templateId, userId));
    }

    private <T> Mono<T> handleError(TemplateEngineException error, Supplier<Mono<T>> operation,
                                    String templateId, String userId) {
        int current = attempts.get(templateId, userId);
        log.error("Template operation failed: code={}, template={}, user={}, attempts={}/{}, message={}",
                error.getCode(), templateId, userId, current, maxRetries, error.getMessage());

        if (error.isRetryable() && current < maxRetries) {
            attempts.increment(templateId, userId);
            metrics.incrementRetries();
            log.info("Retrying template operation after {}ms (attempt {}/{})",
                    error.getRetryDelay().toMillis(), current + 1, maxRetries);
            return Mono.delay(error.getRetryDelay())
                    .then(execute(operation, templateId, userId));
        }

        attempts.clear(templateId, userId);
        return Mono.error(error);
    }

    public RetryStats getRetryStats() {
        Map<String, Integer> details = new LinkedHashMap<>();
        attempts.snapshot().forEach((key, count) -> details.put(key.toString(), count));
        return new RetryStats(details.size(), maxRetries, details);
    }

    public void clearRetryStats() {
        attempts.clearAll();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
        log.info("Updated max retries to {}", this.maxRetries);
    }
}
