package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.config.ResilienceConfig;
import dev.catananti.resumeengine.dto.DataBindingResult;
import dev.catananti.resumeengine.dto.RenderedTemplate;
import dev.catananti.resumeengine.dto.RenderingError;
import dev.catananti.resumeengine.dto.RenderingOptions;
import dev.catananti.resumeengine.dto.RenderingWarning;
import dev.catananti.resumeengine.dto.StageMetric;
import dev.catananti.resumeengine.entity.ResumeData;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.exception.TemplateEngineException;
import dev.catananti.resumeengine.exception.TemplateRenderingException;
import dev.catananti.resumeengine.exception.TemplateValidationException;
import dev.catananti.resumeengine.metrics.RenderingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs the six rendering stages in order over a fresh {@link RenderingContext}.
 * <p>
 * A required stage that fails, times out or leaves an unrecoverable error aborts the render.
 * The optional stage degrades to a {@code STAGE_FAILED} warning and its result is discarded.
 * Timed-out stages are cancelled.
 * </p>
 */
@Service
@Slf4j
public class RenderingPipeline {

    static final String STAGE_FAILED = "STAGE_FAILED";

    private final List<RenderingStage> stages;
    private final ResilienceConfig resilience;
    private final RenderingMetrics metrics;
    private final Clock clock;

    public RenderingPipeline(List<RenderingStage> stages, ResilienceConfig resilience,
                             RenderingMetrics metrics, Clock clock) {
        Set<StageName> provided = EnumSet.noneOf(StageName.class);
        for (RenderingStage stage : stages) {
            if (!provided.add(stage.name())) {
                throw new IllegalStateException("Duplicate rendering stage: " + stage.name().getKey());
            }
        }
        Set<StageName> missing = EnumSet.allOf(StageName.class);
        missing.removeAll(provided);
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing rendering stages: " + missing);
        }
        this.stages = stages.stream()
                .sorted(Comparator.comparing(RenderingStage::name))
                .collect(Collectors.toUnmodifiableList());
        this.resilience = resilience;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Mono<RenderedTemplate> render(ResumeTemplate template, ResumeData resume) {
        return render(template, resume, RenderingOptions.defaults());
    }

    public Mono<RenderedTemplate> render(ResumeTemplate template, ResumeData resume, RenderingOptions options) {
        return Mono.defer(() -> {
            RenderingOptions effective = options != null ? options.toBuilder().build() : RenderingOptions.defaults();
            RenderingContext context = new RenderingContext(template, resume, effective, clock.instant(), System.nanoTime());
            log.info("Starting template rendering: template={}, format={}, resume={}",
                    context.getTemplateId(), effective.getFormat(), resume == null ? null : resume.getId());

            return Flux.fromIterable(stages)
                    .concatMap(stage -> runStage(stage, context))
                    .then(Mono.fromCallable(() -> toRenderedTemplate(context)))
                    .doOnSuccess(rendered -> {
                        metrics.incrementCompleted();
                        log.info("Template rendering completed: template={}, time={}ms, errors={}, warnings={}",
                                context.getTemplateId(), context.getRenderingTime(),
                                context.getErrors().size(), context.getWarnings().size());
                    })
                    .onErrorMap(error -> !(error instanceof TemplateEngineException),
                            error -> TemplateEngineException.from(error, context.getTemplateId(), context.getUserId()))
                    .doOnError(error -> {
                        metrics.incrementFailed();
                        log.error("Template rendering failed: template={}, time={}ms, error={}",
                                context.getTemplateId(), elapsedMillis(context), error.getMessage());
                    });
        });
    }

    public Map<String, StageMetric> getPerformanceMetrics() {
        return metrics.getPerformanceMetrics();
    }

    public void clearPerformanceMetrics() {
        metrics.clear();
    }

    private Mono<RenderingContext> runStage(RenderingStage stage, RenderingContext context) {
        StageName name = stage.name();
        Duration timeout = timeoutFor(name, context.getOptions());
        long started = System.nanoTime();
        log.debug("Starting {} stage", name.getKey());

        Mono<StageResult> execution = Mono.<StageResult>defer(() -> stage.execute(context))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Stage " + name.getKey() + " produced no result")))
                .timeout(timeout, Mono.error(() -> new TimeoutException(
                        "Stage " + name.getKey() + " timed out after " + timeout.toMillis() + "ms")))
                .doOnSuccess(result -> record(context, name, started, result.errors().isEmpty()))
                .doOnError(error -> record(context, name, started, false));

        return execution
                .onErrorResume(error -> onStageFailure(name, error, context))
                .flatMap(result -> apply(name, result, context))
                .defaultIfEmpty(context);
    }

    private Duration timeoutFor(StageName stage, RenderingOptions options) {
        Long override = options.getStageTimeoutsMs() != null ? options.getStageTimeoutsMs().get(stage.getKey()) : null;
        if (override != null && override > 0) {
            return Duration.ofMillis(override);
        }
        return resilience.stageTimeout(stage).orElseGet(() -> options.getTimeoutMs() != null && options.getTimeoutMs() > 0
                ? Duration.ofMillis(options.getTimeoutMs())
                : resilience.getGlobalTimeout());
    }

    /**
     * Required stages abort the render; the optional stage is recorded as a warning and skipped.
     */
    private Mono<StageResult> onStageFailure(StageName stage, Throwable error, RenderingContext context) {
        if (stage.isRequired()) {
            if (error instanceof TemplateEngineException) {
                return Mono.error(error);
            }
            String message = error instanceof TimeoutException
                    ? error.getMessage()
                    : "Stage " + stage.getKey() + " failed: " + error.getMessage();
            return Mono.error(new TemplateRenderingException(message,
                    context.getTemplateId(), context.getUserId(), Map.of("stage", stage.getKey()), error));
        }
        degrade(stage, String.valueOf(error.getMessage()), context);
        return Mono.empty();
    }

    private Mono<RenderingContext> apply(StageName stage, StageResult result, RenderingContext context) {
        if (!stage.isRequired() && !result.errors().isEmpty()) {
            degrade(stage, result.errors().get(0).message(), context);
            return Mono.just(context);
        }

        context.getErrors().addAll(result.errors());
        context.getWarnings().addAll(result.warnings());
        result.applyTo(context);

        if (stage.isRequired()) {
            var fatal = context.firstUnrecoverableError();
            if (fatal.isPresent()) {
                return Mono.error(abort(stage, fatal.get(), context));
            }
        }
        return Mono.just(context);
    }

    private void degrade(StageName stage, String reason, RenderingContext context) {
        log.warn("Stage {} failed but is not critical: {}", stage.getKey(), reason);
        context.getWarnings().add(new RenderingWarning(stage.getKey(), STAGE_FAILED,
                "Stage " + stage.getKey() + " failed but is not critical: " + reason,
                "Rendering quality may be reduced"));
    }

    private TemplateEngineException abort(StageName stage, RenderingError error, RenderingContext context) {
        String message = "Unrecoverable error in stage " + stage.getKey() + ": " + error.message();
        Map<String, Object> details = new HashMap<>();
        details.put("stage", stage.getKey());
        details.put("code", error.code());
        if (error.details() != null) {
            details.putAll(error.details());
        }
        if (stage == StageName.VALIDATION || DataBindingResult.REQUIRED_FIELD_MISSING.equals(error.code())) {
            return new TemplateValidationException(message, context.getTemplateId(), context.getUserId(), details, null);
        }
        return new TemplateRenderingException(message, context.getTemplateId(), context.getUserId(), details, null);
    }

    private RenderedTemplate toRenderedTemplate(RenderingContext context) {
        ResumeTemplate template = context.getTemplate();
        List<RenderingError> recoverable = new ArrayList<>(context.getErrors());
        return RenderedTemplate.builder()
                .id("rendered-" + template.getId() + "-" + clock.millis())
                .templateId(template.getId())
                .resumeData(context.getResumeData())
                .customizations(context.getOptions().getCustomization())
                .rendered(context.getRenderedContent())
                .metadata(RenderedTemplate.Metadata.builder()
                        .generatedAt(context.getStartedAt())
                        .renderingTime(context.getRenderingTime())
                        .version(template.getVersion())
                        .checksum(context.getChecksum())
                        .size(context.getSize())
                        .warnings(List.copyOf(context.getWarnings()))
                        .errors(recoverable)
                        .build())
                .build();
    }

    private void record(RenderingContext context, StageName stage, long startedNanos, boolean success) {
        if (context.getOptions().isEnableProfiling()) {
            metrics.recordStage(stage, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos), success);
        }
    }

    private static long elapsedMillis(RenderingContext context) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - context.getStartNanos());
    }
}
