package dev.catananti.resumeengine.service;

import dev.catananti.resumeengine.TemplateFixtures;
import dev.catananti.resumeengine.config.ResilienceConfig;
import dev.catananti.resumeengine.dto.RenderedTemplate;
import dev.catananti.resumeengine.dto.RenderingOptions;
import dev.catananti.resumeengine.entity.ResumeData;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.exception.TemplateNetworkException;
import dev.catananti.resumeengine.exception.TemplateRenderingException;
import dev.catananti.resumeengine.exception.TemplateValidationException;
import dev.catananti.resumeengine.metrics.RenderingMetrics;
import dev.catananti.resumeengine.service.customization.ColorThemeService;
import dev.catananti.resumeengine.service.customization.CustomizationEngine;
import dev.catananti.resumeengine.service.customization.CustomizationEngineFactory;
import dev.catananti.resumeengine.service.customization.LayoutService;
import dev.catananti.resumeengine.service.customization.SectionVisibilityService;
import dev.catananti.resumeengine.service.customization.StylesheetGenerator;
import dev.catananti.resumeengine.service.customization.TypographyService;
import dev.catananti.resumeengine.service.rendering.RenderingPipeline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TemplateRenderService")
class TemplateRenderServiceTest {

    @Mock private RenderingPipeline renderingPipeline;

    private SimpleMeterRegistry meterRegistry;
    private TemplateErrorHandler errorHandler;
    private TemplateRenderService renderService;

    private ResumeTemplate template;
    private ResumeData resume;
    private RenderedTemplate rendered;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        RenderingMetrics metrics = new RenderingMetrics(meterRegistry, Clock.systemUTC());
        metrics.init();
        errorHandler = new TemplateErrorHandler(new RetryAttemptRegistry(), ResilienceConfig.defaults(), metrics);
        renderService = new TemplateRenderService(renderingPipeline, errorHandler);

        template = TemplateFixtures.template();
        resume = TemplateFixtures.resume();
        rendered = RenderedTemplate.builder()
                .id("render-1")
                .templateId(template.getId())
                .build();
    }

    @Nested
    @DisplayName("render with options")
    class RenderWithOptions {

        @Test
        @DisplayName("Should return the pipeline output on the first attempt")
        void shouldRenderOnce() {
            RenderingOptions options = RenderingOptions.defaults();
            when(renderingPipeline.render(template, resume, options)).thenReturn(Mono.just(rendered));

            StepVerifier.create(renderService.render(template, resume, options))
                    .expectNext(rendered)
                    .verifyComplete();

            verify(renderingPipeline, times(1)).render(template, resume, options);
            assertThat(errorHandler.getRetryStats().activeRetries()).isZero();
        }

        @Test
        @DisplayName("Should retry a network failure and succeed after the delay")
        void shouldRetryNetworkFailure() {
            RenderingOptions options = RenderingOptions.defaults();
            when(renderingPipeline.render(template, resume, options))
                    .thenReturn(Mono.error(new TemplateNetworkException("Failed to fetch font")))
                    .thenReturn(Mono.just(rendered));

            StepVerifier.withVirtualTime(() -> renderService.render(template, resume, options))
                    .expectSubscription()
                    .expectNoEvent(Duration.ofMillis(1999))
                    .thenAwait(Duration.ofMillis(1))
                    .expectNext(rendered)
                    .verifyComplete();

            verify(renderingPipeline, times(2)).render(template, resume, options);
            assertThat(meterRegistry.get("template.render.retries").counter().count()).isEqualTo(1.0);
            assertThat(errorHandler.getRetryStats().activeRetries()).isZero();
        }

        @Test
        @DisplayName("Should give up on a failed required stage after the retry budget")
        void shouldGiveUpOnRenderingFailure() {
            RenderingOptions options = RenderingOptions.defaults();
            when(renderingPipeline.render(template, resume, options))
                    .thenReturn(Mono.error(new TemplateRenderingException("Stage output failed: disk full",
                            template.getId(), resume.getUserId(), Map.of("stage", "output"), null)));

            StepVerifier.withVirtualTime(() -> renderService.render(template, resume, options))
                    .expectSubscription()
                    .thenAwait(Duration.ofSeconds(3))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(TemplateRenderingException.class)
                            .hasMessage("Stage output failed: disk full"))
                    .verify();

            verify(renderingPipeline, times(4)).render(template, resume, options);
            assertThat(errorHandler.getRetryStats().activeRetries()).isZero();
        }

        @Test
        @DisplayName("Should not retry invalid resume data")
        void shouldNotRetryValidationFailure() {
            RenderingOptions options = RenderingOptions.defaults();
            when(renderingPipeline.render(template, resume, options))
                    .thenReturn(Mono.error(new TemplateValidationException("Resume id is required")));

            StepVerifier.create(renderService.render(template, resume, options))
                    .expectError(TemplateValidationException.class)
                    .verify();

            verify(renderingPipeline, times(1)).render(template, resume, options);
        }
    }

    @Nested
    @DisplayName("render with a customization session")
    class RenderWithSession {

        private CustomizationEngine session;

        @BeforeEach
        void createSession() {
            TypographyService typographyService = new TypographyService();
            LayoutService layoutService = new LayoutService();
            CustomizationEngineFactory factory = new CustomizationEngineFactory(
                    new ColorThemeService(),
                    typographyService,
                    layoutService,
                    new SectionVisibilityService(TemplateFixtures.objectMapper()),
                    new StylesheetGenerator(typographyService, layoutService),
                    TemplateFixtures.objectMapper(),
                    Clock.systemUTC());
            session = factory.create(template);
            session.applyColorTheme("modern_blue");
            session.toggleSection("projects");
        }

        @Test
        @DisplayName("Should pass the session's current customization to the pipeline")
        void shouldUseSessionCustomization() {
            when(renderingPipeline.render(eq(template), eq(resume), any(RenderingOptions.class)))
                    .thenReturn(Mono.just(rendered));
            RenderingOptions options = RenderingOptions.builder().format("pdf").timeoutMs(2_000L).build();

            StepVerifier.create(renderService.render(session, resume, options))
                    .expectNext(rendered)
                    .verifyComplete();

            ArgumentCaptor<RenderingOptions> captor = ArgumentCaptor.forClass(RenderingOptions.class);
            verify(renderingPipeline).render(eq(template), eq(resume), captor.capture());
            RenderingOptions passed = captor.getValue();
            assertThat(passed.getCustomization()).isEqualTo(session.getCurrentCustomization());
            assertThat(passed.getFormat()).isEqualTo("pdf");
            assertThat(passed.getTimeoutMs()).isEqualTo(2_000L);
            assertThat(options.getCustomization()).isNull();
        }

        @Test
        @DisplayName("Should fall back to default options when none are given")
        void shouldDefaultOptions() {
            when(renderingPipeline.render(eq(template), eq(resume), any(RenderingOptions.class)))
                    .thenReturn(Mono.just(rendered));

            StepVerifier.create(renderService.render(session, resume, null))
                    .expectNext(rendered)
                    .verifyComplete();

            ArgumentCaptor<RenderingOptions> captor = ArgumentCaptor.forClass(RenderingOptions.class);
            verify(renderingPipeline).render(eq(template), eq(resume), captor.capture());
            assertThat(captor.getValue().getFormat()).isEqualTo("html");
            assertThat(captor.getValue().getCustomization().getColorScheme().getName())
                    .isEqualTo(session.getCurrentCustomization().getColorScheme().getName());
        }
    }
}
