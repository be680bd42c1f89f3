package dev.catananti.resumeengine.config;

import dev.catananti.resumeengine.service.rendering.StageName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResilienceConfig")
class ResilienceConfigTest {

    @Test
    @DisplayName("Should match the built-in stage timeouts by default")
    void shouldMatchStageDefaults() {
        ResilienceConfig config = ResilienceConfig.defaults();

        for (StageName stage : StageName.values()) {
            assertThat(config.stageTimeout(stage)).contains(Duration.ofMillis(stage.getDefaultTimeoutMs()));
        }
        assertThat(config.getGlobalTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getRetryMaxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should treat non-positive stage timeouts as unset")
    void shouldIgnoreNonPositiveTimeouts() {
        ResilienceConfig config = new ResilienceConfig(10_000, 0, 5000, -1, 4000, 2000, 3000, 3);

        assertThat(config.stageTimeout(StageName.VALIDATION)).isEmpty();
        assertThat(config.stageTimeout(StageName.CONTENT_PROCESSING)).isEmpty();
        assertThat(config.stageTimeout(StageName.STYLING)).contains(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Should clamp negative retry limits to zero")
    void shouldClampRetries() {
        assertThat(new ResilienceConfig(10_000, 2000, 5000, 3000, 4000, 2000, 3000, -2).getRetryMaxAttempts())
                .isZero();
    }
}
