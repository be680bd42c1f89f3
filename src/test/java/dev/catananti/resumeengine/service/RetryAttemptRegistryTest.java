package dev.catananti.resumeengine.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryAttemptRegistry")
class RetryAttemptRegistryTest {

    private RetryAttemptRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RetryAttemptRegistry();
    }

    @Test
    @DisplayName("Should count attempts per template and user")
    void shouldCountPerPair() {
        registry.increment("modern-professional", "user-7");
        registry.increment("modern-professional", "user-7");
        registry.increment("modern-professional", "user-8");

        assertThat(registry.get("modern-professional", "user-7")).isEqualTo(2);
        assertThat(registry.get("modern-professional", "user-8")).isEqualTo(1);
        assertThat(registry.get("classic", "user-7")).isZero();
    }

    @Test
    @DisplayName("Should key missing ids as unknown and anonymous")
    void shouldDefaultMissingIds() {
        registry.increment(null, null);

        assertThat(registry.snapshot().keySet()).extracting(Object::toString).containsExactly("unknown-anonymous");
        assertThat(registry.get("unknown", "anonymous")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should clear one pair without touching others")
    void shouldClearSinglePair() {
        registry.increment("modern-professional", "user-7");
        registry.increment("classic", "user-7");

        registry.clear("modern-professional", "user-7");

        assertThat(registry.get("modern-professional", "user-7")).isZero();
        assertThat(registry.get("classic", "user-7")).isEqualTo(1);

        registry.clearAll();
        assertThat(registry.snapshot()).isEmpty();
    }
}
