package dev.catananti.resumeengine.config;

import dev.catananti.resumeengine.service.RetryAttemptRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TemplateEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryAttemptRegistry retryAttemptRegistry() {
        return new RetryAttemptRegistry();
    }
}
