package dev.catananti.resumeengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Resume template rendering and customization engine.
 */
@SpringBootApplication
public class ResumeTemplateEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeTemplateEngineApplication.class, args);
    }
}
