package dev.catananti.resumeengine.dto;

import dev.catananti.resumeengine.entity.ResumeData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Output of a successful render.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderedTemplate {
    private String id;
    private String templateId;
    private ResumeData resumeData;
    private TemplateCustomization customizations;
    private RenderedContent rendered;
    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private Instant generatedAt;
        /** Milliseconds from render start to output. */
        private long renderingTime;
        private String version;
        private String checksum;
        private Size size;
        private List<RenderingWarning> warnings;
        /** Recoverable errors that did not stop the render. */
        private List<RenderingError> errors;
    }

    /**
     * UTF-8 byte counts.
     */
    public record Size(long html, long css, long total) {
    }
}
