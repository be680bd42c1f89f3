package dev.catananti.resumeengine.service.rendering;

import com.fasterxml.jackson.databind.JsonNode;
import dev.catananti.resumeengine.dto.DataBindingResult;
import dev.catananti.resumeengine.dto.OutputFormat;
import dev.catananti.resumeengine.dto.RenderedAsset;
import dev.catananti.resumeengine.dto.RenderedContent;
import dev.catananti.resumeengine.dto.RenderedTemplate;
import dev.catananti.resumeengine.dto.RenderingError;
import dev.catananti.resumeengine.dto.RenderingOptions;
import dev.catananti.resumeengine.dto.RenderingWarning;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import dev.catananti.resumeengine.entity.ResumeData;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State threaded through the stages of a single render. Not shared between renders.
 */
@Getter
@Setter
public class RenderingContext {

    private final ResumeTemplate template;
    private final ResumeData resumeData;
    private final RenderingOptions options;
    private final Instant startedAt;
    private final long startNanos;
    private final List<RenderingError> errors = new ArrayList<>();
    private final List<RenderingWarning> warnings = new ArrayList<>();

    private OutputFormat format = OutputFormat.HTML;

    // dataBinding
    private Map<String, JsonNode> boundData;
    private DataBindingResult.Metadata bindingMetadata;

    // contentProcessing
    private List<ProcessedSection> sections;
    private String markup;
    private List<RenderedAsset> assets = new ArrayList<>();

    // styling
    private String css;

    // optimization
    private String optimizedMarkup;
    private String optimizedCss;
    private boolean minified;
    private boolean cssInlined;
    private boolean compressed;

    // output
    private RenderedContent renderedContent;
    private RenderedTemplate.Size size;
    private String checksum;
    private long renderingTime;

    public RenderingContext(ResumeTemplate template, ResumeData resumeData, RenderingOptions options,
                            Instant startedAt, long startNanos) {
        this.template = template;
        this.resumeData = resumeData;
        this.options = options;
        this.startedAt = startedAt;
        this.startNanos = startNanos;
    }

    public Optional<TemplateCustomization> getCustomization() {
        return Optional.ofNullable(options.getCustomization());
    }

    public Optional<RenderingError> firstUnrecoverableError() {
        return errors.stream().filter(error -> !error.recoverable()).findFirst();
    }

    /**
     * Markup after optimization, or the processed markup when optimization did not apply.
     */
    public String getFinalMarkup() {
        return optimizedMarkup != null ? optimizedMarkup : markup;
    }

    public String getFinalCss() {
        return optimizedCss != null ? optimizedCss : css;
    }

    public String getTemplateId() {
        return template == null ? null : template.getId();
    }

    public String getUserId() {
        return resumeData == null ? null : resumeData.getUserId();
    }
}
