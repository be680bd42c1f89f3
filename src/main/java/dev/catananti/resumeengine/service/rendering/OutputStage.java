package dev.catananti.resumeengine.service.rendering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.resumeengine.dto.RenderedContent;
import dev.catananti.resumeengine.dto.RenderedTemplate;
import dev.catananti.resumeengine.dto.RenderingError;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.util.DigestUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Assembles the rendered content and stamps sizes, checksum and elapsed time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutputStage implements RenderingStage {

    private final ObjectMapper objectMapper;

    @Override
    public StageName name() {
        return StageName.OUTPUT;
    }

    @Override
    public Mono<Result> execute(RenderingContext context) {
        return Mono.fromCallable(() -> assemble(context))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(error -> {
                    log.error("Output generation failed for template {}: {}", context.getTemplateId(), error.getMessage());
                    return Mono.just(new Result(null, null, null, 0, List.of(RenderingError.fatal(name().getKey(),
                            "OUTPUT_ERROR", "Output generation failed",
                            Map.of("error", String.valueOf(error.getMessage()))))));
                });
    }

    private Result assemble(RenderingContext context) throws JsonProcessingException {
        String html = context.getFinalMarkup();
        String css = context.getFinalCss();
        if (html == null || css == null) {
            throw new IllegalStateException("No processed content available for output");
        }

        RenderedContent content = new RenderedContent(html, css, generateJavaScript(context.getTemplate()),
                List.copyOf(context.getAssets()));
        long htmlSize = utf8Length(html);
        long cssSize = utf8Length(css);
        long jsSize = utf8Length(content.javascript());
        String checksum = DigestUtils.rollingHashHex(objectMapper.writeValueAsString(content));
        long renderingTime = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - context.getStartNanos());

        log.debug("Output stage completed: {} bytes in {}ms", htmlSize + cssSize + jsSize, renderingTime);
        return new Result(content, new RenderedTemplate.Size(htmlSize, cssSize, htmlSize + cssSize + jsSize),
                checksum, renderingTime, List.of());
    }

    static String generateJavaScript(ResumeTemplate template) {
        return "// Template JavaScript for " + escapeJs(template.getId()) + "\n"
                + "document.addEventListener('DOMContentLoaded', function() {\n"
                + "  console.log('Template " + escapeJs(template.getName()) + " loaded');\n"
                + "});\n";
    }

    /**
     * Escapes a value for a single-quoted script string: JSON escapes plus quotes and closing tags.
     */
    static String escapeJs(String value) {
        String escaped = new String(JsonStringEncoder.getInstance().quoteAsString(String.valueOf(value)));
        return escaped.replace("'", "\\'").replace("</", "<\\/");
    }

    private static long utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    public record Result(RenderedContent content, RenderedTemplate.Size size, String checksum, long renderingTime,
                         List<RenderingError> errors) implements StageResult {

        @Override
        public void applyTo(RenderingContext context) {
            if (content == null) {
                return;
            }
            context.setRenderedContent(content);
            context.setSize(size);
            context.setChecksum(checksum);
            context.setRenderingTime(renderingTime);
        }
    }
}
