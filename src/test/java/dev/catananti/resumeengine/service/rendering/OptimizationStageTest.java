package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.TemplateFixtures;
import dev.catananti.resumeengine.dto.OptimizationOptions;
import dev.catananti.resumeengine.dto.RenderingOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OptimizationStage")
class OptimizationStageTest {

    private static final String HTML = """
            <!DOCTYPE html>
            <html>
              <head><title>Resume</title></head>
              <body>
                <!-- header -->
                <h1>Ada   Lovelace</h1>
                <pre>  keep
              this  </pre>
              </body>
            </html>
            """;

    private static final String CSS = """
            /* Color Theme */
            .section-title {
              color: #1a1a1a;
              margin: 0 auto;
            }
            """;

    @Nested
    @DisplayName("minify")
    class Minify {

        @Test
        @DisplayName("Should collapse whitespace and strip comments from markup")
        void shouldMinifyHtml() {
            String minified = OptimizationStage.minifyHtml(HTML);

            assertThat(minified).doesNotContain("<!--", "\n").contains("<h1>Ada Lovelace</h1>");
        }

        @Test
        @DisplayName("Should strip comments and spaces around punctuation from CSS")
        void shouldMinifyCss() {
            assertThat(OptimizationStage.minifyCss(CSS)).isEqualTo(".section-title{color:#1a1a1a;margin:0 auto}");
        }
    }

    @Test
    @DisplayName("Should append the stylesheet to the head")
    void shouldInlineCss() {
        String inlined = OptimizationStage.inlineCss(HTML, ".a{color:red}");

        assertThat(inlined).contains("<title>Resume</title><style>\n.a{color:red}\n</style></head>");
    }

    @Test
    @DisplayName("Should drop comments and blank text but keep preformatted text")
    void shouldCompressHtml() {
        String compressed = OptimizationStage.compressHtml(HTML);

        assertThat(compressed).doesNotContain("<!--").doesNotContain("<body>\n");
        assertThat(compressed).contains("<pre>  keep\n  this  </pre>");
    }

    @Test
    @DisplayName("Should run the enabled optimizations and clear the separate stylesheet when inlining")
    void shouldOptimizeContext() {
        RenderingOptions options = RenderingOptions.builder()
                .optimization(OptimizationOptions.builder().minify(true).inlineCss(true).compress(true).build())
                .build();
        RenderingContext context = new RenderingContext(TemplateFixtures.template(), TemplateFixtures.resume(),
                options, Instant.EPOCH, System.nanoTime());
        context.setMarkup(HTML);
        context.setCss(CSS);

        StepVerifier.create(new OptimizationStage().execute(context))
                .assertNext(result -> {
                    assertThat(result.minified()).isTrue();
                    assertThat(result.cssInlined()).isTrue();
                    assertThat(result.compressed()).isTrue();
                    assertThat(result.css()).isEmpty();
                    assertThat(result.markup()).contains("<style>\n.section-title{color:#1a1a1a;margin:0 auto}\n</style>");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fail without processed content")
    void shouldFailWithoutContent() {
        RenderingContext context = new RenderingContext(TemplateFixtures.template(), TemplateFixtures.resume(),
                RenderingOptions.defaults(), Instant.EPOCH, System.nanoTime());

        StepVerifier.create(new OptimizationStage().execute(context))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
