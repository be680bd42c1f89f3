package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.dto.OptimizationOptions;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional size optimizations: minification, stylesheet inlining and compaction.
 * Failures leave the unoptimized markup and stylesheet in place.
 */
@Component
@Slf4j
public class OptimizationStage implements RenderingStage {

    @Override
    public StageName name() {
        return StageName.OPTIMIZATION;
    }

    @Override
    public Mono<Result> execute(RenderingContext context) {
        return Mono.fromCallable(() -> optimize(context))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Result optimize(RenderingContext context) {
        if (context.getMarkup() == null || context.getCss() == null) {
            throw new IllegalStateException("No processed content available for optimization");
        }
        OptimizationOptions optimization = context.getOptions().getOptimization() != null
                ? context.getOptions().getOptimization()
                : new OptimizationOptions();

        String markup = context.getMarkup();
        String css = context.getCss();
        if (optimization.isMinify()) {
            markup = minifyHtml(markup);
            css = minifyCss(css);
        }
        if (optimization.isInlineCss()) {
            markup = inlineCss(markup, css);
            css = "";
        }
        if (optimization.isCompress()) {
            markup = compressHtml(markup);
        }

        log.debug("Optimization stage completed: markup {} -> {} chars, css {} -> {} chars",
                context.getMarkup().length(), markup.length(), context.getCss().length(), css.length());
        return new Result(markup, css, optimization.isMinify(), optimization.isInlineCss(), optimization.isCompress());
    }

    static String minifyHtml(String html) {
        return html
                .replaceAll(">\\s+<", "><")
                .replaceAll("\\s+", " ")
                .replaceAll("<!--[\\s\\S]*?-->", "")
                .trim();
    }

    static String minifyCss(String css) {
        return css
                .replaceAll("/\\*[\\s\\S]*?\\*/", "")
                .replaceAll("\\s*([{}:;,])\\s*", "$1")
                .replaceAll("\\s+", " ")
                .replaceAll(";\\s*}", "}")
                .trim();
    }

    /**
     * Appends the stylesheet to {@code <head>} as a {@code <style>} element.
     */
    static String inlineCss(String html, String css) {
        Document document = Jsoup.parse(html);
        document.outputSettings().prettyPrint(false);
        document.head().appendElement("style").appendChild(new DataNode("\n" + css + "\n"));
        return document.outerHtml();
    }

    /**
     * Drops comments and whitespace-only text outside {@code <pre>}.
     */
    static String compressHtml(String html) {
        Document document = Jsoup.parse(html);
        document.outputSettings().prettyPrint(false);
        List<Node> removable = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Comment) {
                removable.add(node);
            } else if (node instanceof TextNode text && text.isBlank() && !insidePre(text)) {
                removable.add(node);
            }
        }, document);
        removable.forEach(Node::remove);
        return document.outerHtml();
    }

    private static boolean insidePre(Node node) {
        for (Node parent = node.parentNode(); parent != null; parent = parent.parentNode()) {
            if (parent instanceof Element element && "pre".equals(element.normalName())) {
                return true;
            }
        }
        return false;
    }

    public record Result(String markup, String css, boolean minified, boolean cssInlined, boolean compressed)
            implements StageResult {

        @Override
        public void applyTo(RenderingContext context) {
            context.setOptimizedMarkup(markup);
            context.setOptimizedCss(css);
            context.setMinified(minified);
            context.setCssInlined(cssInlined);
            context.setCompressed(compressed);
        }
    }
}
