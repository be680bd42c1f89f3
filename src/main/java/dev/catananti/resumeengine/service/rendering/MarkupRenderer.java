package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.dto.OutputFormat;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.entity.TemplateLayout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.List;
import java.util.Locale;

/**
 * Thymeleaf renderer for resume documents. Templates live under {@code classpath:/templates/resume/}.
 */
@Component
@Slf4j
public class MarkupRenderer {

    static final String DOCUMENT_TEMPLATE = "document";

    private final TemplateEngine templateEngine;

    public MarkupRenderer() {
        var resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/resume/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(true);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        log.info("MarkupRenderer initialized with Thymeleaf (templates/resume/)");
    }

    /**
     * Renders the full document for the given sections, in list order.
     */
    public String render(ResumeTemplate template, List<SectionView> sections, OutputFormat format) {
        var context = new Context(Locale.ENGLISH);
        context.setVariable("templateId", template.getId());
        context.setVariable("templateName", template.getName());
        context.setVariable("format", format.getValue());
        context.setVariable("layoutClass", layoutClass(template.getLayout()));
        context.setVariable("sections", sections);
        return templateEngine.process(DOCUMENT_TEMPLATE, context);
    }

    private static String layoutClass(TemplateLayout layout) {
        if (layout == null || layout.getFormat() == null) {
            return "layout-single-column";
        }
        return "layout-" + layout.getFormat().name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
