package dev.catananti.resumeengine;

import dev.catananti.resumeengine.dto.RenderingOptions;
import dev.catananti.resumeengine.service.TemplateErrorHandler;
import dev.catananti.resumeengine.service.TemplateRenderService;
import dev.catananti.resumeengine.service.customization.CustomizationEngine;
import dev.catananti.resumeengine.service.customization.CustomizationEngineFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Loads the full application context and renders the sample resume end to end.
 */
@SpringBootTest
class ResumeTemplateEngineApplicationTests {

	@Autowired
	private TemplateRenderService renderService;

	@Autowired
	private CustomizationEngineFactory customizationEngineFactory;

	@Autowired
	private TemplateErrorHandler errorHandler;

	@Test
	void contextLoads() {
		assertThat(errorHandler.getMaxRetries()).isEqualTo(3);
	}

	@Test
	void rendersCustomizedResume() {
		CustomizationEngine session = customizationEngineFactory.create(TemplateFixtures.template());
		session.applyColorTheme("modern_blue");

		StepVerifier.create(renderService.render(session, TemplateFixtures.resume(), RenderingOptions.defaults()))
				.assertNext(rendered -> {
					assertThat(rendered.getTemplateId()).isEqualTo("modern-professional");
					assertThat(rendered.getRendered().html()).contains("Ada Lovelace", "--color-primary: #1e3a8a;");
					assertThat(rendered.getMetadata().getChecksum()).isNotBlank();
				})
				.verifyComplete();
	}

}
