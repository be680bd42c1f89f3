package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.TemplateFixtures;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OutputStage")
class OutputStageTest {

    @Nested
    @DisplayName("generateJavaScript")
    class GenerateJavaScript {

        @Test
        @DisplayName("Should emit plain names unchanged")
        void shouldKeepPlainNames() {
            String script = OutputStage.generateJavaScript(TemplateFixtures.template());

            assertThat(script).isEqualTo("""
                    // Template JavaScript for modern-professional
                    document.addEventListener('DOMContentLoaded', function() {
                      console.log('Template Modern Professional loaded');
                    });
                    """);
        }

        @Test
        @DisplayName("Should escape quotes, backslashes, line breaks and closing script tags")
        void shouldEscapeHostileValues() {
            ResumeTemplate template = TemplateFixtures.template();
            template.setId("evil\n</script><script>alert(1)//");
            template.setName("Ada's \\ CV\n</script>");

            String script = OutputStage.generateJavaScript(template);

            assertThat(script.lines()).hasSize(4);
            assertThat(script).doesNotContain("</script>");
            assertThat(script).startsWith("// Template JavaScript for evil\\n<\\/script><script>alert(1)//\n");
            assertThat(script).contains("console.log('Template Ada\\'s \\\\ CV\\n<\\/script> loaded');");
        }

        @Test
        @DisplayName("Should render a missing name as null")
        void shouldHandleMissingName() {
            ResumeTemplate template = TemplateFixtures.template();
            template.setName(null);

            assertThat(OutputStage.generateJavaScript(template)).contains("console.log('Template null loaded');");
        }
    }
}
