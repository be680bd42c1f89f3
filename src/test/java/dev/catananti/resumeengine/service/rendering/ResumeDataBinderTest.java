package dev.catananti.resumeengine.service.rendering;

import dev.catananti.resumeengine.TemplateFixtures;
import dev.catananti.resumeengine.dto.DataBindingResult;
import dev.catananti.resumeengine.dto.DataBindingResult.BindingError;
import dev.catananti.resumeengine.dto.SectionConfig;
import dev.catananti.resumeengine.dto.SectionVisibility;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import dev.catananti.resumeengine.entity.FieldDefinition;
import dev.catananti.resumeengine.entity.ResumeData;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.entity.ValidationRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResumeDataBinder")
class ResumeDataBinderTest {

    private ResumeDataBinder binder;
    private ResumeTemplate template;
    private ResumeData resume;

    @BeforeEach
    void setUp() {
        binder = new ResumeDataBinder(TemplateFixtures.objectMapper());
        template = TemplateFixtures.template();
        resume = TemplateFixtures.resume();
    }

    private DataBindingResult bind(TemplateCustomization customization) {
        return binder.bind(template, resume, customization).block();
    }

    @Test
    @DisplayName("Should bind every section of a complete resume")
    void shouldBindCompleteResume() {
        DataBindingResult result = bind(null);

        assertThat(result.success()).isTrue();
        assertThat(result.data()).containsOnlyKeys("contact", "summary", "experience", "skills");
        assertThat(result.data().get("contact").get("fullName").asText()).isEqualTo("Ada Lovelace");
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.metadata()).isEqualTo(new DataBindingResult.Metadata(6, 6, 100));
    }

    @Test
    @DisplayName("Should fail when a required section has no data")
    void shouldFailOnMissingRequiredSection() {
        resume.setExperience(List.of());

        DataBindingResult result = bind(null);

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly(new BindingError(DataBindingResult.REQUIRED_FIELD_MISSING,
                "Required section is missing: Work Experience", "section", "experience"));
        assertThat(result.data()).doesNotContainKey("experience");
        assertThat(result.metadata().dataCompleteness()).isEqualTo(67);
    }

    @Test
    @DisplayName("Should warn when an optional section has no data")
    void shouldWarnOnMissingOptionalSection() {
        resume.setSummary("  ");

        DataBindingResult result = bind(null);

        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.message()).isEqualTo("Optional section is missing: Professional Summary");
            assertThat(warning.impact()).isEqualTo("Section will be omitted");
        });
    }

    @Test
    @DisplayName("Should report required fields per list item")
    void shouldCheckListItems() {
        resume.setExperience(List.of(
                ResumeData.Experience.builder().title("Engineer").company("Babbage & Co").build(),
                ResumeData.Experience.builder().title("Analyst").build()));

        DataBindingResult result = bind(null);

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).extracting(BindingError::field).containsExactly("[1].company");
        assertThat(result.errors().get(0).message()).isEqualTo("Required field is missing: Company");
    }

    @Test
    @DisplayName("Should report validation rule failures without failing the binding")
    void shouldApplyValidationRules() {
        FieldDefinition email = template.getSections().get(0).getFields().get(1);
        email.setValidation(List.of(
                new ValidationRule(ValidationRule.Type.PATTERN, "^[^@]+@corp\\.example$", "Email must be a corporate address"),
                new ValidationRule(ValidationRule.Type.MAX_LENGTH, "64", null)));

        DataBindingResult result = bind(null);

        assertThat(result.success()).isTrue();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(DataBindingResult.FIELD_VALIDATION_ERROR);
            assertThat(error.message()).isEqualTo("Email must be a corporate address");
            assertThat(error.field()).isEqualTo("email");
        });
    }

    @Test
    @DisplayName("Should treat an invalid pattern as passing")
    void shouldIgnoreInvalidPattern() {
        FieldDefinition email = template.getSections().get(0).getFields().get(1);
        email.setValidation(List.of(new ValidationRule(ValidationRule.Type.PATTERN, "([unclosed", null)));

        assertThat(bind(null).errors()).isEmpty();
    }

    @Test
    @DisplayName("Should skip sections the customization hides")
    void shouldSkipHiddenSections() {
        Map<String, SectionConfig> sections = new LinkedHashMap<>();
        sections.put("skills", SectionConfig.builder().id("skills").name("Skills").visible(false).build());
        TemplateCustomization customization = TemplateCustomization.builder()
                .sectionVisibility(new SectionVisibility(sections))
                .build();

        DataBindingResult result = bind(customization);

        assertThat(result.data()).doesNotContainKey("skills");
        assertThat(result.metadata().totalFields()).isEqualTo(5);
    }
}
