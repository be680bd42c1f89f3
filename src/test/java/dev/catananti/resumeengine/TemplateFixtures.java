package dev.catananti.resumeengine;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.resumeengine.entity.FieldDefinition;
import dev.catananti.resumeengine.entity.ResumeData;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.entity.SectionDefinition;
import dev.catananti.resumeengine.entity.SectionType;
import dev.catananti.resumeengine.entity.TemplateLayout;

import java.util.List;
import java.util.Map;

/**
 * Shared template and resume samples for tests.
 */
public final class TemplateFixtures {

    private TemplateFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    public static ResumeTemplate template() {
        return ResumeTemplate.builder()
                .id("modern-professional")
                .name("Modern Professional")
                .version("2.1")
                .layout(TemplateLayout.builder().build())
                .thumbnailUrl("https://cdn.example.com/templates/modern-professional.png")
                .sections(List.of(
                        SectionDefinition.builder()
                                .id("contact")
                                .name("Contact Information")
                                .type(SectionType.PERSONAL_INFO)
                                .required(true)
                                .fields(List.of(
                                        field("fullName", "Full Name", true),
                                        field("email", "Email", true)))
                                .build(),
                        SectionDefinition.builder()
                                .id("summary")
                                .name("Professional Summary")
                                .type(SectionType.SUMMARY)
                                .build(),
                        SectionDefinition.builder()
                                .id("experience")
                                .name("Work Experience")
                                .type(SectionType.EXPERIENCE)
                                .required(true)
                                .fields(List.of(
                                        field("title", "Job Title", true),
                                        field("company", "Company", true)))
                                .styling(Map.of("border-top", "1px solid #e5e7eb"))
                                .build(),
                        SectionDefinition.builder()
                                .id("skills")
                                .name("Skills")
                                .type(SectionType.SKILLS)
                                .build()))
                .build();
    }

    public static ResumeData resume() {
        return ResumeData.builder()
                .id("resume-42")
                .userId("user-7")
                .personalInfo(ResumeData.PersonalInfo.builder()
                        .fullName("Ada Lovelace")
                        .title("Staff Engineer")
                        .email("ada@example.com")
                        .phone("+44 20 7946 0000")
                        .location("London")
                        .build())
                .summary("Engineer with fifteen years of experience building analytical engines.")
                .experience(List.of(ResumeData.Experience.builder()
                        .title("Staff Engineer")
                        .company("Analytical Engines Ltd")
                        .location("London")
                        .startDate("2019-01")
                        .current(true)
                        .description("Leads the compiler team.")
                        .achievements(List.of("Cut build times by 40%", "Mentored six engineers"))
                        .build()))
                .skills(List.of("Java", "Reactor", "Spring Boot"))
                .build();
    }

    private static FieldDefinition field(String id, String name, boolean required) {
        return FieldDefinition.builder().id(id).name(name).required(required).build();
    }
}
