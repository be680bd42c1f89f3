package dev.catananti.resumeengine.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kind of content a template section renders, and where its data lives in {@link ResumeData}.
 */
public enum SectionType {
    PERSONAL_INFO("personal-info", "personalInfo"),
    SUMMARY("summary", "summary"),
    EXPERIENCE("experience", "experience"),
    EDUCATION("education", "education"),
    SKILLS("skills", "skills"),
    CERTIFICATIONS("certifications", "certifications"),
    PROJECTS("projects", "projects"),
    LANGUAGES("languages", "languages"),
    /** Data is looked up under the section id. */
    CUSTOM("custom", null);

    private final String value;
    private final String dataPath;

    SectionType(String value, String dataPath) {
        this.value = value;
        this.dataPath = dataPath;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDataPath() {
        return dataPath;
    }

    @JsonCreator
    public static SectionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElse(CUSTOM);
    }
}
