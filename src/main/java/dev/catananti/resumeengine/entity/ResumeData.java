package dev.catananti.resumeengine.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The user's resume content. Read-only input to data binding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeData {
    private String id;
    private String userId;
    private PersonalInfo personalInfo;
    private String summary;
    @Builder.Default
    private List<Experience> experience = new ArrayList<>();
    @Builder.Default
    private List<Education> education = new ArrayList<>();
    @Builder.Default
    private List<String> skills = new ArrayList<>();
    @Builder.Default
    private List<Certification> certifications = new ArrayList<>();
    @Builder.Default
    private List<Project> projects = new ArrayList<>();
    @Builder.Default
    private List<String> languages = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PersonalInfo {
        private String fullName;
        private String title;
        private String email;
        private String phone;
        private String location;
        private String linkedin;
        private String website;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Experience {
        private String title;
        private String company;
        private String location;
        private String startDate;
        private String endDate;
        private boolean current;
        private String description;
        @Builder.Default
        private List<String> achievements = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Education {
        private String degree;
        private String institution;
        private String location;
        private String graduationDate;
        private String gpa;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Certification {
        private String name;
        private String issuer;
        private String date;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Project {
        private String name;
        private String description;
        private String url;
    }
}
