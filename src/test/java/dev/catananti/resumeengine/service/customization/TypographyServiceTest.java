package dev.catananti.resumeengine.service.customization;

import dev.catananti.resumeengine.dto.FontCategory;
import dev.catananti.resumeengine.dto.FontRole;
import dev.catananti.resumeengine.dto.FontRoleSettings;
import dev.catananti.resumeengine.dto.ReadabilityScore;
import dev.catananti.resumeengine.dto.TypographySettings;
import dev.catananti.resumeengine.exception.TemplateValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TypographyService")
class TypographyServiceTest {

    private TypographyService typographyService;

    @BeforeEach
    void setUp() {
        typographyService = new TypographyService();
    }

    @Nested
    @DisplayName("Font catalogue")
    class FontCatalogue {

        @Test
        @DisplayName("Should list eleven ATS-safe fonts across three categories")
        void shouldListAtsSafeFonts() {
            assertThat(typographyService.getAtsSafeFonts()).hasSize(11);
            assertThat(typographyService.getAtsSafeFonts(FontCategory.SERIF)).hasSize(4);
            assertThat(typographyService.getAtsSafeFonts(FontCategory.SANS_SERIF)).hasSize(5);
            assertThat(typographyService.getAtsSafeFonts(FontCategory.MONOSPACE)).hasSize(2);
        }

        @Test
        @DisplayName("Should only accept monospace fonts for the monospace role")
        void shouldSeparateMonospace() {
            assertThat(typographyService.isValidFont("Georgia")).isTrue();
            assertThat(typographyService.isValidFont("Consolas")).isFalse();
            assertThat(typographyService.isValidMonospaceFont("Consolas")).isTrue();
            assertThat(typographyService.isAllowedFor(FontRole.MONOSPACE, "Arial")).isFalse();
        }

        @Test
        @DisplayName("Should fall back to the Times New Roman stack for unknown fonts")
        void shouldFallBackForUnknownFont() {
            assertThat(typographyService.getFontStack("Arial")).isEqualTo("Arial, Helvetica, sans-serif");
            assertThat(typographyService.getFontStack("Comic Sans MS")).isEqualTo("\"Times New Roman\", Times, serif");
            assertThat(typographyService.getFontCategory("Comic Sans MS")).isEmpty();
        }
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("Should discard a disallowed family and keep the base one")
        void shouldDiscardDisallowedFamily() {
            TypographySettings overrides = TypographySettings.builder()
                    .heading(FontRoleSettings.builder().fontFamily("Papyrus").fontWeight(700).build())
                    .build();

            TypographySettings merged = typographyService.createCustomTypography(overrides);

            assertThat(merged.getHeading().getFontFamily()).isEqualTo("Arial");
            assertThat(merged.getHeading().getFontWeight()).isEqualTo(700);
        }

        @Test
        @DisplayName("Should merge individual size keys")
        void shouldMergeSizeKeys() {
            TypographySettings overrides = TypographySettings.builder()
                    .heading(FontRoleSettings.builder().fontSize(Map.of("h1", 24.0)).build())
                    .build();

            TypographySettings merged = typographyService.createCustomTypography(overrides);

            assertThat(merged.getHeading().size("h1")).isEqualTo(24.0);
            assertThat(merged.getHeading().size("h2")).isEqualTo(20.0);
        }

        @Test
        @DisplayName("Should not mutate the base settings")
        void shouldNotMutateBase() {
            TypographySettings base = typographyService.defaultTypography();
            TypographySettings overrides = TypographySettings.builder()
                    .body(FontRoleSettings.builder().fontFamily("Verdana").build())
                    .build();

            typographyService.merge(base, overrides);

            assertThat(base.getBody().getFontFamily()).isEqualTo("Arial");
        }
    }

    @ParameterizedTest
    @CsvSource({
            "HEADING, 11, true", "HEADING, 32, true", "HEADING, 33, false",
            "BODY, 8, true", "BODY, 7.5, false", "BODY, 18, true",
            "ACCENT, 10, true", "MONOSPACE, 17, false"
    })
    @DisplayName("Should validate font sizes against the role's range")
    void shouldValidateFontSize(FontRole role, double size, boolean valid) {
        assertThat(typographyService.validateFontSize(size, role)).isEqualTo(valid);
    }

    @Nested
    @DisplayName("calculateReadabilityScore")
    class Readability {

        @Test
        @DisplayName("Should score the default typography near the top")
        void shouldScoreDefaults() {
            ReadabilityScore score = typographyService.calculateReadabilityScore(typographyService.defaultTypography());

            assertThat(score.getScore()).isEqualTo(99);
            assertThat(score.getFactors().getFontFamily()).isEqualTo(94);
            assertThat(score.getRecommendations()).isEmpty();
        }

        @Test
        @DisplayName("Should recommend changes for small tight text")
        void shouldRecommendForPoorSettings() {
            TypographySettings cramped = typographyService.createCustomTypography(TypographySettings.builder()
                    .body(FontRoleSettings.builder().fontSize(Map.of("normal", 8.0)).lineHeight(1.0).build())
                    .build());

            ReadabilityScore score = typographyService.calculateReadabilityScore(cramped);

            assertThat(score.getScore()).isLessThan(80);
            assertThat(score.getRecommendations()).hasSize(2);
        }
    }

    @Test
    @DisplayName("Should return empty settings for an unknown industry")
    void shouldReturnEmptyForUnknownIndustry() {
        TypographySettings settings = typographyService.getIndustryRecommendations("astrology");

        assertThat(settings.getHeading()).isNull();
        assertThat(settings.getBody()).isNull();
        assertThat(typographyService.getIndustryRecommendations("Tech").getMonospace().getFontFamily())
                .isEqualTo("Consolas");
    }

    @Test
    @DisplayName("Should apply a professional combination by name")
    void shouldApplyCombination() {
        TypographySettings settings = typographyService.applyProfessionalCombination("Executive Elegance");

        assertThat(settings.getHeading().getFontFamily()).isEqualTo("Georgia");
        assertThat(settings.getBody().getFontFamily()).isEqualTo("Arial");
        assertThat(settings.getMonospace().getFontFamily()).isEqualTo("Courier New");
    }

    @Test
    @DisplayName("Should reject an unknown combination name")
    void shouldRejectUnknownCombination() {
        assertThatThrownBy(() -> typographyService.applyProfessionalCombination("Comic Relief"))
                .isInstanceOf(TemplateValidationException.class);
    }

    @Test
    @DisplayName("Should generate CSS with point sizes")
    void shouldGenerateCss() {
        String css = typographyService.generateCss(typographyService.defaultTypography());

        assertThat(css).startsWith("/* Typography Styles */");
        assertThat(css).contains("font-size: 28pt");
        assertThat(css).contains(".code, .tech-skills {");
    }
}
