package dev.catananti.resumeengine.service.customization;

import dev.catananti.resumeengine.dto.AccessibilityInfo;
import dev.catananti.resumeengine.dto.ColorRelation;
import dev.catananti.resumeengine.dto.ColorRole;
import dev.catananti.resumeengine.dto.ColorScheme;
import dev.catananti.resumeengine.dto.ColorStates;
import dev.catananti.resumeengine.exception.TemplateValidationException;
import dev.catananti.resumeengine.util.ColorSpaceUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ColorThemeService")
class ColorThemeServiceTest {

    private ColorThemeService colorThemeService;

    @BeforeEach
    void setUp() {
        colorThemeService = new ColorThemeService();
    }

    @Nested
    @DisplayName("isAtsSafe")
    class IsAtsSafe {

        @ParameterizedTest
        @ValueSource(strings = {"#050505", "#101010", "#fefefe", "#fafafa", "#ffff00"})
        @DisplayName("Should reject unlisted colors outside the luminance band")
        void shouldRejectOutsideLuminanceBand(String color) {
            double luminance = ColorSpaceUtils.relativeLuminance(color);
            assertThat(luminance < 0.1 || luminance > 0.9).isTrue();

            assertThat(colorThemeService.isAtsSafe(color)).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {"#2563eb", "#808080", "#16a34a"})
        @DisplayName("Should accept colors inside the luminance band")
        void shouldAcceptInsideBand(String color) {
            assertThat(colorThemeService.isAtsSafe(color)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"#000000", "#ffffff", "#1a1a1a", "#FFFFFF"})
        @DisplayName("Should accept allow-listed colors even outside the band")
        void shouldAcceptAllowListed(String color) {
            assertThat(colorThemeService.isAtsSafe(color)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"blue", "#fff", "", "#12345g"})
        @DisplayName("Should reject malformed colors")
        void shouldRejectMalformed(String color) {
            assertThat(colorThemeService.isAtsSafe(color)).isFalse();
        }
    }

    @Nested
    @DisplayName("Predefined themes")
    class PredefinedThemes {

        @Test
        @DisplayName("Should expose nine themes with every role set")
        void shouldExposeNineThemes() {
            Map<String, ColorScheme> themes = colorThemeService.getPredefinedThemes();

            assertThat(themes).hasSize(9).containsKeys("executive", "modern_blue", "creative_orange");
            themes.values().forEach(theme -> {
                for (ColorRole role : ColorRole.values()) {
                    assertThat(ColorSpaceUtils.isValidHex(theme.get(role))).as(theme.getName() + " " + role).isTrue();
                }
            });
        }

        @Test
        @DisplayName("Should hand out copies")
        void shouldHandOutCopies() {
            ColorScheme first = colorThemeService.getPredefinedTheme("executive").orElseThrow();
            first.setPrimary("#ff0000");

            assertThat(colorThemeService.getPredefinedTheme("executive").orElseThrow().getPrimary())
                    .isEqualTo("#1a1a1a");
        }

        @Test
        @DisplayName("Should return empty for unknown theme")
        void shouldReturnEmptyForUnknownTheme() {
            assertThat(colorThemeService.getPredefinedTheme("neon")).isEmpty();
        }
    }

    @Nested
    @DisplayName("createCustomTheme")
    class CreateCustomTheme {

        @Test
        @DisplayName("Should apply safe overrides and drop unsafe ones")
        void shouldApplyOnlySafeOverrides() {
            ColorScheme scheme = colorThemeService.createCustomTheme(
                    Map.of(ColorRole.ACCENT, "#16a34a", ColorRole.LINK, "#ffff00"), "Brand");

            assertThat(scheme.getName()).isEqualTo("Brand");
            assertThat(scheme.getAccent()).isEqualTo("#16a34a");
            assertThat(scheme.getLink()).isEqualTo("#2563eb");
        }
    }

    @Nested
    @DisplayName("generateHarmoniousColors")
    class GenerateHarmoniousColors {

        @ParameterizedTest
        @EnumSource(ColorRelation.class)
        @DisplayName("Should return at most five colors, all ATS-safe")
        void shouldReturnSafeColors(ColorRelation relation) {
            List<String> colors = colorThemeService.generateHarmoniousColors("#2563eb", relation);

            assertThat(colors).hasSizeLessThanOrEqualTo(5);
            assertThat(colors).allSatisfy(color -> assertThat(colorThemeService.isAtsSafe(color)).isTrue());
        }

        @Test
        @DisplayName("Should reject an unsafe base color")
        void shouldRejectUnsafeBase() {
            assertThatThrownBy(() -> colorThemeService.generateHarmoniousColors("#ffff00", ColorRelation.TRIADIC))
                    .isInstanceOf(TemplateValidationException.class);
        }
    }

    @Nested
    @DisplayName("Accessibility")
    class Accessibility {

        @Test
        @DisplayName("Should rate black on white as AAA")
        void shouldRateBlackOnWhite() {
            AccessibilityInfo info = colorThemeService.getColorAccessibilityInfo("#000000", "#ffffff");

            assertThat(info.getContrastRatio()).isEqualTo(21.0);
            assertThat(info.isWcagAA()).isTrue();
            assertThat(info.isWcagAAA()).isTrue();
            assertThat(info.getRecommendation()).startsWith("Excellent contrast");
        }

        @Test
        @DisplayName("Should rate light gray on white as poor")
        void shouldRatePoorContrast() {
            AccessibilityInfo info = colorThemeService.getColorAccessibilityInfo("#d9d9d9", "#ffffff");

            assertThat(info.isWcagAA()).isFalse();
            assertThat(info.getRecommendation()).startsWith("Poor contrast");
        }

        @Test
        @DisplayName("Should reject malformed input")
        void shouldRejectMalformedInput() {
            assertThatThrownBy(() -> colorThemeService.getColorAccessibilityInfo("black", "#ffffff"))
                    .isInstanceOf(TemplateValidationException.class);
        }

        @Test
        @DisplayName("Should derive color states around the base color")
        void shouldDeriveColorStates() {
            ColorStates states = colorThemeService.createColorStates("#2563eb");

            assertThat(states.getNormal()).isEqualTo("#2563eb");
            assertThat(ColorSpaceUtils.relativeLuminance(states.getLight()))
                    .isGreaterThan(ColorSpaceUtils.relativeLuminance(states.getDark()));
        }
    }

    @Nested
    @DisplayName("optimizeForAts")
    class OptimizeForAts {

        @Test
        @DisplayName("Should replace light primary, dark background and low-contrast accent")
        void shouldReplaceUnsafeRoles() {
            ColorScheme scheme = colorThemeService.getPredefinedTheme("executive").orElseThrow().toBuilder()
                    .primary("#f0f0f0")
                    .background("#1a1a1a")
                    .accent("#f0f0f0")
                    .build();

            ColorScheme optimized = colorThemeService.optimizeForAts(scheme);

            assertThat(optimized.getPrimary()).isEqualTo("#1a1a1a");
            assertThat(optimized.getBackground()).isEqualTo("#ffffff");
            assertThat(optimized.getAccent()).isEqualTo("#2563eb");
        }

        @Test
        @DisplayName("Should be idempotent")
        void shouldBeIdempotent() {
            ColorScheme scheme = colorThemeService.getPredefinedTheme("creative_orange").orElseThrow().toBuilder()
                    .primary("#ffff00")
                    .background("#000000")
                    .accent("#fefefe")
                    .build();

            ColorScheme once = colorThemeService.optimizeForAts(scheme);
            ColorScheme twice = colorThemeService.optimizeForAts(once);

            assertThat(twice).isEqualTo(once);
        }

        @Test
        @DisplayName("Should leave the input untouched")
        void shouldNotMutateInput() {
            ColorScheme scheme = colorThemeService.getPredefinedTheme("executive").orElseThrow().toBuilder()
                    .primary("#f0f0f0")
                    .build();

            colorThemeService.optimizeForAts(scheme);

            assertThat(scheme.getPrimary()).isEqualTo("#f0f0f0");
        }
    }

    @Test
    @DisplayName("Should only ship predefined themes whose every role is ATS-safe")
    void shouldShipSafePredefinedThemes() {
        Map<String, ColorScheme> themes = colorThemeService.getPredefinedThemes();

        assertThat(themes).hasSize(9);
        themes.forEach((id, theme) -> assertThat(ColorRole.values()).allSatisfy(role ->
                assertThat(colorThemeService.isAtsSafe(theme.get(role))).as(id + "." + role.getKey()).isTrue()));
    }

    @Nested
    @DisplayName("replaceUnsafeRoles")
    class ReplaceUnsafeRoles {

        @Test
        @DisplayName("Should keep safe roles and fill the rest from the default theme")
        void shouldReplaceOnlyUnsafeRoles() {
            ColorScheme scheme = ColorScheme.builder()
                    .name("Imported")
                    .primary("#1e3a8a")
                    .secondary("#ffff00")
                    .accent("teal")
                    .build();

            ColorScheme repaired = colorThemeService.replaceUnsafeRoles(scheme);

            assertThat(repaired.getName()).isEqualTo("Imported");
            assertThat(repaired.getPrimary()).isEqualTo("#1e3a8a");
            assertThat(repaired.getSecondary()).isEqualTo("#4a4a4a");
            assertThat(repaired.getAccent()).isEqualTo("#2c5aa0");
            assertThat(repaired.getBackground()).isEqualTo("#ffffff");
            assertThat(scheme.getSecondary()).isEqualTo("#ffff00");
        }
    }
}
