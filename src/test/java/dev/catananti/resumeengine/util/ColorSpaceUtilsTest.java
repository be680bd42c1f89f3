package dev.catananti.resumeengine.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ColorSpaceUtils")
class ColorSpaceUtilsTest {

    @Nested
    @DisplayName("isValidHex")
    class IsValidHex {

        @ParameterizedTest
        @ValueSource(strings = {"#000000", "#FFFFFF", "#2563eb", "#A0b1C2"})
        @DisplayName("Should accept six-digit hex colors")
        void shouldAcceptSixDigitHex(String color) {
            assertThat(ColorSpaceUtils.isValidHex(color)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "#fff", "000000", "#gggggg", "#12345", "#1234567", "rgb(0,0,0)"})
        @DisplayName("Should reject anything else")
        void shouldRejectMalformed(String color) {
            assertThat(ColorSpaceUtils.isValidHex(color)).isFalse();
        }

        @Test
        @DisplayName("Should reject null")
        void shouldRejectNull() {
            assertThat(ColorSpaceUtils.isValidHex(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Conversions")
    class Conversions {

        @Test
        @DisplayName("Should convert hex to RGB components")
        void shouldConvertHexToRgb() {
            assertThat(ColorSpaceUtils.hexToRgb("#2563eb")).containsExactly(0x25, 0x63, 0xeb);
        }

        @Test
        @DisplayName("Should render RGB as lowercase hex")
        void shouldRenderLowercaseHex() {
            assertThat(ColorSpaceUtils.rgbToHex(255, 140, 0)).isEqualTo("#ff8c00");
        }

        @Test
        @DisplayName("Should throw on malformed hex")
        void shouldThrowOnMalformedHex() {
            assertThatThrownBy(() -> ColorSpaceUtils.hexToRgb("blue"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should convert pure red to HSL and back")
        void shouldConvertRedThroughHsl() {
            int[] hsl = ColorSpaceUtils.hexToHsl("#ff0000");

            assertThat(hsl).containsExactly(0, 100, 50);
            assertThat(ColorSpaceUtils.hslToHex(hsl[0], hsl[1], hsl[2])).isEqualTo("#ff0000");
        }

        @Test
        @DisplayName("Should report zero saturation for grays")
        void shouldReportZeroSaturationForGrays() {
            int[] hsl = ColorSpaceUtils.hexToHsl("#808080");

            assertThat(hsl[1]).isZero();
            assertThat(hsl[2]).isEqualTo(50);
        }
    }

    @Nested
    @DisplayName("Luminance and contrast")
    class LuminanceAndContrast {

        @Test
        @DisplayName("Should give black zero and white one luminance")
        void shouldBoundLuminance() {
            assertThat(ColorSpaceUtils.relativeLuminance("#000000")).isCloseTo(0.0, within(1e-9));
            assertThat(ColorSpaceUtils.relativeLuminance("#ffffff")).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("Should give 21:1 contrast for black on white regardless of order")
        void shouldComputeMaximumContrast() {
            assertThat(ColorSpaceUtils.contrastRatio("#000000", "#ffffff")).isCloseTo(21.0, within(1e-6));
            assertThat(ColorSpaceUtils.contrastRatio("#ffffff", "#000000")).isCloseTo(21.0, within(1e-6));
        }

        @Test
        @DisplayName("Should give 1:1 contrast for identical colors")
        void shouldComputeMinimumContrast() {
            assertThat(ColorSpaceUtils.contrastRatio("#2563eb", "#2563eb")).isCloseTo(1.0, within(1e-9));
        }
    }
}
