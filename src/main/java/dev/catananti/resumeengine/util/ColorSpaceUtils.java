package dev.catananti.resumeengine.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Color space conversion utilities and WCAG luminance/contrast metrics.
 * <p>
 * Colors are 6-digit hex strings ({@code #rrggbb}). HSL values are whole numbers:
 * hue in degrees [0, 360), saturation and lightness in percent [0, 100].
 */
public final class ColorSpaceUtils {

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private ColorSpaceUtils() {}

    public static boolean isValidHex(String color) {
        return color != null && HEX_COLOR.matcher(color).matches();
    }

    /**
     * Parse {@code #rrggbb} into [r, g, b] (0–255).
     *
     * @throws IllegalArgumentException if the color is malformed
     */
    public static int[] hexToRgb(String hex) {
        if (!isValidHex(hex)) {
            throw new IllegalArgumentException("Invalid hex color: " + hex);
        }
        int value = Integer.parseInt(hex.substring(1), 16);
        return new int[]{(value >> 16) & 0xff, (value >> 8) & 0xff, value & 0xff};
    }

    public static String rgbToHex(int r, int g, int b) {
        return String.format(Locale.ROOT, "#%02x%02x%02x", clampChannel(r), clampChannel(g), clampChannel(b));
    }

    /**
     * WCAG 2.0 relative luminance, in [0.0, 1.0].
     */
    public static double relativeLuminance(String hex) {
        int[] rgb = hexToRgb(hex);
        return relativeLuminance(rgb[0], rgb[1], rgb[2]);
    }

    public static double relativeLuminance(int r, int g, int b) {
        return 0.2126 * linearize(r / 255.0)
             + 0.7152 * linearize(g / 255.0)
             + 0.0722 * linearize(b / 255.0);
    }

    /**
     * WCAG contrast ratio (L1 + 0.05) / (L2 + 0.05) with L1 the lighter color. Range [1, 21].
     */
    public static double contrastRatio(String first, String second) {
        double l1 = relativeLuminance(first);
        double l2 = relativeLuminance(second);
        double lighter = Math.max(l1, l2);
        double darker = Math.min(l1, l2);
        return (lighter + 0.05) / (darker + 0.05);
    }

    /**
     * Convert {@code #rrggbb} to rounded [h, s, l].
     */
    public static int[] hexToHsl(String hex) {
        int[] rgb = hexToRgb(hex);
        double r = rgb[0] / 255.0;
        double g = rgb[1] / 255.0;
        double b = rgb[2] / 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double l = (max + min) / 2.0;
        double h = 0;
        double s = 0;

        if (max != min) {
            double d = max - min;
            s = l > 0.5 ? d / (2.0 - max - min) : d / (max + min);
            if (max == r) {
                h = (g - b) / d + (g < b ? 6 : 0);
            } else if (max == g) {
                h = (b - r) / d + 2;
            } else {
                h = (r - g) / d + 4;
            }
            h /= 6.0;
        }
        return new int[]{(int) Math.round(h * 360), (int) Math.round(s * 100), (int) Math.round(l * 100)};
    }

    public static String hslToHex(double h, double s, double l) {
        double hue = h / 360.0;
        double sat = s / 100.0;
        double light = l / 100.0;
        double r;
        double g;
        double b;

        if (sat == 0) {
            r = g = b = light;
        } else {
            double q = light < 0.5 ? light * (1 + sat) : light + sat - light * sat;
            double p = 2 * light - q;
            r = hueToChannel(p, q, hue + 1.0 / 3);
            g = hueToChannel(p, q, hue);
            b = hueToChannel(p, q, hue - 1.0 / 3);
        }
        return rgbToHex((int) Math.round(r * 255), (int) Math.round(g * 255), (int) Math.round(b * 255));
    }

    private static double hueToChannel(double p, double q, double t) {
        if (t < 0) t += 1;
        if (t > 1) t -= 1;
        if (t < 1.0 / 6) return p + (q - p) * 6 * t;
        if (t < 1.0 / 2) return q;
        if (t < 2.0 / 3) return p + (q - p) * (2.0 / 3 - t) * 6;
        return p;
    }

    private static double linearize(double c) {
        return c <= 0.03928 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static int clampChannel(int value) {
        return Math.max(0, Math.min(255, value));
    }
}
