package dev.catananti.resumeengine.service.customization;

import dev.catananti.resumeengine.dto.AccessibilityInfo;
import dev.catananti.resumeengine.dto.ColorRelation;
import dev.catananti.resumeengine.dto.ColorRole;
import dev.catananti.resumeengine.dto.ColorScheme;
import dev.catananti.resumeengine.dto.ColorStates;
import dev.catananti.resumeengine.exception.TemplateValidationException;
import dev.catananti.resumeengine.util.ColorSpaceUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Professional color palettes with ATS-safety validation and contrast scoring.
 * Stateless; every operation returns new values.
 */
@Service
@Slf4j
public class ColorThemeService {

    public static final String DEFAULT_THEME = "executive";

    static final String SAFE_DARK_PRIMARY = "#1a1a1a";
    static final String SAFE_BACKGROUND = "#ffffff";
    static final String SAFE_ACCENT = "#2563eb";

    private static final double MIN_SAFE_LUMINANCE = 0.1;
    private static final double MAX_SAFE_LUMINANCE = 0.9;

    private static final Map<String, ColorScheme> PREDEFINED_THEMES = new LinkedHashMap<>();

    static {
        PREDEFINED_THEMES.put("executive", theme("Executive", "#1a1a1a", "#4a4a4a", "#2c5aa0", "#1a1a1a", "#6b7280", "#e5e7eb", "#f3f4f6", "#2563eb"));
        PREDEFINED_THEMES.put("corporate", theme("Corporate", "#0f172a", "#334155", "#0ea5e9", "#0f172a", "#64748b", "#e2e8f0", "#f8fafc", "#0284c7"));
        PREDEFINED_THEMES.put("minimal", theme("Minimal", "#111827", "#374151", "#6366f1", "#111827", "#6b7280", "#f3f4f6", "#f9fafb", "#4f46e5"));
        PREDEFINED_THEMES.put("leadership", theme("Leadership", "#1e293b", "#475569", "#7c3aed", "#1e293b", "#64748b", "#e2e8f0", "#f8fafc", "#6d28d9"));
        PREDEFINED_THEMES.put("modern_blue", theme("Modern Blue", "#1e3a8a", "#3730a3", "#3b82f6", "#1e293b", "#64748b", "#e2e8f0", "#eff6ff", "#2563eb"));
        PREDEFINED_THEMES.put("modern_green", theme("Modern Green", "#14532d", "#166534", "#22c55e", "#1e293b", "#64748b", "#e2e8f0", "#f0fdf4", "#16a34a"));
        PREDEFINED_THEMES.put("modern_purple", theme("Modern Purple", "#581c87", "#6b21a8", "#a855f7", "#1e293b", "#64748b", "#e2e8f0", "#faf5ff", "#9333ea"));
        PREDEFINED_THEMES.put("creative_teal", theme("Creative Teal", "#134e4a", "#0f766e", "#14b8a6", "#1e293b", "#64748b", "#e2e8f0", "#f0fdfa", "#0d9488"));
        PREDEFINED_THEMES.put("creative_orange", theme("Creative Orange", "#7c2d12", "#9a3412", "#f97316", "#1e293b", "#64748b", "#e2e8f0", "#fff7ed", "#ea580c"));
    }

    private static final Set<String> CURATED_COLORS = Set.of(
            // neutrals
            "#000000", "#1a1a1a", "#2d2d2d", "#404040", "#525252", "#666666", "#7a7a7a", "#8d8d8d",
            "#a0a0a0", "#b3b3b3", "#c6c6c6", "#d9d9d9", "#e6e6e6", "#f0f0f0", "#ffffff",
            // blues
            "#000080", "#0000cd", "#1e3a8a", "#1e40af", "#2563eb", "#3b82f6", "#60a5fa", "#93bbfc",
            // greens
            "#006400", "#008000", "#14532d", "#166534", "#16a34a", "#22c55e", "#4ade80", "#86efac",
            // purples
            "#4b0082", "#6b21a8", "#7c3aed", "#8b5cf6", "#a78bfa", "#c4b5fd",
            // warm
            "#8b4513", "#a0522d", "#d2691e", "#ff8c00", "#ff6347", "#ff4500"
    );

    /** Curated colors plus every color of the predefined palettes. */
    private static final Set<String> ATS_SAFE_COLORS = allowList();

    private static Set<String> allowList() {
        Set<String> colors = new HashSet<>(CURATED_COLORS);
        for (ColorScheme theme : PREDEFINED_THEMES.values()) {
            for (ColorRole role : ColorRole.values()) {
                colors.add(theme.get(role).toLowerCase());
            }
        }
        return Set.copyOf(colors);
    }

    private static ColorScheme theme(String name, String primary, String secondary, String accent, String text,
                                     String muted, String border, String highlight, String link) {
        return ColorScheme.builder()
                .name(name)
                .primary(primary)
                .secondary(secondary)
                .accent(accent)
                .background(SAFE_BACKGROUND)
                .text(text)
                .muted(muted)
                .border(border)
                .highlight(highlight)
                .link(link)
                .build();
    }

    public Optional<ColorScheme> getPredefinedTheme(String themeId) {
        ColorScheme theme = PREDEFINED_THEMES.get(themeId);
        return Optional.ofNullable(theme).map(ColorScheme::copy);
    }

    public Map<String, ColorScheme> getPredefinedThemes() {
        Map<String, ColorScheme> themes = new LinkedHashMap<>();
        PREDEFINED_THEMES.forEach((id, theme) -> themes.put(id, theme.copy()));
        return themes;
    }

    /**
     * A color is ATS-safe when it is on the curated allow-list, or a well-formed
     * {@code #rrggbb} whose relative luminance lies in [0.1, 0.9].
     */
    public boolean isAtsSafe(String color) {
        if (!ColorSpaceUtils.isValidHex(color)) {
            return false;
        }
        if (ATS_SAFE_COLORS.contains(color.toLowerCase())) {
            return true;
        }
        double luminance = ColorSpaceUtils.relativeLuminance(color);
        return luminance >= MIN_SAFE_LUMINANCE && luminance <= MAX_SAFE_LUMINANCE;
    }

    /**
     * Starts from the default theme and applies each override that is ATS-safe on its own.
     */
    public ColorScheme createCustomTheme(Map<ColorRole, String> overrides, String name) {
        ColorScheme scheme = PREDEFINED_THEMES.get(DEFAULT_THEME).copy();
        scheme.setName(name);
        for (Map.Entry<ColorRole, String> override : overrides.entrySet()) {
            if (isAtsSafe(override.getValue())) {
                scheme = scheme.with(override.getKey(), override.getValue());
            } else {
                log.debug("Dropping unsafe color override {}={}", override.getKey().getKey(), override.getValue());
            }
        }
        return scheme;
    }

    /**
     * Replaces every malformed, missing or unsafe role with the default theme's color for that role.
     */
    public ColorScheme replaceUnsafeRoles(ColorScheme scheme) {
        ColorScheme fallback = PREDEFINED_THEMES.get(DEFAULT_THEME);
        ColorScheme repaired = scheme.copy();
        for (ColorRole role : ColorRole.values()) {
            String color = repaired.get(role);
            if (!isAtsSafe(color)) {
                log.warn("Replacing unsafe {} color '{}' with {}", role.getKey(), color, fallback.get(role));
                repaired = repaired.with(role, fallback.get(role));
            }
        }
        if (repaired.getName() == null) {
            repaired.setName("Custom");
        }
        return repaired;
    }

    /**
     * Up to five ATS-safe colors related to {@code baseColor} by hue.
     *
     * @throws TemplateValidationException if the base color is not ATS-safe
     */
    public List<String> generateHarmoniousColors(String baseColor, ColorRelation relation) {
        requireSafe(baseColor);
        int[] hsl = ColorSpaceUtils.hexToHsl(baseColor);
        double offset = relation.getHueOffset();

        List<String> colors = new ArrayList<>();
        for (int i = -2; i <= 2; i++) {
            double hue = ((hsl[0] + i * offset / 3) % 360 + 360) % 360;
            double saturation = clamp(hsl[1] + i * 5, 20, 80);
            double lightness = clamp(hsl[2] + i * 5, 20, 80);
            String candidate = ColorSpaceUtils.hslToHex(hue, saturation, lightness);
            if (isAtsSafe(candidate)) {
                colors.add(candidate);
            }
        }
        return colors;
    }

    /**
     * Lightness variants of a base color for hover, border and background use.
     *
     * @throws TemplateValidationException if the base color is not ATS-safe
     */
    public ColorStates createColorStates(String baseColor) {
        requireSafe(baseColor);
        int[] hsl = ColorSpaceUtils.hexToHsl(baseColor);
        int h = hsl[0];
        int s = hsl[1];
        int l = hsl[2];
        return ColorStates.builder()
                .light(ColorSpaceUtils.hslToHex(h, s, Math.min(90, l + 20)))
                .normal(baseColor)
                .dark(ColorSpaceUtils.hslToHex(h, s, Math.max(10, l - 20)))
                .border(ColorSpaceUtils.hslToHex(h, s, Math.max(30, l - 40)))
                .background(ColorSpaceUtils.hslToHex(h, Math.min(10, s), Math.min(98, l + 35)))
                .build();
    }

    public AccessibilityInfo getColorAccessibilityInfo(String foreground, String background) {
        if (!ColorSpaceUtils.isValidHex(foreground) || !ColorSpaceUtils.isValidHex(background)) {
            throw new TemplateValidationException("Invalid color format",
                    Map.of("foreground", String.valueOf(foreground), "background", String.valueOf(background)));
        }
        double ratio = ColorSpaceUtils.contrastRatio(foreground, background);
        return AccessibilityInfo.builder()
                .contrastRatio(Math.round(ratio * 100) / 100.0)
                .wcagAA(ratio >= 4.5)
                .wcagAAA(ratio >= 7)
                .recommendation(contrastRecommendation(ratio))
                .build();
    }

    /**
     * Forces the primary, background and accent roles into ranges that parse and print reliably.
     * Applying it to its own output changes nothing.
     */
    public ColorScheme optimizeForAts(ColorScheme scheme) {
        ColorScheme optimized = scheme.copy();

        if (!ColorSpaceUtils.isValidHex(optimized.getPrimary())
                || ColorSpaceUtils.relativeLuminance(optimized.getPrimary()) > 0.5) {
            optimized.setPrimary(SAFE_DARK_PRIMARY);
        }
        if (!ColorSpaceUtils.isValidHex(optimized.getBackground())
                || ColorSpaceUtils.relativeLuminance(optimized.getBackground()) < 0.8) {
            optimized.setBackground(SAFE_BACKGROUND);
        }
        if (!ColorSpaceUtils.isValidHex(optimized.getAccent())
                || ColorSpaceUtils.contrastRatio(optimized.getAccent(), optimized.getBackground()) < 3.0) {
            optimized.setAccent(SAFE_ACCENT);
        }
        return optimized;
    }

    private void requireSafe(String color) {
        if (!isAtsSafe(color)) {
            throw new TemplateValidationException("Base color is not ATS-safe",
                    Map.of("color", String.valueOf(color)));
        }
    }

    private static String contrastRecommendation(double ratio) {
        if (ratio < 3) {
            return "Poor contrast - not suitable for text";
        }
        if (ratio < 4.5) {
            return "Low contrast - only suitable for large text";
        }
        if (ratio < 7) {
            return "Good contrast - meets WCAG AA standards";
        }
        return "Excellent contrast - meets WCAG AAA standards";
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
