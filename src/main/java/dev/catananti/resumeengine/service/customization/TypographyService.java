package dev.catananti.resumeengine.service.customization;

import dev.catananti.resumeengine.dto.FontCategory;
import dev.catananti.resumeengine.dto.FontCombination;
import dev.catananti.resumeengine.dto.FontInfo;
import dev.catananti.resumeengine.dto.FontRole;
import dev.catananti.resumeengine.dto.FontRoleSettings;
import dev.catananti.resumeengine.dto.ReadabilityScore;
import dev.catananti.resumeengine.dto.TypographySettings;
import dev.catananti.resumeengine.exception.TemplateValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static dev.catananti.resumeengine.util.CssUtils.number;

/**
 * ATS-safe font selection, readability scoring and typography CSS.
 */
@Service
@Slf4j
public class TypographyService {

    private static final String FALLBACK_STACK = "\"Times New Roman\", Times, serif";

    private static final List<FontInfo> SERIF_FONTS = List.of(
            new FontInfo("Times New Roman", "\"Times New Roman\", Times, serif", FontCategory.SERIF, 95),
            new FontInfo("Georgia", "Georgia, \"Times New Roman\", serif", FontCategory.SERIF, 93),
            new FontInfo("Garamond", "Garamond, \"Times New Roman\", serif", FontCategory.SERIF, 92),
            new FontInfo("Cambria", "Cambria, Georgia, serif", FontCategory.SERIF, 91)
    );

    private static final List<FontInfo> SANS_SERIF_FONTS = List.of(
            new FontInfo("Arial", "Arial, Helvetica, sans-serif", FontCategory.SANS_SERIF, 94),
            new FontInfo("Calibri", "Calibri, Arial, sans-serif", FontCategory.SANS_SERIF, 93),
            new FontInfo("Helvetica", "Helvetica, Arial, sans-serif", FontCategory.SANS_SERIF, 95),
            new FontInfo("Verdana", "Verdana, Arial, sans-serif", FontCategory.SANS_SERIF, 92),
            new FontInfo("Tahoma", "Tahoma, Arial, sans-serif", FontCategory.SANS_SERIF, 91)
    );

    private static final List<FontInfo> MONOSPACE_FONTS = List.of(
            new FontInfo("Courier New", "\"Courier New\", Courier, monospace", FontCategory.MONOSPACE, 88),
            new FontInfo("Consolas", "Consolas, \"Courier New\", monospace", FontCategory.MONOSPACE, 90)
    );

    private static final List<FontCombination> PROFESSIONAL_COMBINATIONS = List.of(
            new FontCombination("Corporate Classic", "Arial", "Arial", "Arial",
                    "Consistent, professional, and ATS-friendly"),
            new FontCombination("Executive Elegance", "Georgia", "Arial", "Georgia",
                    "Sophisticated headings with readable body text"),
            new FontCombination("Modern Minimal", "Helvetica", "Helvetica", "Helvetica",
                    "Clean, contemporary, and professional"),
            new FontCombination("Traditional Professional", "Times New Roman", "Arial", "Times New Roman",
                    "Classic combination for traditional industries"),
            new FontCombination("Contemporary Balance", "Calibri", "Calibri", "Calibri",
                    "Modern and widely accepted in business")
    );

    private static final Map<String, TypographySettings> INDUSTRY_RECOMMENDATIONS = Map.of(
            "finance", industry("Georgia", "Arial", null),
            "tech", industry("Arial", "Arial", "Consolas"),
            "healthcare", industry("Times New Roman", "Arial", null),
            "legal", industry("Times New Roman", "Georgia", null),
            "creative", industry("Helvetica", "Arial", null),
            "education", industry("Georgia", "Times New Roman", null)
    );

    private static TypographySettings industry(String heading, String body, String monospace) {
        return TypographySettings.builder()
                .heading(FontRoleSettings.builder().fontFamily(heading).fontWeight(600).build())
                .body(FontRoleSettings.builder().fontFamily(body).fontWeight(400).build())
                .monospace(monospace != null ? FontRoleSettings.builder().fontFamily(monospace).fontWeight(400).build() : null)
                .build();
    }

    public TypographySettings defaultTypography() {
        Map<String, Double> headingSizes = new LinkedHashMap<>();
        headingSizes.put("h1", 28.0);
        headingSizes.put("h2", 20.0);
        headingSizes.put("h3", 16.0);
        headingSizes.put("h4", 14.0);

        Map<String, Double> bodySizes = new LinkedHashMap<>();
        bodySizes.put("large", 16.0);
        bodySizes.put("normal", 12.0);
        bodySizes.put("small", 10.0);
        bodySizes.put("caption", 9.0);

        return TypographySettings.builder()
                .heading(new FontRoleSettings("Arial", 600, headingSizes, 1.2, 0.0))
                .body(new FontRoleSettings("Arial", 400, bodySizes, 1.4, 0.0))
                .accent(new FontRoleSettings("Arial", 500, new LinkedHashMap<>(Map.of("base", 14.0)), 1.4, 0.5))
                .monospace(new FontRoleSettings("Courier New", 400, new LinkedHashMap<>(Map.of("base", 11.0)), 1.3, 0.0))
                .build();
    }

    public List<FontInfo> getAtsSafeFonts() {
        return Stream.of(SERIF_FONTS, SANS_SERIF_FONTS, MONOSPACE_FONTS).flatMap(List::stream).toList();
    }

    public List<FontInfo> getAtsSafeFonts(FontCategory category) {
        return switch (category) {
            case SERIF -> SERIF_FONTS;
            case SANS_SERIF -> SANS_SERIF_FONTS;
            case MONOSPACE -> MONOSPACE_FONTS;
        };
    }

    public List<FontCombination> getProfessionalCombinations() {
        return PROFESSIONAL_COMBINATIONS;
    }

    /**
     * Defaults overlaid with {@code overrides}. See {@link #merge(TypographySettings, TypographySettings)}.
     */
    public TypographySettings createCustomTypography(TypographySettings overrides) {
        return merge(defaultTypography(), overrides);
    }

    /**
     * Overlays {@code overrides} onto {@code base} field by field. A font family outside the
     * role's allow-list is discarded and the base family kept; numeric fields are taken as given.
     */
    public TypographySettings merge(TypographySettings base, TypographySettings overrides) {
        TypographySettings merged = base.copy();
        if (overrides == null) {
            return merged;
        }
        for (FontRole role : FontRole.values()) {
            FontRoleSettings override = overrides.get(role);
            if (override == null) {
                continue;
            }
            FontRoleSettings accepted = override.copy();
            if (accepted.getFontFamily() != null && !isAllowedFor(role, accepted.getFontFamily())) {
                log.debug("Discarding non ATS-safe {} font family '{}'", role, accepted.getFontFamily());
                accepted.setFontFamily(null);
            }
            FontRoleSettings current = merged.get(role);
            merged.set(role, current != null ? current.merge(accepted) : accepted);
        }
        return merged;
    }

    /**
     * Heading, body and accent accept serif or sans-serif fonts; monospace only monospace fonts.
     */
    public boolean isAllowedFor(FontRole role, String fontFamily) {
        return role == FontRole.MONOSPACE ? isValidMonospaceFont(fontFamily) : isValidFont(fontFamily);
    }

    public boolean isValidFont(String fontName) {
        return Stream.concat(SERIF_FONTS.stream(), SANS_SERIF_FONTS.stream())
                .anyMatch(font -> font.name().equals(fontName));
    }

    public boolean isValidMonospaceFont(String fontName) {
        return MONOSPACE_FONTS.stream().anyMatch(font -> font.name().equals(fontName));
    }

    public Optional<FontInfo> findFont(String fontName) {
        return getAtsSafeFonts().stream().filter(font -> font.name().equals(fontName)).findFirst();
    }

    public String getFontStack(String fontName) {
        return findFont(fontName).map(FontInfo::stack).orElse(FALLBACK_STACK);
    }

    public Optional<FontCategory> getFontCategory(String fontName) {
        return findFont(fontName).map(FontInfo::category);
    }

    /**
     * Whether a point size is inside the ATS-friendly range for the role.
     */
    public boolean validateFontSize(double size, FontRole role) {
        return switch (role) {
            case HEADING -> size >= 11 && size <= 32;
            case BODY -> size >= 8 && size <= 18;
            case ACCENT, MONOSPACE -> size >= 10 && size <= 16;
        };
    }

    /**
     * Scores body text out of 100: size, line height and family each up to 25,
     * plus a fixed 25 for estimated contrast.
     */
    public ReadabilityScore calculateReadabilityScore(TypographySettings typography) {
        List<String> recommendations = new ArrayList<>();
        FontRoleSettings body = typography.getBody();

        double bodySize = body.size("normal");
        double fontSizeScore;
        if (bodySize >= 11 && bodySize <= 12) {
            fontSizeScore = 25;
        } else if (bodySize >= 10 && bodySize <= 14) {
            fontSizeScore = 20;
        } else {
            fontSizeScore = 10;
            recommendations.add("Consider using 11-12pt font size for optimal readability");
        }

        double lineHeight = body.getLineHeight() != null ? body.getLineHeight() : 0;
        double lineHeightScore;
        if (lineHeight >= 1.4 && lineHeight <= 1.6) {
            lineHeightScore = 25;
        } else if (lineHeight >= 1.2 && lineHeight <= 1.8) {
            lineHeightScore = 20;
        } else {
            lineHeightScore = 10;
            recommendations.add("Consider using 1.4-1.6 line height for better readability");
        }

        Optional<FontInfo> font = findFont(body.getFontFamily());
        double familyFactor;
        double familyScore;
        if (font.isPresent()) {
            familyFactor = font.get().readability();
            familyScore = familyFactor / 4;
        } else {
            familyFactor = 50;
            familyScore = 12.5;
            recommendations.add("Consider using an ATS-safe font family");
        }

        double contrastScore = 25;
        int score = (int) Math.round(fontSizeScore + lineHeightScore + familyScore + contrastScore);

        return ReadabilityScore.builder()
                .score(score)
                .factors(ReadabilityScore.Factors.builder()
                        .fontSize(fontSizeScore)
                        .lineHeight(lineHeightScore)
                        .fontFamily(familyFactor)
                        .contrast(contrastScore)
                        .build())
                .recommendations(recommendations)
                .build();
    }

    /**
     * Suggested family overrides for an industry keyword; empty settings when unknown.
     */
    public TypographySettings getIndustryRecommendations(String industry) {
        TypographySettings recommendation = industry == null ? null : INDUSTRY_RECOMMENDATIONS.get(industry.toLowerCase());
        return recommendation != null ? recommendation.copy() : new TypographySettings();
    }

    public TypographySettings applyProfessionalCombination(String combinationName) {
        FontCombination combination = PROFESSIONAL_COMBINATIONS.stream()
                .filter(c -> c.name().equals(combinationName))
                .findFirst()
                .orElseThrow(() -> new TemplateValidationException("Invalid combination name",
                        Map.of("combinationName", String.valueOf(combinationName))));

        return createCustomTypography(TypographySettings.builder()
                .heading(FontRoleSettings.builder().fontFamily(combination.heading()).build())
                .body(FontRoleSettings.builder().fontFamily(combination.body()).build())
                .accent(FontRoleSettings.builder().fontFamily(combination.accent()).build())
                .build());
    }

    public String generateCss(TypographySettings typography) {
        FontRoleSettings heading = typography.getHeading();
        FontRoleSettings body = typography.getBody();
        FontRoleSettings accent = typography.getAccent();
        FontRoleSettings monospace = typography.getMonospace();

        return String.join("\n\n",
                "/* Typography Styles */\n" + rule("h1, .resume-name", heading, heading.size("h1")),
                rule("h2, .section-title", heading, heading.size("h2")),
                rule("h3, .subsection-title", heading, heading.size("h3")),
                rule(".body-text, p, li", body, body.size("normal")),
                rule(".accent-text", accent, accent.size("base")),
                rule(".contact-info", body, body.size("small")),
                rule(".caption-text", body, body.size("caption")),
                rule(".code, .tech-skills", monospace, monospace.size("base")));
    }

    private String rule(String selector, FontRoleSettings font, double size) {
        return selector + " {\n"
                + "  font-family: " + getFontStack(font.getFontFamily()) + ";\n"
                + "  font-size: " + number(size) + "pt;\n"
                + "  font-weight: " + number(font.getFontWeight()) + ";\n"
                + "  line-height: " + number(font.getLineHeight()) + ";\n"
                + "  letter-spacing: " + number(font.getLetterSpacing()) + "em;\n"
                + "}";
    }
}
