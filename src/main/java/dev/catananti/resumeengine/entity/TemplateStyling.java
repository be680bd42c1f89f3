package dev.catananti.resumeengine.entity;

import dev.catananti.resumeengine.dto.ColorScheme;
import dev.catananti.resumeengine.dto.TypographySettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateStyling {
    private ColorScheme colors;
    private TypographySettings typography;
}
