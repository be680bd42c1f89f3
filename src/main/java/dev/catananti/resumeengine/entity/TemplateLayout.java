package dev.catananti.resumeengine.entity;

import dev.catananti.resumeengine.dto.LayoutSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateLayout {

    public enum Format {
        SINGLE_COLUMN,
        TWO_COLUMN
    }

    @Builder.Default
    private Format format = Format.SINGLE_COLUMN;
    @Builder.Default
    private int columns = 1;
    private LayoutSettings settings;
    /** Viewport widths in px below which the mobile/tablet rules apply. */
    @Builder.Default
    private int mobileBreakpoint = 480;
    @Builder.Default
    private int tabletBreakpoint = 768;
}
