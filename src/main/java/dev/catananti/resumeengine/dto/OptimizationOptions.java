package dev.catananti.resumeengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationOptions {
    /** Strip comments and collapse whitespace in markup and stylesheet. */
    private boolean minify;
    /** Embed the stylesheet in a {@code <style>} element inside {@code <head>}. */
    @Builder.Default
    private boolean inlineCss = true;
    /** Re-serialize markup compactly and drop comments. */
    private boolean compress;
}
