package dev.catananti.resumeengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-render settings. Unknown formats fall back to {@code html}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RenderingOptions {
    @Builder.Default
    private String format = OutputFormat.HTML.getValue();
    /** Style choices to apply; template defaults are used when absent. */
    private TemplateCustomization customization;
    @Builder.Default
    private OptimizationOptions optimization = new OptimizationOptions();
    /** Fallback for stages without a configured timeout; the configured global timeout applies when unset. */
    private Long timeoutMs;
    /** Per-stage timeouts keyed by stage name, overriding configuration. */
    @Builder.Default
    private Map<String, Long> stageTimeoutsMs = new LinkedHashMap<>();
    @Builder.Default
    private boolean enableProfiling = true;

    public static RenderingOptions defaults() {
        return RenderingOptions.builder().build();
    }
}
