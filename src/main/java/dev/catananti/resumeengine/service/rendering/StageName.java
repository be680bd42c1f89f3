package dev.catananti.resumeengine.service.rendering;

import java.util.Arrays;
import java.util.Optional;

/**
 * Pipeline stages in execution order.
 */
public enum StageName {
    VALIDATION("validation", true, 2000),
    DATA_BINDING("dataBinding", true, 5000),
    CONTENT_PROCESSING("contentProcessing", true, 3000),
    STYLING("styling", true, 4000),
    OPTIMIZATION("optimization", false, 2000),
    OUTPUT("output", true, 3000);

    private final String key;
    private final boolean required;
    private final long defaultTimeoutMs;

    StageName(String key, boolean required, long defaultTimeoutMs) {
        this.key = key;
        this.required = required;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public String getKey() {
        return key;
    }

    public boolean isRequired() {
        return required;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public static Optional<StageName> fromKey(String key) {
        return Arrays.stream(values()).filter(stage -> stage.key.equals(key)).findFirst();
    }
}
