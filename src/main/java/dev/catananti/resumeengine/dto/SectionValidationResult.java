package dev.catananti.resumeengine.dto;

import java.util.List;

public record SectionValidationResult(boolean valid, List<String> errors, List<String> warnings) {
}
