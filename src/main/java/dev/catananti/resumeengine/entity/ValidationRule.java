package dev.catananti.resumeengine.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Constraint on a bound field value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRule {

    public enum Type {
        MIN_LENGTH,
        MAX_LENGTH,
        PATTERN
    }

    private Type type;
    /** Length for MIN_LENGTH/MAX_LENGTH, regular expression for PATTERN. */
    private String value;
    private String message;
}
