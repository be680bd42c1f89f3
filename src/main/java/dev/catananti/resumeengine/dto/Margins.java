package dev.catananti.resumeengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Page margins in inches.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Margins {
    private double top;
    private double right;
    private double bottom;
    private double left;

    public static Margins uniform(double value) {
        return new Margins(value, value, value, value);
    }

    public double average() {
        return (top + right + bottom + left) / 4;
    }

    public Margins copy() {
        return toBuilder().build();
    }
}
