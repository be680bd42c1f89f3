package dev.catananti.resumeengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColorStates {
    private String light;
    private String normal;
    private String dark;
    private String border;
    private String background;
}
