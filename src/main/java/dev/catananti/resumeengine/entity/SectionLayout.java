package dev.catananti.resumeengine.entity;

import dev.catananti.resumeengine.dto.Alignment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionLayout {
    @Builder.Default
    private int columns = 1;
    @Builder.Default
    private Alignment alignment = Alignment.LEFT;
}
