package dev.catananti.resumeengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TypographySettings {
    private FontRoleSettings heading;
    private FontRoleSettings body;
    private FontRoleSettings accent;
    private FontRoleSettings monospace;

    public FontRoleSettings get(FontRole role) {
        return switch (role) {
            case HEADING -> heading;
            case BODY -> body;
            case ACCENT -> accent;
            case MONOSPACE -> monospace;
        };
    }

    public void set(FontRole role, FontRoleSettings settings) {
        switch (role) {
            case HEADING -> heading = settings;
            case BODY -> body = settings;
            case ACCENT -> accent = settings;
            case MONOSPACE -> monospace = settings;
        }
    }

    public TypographySettings copy() {
        TypographySettings copy = new TypographySettings();
        for (FontRole role : FontRole.values()) {
            FontRoleSettings settings = get(role);
            copy.set(role, settings != null ? settings.copy() : null);
        }
        return copy;
    }
}
