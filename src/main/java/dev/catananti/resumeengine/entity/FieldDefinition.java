package dev.catananti.resumeengine.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDefinition {
    private String id;
    private String name;
    @Builder.Default
    private FieldType type = FieldType.TEXT;
    private boolean required;
    @Builder.Default
    private List<ValidationRule> validation = new ArrayList<>();
}
