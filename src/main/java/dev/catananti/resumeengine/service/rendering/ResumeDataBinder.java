package dev.catananti.resumeengine.service.rendering;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.resumeengine.dto.DataBindingResult;
import dev.catananti.resumeengine.dto.DataBindingResult.BindingError;
import dev.catananti.resumeengine.dto.DataBindingResult.BindingWarning;
import dev.catananti.resumeengine.dto.SectionConfig;
import dev.catananti.resumeengine.dto.TemplateCustomization;
import dev.catananti.resumeengine.entity.FieldDefinition;
import dev.catananti.resumeengine.entity.ResumeData;
import dev.catananti.resumeengine.entity.ResumeTemplate;
import dev.catananti.resumeengine.entity.SectionDefinition;
import dev.catananti.resumeengine.entity.ValidationRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Default binder: looks each section's data up in the resume's JSON tree and checks it against
 * the section's field definitions. List sections are checked item by item.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResumeDataBinder implements DataBinder {

    private final ObjectMapper objectMapper;

    @Override
    public Mono<DataBindingResult> bind(ResumeTemplate template, ResumeData resume,
                                        TemplateCustomization customization) {
        return Mono.fromCallable(() -> bindSections(template, resume, customization))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private DataBindingResult bindSections(ResumeTemplate template, ResumeData resume,
                                           TemplateCustomization customization) {
        JsonNode tree = objectMapper.valueToTree(resume);
        Map<String, JsonNode> data = new LinkedHashMap<>();
        List<BindingError> errors = new ArrayList<>();
        List<BindingWarning> warnings = new ArrayList<>();
        int totalFields = 0;
        int missingFields = 0;

        for (SectionDefinition section : template.getSections()) {
            if (isHidden(section, customization)) {
                continue;
            }
            int declared = Math.max(1, section.getFields().size());
            totalFields += declared;

            String path = section.getType().getDataPath() != null ? section.getType().getDataPath() : section.getId();
            JsonNode node = tree.get(path);
            if (isEmpty(node)) {
                missingFields += declared;
                if (section.isRequired()) {
                    errors.add(new BindingError(DataBindingResult.REQUIRED_FIELD_MISSING,
                            "Required section is missing: " + section.getName(), "section", section.getId()));
                } else {
                    warnings.add(new BindingWarning("Optional section is missing: " + section.getName(),
                            "Section will be omitted", "section", section.getId()));
                }
                continue;
            }

            if (node.isArray()) {
                for (int i = 0; i < node.size(); i++) {
                    missingFields += checkFields(section, node.get(i), "[" + i + "].", errors, warnings);
                }
            } else if (node.isObject()) {
                missingFields += checkFields(section, node, "", errors, warnings);
            }
            data.put(section.getId(), node);
        }

        int boundFields = Math.max(0, totalFields - missingFields);
        int completeness = totalFields > 0 ? (int) Math.round(boundFields * 100.0 / totalFields) : 0;
        boolean success = errors.stream()
                .noneMatch(error -> DataBindingResult.REQUIRED_FIELD_MISSING.equals(error.code()));

        log.debug("Bound {} sections of template {} ({}% complete)", data.size(), template.getId(), completeness);
        return new DataBindingResult(success, data, errors, warnings,
                new DataBindingResult.Metadata(boundFields, totalFields, completeness));
    }

    /**
     * @return how many fields of this item had no value
     */
    private int checkFields(SectionDefinition section, JsonNode item, String prefix,
                            List<BindingError> errors, List<BindingWarning> warnings) {
        int missing = 0;
        for (FieldDefinition field : section.getFields()) {
            JsonNode value = item.get(field.getId());
            String fieldPath = prefix + field.getId();
            if (isEmpty(value)) {
                missing++;
                if (field.isRequired()) {
                    errors.add(new BindingError(DataBindingResult.REQUIRED_FIELD_MISSING,
                            "Required field is missing: " + field.getName(), fieldPath, section.getId()));
                } else {
                    warnings.add(new BindingWarning("Optional field is missing: " + field.getName(),
                            "Section may appear incomplete", fieldPath, section.getId()));
                }
                continue;
            }
            for (ValidationRule rule : field.getValidation()) {
                if (!satisfies(rule, value.asText())) {
                    String message = rule.getMessage() != null ? rule.getMessage()
                            : "Field validation failed: " + field.getName();
                    errors.add(new BindingError(DataBindingResult.FIELD_VALIDATION_ERROR, message,
                            fieldPath, section.getId()));
                }
            }
        }
        return missing;
    }

    private boolean satisfies(ValidationRule rule, String text) {
        return switch (rule.getType()) {
            case MIN_LENGTH -> text.length() >= Integer.parseInt(rule.getValue());
            case MAX_LENGTH -> text.length() <= Integer.parseInt(rule.getValue());
            case PATTERN -> matches(rule.getValue(), text);
        };
    }

    private boolean matches(String regex, String text) {
        try {
            return Pattern.compile(regex).matcher(text).matches();
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid validation pattern '{}': {}", regex, e.getDescription());
            return true;
        }
    }

    private boolean isHidden(SectionDefinition section, TemplateCustomization customization) {
        if (customization == null || customization.getSectionVisibility() == null) {
            return false;
        }
        SectionConfig config = customization.getSectionVisibility().get(section.getId());
        return config != null && !config.isVisible();
    }

    private static boolean isEmpty(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return true;
        }
        if (node.isTextual()) {
            return node.asText().isBlank();
        }
        return node.isContainerNode() && node.isEmpty();
    }
}
