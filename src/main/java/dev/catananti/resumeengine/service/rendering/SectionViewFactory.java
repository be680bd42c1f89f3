package dev.catananti.resumeengine.service.rendering;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns bound section data into the flat view the markup template renders.
 */
@Component
public class SectionViewFactory {

    private static final List<String> CONTACT_FIELDS = List.of("email", "phone", "location", "linkedin", "website");

    public SectionView create(ProcessedSection section) {
        SectionView.SectionViewBuilder view = SectionView.builder()
                .id(section.id())
                .name(section.name())
                .type(section.type().getValue())
                .cssClass("resume-section section-" + section.id() + (section.visible() ? " visible" : ""));
        JsonNode data = section.data();

        return switch (section.type()) {
            case PERSONAL_INFO -> view.kind(SectionView.Kind.PERSONAL)
                    .heading(text(data, "fullName"))
                    .subheading(text(data, "title"))
                    .contacts(CONTACT_FIELDS.stream().map(field -> text(data, field)).filter(Objects::nonNull)
                            .collect(Collectors.toList()))
                    .build();
            case SUMMARY -> view.kind(SectionView.Kind.TEXT).paragraphs(paragraphs(data)).build();
            case EXPERIENCE -> view.kind(SectionView.Kind.ITEMS).items(items(data, this::experience)).build();
            case EDUCATION -> view.kind(SectionView.Kind.ITEMS).items(items(data, this::education)).build();
            case CERTIFICATIONS -> view.kind(SectionView.Kind.ITEMS).items(items(data, this::certification)).build();
            case PROJECTS -> view.kind(SectionView.Kind.ITEMS).items(items(data, this::project)).build();
            case SKILLS, LANGUAGES -> view.kind(SectionView.Kind.TAGS).tags(strings(data)).build();
            case CUSTOM -> generic(view, data);
        };
    }

    private SectionView generic(SectionView.SectionViewBuilder view, JsonNode data) {
        if (data.isArray() && data.size() > 0 && data.get(0).isObject()) {
            return view.kind(SectionView.Kind.ITEMS).items(items(data, this::genericItem)).build();
        }
        if (data.isArray()) {
            return view.kind(SectionView.Kind.TAGS).tags(strings(data)).build();
        }
        if (data.isObject()) {
            List<String> lines = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                lines.add(field.getKey() + ": " + field.getValue().asText());
            }
            return view.kind(SectionView.Kind.TEXT).paragraphs(lines).build();
        }
        return view.kind(SectionView.Kind.TEXT).paragraphs(paragraphs(data)).build();
    }

    private SectionView.Item experience(JsonNode item) {
        String end = item.path("current").asBoolean() ? "Present" : text(item, "endDate");
        return SectionView.Item.builder()
                .title(text(item, "title"))
                .subtitle(text(item, "company"))
                .meta(join(text(item, "location"), join(text(item, "startDate"), end, " - "), " | "))
                .description(text(item, "description"))
                .bullets(strings(item.path("achievements")))
                .build();
    }

    private SectionView.Item education(JsonNode item) {
        String gpa = text(item, "gpa");
        return SectionView.Item.builder()
                .title(text(item, "degree"))
                .subtitle(text(item, "institution"))
                .meta(join(join(text(item, "location"), text(item, "graduationDate"), " | "),
                        gpa == null ? null : "GPA: " + gpa, " | "))
                .build();
    }

    private SectionView.Item certification(JsonNode item) {
        return SectionView.Item.builder()
                .title(text(item, "name"))
                .subtitle(text(item, "issuer"))
                .meta(text(item, "date"))
                .build();
    }

    private SectionView.Item project(JsonNode item) {
        return SectionView.Item.builder()
                .title(text(item, "name"))
                .description(text(item, "description"))
                .link(text(item, "url"))
                .build();
    }

    private SectionView.Item genericItem(JsonNode item) {
        List<String> values = new ArrayList<>();
        item.elements().forEachRemaining(value -> {
            if (value.isValueNode() && !value.asText().isBlank()) {
                values.add(value.asText());
            }
        });
        return SectionView.Item.builder()
                .title(values.isEmpty() ? null : values.get(0))
                .description(values.size() > 1 ? String.join(" | ", values.subList(1, values.size())) : null)
                .build();
    }

    private List<SectionView.Item> items(JsonNode data, Function<JsonNode, SectionView.Item> mapper) {
        if (!data.isArray()) {
            return List.of(mapper.apply(data));
        }
        List<SectionView.Item> items = new ArrayList<>();
        data.forEach(item -> items.add(mapper.apply(item)));
        return items;
    }

    private static List<String> paragraphs(JsonNode data) {
        return Stream.of(data.asText().split("\\n\\s*\\n"))
                .map(String::trim)
                .filter(paragraph -> !paragraph.isEmpty())
                .collect(Collectors.toList());
    }

    private static List<String> strings(JsonNode data) {
        List<String> values = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(value -> {
                if (!value.asText().isBlank()) {
                    values.add(value.asText());
                }
            });
        } else if (data.isValueNode() && !data.asText().isBlank()) {
            values.add(data.asText());
        }
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static String join(String first, String second, String separator) {
        if (first == null) {
            return second;
        }
        return second == null ? first : first + separator + second;
    }
}
