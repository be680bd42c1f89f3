package dev.catananti.resumeengine.service.rendering;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Template-facing view of a processed section.
 */
@Value
@Builder
public class SectionView {

    public enum Kind {
        PERSONAL,
        TEXT,
        ITEMS,
        TAGS
    }

    String id;
    String name;
    String type;
    String cssClass;
    Kind kind;
    String heading;
    String subheading;
    @Singular
    List<String> contacts;
    @Singular
    List<String> paragraphs;
    @Singular
    List<Item> items;
    @Singular
    List<String> tags;

    /** Lower-case kind name, used by the markup template's switch. */
    public String getKindName() {
        return kind.name().toLowerCase();
    }

    @Value
    @Builder
    public static class Item {
        String title;
        String subtitle;
        String meta;
        String description;
        String link;
        @Singular
        List<String> bullets;
    }
}
