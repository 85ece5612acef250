package de.bycsitsm.calsync.ics;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * The properties of one {@code VEVENT}, independent of the parser that read them.
 */
public record ParsedComponent(List<ParsedProperty> properties) {

    public ParsedComponent {
        properties = List.copyOf(properties);
    }

    public @Nullable ParsedProperty first(String name) {
        var upper = name.toUpperCase(Locale.ROOT);
        for (var property : properties) {
            if (property.name().equals(upper)) {
                return property;
            }
        }
        return null;
    }

    public List<ParsedProperty> all(String name) {
        var upper = name.toUpperCase(Locale.ROOT);
        return properties.stream()
                .filter(property -> property.name().equals(upper))
                .toList();
    }

    /**
     * Returns the value of the first property with the given name, or
     * {@code null} if it is absent or blank.
     */
    public @Nullable String value(String name) {
        var property = first(name);
        if (property == null || property.value().isBlank()) {
            return null;
        }
        return property.value();
    }
}
