package de.bycsitsm.calsync.ics;

import org.jspecify.annotations.Nullable;

import java.time.temporal.TemporalAmount;
import java.util.Locale;
import java.util.Map;

/**
 * A single iCalendar property as delivered by an {@link IcsParsingFacility}.
 *
 * @param name       the upper-case property name
 * @param parameters the parameters by upper-case name; values are unquoted
 * @param value      the property value; TEXT values are already unescaped
 * @param time       the resolved value of a date or date-time property, with its
 *                   {@code TZID} already applied
 * @param amount     the resolved value of a duration property
 */
public record ParsedProperty(String name, Map<String, String> parameters, String value,
                             @Nullable ParsedTime time, @Nullable TemporalAmount amount) {

    public ParsedProperty {
        name = name.toUpperCase(Locale.ROOT);
        parameters = Map.copyOf(parameters);
        value = value == null ? "" : value;
    }

    public ParsedProperty(String name, Map<String, String> parameters, String value) {
        this(name, parameters, value, null, null);
    }

    public @Nullable String parameter(String parameterName) {
        return parameters.get(parameterName.toUpperCase(Locale.ROOT));
    }
}
