package de.bycsitsm.calsync.ics;

import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.CalendarParserFactory;
import net.fortuna.ical4j.data.ContentHandlerContext;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Component;
import net.fortuna.ical4j.model.Parameter;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.TimeZone;
import net.fortuna.ical4j.model.TimeZoneRegistry;
import net.fortuna.ical4j.model.TimeZoneRegistryImpl;
import net.fortuna.ical4j.model.component.CalendarComponent;
import net.fortuna.ical4j.model.component.VTimeZone;
import net.fortuna.ical4j.model.property.DateProperty;
import net.fortuna.ical4j.model.property.Duration;
import net.fortuna.ical4j.util.CompatibilityHints;
import net.fortuna.ical4j.util.MapTimeZoneCache;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAmount;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * {@link IcsParsingFacility} backed by ical4j, configured for the relaxed
 * parsing that real-world CalDAV servers require.
 */
@org.springframework.stereotype.Component
public class Ical4jParsingFacility implements IcsParsingFacility {

    private static final Logger log = LoggerFactory.getLogger(Ical4jParsingFacility.class);

    static {
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_PARSING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_UNFOLDING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_VALIDATION, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_OUTLOOK_COMPATIBILITY, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_NOTES_COMPATIBILITY, true);

        System.setProperty("net.fortuna.ical4j.timezone.cache.impl", MapTimeZoneCache.class.getName());
    }

    /**
     * Falls back to the global zone table for TZIDs without a VTIMEZONE
     * definition, as sent by several desktop clients. Vendor prefixes such as
     * {@code /mozilla.org/20050126_1/Europe/Berlin} are stripped; identifiers
     * that match nothing are read as UTC.
     */
    static class LenientTimeZoneRegistry extends TimeZoneRegistryImpl {

        @Override
        public ZoneId getZoneId(String tzId) {
            try {
                return super.getZoneId(tzId);
            } catch (DateTimeException e) {
                if (e.getMessage() == null || !e.getMessage().contains("Unknown timezone identifier")) {
                    throw e;
                }
            }
            try {
                return TimeZoneRegistry.getGlobalZoneId(tzId);
            } catch (DateTimeException e) {
                var parts = tzId.split("/");
                if (parts.length >= 2) {
                    var region = parts[parts.length - 2] + "/" + parts[parts.length - 1];
                    if (ZoneId.getAvailableZoneIds().contains(region)) {
                        return ZoneId.of(region);
                    }
                }
                log.warn("Unknown time zone '{}' without definition, reading its times as UTC", tzId);
                return ZoneOffset.UTC;
            }
        }
    }

    @Override
    public ParsedComponent parseEvent(String ics) {
        var registry = new LenientTimeZoneRegistry();
        var builder = new CalendarBuilder(
                CalendarParserFactory.getInstance().get(),
                new ContentHandlerContext(),
                registry);

        Calendar calendar;
        try {
            calendar = builder.build(new StringReader(ics));
        } catch (IOException e) {
            throw new IcsParseException("Error while reading calendar data: " + e.getMessage(), e);
        } catch (ParserException e) {
            throw new IcsParseException("Error while parsing calendar data: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // ical4j reports invalid property values (dates, recurrence rules) unchecked
            throw new IcsParseException("Invalid calendar data: " + e.getMessage(), e);
        }

        List<CalendarComponent> events = calendar.getComponents(Component.VEVENT);
        if (events.isEmpty()) {
            throw new IcsParseException("No VEVENT found in calendar data");
        }
        List<VTimeZone> zones = calendar.getComponents(Component.VTIMEZONE);
        for (var zone : zones) {
            try {
                registry.register(new TimeZone(zone));
            } catch (RuntimeException e) {
                log.debug("Ignoring unusable VTIMEZONE: {}", e.getMessage());
            }
        }

        var master = events.stream()
                .filter(event -> event.getProperty(Property.RECURRENCE_ID).isEmpty())
                .findFirst()
                .orElse(events.get(0));

        return new ParsedComponent(toParsedProperties(master, registry));
    }

    private List<ParsedProperty> toParsedProperties(CalendarComponent event, TimeZoneRegistry registry) {
        var properties = new ArrayList<ParsedProperty>();
        for (Property property : event.getPropertyList().getAll()) {
            var parameters = new LinkedHashMap<String, String>();
            for (Parameter parameter : property.getParameterList().getAll()) {
                parameters.putIfAbsent(parameter.getName().toUpperCase(), parameter.getValue());
            }
            ParsedTime time = null;
            TemporalAmount amount = null;
            try {
                if (property instanceof DateProperty<?> dateProperty) {
                    var utc = property.getValue() != null && property.getValue().strip().endsWith("Z");
                    time = resolve(dateProperty.getDate(), utc ? null : parameters.get("TZID"), registry);
                } else if (property instanceof Duration duration) {
                    amount = duration.getDuration();
                }
            } catch (DateTimeException | IllegalArgumentException e) {
                log.debug("Unresolvable {} value '{}': {}", property.getName(), property.getValue(), e.getMessage());
            }
            properties.add(new ParsedProperty(property.getName(), parameters, property.getValue(), time, amount));
        }
        return properties;
    }

    /**
     * Converts a date value, anchoring TZID-qualified wall-clock times in the
     * zone the calendar itself defines for that TZID.
     */
    private static @Nullable ParsedTime resolve(@Nullable Temporal value, @Nullable String tzId,
                                                TimeZoneRegistry registry) {
        if (value == null) {
            return null;
        }
        if (value instanceof ZonedDateTime zoned && tzId != null) {
            var zone = registry.getZoneId(tzId);
            return ParsedTime.of(ZonedDateTime.of(zoned.toLocalDateTime(), zone));
        }
        return ParsedTime.of(value);
    }
}
