package de.bycsitsm.calsync.ics;

import de.bycsitsm.calsync.CalSyncProperties;
import de.bycsitsm.calsync.model.Attendee;
import de.bycsitsm.calsync.model.CalendarEventRecord;
import de.bycsitsm.calsync.model.Participant;
import de.bycsitsm.calsync.model.Resource;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAmount;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns iCalendar text received from a CalDAV server into a {@link CalendarEventRecord}.
 * <p>
 * The parser is tolerant of the corruption produced by various clients: known
 * signatures are repaired before the standards parse, and a second, more
 * aggressive repair round is attempted when the standards parse fails.
 * Records are only dropped when neither usable dates nor a summary can be derived.
 */
@Component
public class IcsParser {

    private static final Logger log = LoggerFactory.getLogger(IcsParser.class);

    static final String UNTITLED = "Untitled Event";

    private static final Pattern RAW_RRULE = Pattern.compile("(?im)^RRULE:([^\\r\\n]+)");
    private static final Pattern MAILTO = Pattern.compile("(?i)mailto:([^;:\\s\"]+)");
    private static final Pattern RAW_PARAM = Pattern.compile("(?i);([A-Z][A-Z0-9-]*)=(\"[^\"]*\"|[^;:]*)");

    private final IcsParsingFacility facility;
    private final Clock clock;
    private final String uidDomain;
    private final IcsRepairPipeline preClean = IcsRepairPipeline.preClean();
    private final IcsRepairPipeline aggressive = IcsRepairPipeline.aggressive();

    public IcsParser(IcsParsingFacility facility, Clock clock, CalSyncProperties properties) {
        this.facility = facility;
        this.clock = clock;
        this.uidDomain = properties.uidDomain();
    }

    /**
     * Parses one calendar object.
     *
     * @param ics  the calendar object as received
     * @param etag the entity tag reported by the server, if any
     * @param url  the object URL, if any
     * @return the parsed record, or {@code null} if the object holds no usable event
     */
    public @Nullable CalendarEventRecord parse(String ics, @Nullable String etag, @Nullable String url) {
        if (ics == null || ics.isBlank()) {
            return null;
        }
        var cleaned = preClean.apply(ics);

        var component = tryParse(cleaned);
        var scanned = cleaned;
        if (component == null) {
            var repaired = aggressive.apply(cleaned);
            component = tryParse(repaired);
            scanned = repaired;
            if (component == null) {
                log.warn("Dropping calendar object {}: unparseable after repair", url);
                return null;
            }
            log.info("Parsed calendar object {} after aggressive repair", url);
        }

        var summary = component.value("SUMMARY");
        var start = time(component.first("DTSTART"));
        if (start == null) {
            if (summary == null) {
                log.warn("Dropping calendar object {}: neither start date nor summary", url);
                return null;
            }
            start = firstTime(component, "DTSTAMP", "CREATED", "LAST-MODIFIED");
            if (start == null) {
                log.warn("Dropping calendar object {}: no usable date", url);
                return null;
            }
            log.debug("Calendar object {} has no DTSTART, anchored on its timestamp", url);
        }

        boolean allDay = start.atMidnight();
        var startInstant = allDay ? startOfDay(start.date()) : start.instant();
        var endInstant = endOf(component, start, startInstant, allDay);

        var uid = component.value("UID");
        if (uid == null) {
            uid = EventUids.extract(cleaned);
        }
        if (uid == null) {
            uid = EventUids.generate(clock, uidDomain);
            log.debug("Calendar object {} has no UID, generated {}", url, uid);
        }

        var record = new CalendarEventRecord(uid.strip(), summary != null ? summary : UNTITLED, startInstant, endInstant);
        record.setAllDay(allDay);
        record.setDescription(component.value("DESCRIPTION"));
        record.setLocation(component.value("LOCATION"));
        var tzid = tzid(component, start);
        record.setTimezone(tzid != null ? tzid : "UTC");
        record.setRecurrenceRule(recurrence(component, cleaned));
        applyParticipants(record, component, scanned);
        record.setEtag(etag);
        record.setUrl(url);
        record.setRawData(cleaned);
        return record;
    }

    private @Nullable ParsedComponent tryParse(String ics) {
        try {
            return facility.parseEvent(ics);
        } catch (IcsParseException e) {
            log.debug("Standards parse failed: {}", e.getMessage());
            return null;
        }
    }

    // Dates

    private static @Nullable ParsedTime firstTime(ParsedComponent component, String... names) {
        for (var name : names) {
            var time = time(component.first(name));
            if (time != null) {
                return time;
            }
        }
        return null;
    }

    private static @Nullable ParsedTime time(@Nullable ParsedProperty property) {
        return property == null ? null : property.time();
    }

    private static @Nullable String tzid(ParsedComponent component, ParsedTime start) {
        var property = component.first("DTSTART");
        if (start.dateOnly() || property == null || property.value().strip().toUpperCase(Locale.ROOT).endsWith("Z")) {
            return null;
        }
        return property.parameter("TZID");
    }

    private static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static Instant endOf(ParsedComponent component, ParsedTime start, Instant startInstant, boolean allDay) {
        var end = time(component.first("DTEND"));
        Instant endInstant = null;
        if (end != null) {
            if (allDay) {
                var endDate = end.atMidnight() ? end.date() : end.date().plusDays(1);
                endInstant = startOfDay(endDate);
            } else {
                endInstant = end.instant();
            }
        } else {
            var duration = component.first("DURATION");
            if (duration != null && duration.amount() != null) {
                endInstant = plus(startInstant, allDay ? ZoneOffset.UTC : start.zone(), duration.amount());
            }
        }
        // zero-length timed events are legal, zero-length all-day events are not
        if (endInstant == null || endInstant.isBefore(startInstant)
                || (allDay && endInstant.equals(startInstant))) {
            return startInstant.plus(allDay ? Duration.ofDays(1) : Duration.ofHours(1));
        }
        return endInstant;
    }

    /**
     * Adds a duration in the event's own zone, so that nominal days span
     * daylight saving transitions.
     */
    private static @Nullable Instant plus(Instant start, ZoneId zone, TemporalAmount amount) {
        try {
            return start.atZone(zone).plus(amount).toInstant();
        } catch (DateTimeException | ArithmeticException e) {
            log.debug("Unusable DURATION {}", amount);
            return null;
        }
    }

    // Recurrence

    private static @Nullable String recurrence(ParsedComponent component, String ics) {
        var structured = component.value("RRULE");
        String rule;
        if (structured != null && structured.strip().toUpperCase(Locale.ROOT).startsWith("FREQ=")) {
            rule = structured;
        } else {
            var matcher = RAW_RRULE.matcher(IcsFormat.unfold(ics));
            rule = matcher.find() ? matcher.group(1) : null;
        }
        var sanitized = RruleSanitizer.sanitize(rule);
        return sanitized.isEmpty() ? null : sanitized;
    }

    // Participants

    private static void applyParticipants(CalendarEventRecord record, ParsedComponent component, String ics) {
        var participants = new ArrayList<Participant>();
        var structured = component.all("ATTENDEE");
        if (!structured.isEmpty()) {
            for (var property : structured) {
                var email = address(property.value());
                if (email != null) {
                    participants.add(ParticipantClassifier.classify(email, property.parameters()));
                }
            }
        } else {
            participants.addAll(scanAttendees(ics));
        }

        var resourceEmails = new HashSet<String>();
        var resources = new ArrayList<Resource>();
        for (var participant : participants) {
            if (participant instanceof Resource resource
                    && resourceEmails.add(resource.adminEmail().toLowerCase(Locale.ROOT))) {
                resources.add(resource);
            }
        }
        var seen = new HashSet<String>();
        var attendees = new ArrayList<Attendee>();
        for (var participant : participants) {
            if (participant instanceof Attendee attendee) {
                var key = attendee.email().toLowerCase(Locale.ROOT);
                if (!resourceEmails.contains(key) && seen.add(key)) {
                    attendees.add(attendee);
                }
            }
        }
        record.setAttendees(attendees);
        record.setResources(resources);
    }

    /**
     * Extracts attendees from the raw text when the standards parse delivered none.
     * Physical lines that continue an {@code ATTENDEE} line without folding
     * whitespace are merged first.
     */
    static List<Participant> scanAttendees(String ics) {
        var merged = new ArrayList<String>();
        for (var line : IcsFormat.logicalLines(ics)) {
            var isProperty = line.matches("^[A-Za-z][A-Za-z0-9-]*[;:].*");
            if (!isProperty && !merged.isEmpty()
                    && IcsFormat.propertyName(merged.get(merged.size() - 1)).equals("ATTENDEE")) {
                merged.set(merged.size() - 1, merged.get(merged.size() - 1) + line.strip());
            } else {
                merged.add(line);
            }
        }

        var participants = new ArrayList<Participant>();
        for (var line : merged) {
            if (!IcsFormat.propertyName(line).equals("ATTENDEE")) {
                continue;
            }
            var email = address(IcsFormat.propertyValue(line));
            if (email == null) {
                email = address(line);
            }
            if (email == null) {
                continue;
            }
            Map<String, String> parameters = new LinkedHashMap<>();
            var matcher = RAW_PARAM.matcher(line);
            while (matcher.find()) {
                var value = matcher.group(2);
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                parameters.putIfAbsent(matcher.group(1).toUpperCase(Locale.ROOT), value);
            }
            participants.add(ParticipantClassifier.classify(email, parameters));
        }
        return participants;
    }

    private static @Nullable String address(String value) {
        var matcher = MAILTO.matcher(value);
        if (matcher.find()) {
            return matcher.group(1).strip();
        }
        var trimmed = value.strip();
        return trimmed.contains("@") && !trimmed.contains(" ") ? trimmed : null;
    }
}
