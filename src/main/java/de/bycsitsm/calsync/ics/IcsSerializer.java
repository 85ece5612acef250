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
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders a {@link CalendarEventRecord} as iCalendar text for a PUT.
 * <p>
 * When the record carries the text it was last synchronized from, that text is
 * used as template: only the properties the application manages are replaced,
 * every other line (vendor extensions, alarms, time zones, overrides) is kept
 * verbatim. Otherwise a minimal calendar is synthesized.
 */
@Component
public class IcsSerializer {

    private static final Logger log = LoggerFactory.getLogger(IcsSerializer.class);

    private static final Pattern SEQUENCE = Pattern.compile("(?im)^SEQUENCE(?:;[^:\\r\\n]*)?:\\s*(\\d+)");

    /** Properties of the master VEVENT that are regenerated from the record. */
    private static final Set<String> MANAGED = Set.of(
            "UID", "SUMMARY", "DTSTART", "DTEND", "DURATION", "LOCATION", "DESCRIPTION",
            "SEQUENCE", "DTSTAMP", "LAST-MODIFIED", "RRULE", "ATTENDEE");

    private final Clock clock;
    private final String productId;

    public IcsSerializer(Clock clock, CalSyncProperties properties) {
        this.clock = clock;
        this.productId = properties.productId();
    }

    public String generateICalEvent(CalendarEventRecord event) {
        return generateICalEvent(event, null);
    }

    /**
     * Generates the iCalendar text of an event.
     *
     * @param event          the event to render
     * @param organizerEmail the organizer written into synthesized calendars with participants
     */
    public String generateICalEvent(CalendarEventRecord event, @Nullable String organizerEmail) {
        var template = event.getRawData();
        if (template != null && template.toUpperCase().contains("BEGIN:VEVENT")) {
            return substitute(template, event);
        }
        return synthesize(event, organizerEmail);
    }

    /**
     * Returns the first {@code SEQUENCE} value of the given text, or 0. Values
     * beyond the integer range are capped at {@link Integer#MAX_VALUE}.
     */
    public static int extractSequence(@Nullable String ics) {
        if (ics == null) {
            return 0;
        }
        var matcher = SEQUENCE.matcher(IcsFormat.unfold(ics));
        if (!matcher.find()) {
            return 0;
        }
        try {
            return (int) Math.min(Long.parseLong(matcher.group(1)), Integer.MAX_VALUE);
        } catch (NumberFormatException e) {
            // only digits are matched, so the value exceeds even a long
            return Integer.MAX_VALUE;
        }
    }

    /**
     * Returns the sequence number that follows the one embedded in the given
     * text. Never lower than the embedded value.
     */
    public static int nextSequence(@Nullable String ics) {
        int sequence = extractSequence(ics);
        return sequence == Integer.MAX_VALUE ? sequence : sequence + 1;
    }

    private String substitute(String template, CalendarEventRecord event) {
        var lines = IcsFormat.logicalLines(template);
        int master = masterEventIndex(lines);
        var managed = managedLines(event, nextSequence(template));

        var result = new ArrayList<String>(lines.size() + managed.size());
        var stack = new ArrayDeque<String>();
        var written = new LinkedHashSet<String>();
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            var name = IcsFormat.propertyName(line);
            boolean inMaster = isInMaster(stack, master, i);

            if (name.equals("BEGIN")) {
                stack.push(componentName(line, i));
            } else if (name.equals("END")) {
                if (inMaster && isMasterTop(stack, master)) {
                    // properties the template did not have
                    for (var entry : managed) {
                        if (!written.contains(IcsFormat.propertyName(entry.get(0)))) {
                            result.addAll(entry);
                        }
                    }
                }
                if (!stack.isEmpty()) {
                    stack.pop();
                }
            } else if (inMaster && isMasterTop(stack, master) && MANAGED.contains(name)) {
                var replacement = replacementFor(name, managed);
                if (replacement != null && written.add(IcsFormat.propertyName(replacement.get(0)))) {
                    result.addAll(replacement);
                }
                continue;
            }
            result.add(line);
        }
        log.debug("Regenerated calendar data of {} from template", event.getUid());
        return IcsFormat.foldAll(result);
    }

    /**
     * Returns the regenerated lines grouped by property, in output order. A group
     * for {@code DTEND} also replaces {@code DURATION}.
     */
    private List<List<String>> managedLines(CalendarEventRecord event, int sequence) {
        var now = IcsFormat.formatUtc(clock.instant());
        var groups = new ArrayList<List<String>>();
        groups.add(List.of("UID:" + event.getUid()));
        groups.add(List.of("DTSTAMP:" + now));
        groups.add(List.of(dateLine("DTSTART", event.getStartDate(), event.isAllDay())));
        groups.add(List.of(dateLine("DTEND", event.getEndDate(), event.isAllDay())));
        groups.add(List.of("SUMMARY:" + IcsFormat.escapeText(event.getTitle())));
        if (event.getLocation() != null && !event.getLocation().isBlank()) {
            groups.add(List.of("LOCATION:" + IcsFormat.escapeText(event.getLocation())));
        }
        if (event.getDescription() != null && !event.getDescription().isBlank()) {
            groups.add(List.of("DESCRIPTION:" + IcsFormat.escapeText(event.getDescription())));
        }
        var rule = RruleSanitizer.sanitize(event.getRecurrenceRule());
        if (!rule.isEmpty()) {
            groups.add(List.of("RRULE:" + rule));
        }
        var attendees = attendeeLines(event);
        if (!attendees.isEmpty()) {
            groups.add(attendees);
        }
        groups.add(List.of("SEQUENCE:" + sequence));
        groups.add(List.of("LAST-MODIFIED:" + now));
        return groups;
    }

    private static @Nullable List<String> replacementFor(String name, List<List<String>> managed) {
        var lookup = name.equals("DURATION") ? "DTEND" : name;
        for (var group : managed) {
            if (IcsFormat.propertyName(group.get(0)).equals(lookup)) {
                return group;
            }
        }
        return null;
    }

    private String synthesize(CalendarEventRecord event, @Nullable String organizerEmail) {
        var now = IcsFormat.formatUtc(clock.instant());
        var lines = new ArrayList<String>();
        lines.add("BEGIN:VCALENDAR");
        lines.add("VERSION:2.0");
        lines.add("PRODID:" + productId);
        lines.add("CALSCALE:GREGORIAN");
        lines.add("BEGIN:VEVENT");
        lines.add("UID:" + event.getUid());
        lines.add("DTSTAMP:" + now);
        lines.add(dateLine("DTSTART", event.getStartDate(), event.isAllDay()));
        lines.add(dateLine("DTEND", event.getEndDate(), event.isAllDay()));
        lines.add("SUMMARY:" + IcsFormat.escapeText(event.getTitle()));
        if (event.getDescription() != null && !event.getDescription().isBlank()) {
            lines.add("DESCRIPTION:" + IcsFormat.escapeText(event.getDescription()));
        }
        if (event.getLocation() != null && !event.getLocation().isBlank()) {
            lines.add("LOCATION:" + IcsFormat.escapeText(event.getLocation()));
        }
        var rule = RruleSanitizer.sanitize(event.getRecurrenceRule());
        if (!rule.isEmpty()) {
            lines.add("RRULE:" + rule);
        }
        var attendees = attendeeLines(event);
        if (organizerEmail != null && !attendees.isEmpty()) {
            lines.add("ORGANIZER:mailto:" + organizerEmail);
        }
        lines.addAll(attendees);
        lines.add("SEQUENCE:0");
        lines.add("STATUS:CONFIRMED");
        lines.add("CREATED:" + now);
        lines.add("LAST-MODIFIED:" + now);
        lines.add("END:VEVENT");
        lines.add("END:VCALENDAR");
        return IcsFormat.foldAll(lines);
    }

    static String dateLine(String name, Instant instant, boolean allDay) {
        if (allDay) {
            return name + ";VALUE=DATE:" + IcsFormat.formatDate(instant);
        }
        return name + ":" + IcsFormat.formatUtc(instant);
    }

    static List<String> attendeeLines(CalendarEventRecord event) {
        var lines = new ArrayList<String>();
        for (var attendee : event.getAttendees()) {
            lines.add(attendeeLine(attendee));
        }
        for (var resource : event.getResources()) {
            lines.add(attendeeLine(resource));
        }
        return lines;
    }

    static String attendeeLine(Participant participant) {
        var sb = new StringBuilder("ATTENDEE");
        if (participant instanceof Resource resource) {
            sb.append(";CN=").append(IcsFormat.parameterValue(resource.name()));
            sb.append(";CUTYPE=RESOURCE;ROLE=NON-PARTICIPANT");
            if (resource.type() != null && !resource.type().isBlank()) {
                sb.append(";X-RESOURCE-TYPE=").append(IcsFormat.parameterValue(resource.type()));
            }
        } else if (participant instanceof Attendee attendee) {
            if (attendee.name() != null && !attendee.name().isBlank()) {
                sb.append(";CN=").append(IcsFormat.parameterValue(attendee.name()));
            }
            sb.append(";ROLE=").append(attendee.role() != null ? attendee.role() : "REQ-PARTICIPANT");
            sb.append(";PARTSTAT=").append(attendee.status() != null ? attendee.status() : "NEEDS-ACTION");
            sb.append(";RSVP=TRUE");
        }
        return sb.append(":mailto:").append(participant.email()).toString();
    }

    // Component tracking: the stack holds "<NAME>@<line index>" entries.

    private static int masterEventIndex(List<String> lines) {
        int candidate = -1;
        int depth = 0;
        int eventDepth = -1;
        boolean hasRecurrenceId = false;
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            var name = IcsFormat.propertyName(line);
            if (name.equals("BEGIN")) {
                depth++;
                if (eventDepth < 0 && IcsFormat.propertyValue(line).strip().equalsIgnoreCase("VEVENT")) {
                    candidate = i;
                    eventDepth = depth;
                    hasRecurrenceId = false;
                }
            } else if (name.equals("END")) {
                if (depth == eventDepth) {
                    if (!hasRecurrenceId) {
                        return candidate;
                    }
                    eventDepth = -1;
                }
                depth--;
            } else if (depth == eventDepth && name.equals("RECURRENCE-ID")) {
                hasRecurrenceId = true;
            }
        }
        // only overrides: use the first VEVENT
        for (int i = 0; i < lines.size(); i++) {
            if (IcsFormat.propertyName(lines.get(i)).equals("BEGIN")
                    && IcsFormat.propertyValue(lines.get(i)).strip().equalsIgnoreCase("VEVENT")) {
                return i;
            }
        }
        return -1;
    }

    private static String componentName(String line, int index) {
        return IcsFormat.propertyValue(line).strip().toUpperCase() + "@" + index;
    }

    private static boolean isMasterTop(Deque<String> stack, int master) {
        return !stack.isEmpty() && stack.peek().endsWith("@" + master);
    }

    private static boolean isInMaster(Deque<String> stack, int master, int index) {
        return index != master && stack.stream().anyMatch(entry -> entry.endsWith("@" + master));
    }
}
