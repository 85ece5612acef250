package de.bycsitsm.calsync.ics;

import de.bycsitsm.calsync.CalSyncProperties;
import de.bycsitsm.calsync.model.CalendarEventRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds RFC 5546 {@code METHOD:CANCEL} messages from the original invitation.
 * <p>
 * Receiving clients correlate a cancellation with the invitation by its UID,
 * so the UID is copied verbatim and never regenerated. All original attendees
 * and resources are addressed, and the sequence number is raised by one.
 */
@Component
public class IcsCancellationTransformer {

    private static final Logger log = LoggerFactory.getLogger(IcsCancellationTransformer.class);

    private static final Pattern UID = Pattern.compile("(?m)^UID(?:;[^:\\n]*)?:(.*)$");
    private static final Pattern MAILTO = Pattern.compile("(?i)mailto:([^;:\\s\"]+)");
    private static final Pattern SCHEDULE_STATUS = Pattern.compile("(?i);SCHEDULE-STATUS=(\"[^\"]*\"|[^;:]*)");
    private static final Pattern VTIMEZONE = Pattern.compile("(?ms)^BEGIN:VTIMEZONE\\n.*?^END:VTIMEZONE$");
    private static final Pattern TZID = Pattern.compile("(?i);TZID=(\"[^\"]*\"|[^;:]*)");

    private final Clock clock;
    private final String productId;

    public IcsCancellationTransformer(Clock clock, CalSyncProperties properties) {
        this.clock = clock;
        this.productId = properties.productId();
    }

    /**
     * Transforms the original invitation of an event into a cancellation.
     *
     * @param originalIcs the iCalendar text the attendees received, usually the event's raw data
     * @param event       the event being cancelled, used for missing values
     */
    public String transformIcsForCancellation(@Nullable String originalIcs, CalendarEventRecord event) {
        if (originalIcs == null || originalIcs.isBlank()) {
            log.debug("No original calendar data for {}, synthesizing cancellation", event.getUid());
            return synthesize(event);
        }
        var cleaned = deepClean(originalIcs);
        var uidMatcher = UID.matcher(cleaned);
        if (!uidMatcher.find() || uidMatcher.group(1).isBlank()) {
            log.debug("Original calendar data of {} has no UID, synthesizing cancellation", event.getUid());
            return synthesize(event);
        }
        var uid = uidMatcher.group(1);

        var lines = IcsFormat.lines(cleaned);
        var summary = firstLine(lines, "SUMMARY");
        var dtstart = firstLine(lines, "DTSTART");
        var dtend = firstLine(lines, "DTEND");
        var organizer = firstLine(lines, "ORGANIZER");
        int sequence = IcsSerializer.nextSequence(cleaned);

        var attendees = new ArrayList<String>();
        var addresses = new HashSet<String>();
        for (var line : lines) {
            if (!IcsFormat.propertyName(line).equals("ATTENDEE")) {
                continue;
            }
            var matcher = MAILTO.matcher(line);
            var key = matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : line;
            if (addresses.add(key)) {
                attendees.add(SCHEDULE_STATUS.matcher(line).replaceAll(""));
            }
        }
        // participants added locally after the invitation went out
        for (var line : IcsSerializer.attendeeLines(event)) {
            var matcher = MAILTO.matcher(line);
            if (matcher.find() && addresses.add(matcher.group(1).toLowerCase(Locale.ROOT))) {
                attendees.add(line);
            }
        }

        var result = new ArrayList<String>();
        result.add("BEGIN:VCALENDAR");
        result.add("PRODID:" + productId);
        result.add("VERSION:2.0");
        result.add("METHOD:CANCEL");
        var timezone = referencedTimezone(cleaned, dtstart);
        if (timezone != null) {
            result.addAll(IcsFormat.lines(timezone));
        }
        result.add("BEGIN:VEVENT");
        result.add("UID:" + uid);
        result.add("DTSTAMP:" + IcsFormat.formatUtc(clock.instant()));
        result.add(dtstart != null ? dtstart : IcsSerializer.dateLine("DTSTART", event.getStartDate(), event.isAllDay()));
        result.add(dtend != null ? dtend : IcsSerializer.dateLine("DTEND", event.getEndDate(), event.isAllDay()));
        result.add(summary != null ? summary : "SUMMARY:" + IcsFormat.escapeText(event.getTitle()));
        if (organizer != null) {
            result.add(organizer);
        }
        result.addAll(attendees);
        result.add("SEQUENCE:" + sequence);
        result.add("STATUS:CANCELLED");
        result.add("END:VEVENT");
        result.add("END:VCALENDAR");

        log.debug("Created cancellation for {} with {} attendees, sequence {}", uid, attendees.size(), sequence);
        return IcsFormat.foldAll(result);
    }

    /**
     * Normalizes line endings, repairs broken attendee continuations, unfolds,
     * removes empty lines and fixes {@code mailto::} artifacts. Returns LF
     * separated logical lines.
     */
    static String deepClean(String ics) {
        var repaired = IcsRepairPasses.repairAttendeeFolding(ics);
        var unfolded = IcsFormat.unfold(repaired);
        unfolded = unfolded.replaceAll("(?i)mailto::+", "mailto:");
        unfolded = unfolded.replaceAll("\\n{2,}", "\n");
        return unfolded.strip() + "\n";
    }

    private static @Nullable String firstLine(List<String> lines, String name) {
        boolean inEvent = false;
        for (var line : lines) {
            var property = IcsFormat.propertyName(line);
            if (property.equals("BEGIN") && IcsFormat.propertyValue(line).strip().equalsIgnoreCase("VEVENT")) {
                inEvent = true;
            } else if (inEvent && property.equals(name)) {
                return line;
            }
        }
        return null;
    }

    private static @Nullable String referencedTimezone(String cleaned, @Nullable String dtstart) {
        if (dtstart == null) {
            return null;
        }
        var tzid = TZID.matcher(dtstart);
        if (!tzid.find()) {
            return null;
        }
        var id = tzid.group(1).replace("\"", "");
        var matcher = VTIMEZONE.matcher(cleaned);
        while (matcher.find()) {
            var block = matcher.group();
            if (block.contains("TZID:" + id)) {
                return block;
            }
        }
        return null;
    }

    private String synthesize(CalendarEventRecord event) {
        var lines = new ArrayList<String>();
        lines.add("BEGIN:VCALENDAR");
        lines.add("PRODID:" + productId);
        lines.add("VERSION:2.0");
        lines.add("METHOD:CANCEL");
        lines.add("BEGIN:VEVENT");
        lines.add("UID:" + event.getUid());
        lines.add("DTSTAMP:" + IcsFormat.formatUtc(clock.instant()));
        lines.add(IcsSerializer.dateLine("DTSTART", event.getStartDate(), event.isAllDay()));
        lines.add(IcsSerializer.dateLine("DTEND", event.getEndDate(), event.isAllDay()));
        lines.add("SUMMARY:" + IcsFormat.escapeText(event.getTitle()));
        lines.addAll(IcsSerializer.attendeeLines(event));
        lines.add("SEQUENCE:" + IcsSerializer.nextSequence(event.getRawData()));
        lines.add("STATUS:CANCELLED");
        lines.add("END:VEVENT");
        lines.add("END:VCALENDAR");
        return IcsFormat.foldAll(lines);
    }
}
