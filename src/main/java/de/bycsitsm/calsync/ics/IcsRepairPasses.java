package de.bycsitsm.calsync.ics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The repair passes known to the parser. Each pass is a pure function that is
 * exposed both as {@link IcsRepairPass} and as a static text method so it can
 * be tested on its own.
 */
public final class IcsRepairPasses {

    private static final Pattern PROPERTY_START = Pattern.compile("^[A-Z][A-Z0-9-]*[;:].*");
    private static final Pattern SCHEDULE_STATUS_PARAM =
            Pattern.compile(";?SCHEDULE-STATUS=[^;:]*", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_MAILTO = Pattern.compile("(?i)^mailto:\\S*$");

    /**
     * Start of attendee data glued onto a recurrence rule.
     */
    private static final Pattern RRULE_FRAGMENT_START = Pattern.compile(
            "(?i);?(ATTENDEE[;:]|CN=|CUTYPE=|ROLE=|PARTSTAT=|RSVP=|(?:X-)?RESOURCE-TYPE=|mailto:)");

    private static final Pattern FRAGMENT_ADDRESS = Pattern.compile(
            "(?i:mailto:)?([A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)*\\.[a-z]{2,})([A-Z][A-Za-z]*)?");

    private static final Pattern FRAGMENT_PARAM = Pattern.compile(
            "(?i)(CN|CUTYPE|ROLE|PARTSTAT|RSVP|X-RESOURCE-TYPE|RESOURCE-TYPE)=([^;:]+)");

    private static final Pattern ATTENDEE_ADDRESS = Pattern.compile("(?i)mailto:([^;:\\s]+)");

    private IcsRepairPasses() {
    }

    public static IcsRepairPass scheduleStatusInRrule() {
        return IcsRepairPass.of("schedule-status-in-rrule", IcsRepairPasses::removeScheduleStatusFromRrule);
    }

    public static IcsRepairPass brokenAttendeeFolding() {
        return IcsRepairPass.of("broken-attendee-folding", IcsRepairPasses::repairAttendeeFolding);
    }

    public static IcsRepairPass rruleAttendeeFragments() {
        return IcsRepairPass.of("rrule-attendee-fragments", IcsRepairPasses::splitAttendeeFragmentsFromRrule);
    }

    public static IcsRepairPass rruleTruncation() {
        return IcsRepairPass.of("rrule-truncation", IcsRepairPasses::truncateRrule);
    }

    public static IcsRepairPass danglingMailto() {
        return IcsRepairPass.of("dangling-mailto", IcsRepairPasses::removeDanglingMailto);
    }

    /**
     * Removes {@code SCHEDULE-STATUS} parameters that leaked into {@code RRULE} lines.
     */
    public static String removeScheduleStatusFromRrule(String ics) {
        var lines = IcsFormat.logicalLines(ics);
        boolean changed = false;
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (!IcsFormat.propertyName(line).equals("RRULE")) {
                continue;
            }
            var cleaned = SCHEDULE_STATUS_PARAM.matcher(line).replaceAll("");
            if (!cleaned.equals(line)) {
                lines.set(i, cleaned);
                changed = true;
            }
        }
        return changed ? IcsFormat.foldAll(lines) : ics;
    }

    /**
     * Re-attaches physical lines that continue an {@code ATTENDEE} or
     * {@code ORGANIZER} line but lack the leading folding whitespace.
     */
    public static String repairAttendeeFolding(String ics) {
        var lines = IcsFormat.lines(ics);
        var result = new ArrayList<String>(lines.size());
        boolean changed = false;
        boolean inParticipant = false;
        var logical = new StringBuilder();

        for (var line : lines) {
            if (line.startsWith(" ") || line.startsWith("\t")) {
                result.add(line);
                logical.append(line, 1, line.length());
                continue;
            }
            if (inParticipant && !line.isBlank() && continuesParticipant(line, logical)) {
                result.add(" " + line);
                logical.append(line);
                changed = true;
                continue;
            }
            result.add(line);
            logical.setLength(0);
            logical.append(line);
            var name = IcsFormat.propertyName(line);
            inParticipant = name.equals("ATTENDEE") || name.equals("ORGANIZER");
        }
        return changed ? IcsFormat.joinLines(result) : ics;
    }

    private static boolean continuesParticipant(String line, CharSequence previous) {
        if (line.regionMatches(true, 0, "mailto:", 0, 7)) {
            // only join when the previous line is still waiting for its address
            var prev = previous.toString();
            return prev.endsWith(":") || prev.endsWith(";") || IcsFormat.propertyValue(prev).isEmpty();
        }
        return !PROPERTY_START.matcher(line).matches();
    }

    /**
     * Moves attendee and resource fragments that were concatenated onto
     * {@code RRULE} lines into standalone {@code ATTENDEE} lines.
     */
    public static String splitAttendeeFragmentsFromRrule(String ics) {
        var lines = IcsFormat.logicalLines(ics);
        var knownAddresses = new HashSet<String>();
        for (var line : lines) {
            if (IcsFormat.propertyName(line).equals("ATTENDEE")) {
                var matcher = ATTENDEE_ADDRESS.matcher(line);
                if (matcher.find()) {
                    knownAddresses.add(matcher.group(1).toLowerCase(Locale.ROOT));
                }
            }
        }

        var result = new ArrayList<String>(lines.size());
        boolean changed = false;
        for (var line : lines) {
            if (!IcsFormat.propertyName(line).equals("RRULE")) {
                result.add(line);
                continue;
            }
            int valueStart = line.indexOf(':') + 1;
            var matcher = RRULE_FRAGMENT_START.matcher(line);
            if (valueStart <= 0 || !matcher.find(valueStart)) {
                result.add(line);
                continue;
            }
            var rule = line.substring(valueStart, matcher.start()).replaceAll("[;:]+$", "");
            result.add("RRULE:" + rule);
            result.addAll(attendeeLinesFromFragment(line.substring(matcher.start()), knownAddresses));
            changed = true;
        }
        return changed ? IcsFormat.foldAll(result) : ics;
    }

    private static List<String> attendeeLinesFromFragment(String fragment, Set<String> knownAddresses) {
        var attendees = new ArrayList<String>();
        var matcher = FRAGMENT_ADDRESS.matcher(fragment);
        int segmentStart = 0;
        while (matcher.find()) {
            var email = matcher.group(1);
            var gluedType = matcher.group(2);
            var params = new LinkedHashMap<String, String>();
            var paramMatcher = FRAGMENT_PARAM.matcher(fragment.substring(segmentStart, matcher.start()));
            while (paramMatcher.find()) {
                params.putIfAbsent(paramMatcher.group(1).toUpperCase(Locale.ROOT), paramMatcher.group(2).strip());
            }
            if (gluedType != null) {
                params.putIfAbsent("CUTYPE", "RESOURCE");
                params.putIfAbsent("X-RESOURCE-TYPE", gluedType);
            }
            segmentStart = matcher.end();

            if (!knownAddresses.add(email.toLowerCase(Locale.ROOT))) {
                continue;
            }
            var sb = new StringBuilder("ATTENDEE");
            params.forEach((name, value) -> sb.append(';').append(name).append('=').append(value));
            sb.append(":mailto:").append(email);
            attendees.add(sb.toString());
        }
        return attendees;
    }

    /**
     * Reduces every {@code RRULE} to the parts the sanitizer recognizes and
     * drops rules from which no frequency can be recovered.
     */
    public static String truncateRrule(String ics) {
        var lines = IcsFormat.logicalLines(ics);
        var result = new ArrayList<String>(lines.size());
        boolean changed = false;
        for (var line : lines) {
            if (!IcsFormat.propertyName(line).equals("RRULE")) {
                result.add(line);
                continue;
            }
            var value = line.substring(line.indexOf(':') + 1);
            var sanitized = RruleSanitizer.sanitize(value);
            if (!sanitized.equals(value)) {
                changed = true;
            }
            if (!sanitized.isEmpty()) {
                result.add("RRULE:" + sanitized);
            } else {
                changed = true;
            }
        }
        return changed ? IcsFormat.foldAll(result) : ics;
    }

    /**
     * Drops physical lines that consist of nothing but a {@code mailto:} address.
     */
    public static String removeDanglingMailto(String ics) {
        var lines = IcsFormat.lines(ics);
        var result = new ArrayList<String>(lines.size());
        for (var line : lines) {
            if (!BARE_MAILTO.matcher(line.stripTrailing()).matches()) {
                result.add(line);
            }
        }
        return result.size() == lines.size() ? ics : IcsFormat.joinLines(result);
    }
}
