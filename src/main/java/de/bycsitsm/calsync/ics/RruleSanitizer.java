package de.bycsitsm.calsync.ics;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Defensive cleanup of {@code RRULE} values received from other calendar clients.
 * <p>
 * Some clients corrupt recurrence rules by gluing attendee data onto them, for
 * example {@code FREQ=WEEKLY;BYDAY=MO:mailto:someone@example.com} or
 * {@code FREQ=DAILY;...user@domain.comProjector}. The sanitizer recovers the
 * rule parts it recognizes and drops everything else. Clean rules pass through
 * unchanged.
 */
public final class RruleSanitizer {

    private static final Logger log = LoggerFactory.getLogger(RruleSanitizer.class);

    static final Set<String> ALLOWED_PARTS = Set.of(
            "FREQ", "INTERVAL", "COUNT", "UNTIL", "BYDAY", "BYMONTHDAY", "BYMONTH", "WKST", "BYSETPOS");

    private static final Set<String> FREQUENCIES = Set.of(
            "SECONDLY", "MINUTELY", "HOURLY", "DAILY", "WEEKLY", "MONTHLY", "YEARLY");

    /**
     * An e-mail address with a lower-case TLD immediately followed by a
     * capitalized word of at least three letters, e.g. {@code a@b.comProjector}.
     */
    private static final Pattern EMAIL_WITH_RESOURCE_TYPE =
            Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)*\\.[a-z]{2,}[A-Z][a-z]{2,}");

    private static final Pattern FREQ_TOKEN = Pattern.compile("FREQ=([A-Z]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNTIL_VALUE = Pattern.compile("\\d{8}(T\\d{6}Z?)?");
    private static final Pattern POSITIVE_INT = Pattern.compile("\\d+");

    private RruleSanitizer() {
    }

    /**
     * Sanitizes a recurrence rule.
     *
     * @param raw the rule, with or without an {@code RRULE:} prefix
     * @return a rule starting with {@code FREQ=}, or an empty string if no
     * frequency can be recovered
     */
    public static String sanitize(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        var rule = raw.strip();
        if (rule.regionMatches(true, 0, "RRULE:", 0, 6)) {
            rule = rule.substring(6).strip();
        }

        if (EMAIL_WITH_RESOURCE_TYPE.matcher(rule).find()) {
            var freq = recoverFrequency(rule);
            log.debug("Recovered '{}' from RRULE with attached resource address: {}", freq, raw);
            return freq;
        }

        int colon = rule.indexOf(':');
        if (colon >= 0) {
            rule = rule.substring(0, colon);
        }

        String frequency = null;
        var others = new ArrayList<String>();
        for (var part : rule.split(";")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            var name = part.substring(0, eq).strip().toUpperCase(Locale.ROOT);
            var value = part.substring(eq + 1).strip();
            if (!ALLOWED_PARTS.contains(name) || value.isEmpty() || !isValidValue(name, value)) {
                continue;
            }
            if (name.equals("FREQ")) {
                if (frequency == null) {
                    frequency = value.toUpperCase(Locale.ROOT);
                }
            } else {
                others.add(name + "=" + value);
            }
        }

        if (frequency == null) {
            if (!raw.toUpperCase(Locale.ROOT).contains("FREQ")) {
                return "";
            }
            frequency = "DAILY";
        }

        var sb = new StringBuilder("FREQ=").append(frequency);
        for (var part : others) {
            sb.append(';').append(part);
        }
        var result = sb.toString();
        if (!result.equals(raw)) {
            log.debug("Sanitized RRULE '{}' to '{}'", raw, result);
        }
        return result;
    }

    private static boolean isValidValue(String name, String value) {
        return switch (name) {
            case "FREQ" -> FREQUENCIES.contains(value.toUpperCase(Locale.ROOT));
            case "COUNT", "INTERVAL" -> POSITIVE_INT.matcher(value).matches() && !value.matches("0+");
            case "UNTIL" -> UNTIL_VALUE.matcher(value).matches();
            default -> true;
        };
    }

    private static String recoverFrequency(String rule) {
        var matcher = FREQ_TOKEN.matcher(rule);
        while (matcher.find()) {
            var freq = matcher.group(1).toUpperCase(Locale.ROOT);
            if (FREQUENCIES.contains(freq)) {
                return "FREQ=" + freq;
            }
        }
        return "";
    }
}
