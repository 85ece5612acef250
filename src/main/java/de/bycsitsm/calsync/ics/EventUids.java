package de.bycsitsm.calsync.ics;

import org.jspecify.annotations.Nullable;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Generation and extraction of iCalendar {@code UID} values of the form {@code <local>@<domain>}.
 */
public final class EventUids {

    private static final Pattern WELL_FORMED = Pattern.compile("[^\\s@]+@[^\\s@]+");
    private static final Pattern UID_LINE = Pattern.compile("(?im)^UID(?:;[^:\\r\\n]*)?:([^\\r\\n]+)");
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private EventUids() {
    }

    /**
     * Generates a new UID like {@code event-1718000000000-k3j9x0ab@calsync.local}.
     */
    public static String generate(Clock clock, String domain) {
        var random = new StringBuilder(8);
        for (int i = 0; i < 8; i++) {
            random.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return "event-" + clock.millis() + "-" + random + "@" + domain;
    }

    public static boolean isWellFormed(@Nullable String uid) {
        return uid != null && WELL_FORMED.matcher(uid.strip()).matches();
    }

    /**
     * Returns the UID of the first {@code UID} line in the given iCalendar text,
     * or {@code null} if there is none.
     */
    public static @Nullable String extract(@Nullable String ics) {
        if (ics == null) {
            return null;
        }
        var matcher = UID_LINE.matcher(IcsFormat.unfold(ics));
        if (!matcher.find()) {
            return null;
        }
        var uid = matcher.group(1).strip();
        return uid.isEmpty() ? null : uid;
    }

    /**
     * Keeps a well-formed candidate, otherwise generates a new UID.
     */
    public static String preserveOrGenerate(@Nullable String candidate, Clock clock, String domain) {
        return isWellFormed(candidate) ? candidate.strip() : generate(clock, domain);
    }
}
