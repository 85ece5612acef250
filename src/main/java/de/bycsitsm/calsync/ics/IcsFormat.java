package de.bycsitsm.calsync.ics;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-level helpers for RFC 5545 text: line endings, folding, escaping and
 * date-time formatting.
 */
public final class IcsFormat {

    public static final String CRLF = "\r\n";

    /** Maximum octets per physical line, excluding the CRLF. */
    static final int MAX_LINE_OCTETS = 75;

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");
    private static final Pattern FOLD = Pattern.compile("\r?\n[ \t]");

    private static final DateTimeFormatter UTC_DATE_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private IcsFormat() {
    }

    /**
     * Splits text into physical lines, accepting CRLF, CR and LF endings.
     * A trailing line break does not produce an empty last line.
     */
    public static List<String> lines(String text) {
        var lines = new ArrayList<>(Arrays.asList(LINE_BREAK.split(text, -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * Joins lines with CRLF, terminating the last line as well.
     */
    public static String joinLines(List<String> lines) {
        var sb = new StringBuilder();
        for (var line : lines) {
            sb.append(line).append(CRLF);
        }
        return sb.toString();
    }

    public static String normalizeLineEndings(String text) {
        return LINE_BREAK.matcher(text).replaceAll("\n");
    }

    /**
     * Removes RFC 5545 folding (a line break followed by a single space or tab).
     */
    public static String unfold(String text) {
        return FOLD.matcher(normalizeLineEndings(text)).replaceAll("");
    }

    /**
     * Returns the logical (unfolded) lines of the given text.
     */
    public static List<String> logicalLines(String text) {
        return lines(unfold(text));
    }

    /**
     * Folds one logical line into physical lines of at most 75 octets.
     * Continuation lines start with a single space. Multi-byte UTF-8 characters
     * are never split.
     */
    public static String fold(String line) {
        if (line.getBytes(StandardCharsets.UTF_8).length <= MAX_LINE_OCTETS) {
            return line;
        }
        var sb = new StringBuilder();
        int octets = 0;
        int limit = MAX_LINE_OCTETS;
        int i = 0;
        while (i < line.length()) {
            int codePoint = line.codePointAt(i);
            int charCount = Character.charCount(codePoint);
            int size = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (octets + size > limit) {
                sb.append(CRLF).append(' ');
                // the leading space counts towards the continuation line
                octets = 1;
            }
            sb.appendCodePoint(codePoint);
            octets += size;
            i += charCount;
        }
        return sb.toString();
    }

    /**
     * Folds every logical line and joins them with CRLF.
     */
    public static String foldAll(List<String> logicalLines) {
        var folded = new ArrayList<String>(logicalLines.size());
        for (var line : logicalLines) {
            folded.add(fold(line));
        }
        return joinLines(folded);
    }

    /**
     * Escapes a TEXT value (RFC 5545 section 3.3.11).
     */
    public static String escapeText(String value) {
        return normalizeLineEndings(value)
                .replace("\\", "\\\\")
                .replace(";", "\\;")
                .replace(",", "\\,")
                .replace("\n", "\\n");
    }

    /**
     * Reverses {@link #escapeText(String)}.
     */
    public static String unescapeText(String value) {
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                switch (next) {
                    case 'n', 'N' -> sb.append('\n');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String formatUtc(Instant instant) {
        return UTC_DATE_TIME.format(instant);
    }

    public static String formatDate(LocalDate date) {
        return DATE.format(date);
    }

    /**
     * Formats the UTC calendar date of an instant, used for all-day values.
     */
    public static String formatDate(Instant instant) {
        return formatDate(instant.atZone(ZoneOffset.UTC).toLocalDate());
    }

    /**
     * Returns the property name of a logical line ({@code DTSTART} for
     * {@code DTSTART;TZID=Europe/Berlin:...}), upper-cased.
     */
    public static String propertyName(String line) {
        int end = line.length();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ';' || c == ':') {
                end = i;
                break;
            }
        }
        return line.substring(0, end).strip().toUpperCase();
    }

    /**
     * Returns the value part of a logical line: everything after the first
     * colon that is not inside a quoted parameter value.
     */
    public static String propertyValue(String line) {
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ':' && !quoted) {
                return line.substring(i + 1);
            }
        }
        return "";
    }

    /**
     * Quotes a parameter value when it contains characters that are not allowed unquoted.
     */
    public static String parameterValue(String value) {
        var cleaned = value.replace("\"", "'");
        if (cleaned.contains(":") || cleaned.contains(";") || cleaned.contains(",")) {
            return '"' + cleaned + '"';
        }
        return cleaned;
    }
}
