package de.bycsitsm.calsync.ics;

import de.bycsitsm.calsync.model.Attendee;
import de.bycsitsm.calsync.model.Participant;
import de.bycsitsm.calsync.model.Resource;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decides whether an {@code ATTENDEE} entry denotes a person or a bookable resource.
 */
final class ParticipantClassifier {

    private static final List<String> RESOURCE_KEYWORDS = List.of("room", "projector", "chair");

    private ParticipantClassifier() {
    }

    /**
     * Classifies one attendee entry.
     *
     * @param email      the address without {@code mailto:} prefix
     * @param parameters the property parameters by upper-case name
     */
    static Participant classify(String email, Map<String, String> parameters) {
        var name = blankToNull(parameters.get("CN"));
        var cutype = parameters.get("CUTYPE");
        var role = parameters.get("ROLE");
        var type = blankToNull(parameters.getOrDefault("X-RESOURCE-TYPE", parameters.get("RESOURCE-TYPE")));

        var keyword = resourceKeyword(name, email);
        boolean resource = "RESOURCE".equalsIgnoreCase(cutype)
                || "ROOM".equalsIgnoreCase(cutype)
                || "NON-PARTICIPANT".equalsIgnoreCase(role)
                || keyword != null;
        if (resource) {
            if (type == null && keyword != null) {
                type = capitalize(keyword);
            }
            return new Resource(name != null ? name : email, email, type);
        }
        return new Attendee(email, name,
                role != null ? role : "REQ-PARTICIPANT",
                parameters.getOrDefault("PARTSTAT", "NEEDS-ACTION"),
                blankToNull(parameters.get("SCHEDULE-STATUS")));
    }

    private static @Nullable String resourceKeyword(@Nullable String name, String email) {
        var haystack = ((name != null ? name : "") + " " + email).toLowerCase(Locale.ROOT);
        for (var keyword : RESOURCE_KEYWORDS) {
            if (haystack.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private static @Nullable String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
