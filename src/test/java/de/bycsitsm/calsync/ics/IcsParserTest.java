package de.bycsitsm.calsync.ics;

import de.bycsitsm.calsync.CalSyncProperties;
import de.bycsitsm.calsync.model.Attendee;
import de.bycsitsm.calsync.model.Resource;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IcsParserTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final IcsParser parser = new IcsParser(new Ical4jParsingFacility(),
            Clock.fixed(NOW, ZoneOffset.UTC), CalSyncProperties.defaults());

    private static String calendar(String eventBody) {
        return """
                BEGIN:VCALENDAR
                VERSION:2.0
                PRODID:-//Test//Test//EN
                BEGIN:VEVENT
                """ + eventBody + """
                END:VEVENT
                END:VCALENDAR
                """;
    }

    @Test
    void parses_a_timed_event() {
        var ics = calendar("""
                UID:meeting-1@example.com
                DTSTAMP:20240301T080000Z
                DTSTART:20240315T100000Z
                DTEND:20240315T113000Z
                SUMMARY:Planning
                LOCATION:Room 4
                DESCRIPTION:Quarterly planning
                """);

        var event = parser.parse(ics, "\"etag-1\"", "https://dav.example.com/cal/meeting-1.ics");

        assertThat(event).isNotNull();
        assertThat(event.getUid()).isEqualTo("meeting-1@example.com");
        assertThat(event.getTitle()).isEqualTo("Planning");
        assertThat(event.getStartDate()).isEqualTo(Instant.parse("2024-03-15T10:00:00Z"));
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-03-15T11:30:00Z"));
        assertThat(event.isAllDay()).isFalse();
        assertThat(event.getLocation()).isEqualTo("Room 4");
        assertThat(event.getDescription()).isEqualTo("Quarterly planning");
        assertThat(event.getTimezone()).isEqualTo("UTC");
        assertThat(event.getEtag()).isEqualTo("\"etag-1\"");
        assertThat(event.getUrl()).isEqualTo("https://dav.example.com/cal/meeting-1.ics");
        assertThat(event.getRawData()).contains("UID:meeting-1@example.com");
    }

    @Test
    void date_values_are_all_day() {
        var ics = calendar("""
                UID:holiday@example.com
                DTSTART;VALUE=DATE:20240501
                DTEND;VALUE=DATE:20240502
                SUMMARY:Holiday
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.isAllDay()).isTrue();
        assertThat(event.getStartDate()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-05-02T00:00:00Z"));
    }

    @Test
    void midnight_start_without_date_value_is_all_day() {
        var ics = calendar("""
                UID:offsite@example.com
                DTSTART:20240315T000000
                DTEND:20240316T000000
                SUMMARY:Offsite
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.isAllDay()).isTrue();
        assertThat(event.getStartDate()).isEqualTo(Instant.parse("2024-03-15T00:00:00Z"));
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-03-16T00:00:00Z"));
    }

    @Test
    void missing_end_of_timed_event_defaults_to_one_hour() {
        var ics = calendar("""
                UID:call@example.com
                DTSTART:20240315T140000Z
                SUMMARY:Call
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-03-15T15:00:00Z"));
    }

    @Test
    void missing_end_of_all_day_event_defaults_to_one_day() {
        var ics = calendar("""
                UID:birthday@example.com
                DTSTART;VALUE=DATE:20240620
                SUMMARY:Birthday
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-06-21T00:00:00Z"));
    }

    @Test
    void end_before_start_is_replaced() {
        var ics = calendar("""
                UID:broken-end@example.com
                DTSTART:20240315T140000Z
                DTEND:20240315T120000Z
                SUMMARY:Broken end
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-03-15T15:00:00Z"));
    }

    @Test
    void duration_determines_the_end() {
        var ics = calendar("""
                UID:workshop@example.com
                DTSTART:20240315T090000Z
                DURATION:PT90M
                SUMMARY:Workshop
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-03-15T10:30:00Z"));
    }

    @Test
    void week_durations_are_understood() {
        var ics = calendar("""
                UID:retreat@example.com
                DTSTART:20240315T090000Z
                DURATION:P2W
                SUMMARY:Retreat
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-03-29T09:00:00Z"));
    }

    @Test
    void tzid_is_resolved_through_the_embedded_time_zone_definition() {
        var ics = """
                BEGIN:VCALENDAR
                VERSION:2.0
                PRODID:Microsoft Exchange Server 2010
                BEGIN:VTIMEZONE
                TZID:W. Europe Standard Time
                BEGIN:STANDARD
                DTSTART:16010101T030000
                TZOFFSETFROM:+0200
                TZOFFSETTO:+0100
                RRULE:FREQ=YEARLY;INTERVAL=1;BYDAY=-1SU;BYMONTH=10
                END:STANDARD
                BEGIN:DAYLIGHT
                DTSTART:16010101T020000
                TZOFFSETFROM:+0100
                TZOFFSETTO:+0200
                RRULE:FREQ=YEARLY;INTERVAL=1;BYDAY=-1SU;BYMONTH=3
                END:DAYLIGHT
                END:VTIMEZONE
                BEGIN:VEVENT
                UID:040000008200E00074C5B7101A82E00800000000@example.com
                DTSTART;TZID=W. Europe Standard Time:20240612T090000
                DTEND;TZID=W. Europe Standard Time:20240612T100000
                SUMMARY:Steering committee
                END:VEVENT
                END:VCALENDAR
                """;

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.isAllDay()).isFalse();
        assertThat(event.getStartDate()).isEqualTo(Instant.parse("2024-06-12T07:00:00Z"));
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-06-12T08:00:00Z"));
        assertThat(event.getTimezone()).isEqualTo("W. Europe Standard Time");
    }

    @Test
    void custom_time_zone_definition_wins_over_unknown_identifier() {
        var ics = """
                BEGIN:VCALENDAR
                VERSION:2.0
                PRODID:-//Test//Test//EN
                BEGIN:VTIMEZONE
                TZID:Customized Time Zone
                BEGIN:STANDARD
                DTSTART:16010101T000000
                TZOFFSETFROM:+0530
                TZOFFSETTO:+0530
                END:STANDARD
                END:VTIMEZONE
                BEGIN:VEVENT
                UID:kolkata@example.com
                DTSTART;TZID=Customized Time Zone:20240612T093000
                DURATION:PT1H
                SUMMARY:Offshore sync
                END:VEVENT
                END:VCALENDAR
                """;

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getStartDate()).isEqualTo(Instant.parse("2024-06-12T04:00:00Z"));
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-06-12T05:00:00Z"));
    }

    @Test
    void local_time_with_tzid_is_converted() {
        var ics = calendar("""
                UID:berlin@example.com
                DTSTART;TZID=Europe/Berlin:20240315T100000
                DTEND;TZID=Europe/Berlin:20240315T110000
                SUMMARY:Standup
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getStartDate()).isEqualTo(Instant.parse("2024-03-15T09:00:00Z"));
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-03-15T10:00:00Z"));
        assertThat(event.getTimezone()).isEqualTo("Europe/Berlin");
    }

    @Test
    void missing_summary_gets_a_placeholder() {
        var ics = calendar("""
                UID:nameless@example.com
                DTSTART:20240315T100000Z
                DTEND:20240315T110000Z
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getTitle()).isEqualTo("Untitled Event");
    }

    @Test
    void missing_start_is_anchored_on_the_timestamp() {
        var ics = calendar("""
                UID:undated@example.com
                DTSTAMP:20240110T083000Z
                SUMMARY:Undated note
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getStartDate()).isEqualTo(Instant.parse("2024-01-10T08:30:00Z"));
        assertThat(event.getEndDate()).isEqualTo(Instant.parse("2024-01-10T09:30:00Z"));
    }

    @Test
    void event_without_start_and_summary_is_dropped() {
        var ics = calendar("""
                UID:empty@example.com
                DTSTAMP:20240110T083000Z
                """);

        assertThat(parser.parse(ics, null, null)).isNull();
    }

    @Test
    void unparseable_input_is_dropped() {
        assertThat(parser.parse("", null, null)).isNull();
        assertThat(parser.parse("this is not a calendar", null, null)).isNull();
    }

    @Test
    void missing_uid_is_generated() {
        var ics = calendar("""
                DTSTART:20240315T100000Z
                SUMMARY:No uid
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getUid()).startsWith("event-" + NOW.toEpochMilli() + "-").endsWith("@calsync.local");
    }

    @Test
    void uid_is_kept_verbatim() {
        var ics = calendar("""
                UID:040000008200E00074C5B7101A82E00800000000@outlook:example
                DTSTART:20240315T100000Z
                SUMMARY:Outlook invite
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getUid()).isEqualTo("040000008200E00074C5B7101A82E00800000000@outlook:example");
    }

    @Test
    void recurrence_rule_with_attendee_fragment_is_sanitized() {
        var ics = calendar("""
                UID:weekly@example.com
                DTSTART:20240311T090000Z
                DTEND:20240311T093000Z
                SUMMARY:Weekly
                RRULE:FREQ=WEEKLY;BYDAY=MO:mailto:evil@x.com
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getTitle()).isEqualTo("Weekly");
        assertThat(event.getRecurrenceRule()).isEqualTo("FREQ=WEEKLY;BYDAY=MO");
    }

    @Test
    void recurrence_rule_with_schedule_status_is_cleaned() {
        var ics = calendar("""
                UID:daily@example.com
                DTSTART:20240311T090000Z
                SUMMARY:Daily
                RRULE:FREQ=DAILY;SCHEDULE-STATUS=3.7;COUNT=10
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getRecurrenceRule()).isEqualTo("FREQ=DAILY;COUNT=10");
    }

    @Test
    void participants_are_split_into_attendees_and_resources() {
        var ics = calendar("""
                UID:review@example.com
                DTSTART:20240315T100000Z
                SUMMARY:Review
                ATTENDEE;CN=Jane Doe;ROLE=REQ-PARTICIPANT;PARTSTAT=ACCEPTED:mailto:jane@example.com
                ATTENDEE;CN=Conference Room 1;CUTYPE=ROOM:mailto:room1@example.com
                ATTENDEE;CN=Beamer;CUTYPE=RESOURCE;X-RESOURCE-TYPE=Projector:mailto:beamer@example.com
                ATTENDEE;CN=Beamer;CUTYPE=RESOURCE:mailto:beamer@example.com
                ATTENDEE;CN=Bob:mailto:bob@example.com
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getAttendees()).extracting(Attendee::email)
                .containsExactly("jane@example.com", "bob@example.com");
        assertThat(event.getAttendees().get(0).status()).isEqualTo("ACCEPTED");
        assertThat(event.getAttendees().get(1).status()).isEqualTo("NEEDS-ACTION");
        assertThat(event.getResources()).extracting(Resource::adminEmail)
                .containsExactly("room1@example.com", "beamer@example.com");
        assertThat(event.getResources()).extracting(Resource::type)
                .containsExactly("Room", "Projector");
    }

    @Test
    void attendee_split_across_lines_without_folding_is_recovered() {
        var ics = calendar("""
                UID:split@example.com
                DTSTART:20240315T100000Z
                SUMMARY:Split attendee
                ATTENDEE;CN=Jane Doe;ROLE=REQ-PARTICIPANT;
                PARTSTAT=TENTATIVE:mailto:jane@example.com
                """);

        var event = parser.parse(ics, null, null);

        assertThat(event).isNotNull();
        assertThat(event.getAttendees()).extracting(Attendee::email).containsExactly("jane@example.com");
        assertThat(event.getAttendees().get(0).status()).isEqualTo("TENTATIVE");
    }

    @Test
    void participant_classification_uses_keywords() {
        var projector = ParticipantClassifier.classify("projector-2@example.com", Map.of());
        var person = ParticipantClassifier.classify("anna@example.com", Map.of("CN", "Anna"));
        var nonParticipant = ParticipantClassifier.classify("desk@example.com",
                Map.of("ROLE", "NON-PARTICIPANT", "RESOURCE-TYPE", "Desk"));

        assertThat(projector).isInstanceOf(Resource.class);
        assertThat(((Resource) projector).type()).isEqualTo("Projector");
        assertThat(person).isEqualTo(new Attendee("anna@example.com", "Anna"));
        assertThat(nonParticipant).isEqualTo(new Resource("desk@example.com", "desk@example.com", "Desk"));
    }
}
