package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.CalSyncProperties;
import de.bycsitsm.calsync.caldav.CalDavCredentials;
import de.bycsitsm.calsync.ics.Ical4jParsingFacility;
import de.bycsitsm.calsync.ics.IcsParser;
import de.bycsitsm.calsync.ics.IcsSerializer;
import de.bycsitsm.calsync.model.Calendar;
import de.bycsitsm.calsync.model.CalendarEventRecord;
import de.bycsitsm.calsync.model.ConnectionStatus;
import de.bycsitsm.calsync.model.ServerConnection;
import de.bycsitsm.calsync.model.SyncStatus;
import de.bycsitsm.calsync.store.InMemoryCalendarStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarSyncOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final String WORK_URL = "https://dav.example.com/caldav.php/jane/work/";
    private static final String HOME_URL = "https://dav.example.com/caldav.php/jane/home/";

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final InMemoryCalendarStore store = new InMemoryCalendarStore();
    private final FakeCalDavAdapter server = new FakeCalDavAdapter();
    private final RecordingChangeNotifier notifier = new RecordingChangeNotifier();
    private final CalendarSyncOrchestrator orchestrator = new CalendarSyncOrchestrator(server, store,
            new IcsParser(new Ical4jParsingFacility(), clock, CalSyncProperties.defaults()),
            new IcsSerializer(clock, CalSyncProperties.defaults()), notifier, clock);

    private final ServerConnection connection = new ServerConnection(1, "https://dav.example.com/caldav.php/jane/",
            "jane@example.com", "secret", null, false, ConnectionStatus.PENDING, null);

    static String ics(String uid, String summary) {
        return """
                BEGIN:VCALENDAR
                VERSION:2.0
                PRODID:-//Other//Client//EN
                BEGIN:VEVENT
                UID:%s
                DTSTAMP:20240301T080000Z
                DTSTART:20240315T100000Z
                DTEND:20240315T110000Z
                SUMMARY:%s
                END:VEVENT
                END:VCALENDAR
                """.formatted(uid, summary);
    }

    private Calendar workCalendar() {
        server.addCalendar("Work", WORK_URL);
        return store.createCalendar(new Calendar(null, 1, "Work", Calendar.DEFAULT_COLOR, WORK_URL, null, true, null));
    }

    private CalendarEventRecord localEvent(Calendar calendar, String uid, String title) {
        var event = new CalendarEventRecord(uid, title,
                Instant.parse("2024-03-20T09:00:00Z"), Instant.parse("2024-03-20T10:00:00Z"));
        event.setCalendarId(calendar.id());
        event.setSyncStatus(SyncStatus.LOCAL);
        return store.createEvent(event);
    }

    /**
     * Simulates a local edit as the event service performs it.
     */
    private void editLocally(CalendarEventRecord event, String title) {
        var current = store.getEvent(event.getId());
        current.setTitle(title);
        current.setRevision(current.getRevision() + 1);
        current.setSyncStatus(current.existsRemotely() ? SyncStatus.PENDING : SyncStatus.LOCAL);
        store.updateEvent(current);
    }

    @Test
    void first_pass_creates_calendars_and_imports_remote_events() {
        server.addCalendar("Work", WORK_URL);
        var etag = server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Remote meeting"));

        assertThat(orchestrator.runPass(connection, SyncOptions.defaults())).isTrue();

        var calendars = store.getCalendars(1);
        assertThat(calendars).hasSize(1);
        assertThat(calendars.get(0).name()).isEqualTo("Work");
        assertThat(calendars.get(0).url()).isEqualTo(WORK_URL);
        assertThat(calendars.get(0).color()).isEqualTo(Calendar.DEFAULT_COLOR);
        assertThat(calendars.get(0).syncToken()).isEqualTo(NOW.toString());

        var event = store.getEventByUid(1, "m1@example.com");
        assertThat(event).isNotNull();
        assertThat(event.getTitle()).isEqualTo("Remote meeting");
        assertThat(event.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(event.getEtag()).isEqualTo(etag);
        assertThat(event.getUrl()).isEqualTo(WORK_URL + "m1.ics");
        assertThat(event.getCalendarId()).isEqualTo(calendars.get(0).id());

        var stored = store.getServerConnection(1);
        assertThat(stored.status()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(stored.lastSync()).isEqualTo(NOW);
        assertThat(notifier.types()).containsSubsequence(
                ChangeType.CALENDAR_CREATED, ChangeType.EVENT_CREATED, ChangeType.SYNC_COMPLETED);
    }

    @Test
    void local_event_is_pushed_and_becomes_synced() {
        var calendar = workCalendar();
        var event = localEvent(calendar, "event-1@calsync.local", "Dentist");

        assertThat(orchestrator.runPass(connection, SyncOptions.defaults())).isTrue();

        var pushed = store.getEvent(event.getId());
        assertThat(pushed.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(pushed.getUrl()).isEqualTo(WORK_URL + "event-1_calsync_local.ics");
        assertThat(pushed.getEtag()).isEqualTo(server.object(pushed.getUrl()).etag());
        assertThat(pushed.getLastSyncAttempt()).isEqualTo(NOW);
        assertThat(pushed.getRawData()).contains("UID:event-1@calsync.local");
        assertThat(server.object(pushed.getUrl()).calendarData())
                .contains("SUMMARY:Dentist")
                .contains("UID:event-1@calsync.local");

        orchestrator.runPass(connection, SyncOptions.defaults());

        assertThat(server.puts).hasSize(1);
        assertThat(store.getEvents(calendar.id())).hasSize(1);
    }

    @Test
    void pull_keeps_local_edits_and_only_adopts_the_etag() {
        var calendar = workCalendar();
        server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Original"));
        orchestrator.runPass(connection, SyncOptions.defaults());
        var event = store.getEventByUid(1, "m1@example.com");

        editLocally(event, "Edited locally");
        var newEtag = server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Edited remotely"));
        var target = new CalendarSyncOrchestrator.SyncTarget(store.getCalendar(calendar.id()),
                server.fetchCalendars(CalDavCredentials.of(connection)).get(0));

        orchestrator.pull(1, CalDavCredentials.of(connection), target, SyncOptions.defaults());

        var pulled = store.getEvent(event.getId());
        assertThat(pulled.getTitle()).isEqualTo("Edited locally");
        assertThat(pulled.getStartDate()).isEqualTo(event.getStartDate());
        assertThat(pulled.getSyncStatus()).isEqualTo(SyncStatus.PENDING);
        assertThat(pulled.getEtag()).isEqualTo(newEtag);
    }

    @Test
    void pending_edit_wins_over_concurrent_remote_change() {
        workCalendar();
        server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Original"));
        orchestrator.runPass(connection, SyncOptions.defaults());
        var event = store.getEventByUid(1, "m1@example.com");

        editLocally(event, "Edited locally");
        server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Edited remotely"));

        assertThat(orchestrator.runPass(connection, SyncOptions.defaults())).isTrue();

        var synced = store.getEvent(event.getId());
        assertThat(synced.getTitle()).isEqualTo("Edited locally");
        assertThat(synced.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(server.object(WORK_URL + "m1.ics").calendarData()).contains("SUMMARY:Edited locally");
        assertThat(synced.getEtag()).isEqualTo(server.object(WORK_URL + "m1.ics").etag());
    }

    @Test
    void edit_during_put_keeps_the_record_pending() {
        workCalendar();
        server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Original"));
        orchestrator.runPass(connection, SyncOptions.defaults());
        var event = store.getEventByUid(1, "m1@example.com");
        editLocally(event, "First edit");

        var edited = new boolean[1];
        server.beforePut = () -> {
            if (!edited[0]) {
                edited[0] = true;
                editLocally(event, "Edited in flight");
            }
        };
        orchestrator.runPass(connection, SyncOptions.defaults());

        var afterFirstPass = store.getEvent(event.getId());
        assertThat(afterFirstPass.getTitle()).isEqualTo("Edited in flight");
        assertThat(afterFirstPass.getSyncStatus()).isEqualTo(SyncStatus.PENDING);
        assertThat(afterFirstPass.getEtag()).isEqualTo(server.object(WORK_URL + "m1.ics").etag());
        assertThat(server.object(WORK_URL + "m1.ics").calendarData()).contains("SUMMARY:First edit");

        orchestrator.runPass(connection, SyncOptions.defaults());

        var afterSecondPass = store.getEvent(event.getId());
        assertThat(afterSecondPass.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(server.object(WORK_URL + "m1.ics").calendarData()).contains("SUMMARY:Edited in flight");
    }

    @Test
    void failed_push_marks_only_that_event() {
        var calendar = workCalendar();
        var failing = localEvent(calendar, "broken@calsync.local", "Broken");
        var fine = localEvent(calendar, "fine@calsync.local", "Fine");
        server.failPutsTo(WORK_URL + "broken_calsync_local.ics");

        assertThat(orchestrator.runPass(connection, SyncOptions.defaults())).isTrue();

        var failed = store.getEvent(failing.getId());
        assertThat(failed.getSyncStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(failed.getLastSyncAttempt()).isEqualTo(NOW);
        assertThat(store.getEvent(fine.getId()).getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
    }

    @Test
    void rejected_login_aborts_the_pass() {
        workCalendar();
        server.rejectLogin = true;

        assertThat(orchestrator.runPass(connection, SyncOptions.defaults())).isFalse();

        assertThat(store.getServerConnection(1).status()).isEqualTo(ConnectionStatus.ERROR);
        assertThat(notifier.types()).doesNotContain(ChangeType.SYNC_COMPLETED);
    }

    @Test
    void calendars_are_matched_by_url_then_by_name() {
        var work = store.createCalendar(new Calendar(null, 1, "Old name", "#ff0000", WORK_URL, null, true, null));
        var home = store.createCalendar(new Calendar(null, 1, "Home", Calendar.DEFAULT_COLOR, null, null, true, null));
        server.addCalendar("Work", WORK_URL);
        server.addCalendar("Home", HOME_URL);

        orchestrator.runPass(connection, SyncOptions.defaults());

        assertThat(store.getCalendars(1)).hasSize(2);
        var renamed = store.getCalendar(work.id());
        assertThat(renamed.name()).isEqualTo("Work");
        assertThat(renamed.color()).isEqualTo("#ff0000");
        assertThat(store.getCalendar(home.id()).url()).isEqualTo(HOME_URL);
        assertThat(notifier.types()).filteredOn(type -> type == ChangeType.CALENDAR_UPDATED).hasSize(2);
    }

    @Test
    void one_local_calendar_is_matched_at_most_once() {
        store.createCalendar(new Calendar(null, 1, "Work", Calendar.DEFAULT_COLOR, null, null, true, null));
        server.addCalendar("Work", WORK_URL);
        server.addCalendar("Work", HOME_URL);

        orchestrator.runPass(connection, SyncOptions.defaults());

        assertThat(store.getCalendars(1)).extracting(Calendar::url).containsExactly(WORK_URL, HOME_URL);
    }

    @Test
    void disabled_calendars_are_not_synced() {
        store.createCalendar(new Calendar(null, 1, "Work", Calendar.DEFAULT_COLOR, WORK_URL, null, false, null));
        server.addCalendar("Work", WORK_URL);
        server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Remote meeting"));

        orchestrator.runPass(connection, SyncOptions.defaults());

        assertThat(store.getEventByUid(1, "m1@example.com")).isNull();
    }

    @Test
    void preserving_local_deletes_removes_remote_objects() {
        workCalendar();
        server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Deleted here"));

        orchestrator.runPass(connection, new SyncOptions(false, null, false, true));

        assertThat(server.deletes).containsExactly(WORK_URL + "m1.ics");
        assertThat(store.getEventByUid(1, "m1@example.com")).isNull();
    }

    @Test
    void preserving_local_events_keeps_unpushed_content() {
        var calendar = workCalendar();
        var event = localEvent(calendar, "shared@example.com", "Local version");
        server.putRemote(WORK_URL + "shared.ics", ics("shared@example.com", "Remote version"));

        orchestrator.runPass(connection, SyncOptions.afterLocalChange(calendar.id()));

        var synced = store.getEvent(event.getId());
        assertThat(synced.getTitle()).isEqualTo("Local version");
        assertThat(synced.getUrl()).isEqualTo(WORK_URL + "shared.ics");
        assertThat(synced.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(server.objects()).hasSize(1);
        assertThat(server.object(WORK_URL + "shared.ics").calendarData()).contains("SUMMARY:Local version");
    }

    @Test
    void local_event_without_preservation_takes_the_remote_content() {
        var calendar = workCalendar();
        var event = localEvent(calendar, "shared@example.com", "Local version");
        server.putRemote(WORK_URL + "shared.ics", ics("shared@example.com", "Remote version"));

        orchestrator.runPass(connection, SyncOptions.defaults());

        var synced = store.getEvent(event.getId());
        assertThat(synced.getTitle()).isEqualTo("Remote version");
        assertThat(synced.getSyncStatus()).isEqualTo(SyncStatus.SYNCED);
        assertThat(server.puts).isEmpty();
    }

    @Test
    void calendar_scoped_pass_requires_an_owned_calendar() {
        var local = store.createCalendar(new Calendar(null, 1, "Offline", Calendar.DEFAULT_COLOR, null, null, true, null));
        var foreign = store.createCalendar(new Calendar(null, 2, "Foreign", Calendar.DEFAULT_COLOR, WORK_URL, null, true,
                null));

        assertThat(orchestrator.runPass(connection, SyncOptions.afterLocalChange(foreign.id()))).isFalse();
        assertThat(orchestrator.runPass(connection, SyncOptions.afterLocalChange(999))).isFalse();
        assertThat(orchestrator.runPass(connection, SyncOptions.afterLocalChange(local.id()))).isTrue();
        assertThat(server.puts).isEmpty();
    }

    @Test
    void unparseable_objects_are_skipped() {
        workCalendar();
        server.putRemote(WORK_URL + "junk.ics", "garbage");
        server.putRemote(WORK_URL + "m1.ics", ics("m1@example.com", "Fine"));

        assertThat(orchestrator.runPass(connection, SyncOptions.defaults())).isTrue();

        assertThat(store.getEventByUid(1, "m1@example.com")).isNotNull();
    }

    @Test
    void object_urls_are_derived_from_the_uid() {
        assertThat(CalendarSyncOrchestrator.objectUrl("https://dav.example.com/cal", "a.b@host:x/y"))
                .isEqualTo("https://dav.example.com/cal/a_b_host_x_y.ics");
    }
}
