package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.caldav.CalDavAdapter;
import de.bycsitsm.calsync.caldav.CalDavCalendar;
import de.bycsitsm.calsync.caldav.CalDavCredentials;
import de.bycsitsm.calsync.caldav.CalDavException;
import de.bycsitsm.calsync.ics.IcsParser;
import de.bycsitsm.calsync.ics.IcsSerializer;
import de.bycsitsm.calsync.model.Calendar;
import de.bycsitsm.calsync.model.CalendarEventRecord;
import de.bycsitsm.calsync.model.ConnectionStatus;
import de.bycsitsm.calsync.model.ServerConnection;
import de.bycsitsm.calsync.model.SyncStatus;
import de.bycsitsm.calsync.store.CalendarStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Runs one reconciliation pass between the local store and a user's CalDAV server.
 * <p>
 * A pass authenticates, reconciles the calendar list, pulls remote objects
 * (never overwriting records with unpushed local edits) and then pushes
 * local changes with conditional PUTs. Only an authentication failure aborts
 * the pass; failures of single calendars or events are logged and skipped.
 * <p>
 * Callers make sure that at most one pass per user runs at a time.
 */
@Service
public class CalendarSyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CalendarSyncOrchestrator.class);

    private final CalDavAdapter calDav;
    private final CalendarStore store;
    private final IcsParser parser;
    private final IcsSerializer serializer;
    private final ChangeNotifier notifier;
    private final Clock clock;

    CalendarSyncOrchestrator(CalDavAdapter calDav, CalendarStore store, IcsParser parser, IcsSerializer serializer,
                             ChangeNotifier notifier, Clock clock) {
        this.calDav = calDav;
        this.store = store;
        this.parser = parser;
        this.serializer = serializer;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Pairs a local calendar with the remote collection it mirrors.
     */
    record SyncTarget(Calendar local, CalDavCalendar remote) {
    }

    /**
     * Runs one pass.
     *
     * @return {@code true} if the pass completed, {@code false} if it was aborted
     */
    public boolean runPass(ServerConnection connection, SyncOptions options) {
        var userId = connection.userId();
        var credentials = CalDavCredentials.of(connection);
        log.info("Starting sync for user {} ({})", userId, options);

        try {
            calDav.login(credentials);
        } catch (CalDavException e) {
            log.warn("Sync for user {} aborted, login to {} failed: {}", userId, connection.url(), e.getMessage());
            updateConnection(connection, stored -> stored.withStatus(ConnectionStatus.ERROR));
            return false;
        }

        List<SyncTarget> targets;
        try {
            targets = resolveTargets(userId, credentials, options);
        } catch (CalDavException e) {
            log.warn("Sync for user {} aborted, calendar discovery failed: {}", userId, e.getMessage());
            updateConnection(connection, stored -> stored.withStatus(ConnectionStatus.ERROR));
            return false;
        }
        if (targets == null) {
            return false;
        }

        for (var target : targets) {
            try {
                pull(userId, credentials, target, options);
            } catch (RuntimeException e) {
                log.warn("Pull of calendar '{}' for user {} failed: {}", target.local().name(), userId, e.getMessage());
            }
        }

        pushLocalEvents(connection, targets);

        var now = clock.instant();
        for (var target : targets) {
            var current = store.getCalendar(Objects.requireNonNull(target.local().id()));
            if (current != null) {
                store.updateCalendar(current.withSyncToken(now.toString()));
            }
        }
        updateConnection(connection, stored -> stored.withSyncCompleted(now));
        notifier.notify(userId, null, ChangeType.SYNC_COMPLETED);
        log.info("Finished sync for user {}: {} calendar(s)", userId, targets.size());
        return true;
    }

    /**
     * Applies a status change to the stored connection, so that settings
     * changed while the pass ran are kept.
     */
    private void updateConnection(ServerConnection connection, UnaryOperator<ServerConnection> change) {
        var stored = store.getServerConnection(connection.userId());
        store.updateServerConnection(change.apply(stored != null ? stored : connection));
    }

    /**
     * Determines the calendars of this pass. Returns {@code null} if the
     * requested calendar does not exist or belongs to another user.
     */
    private @Nullable List<SyncTarget> resolveTargets(long userId, CalDavCredentials credentials, SyncOptions options) {
        if (options.calendarId() != null) {
            var local = store.getCalendar(options.calendarId());
            if (local == null || local.userId() != userId) {
                log.warn("Calendar {} not found for user {}", options.calendarId(), userId);
                return null;
            }
            if (!local.isRemote() || !local.enabled()) {
                log.debug("Calendar {} is not synchronized", local.id());
                return List.of();
            }
            var remote = new CalDavCalendar(local.name(), Objects.requireNonNull(local.url()), local.description(),
                    local.color(), null);
            return List.of(new SyncTarget(local, remote));
        }

        var remoteCalendars = calDav.fetchCalendars(credentials);
        var locals = new ArrayList<>(store.getCalendars(userId));
        var claimed = new HashSet<Long>();
        var targets = new ArrayList<SyncTarget>();
        for (var remote : remoteCalendars) {
            try {
                var local = reconcileCalendar(userId, remote, locals, claimed);
                if (local.enabled()) {
                    targets.add(new SyncTarget(local, remote));
                }
            } catch (RuntimeException e) {
                log.warn("Could not reconcile calendar '{}' for user {}: {}", remote.displayName(), userId,
                        e.getMessage());
            }
        }
        return targets;
    }

    /**
     * Matches a remote calendar to a local one by URL, then by exact name, and
     * creates or updates the local calendar.
     */
    Calendar reconcileCalendar(long userId, CalDavCalendar remote, List<Calendar> locals, Set<Long> claimed) {
        var match = locals.stream()
                .filter(calendar -> !claimed.contains(calendar.id()))
                .filter(calendar -> sameUrl(calendar.url(), remote.url()))
                .findFirst()
                .or(() -> locals.stream()
                        .filter(calendar -> !claimed.contains(calendar.id()))
                        .filter(calendar -> calendar.name().equals(remote.displayName()))
                        .findFirst())
                .orElse(null);

        if (match == null) {
            var color = remote.color() != null ? remote.color() : Calendar.DEFAULT_COLOR;
            var created = store.createCalendar(new Calendar(null, userId, remote.displayName(), color, remote.url(),
                    null, true, remote.description()));
            claimed.add(created.id());
            locals.add(created);
            notifier.notify(userId, created.id(), ChangeType.CALENDAR_CREATED);
            log.info("Created local calendar '{}' for {}", created.name(), remote.url());
            return created;
        }

        claimed.add(match.id());
        var updated = match
                .withRemoteState(remote.displayName(), remote.url(), match.syncToken())
                .withAppearance(remote.color() != null ? remote.color() : match.color(),
                        remote.description() != null ? remote.description() : match.description());
        if (!updated.equals(match)) {
            updated = store.updateCalendar(updated);
            notifier.notify(userId, updated.id(), ChangeType.CALENDAR_UPDATED);
        }
        return updated;
    }

    /**
     * Pulls all objects of one calendar into the store.
     */
    void pull(long userId, CalDavCredentials credentials, SyncTarget target, SyncOptions options) {
        var objects = calDav.fetchCalendarObjects(credentials, target.remote());
        var calendarId = Objects.requireNonNull(target.local().id());
        int created = 0;
        int updated = 0;
        for (var object : objects) {
            try {
                var parsed = parser.parse(object.calendarData(), object.etag(), object.url());
                if (parsed == null) {
                    continue;
                }
                var existing = store.getEventByUid(userId, parsed.getUid());
                if (existing == null) {
                    if (options.preserveLocalDeletes()) {
                        log.info("Deleting remote object {}, it was deleted locally", object.url());
                        calDav.deleteCalendarObject(credentials, object.url(), object.etag());
                        continue;
                    }
                    parsed.setCalendarId(calendarId);
                    parsed.setSyncStatus(SyncStatus.SYNCED);
                    parsed.setLastSyncAttempt(clock.instant());
                    var stored = store.createEvent(parsed);
                    notifier.notify(userId, stored.getId(), ChangeType.EVENT_CREATED);
                    created++;
                } else if (hasUnpushedChanges(existing, options)) {
                    adoptRemoteVersion(existing, parsed);
                } else if (applyRemote(existing, parsed, calendarId)) {
                    notifier.notify(userId, existing.getId(), ChangeType.EVENT_UPDATED);
                    updated++;
                }
            } catch (RuntimeException e) {
                log.warn("Skipping remote object {}: {}", object.url(), e.getMessage());
            }
        }
        log.debug("Pulled calendar '{}': {} object(s), {} created, {} updated", target.local().name(),
                objects.size(), created, updated);
    }

    private static boolean hasUnpushedChanges(CalendarEventRecord event, SyncOptions options) {
        return switch (event.getSyncStatus()) {
            case PENDING -> true;
            case LOCAL, ERROR -> options.preserveLocalEvents();
            case SYNCED -> false;
        };
    }

    /**
     * Records the remote ETag (and the object URL, if still unknown) on a record
     * with unpushed edits, so that the next push overwrites that version.
     */
    private void adoptRemoteVersion(CalendarEventRecord existing, CalendarEventRecord parsed) {
        boolean missingUrl = existing.getUrl() == null || existing.getUrl().isBlank();
        if (Objects.equals(existing.getEtag(), parsed.getEtag()) && !missingUrl) {
            return;
        }
        existing.setEtag(parsed.getEtag());
        if (missingUrl) {
            existing.setUrl(parsed.getUrl());
        }
        if (store.updateEventIfUnchanged(existing, existing.getRevision()) == null) {
            log.debug("Event {} changed locally during pull, ETag not refreshed", existing.getUid());
        }
    }

    /**
     * Overwrites a synchronized record with the remote state.
     *
     * @return {@code true} if the record changed
     */
    private boolean applyRemote(CalendarEventRecord existing, CalendarEventRecord parsed, long calendarId) {
        if (existing.getSyncStatus() == SyncStatus.SYNCED
                && parsed.getEtag() != null
                && parsed.getEtag().equals(existing.getEtag())
                && Objects.equals(existing.getCalendarId(), calendarId)) {
            return false;
        }
        existing.copyContentFrom(parsed);
        existing.setCalendarId(calendarId);
        existing.setSyncStatus(SyncStatus.SYNCED);
        existing.setLastSyncAttempt(clock.instant());
        if (store.updateEventIfUnchanged(existing, existing.getRevision()) == null) {
            log.debug("Event {} changed locally during pull, remote state not applied", existing.getUid());
            return false;
        }
        return true;
    }

    /**
     * Pushes local changes of the given calendars: records with unpushed edits
     * first, then never-synced records, then records whose last push failed.
     * A failure marks only the affected record as {@code ERROR}.
     */
    void pushLocalEvents(ServerConnection connection, List<SyncTarget> targets) {
        var credentials = CalDavCredentials.of(connection);
        var organizer = connection.username().contains("@") ? connection.username() : null;
        for (var target : targets) {
            var calendar = target.local();
            if (!calendar.isRemote()) {
                continue;
            }
            var candidates = store.getEvents(Objects.requireNonNull(calendar.id())).stream()
                    .filter(event -> event.getSyncStatus() != SyncStatus.SYNCED)
                    .sorted(Comparator.comparingInt(event -> pushOrder(event.getSyncStatus())))
                    .toList();
            if (candidates.isEmpty()) {
                continue;
            }

            boolean updatedExisting = false;
            for (var event : candidates) {
                try {
                    updatedExisting |= push(credentials, calendar, event, organizer);
                } catch (RuntimeException e) {
                    log.warn("Push of event {} to {} failed: {}", event.getUid(), calendar.url(), e.getMessage());
                    markFailed(event);
                }
            }

            if (updatedExisting) {
                // reconcile server-side changes such as scheduling updates
                try {
                    pull(connection.userId(), credentials, target, SyncOptions.defaults());
                } catch (RuntimeException e) {
                    log.warn("Follow-up pull of calendar '{}' failed: {}", calendar.name(), e.getMessage());
                }
            }
        }
    }

    /**
     * @return {@code true} if an existing remote object was updated
     */
    private boolean push(CalDavCredentials credentials, Calendar calendar, CalendarEventRecord event,
                         @Nullable String organizer) {
        boolean existing = event.existsRemotely();
        var ics = serializer.generateICalEvent(event, organizer);
        var url = event.getUrl() != null && !event.getUrl().isBlank()
                ? event.getUrl()
                : objectUrl(Objects.requireNonNull(calendar.url()), event.getUid());
        var etag = calDav.putCalendarObject(credentials, url, ics, existing ? event.getEtag() : null);

        event.setUrl(url);
        event.setEtag(etag);
        event.setRawData(ics);
        event.setLastSyncAttempt(clock.instant());
        event.setSyncStatus(SyncStatus.SYNCED);
        if (store.updateEventIfUnchanged(event, event.getRevision()) == null) {
            // edited while the PUT was in flight: keep the remote state, stay PENDING
            var latest = store.modifyEvent(Objects.requireNonNull(event.getId()), current -> {
                current.setUrl(url);
                current.setEtag(etag);
                current.setRawData(ics);
                current.setLastSyncAttempt(clock.instant());
            });
            if (latest != null) {
                log.debug("Event {} was edited during push and stays {}", event.getUid(), latest.getSyncStatus());
            }
        } else {
            log.debug("Pushed event {} to {}", event.getUid(), url);
        }
        return existing;
    }

    private void markFailed(CalendarEventRecord event) {
        event.setSyncStatus(SyncStatus.ERROR);
        event.setLastSyncAttempt(clock.instant());
        if (store.updateEventIfUnchanged(event, event.getRevision()) == null) {
            log.debug("Event {} changed during failed push, status left as is", event.getUid());
        }
    }

    private static int pushOrder(SyncStatus status) {
        return switch (status) {
            case PENDING -> 0;
            case LOCAL -> 1;
            case ERROR -> 2;
            case SYNCED -> 3;
        };
    }

    /**
     * Derives the URL of a new object from its UID: {@code @ : . /} become underscores.
     */
    static String objectUrl(String calendarUrl, String uid) {
        var base = calendarUrl.endsWith("/") ? calendarUrl : calendarUrl + "/";
        return base + uid.replaceAll("[@:./]", "_") + ".ics";
    }

    private static boolean sameUrl(@Nullable String a, @Nullable String b) {
        if (a == null || b == null) {
            return false;
        }
        return a.replaceAll("/+$", "").equals(b.replaceAll("/+$", ""));
    }
}
