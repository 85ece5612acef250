package de.bycsitsm.calsync.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A calendar event as held by the local store, together with the state needed
 * to reconcile it against its remote counterpart.
 * <p>
 * The {@code uid} is assigned once and never changes afterwards; the store and
 * {@code CalendarEventService} enforce that. {@code rawData} holds the last
 * known iCalendar text and is used as template when the event is pushed again,
 * so vendor properties the application does not model survive a round trip.
 */
public class CalendarEventRecord {

    private @Nullable Long id;
    private String uid;
    private @Nullable Long calendarId;
    private String title;
    private @Nullable String description;
    private @Nullable String location;
    private Instant startDate;
    private Instant endDate;
    private boolean allDay;
    private String timezone = "UTC";
    private @Nullable String recurrenceRule;
    private List<Attendee> attendees = new ArrayList<>();
    private List<Resource> resources = new ArrayList<>();
    private @Nullable String etag;
    private @Nullable String url;
    private @Nullable String rawData;
    private SyncStatus syncStatus = SyncStatus.LOCAL;
    private @Nullable Instant lastSyncAttempt;
    private long revision;

    public CalendarEventRecord(String uid, String title, Instant startDate, Instant endDate) {
        this.uid = Objects.requireNonNull(uid, "uid");
        this.title = Objects.requireNonNull(title, "title");
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        this.endDate = Objects.requireNonNull(endDate, "endDate");
    }

    /**
     * Returns a deep copy; participant lists are copied, participants themselves are immutable.
     */
    public CalendarEventRecord copy() {
        var copy = new CalendarEventRecord(uid, title, startDate, endDate);
        copy.id = id;
        copy.calendarId = calendarId;
        copy.description = description;
        copy.location = location;
        copy.allDay = allDay;
        copy.timezone = timezone;
        copy.recurrenceRule = recurrenceRule;
        copy.attendees = new ArrayList<>(attendees);
        copy.resources = new ArrayList<>(resources);
        copy.etag = etag;
        copy.url = url;
        copy.rawData = rawData;
        copy.syncStatus = syncStatus;
        copy.lastSyncAttempt = lastSyncAttempt;
        copy.revision = revision;
        return copy;
    }

    /**
     * Copies every content field (title, dates, participants, recurrence, remote
     * state) from {@code source}. Identity fields ({@code id}, {@code uid},
     * {@code calendarId}) and the local {@code revision} are left untouched.
     */
    public void copyContentFrom(CalendarEventRecord source) {
        this.title = source.title;
        this.description = source.description;
        this.location = source.location;
        this.startDate = source.startDate;
        this.endDate = source.endDate;
        this.allDay = source.allDay;
        this.timezone = source.timezone;
        this.recurrenceRule = source.recurrenceRule;
        this.attendees = new ArrayList<>(source.attendees);
        this.resources = new ArrayList<>(source.resources);
        this.etag = source.etag;
        this.url = source.url;
        this.rawData = source.rawData;
    }

    public @Nullable Long getId() {
        return id;
    }

    public void setId(@Nullable Long id) {
        this.id = id;
    }

    public String getUid() {
        return uid;
    }

    public void setUid(String uid) {
        this.uid = Objects.requireNonNull(uid, "uid");
    }

    public @Nullable Long getCalendarId() {
        return calendarId;
    }

    public void setCalendarId(@Nullable Long calendarId) {
        this.calendarId = calendarId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = Objects.requireNonNull(title, "title");
    }

    public @Nullable String getDescription() {
        return description;
    }

    public void setDescription(@Nullable String description) {
        this.description = description;
    }

    public @Nullable String getLocation() {
        return location;
    }

    public void setLocation(@Nullable String location) {
        this.location = location;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public void setStartDate(Instant startDate) {
        this.startDate = Objects.requireNonNull(startDate, "startDate");
    }

    public Instant getEndDate() {
        return endDate;
    }

    public void setEndDate(Instant endDate) {
        this.endDate = Objects.requireNonNull(endDate, "endDate");
    }

    public boolean isAllDay() {
        return allDay;
    }

    public void setAllDay(boolean allDay) {
        this.allDay = allDay;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = Objects.requireNonNull(timezone, "timezone");
    }

    public @Nullable String getRecurrenceRule() {
        return recurrenceRule;
    }

    public void setRecurrenceRule(@Nullable String recurrenceRule) {
        this.recurrenceRule = recurrenceRule;
    }

    public List<Attendee> getAttendees() {
        return attendees;
    }

    public void setAttendees(List<Attendee> attendees) {
        this.attendees = new ArrayList<>(attendees);
    }

    public List<Resource> getResources() {
        return resources;
    }

    public void setResources(List<Resource> resources) {
        this.resources = new ArrayList<>(resources);
    }

    public @Nullable String getEtag() {
        return etag;
    }

    public void setEtag(@Nullable String etag) {
        this.etag = etag;
    }

    public @Nullable String getUrl() {
        return url;
    }

    public void setUrl(@Nullable String url) {
        this.url = url;
    }

    public @Nullable String getRawData() {
        return rawData;
    }

    public void setRawData(@Nullable String rawData) {
        this.rawData = rawData;
    }

    public SyncStatus getSyncStatus() {
        return syncStatus;
    }

    public void setSyncStatus(SyncStatus syncStatus) {
        this.syncStatus = Objects.requireNonNull(syncStatus, "syncStatus");
    }

    public @Nullable Instant getLastSyncAttempt() {
        return lastSyncAttempt;
    }

    public void setLastSyncAttempt(@Nullable Instant lastSyncAttempt) {
        this.lastSyncAttempt = lastSyncAttempt;
    }

    public long getRevision() {
        return revision;
    }

    public void setRevision(long revision) {
        this.revision = revision;
    }

    public boolean existsRemotely() {
        return url != null && !url.isBlank() && etag != null && !etag.isBlank();
    }

    @Override
    public String toString() {
        return "CalendarEventRecord[id=" + id + ", uid=" + uid + ", title=" + title
                + ", syncStatus=" + syncStatus + ", etag=" + etag + "]";
    }
}
