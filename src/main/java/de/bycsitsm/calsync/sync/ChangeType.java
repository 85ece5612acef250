package de.bycsitsm.calsync.sync;

public enum ChangeType {
    EVENT_CREATED,
    EVENT_UPDATED,
    EVENT_DELETED,
    CALENDAR_CREATED,
    CALENDAR_UPDATED,
    SYNC_COMPLETED
}
