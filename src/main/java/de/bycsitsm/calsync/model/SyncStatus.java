package de.bycsitsm.calsync.model;

/**
 * Local lifecycle of a {@link CalendarEventRecord} relative to the remote store.
 */
public enum SyncStatus {

    /** Created locally, never pushed. */
    LOCAL,

    /** Modified locally since the last successful push. */
    PENDING,

    SYNCED,

    /** The last push failed; retried on the next scheduled pass. */
    ERROR
}
