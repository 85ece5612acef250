package de.bycsitsm.calsync.sync;

import org.jspecify.annotations.Nullable;

/**
 * Options of a single sync pass.
 *
 * @param forceRefresh         queue a follow-up pass if a pass is already running instead of skipping
 * @param calendarId           restrict the pass to one local calendar, or {@code null} for all
 * @param preserveLocalEvents  treat unsynchronized local records ({@code LOCAL}, {@code ERROR}) like
 *                             {@code PENDING} ones, so remote content never overwrites them
 * @param preserveLocalDeletes delete remote objects that have no local counterpart instead of re-creating them
 */
public record SyncOptions(
        boolean forceRefresh,
        @Nullable Long calendarId,
        boolean preserveLocalEvents,
        boolean preserveLocalDeletes
) {

    public static SyncOptions defaults() {
        return new SyncOptions(false, null, false, false);
    }

    public static SyncOptions forced() {
        return new SyncOptions(true, null, false, false);
    }

    /**
     * A forced pass for one calendar that keeps local edits, as requested after a local mutation.
     */
    public static SyncOptions afterLocalChange(long calendarId) {
        return new SyncOptions(true, calendarId, true, false);
    }
}
