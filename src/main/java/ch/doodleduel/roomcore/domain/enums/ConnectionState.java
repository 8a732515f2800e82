package ch.doodleduel.roomcore.domain.enums;

/**
 * How a client currently sees its room subscription.
 */
public enum ConnectionState {
    /**
     * Snapshots arrive and writes succeed.
     */
    LIVE,

    /**
     * The last write failed with a transient store error; the view shows the last known snapshot.
     */
    OFFLINE,

    /**
     * The room record no longer exists (deleted by a player or by the reaper).
     */
    GONE
}
