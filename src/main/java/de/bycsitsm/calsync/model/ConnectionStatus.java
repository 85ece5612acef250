package de.bycsitsm.calsync.model;

/**
 * Health of a user's CalDAV server connection as seen by the last sync pass.
 */
public enum ConnectionStatus {
    PENDING,
    CONNECTED,
    ERROR
}
