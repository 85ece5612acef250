package de.bycsitsm.calsync;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the synchronization engine.
 *
 * @param defaultSyncInterval the per-user sync interval used when a connection does not define one
 * @param globalSyncInterval  the interval of the sweep over all users with an active session
 * @param uidDomain           the domain part of generated event UIDs
 * @param productId           the {@code PRODID} written into generated calendars
 * @param schedulerPoolSize   the number of threads running sync passes
 */
@ConfigurationProperties(prefix = "calsync")
public record CalSyncProperties(
        Duration defaultSyncInterval,
        Duration globalSyncInterval,
        String uidDomain,
        String productId,
        int schedulerPoolSize
) {

    public CalSyncProperties {
        if (defaultSyncInterval == null || defaultSyncInterval.isZero() || defaultSyncInterval.isNegative()) {
            defaultSyncInterval = Duration.ofMinutes(5);
        }
        if (globalSyncInterval == null || globalSyncInterval.isZero() || globalSyncInterval.isNegative()) {
            globalSyncInterval = Duration.ofMinutes(3);
        }
        if (uidDomain == null || uidDomain.isBlank()) {
            uidDomain = "calsync.local";
        }
        if (productId == null || productId.isBlank()) {
            productId = "-//CalSync//CalSync Calendar//EN";
        }
        if (schedulerPoolSize <= 0) {
            schedulerPoolSize = 4;
        }
    }

    public static CalSyncProperties defaults() {
        return new CalSyncProperties(null, null, null, null, 0);
    }
}
