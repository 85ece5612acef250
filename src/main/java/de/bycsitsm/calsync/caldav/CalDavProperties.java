package de.bycsitsm.calsync.caldav;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the CalDAV client.
 *
 * @param trustAllCertificates whether self-signed and otherwise untrusted server certificates are accepted
 * @param connectTimeout       the connect timeout
 * @param requestTimeout       the timeout of a single request
 */
@ConfigurationProperties(prefix = "caldav")
public record CalDavProperties(boolean trustAllCertificates, Duration connectTimeout, Duration requestTimeout) {

    public CalDavProperties {
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(30);
        }
        if (requestTimeout == null) {
            requestTimeout = Duration.ofSeconds(60);
        }
    }
}
