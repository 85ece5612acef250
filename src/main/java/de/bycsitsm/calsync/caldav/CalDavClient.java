package de.bycsitsm.calsync.caldav;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * CalDAV protocol client that communicates with CalDAV servers using Java's
 * built-in {@link HttpClient}.
 * <p>
 * Supports PROPFIND requests for calendar discovery, including two-level
 * discovery where the given URL points to a server root containing principals
 * rather than calendars directly (e.g. DAViCal's {@code /caldav.php/}),
 * {@code calendar-query} REPORTs for fetching calendar objects, and
 * conditional PUT and DELETE for writing them back.
 */
@Component
class CalDavClient implements CalDavAdapter {

    private static final Logger log = LoggerFactory.getLogger(CalDavClient.class);

    private static final String DAV_NS = "DAV:";
    private static final String CALDAV_NS = "urn:ietf:params:xml:ns:caldav";
    private static final String APPLE_ICAL_NS = "http://apple.com/ns/ical/";
    private static final String CALENDARSERVER_NS = "http://calendarserver.org/ns/";

    private final Duration requestTimeout;
    private final HttpClient httpClient;

    CalDavClient(CalDavProperties properties) {
        this.requestTimeout = properties.requestTimeout();
        var clientBuilder = HttpClient.newBuilder()
                .connectTimeout(properties.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (properties.trustAllCertificates()) {
            log.warn("CalDAV client is configured to accept all SSL certificates including self-signed. "
                    + "Set caldav.trust-all-certificates=false to enforce certificate validation.");
            clientBuilder.sslContext(createTrustAllSslContext());
        }
        this.httpClient = clientBuilder.build();
    }

    /**
     * XML body for a Depth 0 PROPFIND that verifies the credentials.
     */
    private static final String PROPFIND_PRINCIPAL_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <d:propfind xmlns:d="DAV:">
              <d:prop>
                <d:current-user-principal/>
                <d:resourcetype/>
              </d:prop>
            </d:propfind>
            """;

    /**
     * XML body for a PROPFIND request that discovers calendars and collections.
     */
    private static final String PROPFIND_CALENDARS_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <d:propfind xmlns:d="DAV:"
                        xmlns:cs="http://calendarserver.org/ns/"
                        xmlns:c="urn:ietf:params:xml:ns:caldav"
                        xmlns:ic="http://apple.com/ns/ical/">
              <d:prop>
                <d:displayname/>
                <d:resourcetype/>
                <c:calendar-description/>
                <ic:calendar-color/>
                <cs:getctag/>
              </d:prop>
            </d:propfind>
            """;

    private static final String PROPFIND_ETAG_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <d:propfind xmlns:d="DAV:">
              <d:prop>
                <d:getetag/>
              </d:prop>
            </d:propfind>
            """;

    /**
     * XML body for a {@code calendar-query} REPORT returning all events of a collection.
     */
    private static final String CALENDAR_QUERY_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <c:calendar-query xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
              <d:prop>
                <d:getetag/>
                <c:calendar-data/>
              </d:prop>
              <c:filter>
                <c:comp-filter name="VCALENDAR">
                  <c:comp-filter name="VEVENT"/>
                </c:comp-filter>
              </c:filter>
            </c:calendar-query>
            """;

    @Override
    public void login(CalDavCredentials credentials) {
        var url = normalizeUrl(credentials.url());
        try {
            sendXml("PROPFIND", url, "0", PROPFIND_PRINCIPAL_XML, credentials);
            log.debug("Authenticated {} at {}", credentials.username(), url);
        } catch (CalDavException e) {
            if (e.getStatusCode() == 401) {
                throw new CalDavAuthenticationException(e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Discovers all calendars accessible from the configured CalDAV URL.
     * <p>
     * If the URL points directly at a principal's collection (e.g.
     * {@code /caldav.php/username/}), calendars are returned directly.
     * If it points at a server root containing principals (e.g.
     * {@code /caldav.php/}), each principal is queried for its calendars.
     */
    @Override
    public List<CalDavCalendar> fetchCalendars(CalDavCredentials credentials) {
        var normalizedUrl = normalizeUrl(credentials.url());
        var responseBody = sendXml("PROPFIND", normalizedUrl, "1", PROPFIND_CALENDARS_XML, credentials);
        var parseResult = parseMultistatusResponse(responseBody, normalizedUrl);

        if (!parseResult.calendars().isEmpty()) {
            return parseResult.calendars();
        }

        if (!parseResult.childCollections().isEmpty()) {
            log.debug("No calendars found directly at {}, querying {} sub-collection(s)",
                    normalizedUrl, parseResult.childCollections().size());
            var allCalendars = new ArrayList<CalDavCalendar>();
            for (var collectionHref : parseResult.childCollections()) {
                var collectionUrl = resolveHref(normalizedUrl, collectionHref);
                try {
                    var childResponse = sendXml("PROPFIND", collectionUrl, "1", PROPFIND_CALENDARS_XML, credentials);
                    allCalendars.addAll(parseMultistatusResponse(childResponse, collectionUrl).calendars());
                } catch (CalDavException e) {
                    log.warn("Failed to query sub-collection {}: {}", collectionUrl, e.getMessage());
                }
            }
            return allCalendars;
        }

        return List.of();
    }

    @Override
    public List<CalDavObject> fetchCalendarObjects(CalDavCredentials credentials, CalDavCalendar calendar) {
        var calendarUrl = normalizeUrl(calendar.url());
        var responseBody = sendXml("REPORT", calendarUrl, "1", CALENDAR_QUERY_XML, credentials);
        var objects = parseCalendarQueryResponse(responseBody, calendarUrl);
        log.debug("Fetched {} object(s) from {}", objects.size(), calendarUrl);
        return objects;
    }

    @Override
    public @Nullable String putCalendarObject(CalDavCredentials credentials, String objectUrl, String ics,
                                              @Nullable String etag) {
        var builder = requestBuilder(objectUrl, credentials)
                .PUT(HttpRequest.BodyPublishers.ofString(ics, StandardCharsets.UTF_8))
                .header("Content-Type", "text/calendar; charset=utf-8");
        if (etag != null && !etag.isBlank()) {
            builder.header("If-Match", etag);
        }

        log.debug("Sending PUT to {} (If-Match: {})", objectUrl, etag);
        var response = send(builder.build());
        switch (response.statusCode()) {
            case 200, 201, 204 -> {
                // stored
            }
            case 412 -> throw new CalDavException(
                    "The event was changed on the server in the meantime (precondition failed).", 412);
            default -> throw statusException(response.statusCode(), "store this event");
        }

        var newEtag = response.headers().firstValue("ETag").orElse(null);
        if (newEtag == null) {
            // Some servers only report the ETag on a subsequent PROPFIND
            newEtag = fetchEtag(credentials, objectUrl);
        }
        return newEtag;
    }

    @Override
    public void deleteCalendarObject(CalDavCredentials credentials, String objectUrl, @Nullable String etag) {
        var builder = requestBuilder(objectUrl, credentials).DELETE();
        if (etag != null && !etag.isBlank()) {
            builder.header("If-Match", etag);
        }

        log.debug("Sending DELETE to {}", objectUrl);
        var response = send(builder.build());
        switch (response.statusCode()) {
            case 200, 202, 204 -> log.debug("Deleted {}", objectUrl);
            case 404, 410 -> log.debug("Object {} was already deleted", objectUrl);
            case 412 -> throw new CalDavException(
                    "The event was changed on the server in the meantime (precondition failed).", 412);
            default -> throw statusException(response.statusCode(), "delete this event");
        }
    }

    private @Nullable String fetchEtag(CalDavCredentials credentials, String objectUrl) {
        try {
            var body = sendXml("PROPFIND", objectUrl, "0", PROPFIND_ETAG_XML, credentials);
            var document = parseXml(body);
            var etags = document.getElementsByTagNameNS(DAV_NS, "getetag");
            if (etags.getLength() > 0) {
                var text = etags.item(0).getTextContent();
                return text == null || text.isBlank() ? null : text.strip();
            }
        } catch (CalDavException e) {
            log.debug("Could not determine ETag of {}: {}", objectUrl, e.getMessage());
        }
        return null;
    }

    private String sendXml(String method, String url, String depth, String body, CalDavCredentials credentials) {
        var request = requestBuilder(url, credentials)
                .method(method, HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/xml; charset=utf-8")
                .header("Depth", depth)
                .build();

        log.debug("Sending {} to {}", method, url);
        var response = send(request);
        return switch (response.statusCode()) {
            case 200, 207 -> response.body();
            default -> throw statusException(response.statusCode(), "access this calendar");
        };
    }

    private HttpRequest.Builder requestBuilder(String url, CalDavCredentials credentials) {
        var encoded = Base64.getEncoder().encodeToString(
                (credentials.username() + ":" + credentials.password()).getBytes(StandardCharsets.UTF_8));
        try {
            return HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Authorization", "Basic " + encoded)
                    .timeout(requestTimeout);
        } catch (IllegalArgumentException e) {
            throw new CalDavException("Invalid CalDAV URL: " + url, e);
        }
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CalDavException("Failed to reach CalDAV server: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalDavException("Interrupted while waiting for CalDAV server.", e);
        }
    }

    static CalDavException statusException(int statusCode, String action) {
        return switch (statusCode) {
            case 401 -> new CalDavException("Authentication failed. Please check your username and password.", 401);
            case 403 -> new CalDavException("Access denied. You don't have permission to " + action + ".", 403);
            case 404 -> new CalDavException("Calendar URL not found. Please check the URL.", 404);
            case 412 -> new CalDavException("Precondition failed.", 412);
            default -> new CalDavException("Server returned unexpected status " + statusCode + ".", statusCode);
        };
    }

    // Response parsing

    /**
     * Result of parsing a PROPFIND multistatus response. Contains both
     * discovered calendars and non-calendar child collections (principals).
     */
    record PropfindResult(List<CalDavCalendar> calendars, List<String> childCollections) {
    }

    PropfindResult parseMultistatusResponse(String xml, String requestUrl) {
        var calendars = new ArrayList<CalDavCalendar>();
        var childCollections = new ArrayList<String>();
        var document = parseXml(xml);

        var responses = document.getElementsByTagNameNS(DAV_NS, "response");
        for (int i = 0; i < responses.getLength(); i++) {
            var response = (Element) responses.item(i);
            var href = getTextContent(response, DAV_NS, "href");
            if (href == null) {
                continue;
            }

            // Skip the response for the collection itself
            if (isSameResource(href, requestUrl)) {
                continue;
            }

            if (!isSuccessResponse(response)) {
                continue;
            }

            if (hasResourceType(response, CALDAV_NS, "calendar")) {
                calendars.add(parseCalendarFromResponse(response, resolveHref(requestUrl, href)));
            } else if (hasResourceType(response, DAV_NS, "collection")) {
                childCollections.add(href);
            }
        }
        return new PropfindResult(calendars, childCollections);
    }

    List<CalDavObject> parseCalendarQueryResponse(String xml, String calendarUrl) {
        var objects = new ArrayList<CalDavObject>();
        var document = parseXml(xml);

        var responses = document.getElementsByTagNameNS(DAV_NS, "response");
        for (int i = 0; i < responses.getLength(); i++) {
            var response = (Element) responses.item(i);
            var href = getTextContent(response, DAV_NS, "href");
            if (href == null || !isSuccessResponse(response)) {
                continue;
            }
            var calendarData = getPropertyText(response, CALDAV_NS, "calendar-data");
            if (calendarData == null) {
                log.debug("Skipping {} without calendar data", href);
                continue;
            }
            var etag = getPropertyText(response, DAV_NS, "getetag");
            objects.add(new CalDavObject(resolveObjectHref(calendarUrl, href.strip()), etag, calendarData));
        }
        return objects;
    }

    private CalDavCalendar parseCalendarFromResponse(Element response, String url) {
        var displayName = getPropertyText(response, DAV_NS, "displayname");
        var description = getPropertyText(response, CALDAV_NS, "calendar-description");
        var color = getPropertyText(response, APPLE_ICAL_NS, "calendar-color");
        var ctag = getPropertyText(response, CALENDARSERVER_NS, "getctag");

        // Use the last path segment as display name fallback
        if (displayName == null || displayName.isBlank()) {
            var path = url.replaceAll("/+$", "");
            displayName = path.substring(path.lastIndexOf('/') + 1);
        }

        // Normalize color to 7-char hex if it has alpha channel (#RRGGBBAA -> #RRGGBB)
        if (color != null && color.length() == 9 && color.startsWith("#")) {
            color = color.substring(0, 7);
        }

        return new CalDavCalendar(displayName, url, description, color, ctag);
    }

    private Document parseXml(String xml) {
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            var builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (Exception e) {
            throw new CalDavException("Failed to parse server response: " + e.getMessage(), e);
        }
    }

    private boolean hasResourceType(Element response, String namespace, String localName) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var resourceTypes = propstat.getElementsByTagNameNS(DAV_NS, "resourcetype");
            for (int k = 0; k < resourceTypes.getLength(); k++) {
                var resourceType = (Element) resourceTypes.item(k);
                if (resourceType.getElementsByTagNameNS(namespace, localName).getLength() > 0) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isSuccessResponse(Element response) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var statusText = getTextContent(propstat, DAV_NS, "status");
            if (statusText != null && statusText.contains("200")) {
                return true;
            }
        }
        return false;
    }

    private @Nullable String getPropertyText(Element response, String namespace, String localName) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var props = propstat.getElementsByTagNameNS(DAV_NS, "prop");
            for (int j = 0; j < props.getLength(); j++) {
                var prop = (Element) props.item(j);
                var elements = prop.getElementsByTagNameNS(namespace, localName);
                if (elements.getLength() > 0) {
                    var text = elements.item(0).getTextContent();
                    return (text != null && !text.isBlank()) ? text.strip() : null;
                }
            }
        }
        return null;
    }

    private @Nullable String getTextContent(Element parent, String namespace, String localName) {
        var elements = parent.getElementsByTagNameNS(namespace, localName);
        if (elements.getLength() > 0) {
            return elements.item(0).getTextContent();
        }
        return null;
    }

    private boolean isSameResource(String href, String requestUrl) {
        var normalizedHref = href.strip().replaceAll("/+$", "");
        var normalizedUrl = requestUrl.replaceAll("/+$", "");

        if (normalizedUrl.endsWith(normalizedHref)) {
            return true;
        }

        try {
            var hrefPath = URI.create(normalizedHref).getPath();
            var urlPath = URI.create(normalizedUrl).getPath();
            if (hrefPath != null && urlPath != null) {
                return hrefPath.replaceAll("/+$", "").equals(urlPath.replaceAll("/+$", ""));
            }
        } catch (IllegalArgumentException e) {
            log.trace("Cannot compare {} with {} as URIs", href, requestUrl);
        }
        return normalizedHref.equals(normalizedUrl);
    }

    /**
     * Resolves a collection href (which may be relative) against the request URL.
     */
    String resolveHref(String baseUrl, String href) {
        var trimmed = href.strip();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return normalizeUrl(trimmed);
        }
        return normalizeUrl(URI.create(baseUrl).resolve(trimmed).toString());
    }

    /**
     * Resolves an object href against its calendar URL without appending a slash.
     */
    String resolveObjectHref(String calendarUrl, String href) {
        if (href.startsWith("http://") || href.startsWith("https://")) {
            return href;
        }
        return URI.create(calendarUrl).resolve(href).toString();
    }

    String normalizeUrl(String url) {
        var normalized = url.strip();
        if (!normalized.endsWith("/")) {
            normalized += "/";
        }
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        return normalized;
    }

    /**
     * Creates an {@link SSLContext} that trusts all certificates, including self-signed ones.
     */
    private static SSLContext createTrustAllSslContext() {
        try {
            var trustAllManager = new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                    // Trust all client certificates
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                    // Trust all server certificates
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            };

            var sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAllManager}, null);
            return sslContext;
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            throw new CalDavException("Failed to create SSL context for trusting all certificates.", e);
        }
    }
}
