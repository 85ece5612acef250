package de.bycsitsm.calsync.caldav;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the HTTP conversation against a local server.
 */
class CalDavClientHttpTest {

    private final CalDavClient client = new CalDavClient(new CalDavProperties(false, null, null));
    private final List<String> requests = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/dav/", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/dav/";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        var method = exchange.getRequestMethod();
        var path = exchange.getRequestURI().getPath();
        var ifMatch = exchange.getRequestHeaders().getFirst("If-Match");
        requests.add(method + " " + path + (ifMatch != null ? " If-Match=" + ifMatch : ""));
        exchange.getRequestBody().readAllBytes();

        var authorization = exchange.getRequestHeaders().getFirst("Authorization");
        if (authorization == null || !authorization.startsWith("Basic ")) {
            respond(exchange, 401, "");
            return;
        }
        if (path.endsWith("/denied/")) {
            respond(exchange, 401, "");
        } else if (method.equals("PROPFIND") && path.endsWith("noetag.ics")) {
            respond(exchange, 207, """
                    <?xml version="1.0" encoding="utf-8"?>
                    <multistatus xmlns="DAV:">
                      <response>
                        <href>/dav/noetag.ics</href>
                        <propstat><prop><getetag>"from-propfind"</getetag></prop><status>HTTP/1.1 200 OK</status></propstat>
                      </response>
                    </multistatus>
                    """);
        } else if (method.equals("PROPFIND")) {
            respond(exchange, 207, "<multistatus xmlns=\"DAV:\"/>");
        } else if (method.equals("PUT") && "\"stale\"".equals(ifMatch)) {
            respond(exchange, 412, "");
        } else if (method.equals("PUT") && path.endsWith("noetag.ics")) {
            respond(exchange, 201, "");
        } else if (method.equals("PUT")) {
            exchange.getResponseHeaders().add("ETag", "\"v2\"");
            respond(exchange, 204, "");
        } else if (method.equals("DELETE") && path.endsWith("missing.ics")) {
            respond(exchange, 404, "");
        } else if (method.equals("DELETE")) {
            respond(exchange, 204, "");
        } else {
            respond(exchange, 405, "");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        if (status == 401) {
            exchange.getResponseHeaders().add("WWW-Authenticate", "Basic realm=\"dav\"");
        }
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (var out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private CalDavCredentials credentials(String url) {
        return new CalDavCredentials(url, "jane", "secret");
    }

    @Test
    void login_succeeds_with_multistatus() {
        client.login(credentials(baseUrl));

        assertThat(requests).containsExactly("PROPFIND /dav/");
    }

    @Test
    void login_with_rejected_credentials_fails_with_authentication_error() {
        assertThatThrownBy(() -> client.login(credentials(baseUrl + "denied/")))
                .isInstanceOf(CalDavAuthenticationException.class)
                .hasMessageContaining("Authentication failed");
    }

    @Test
    void put_returns_etag_and_sends_if_match() {
        var etag = client.putCalendarObject(credentials(baseUrl), baseUrl + "a.ics", "BEGIN:VCALENDAR", "\"v1\"");

        assertThat(etag).isEqualTo("\"v2\"");
        assertThat(requests).containsExactly("PUT /dav/a.ics If-Match=\"v1\"");
    }

    @Test
    void put_of_new_object_sends_no_precondition() {
        client.putCalendarObject(credentials(baseUrl), baseUrl + "a.ics", "BEGIN:VCALENDAR", null);

        assertThat(requests).containsExactly("PUT /dav/a.ics");
    }

    @Test
    void put_without_etag_header_asks_for_the_etag() {
        var etag = client.putCalendarObject(credentials(baseUrl), baseUrl + "noetag.ics", "BEGIN:VCALENDAR", null);

        assertThat(etag).isEqualTo("\"from-propfind\"");
        assertThat(requests).containsExactly("PUT /dav/noetag.ics", "PROPFIND /dav/noetag.ics");
    }

    @Test
    void put_with_stale_etag_reports_precondition_failure() {
        assertThatThrownBy(() -> client.putCalendarObject(credentials(baseUrl), baseUrl + "a.ics",
                "BEGIN:VCALENDAR", "\"stale\""))
                .isInstanceOf(CalDavException.class)
                .extracting(e -> ((CalDavException) e).getStatusCode())
                .isEqualTo(412);
    }

    @Test
    void delete_tolerates_missing_objects() {
        client.deleteCalendarObject(credentials(baseUrl), baseUrl + "missing.ics", "\"v1\"");
        client.deleteCalendarObject(credentials(baseUrl), baseUrl + "a.ics", null);

        assertThat(requests).containsExactly("DELETE /dav/missing.ics If-Match=\"v1\"", "DELETE /dav/a.ics");
    }
}
