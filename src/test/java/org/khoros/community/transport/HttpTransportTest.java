package org.khoros.community.transport;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.khoros.community.KhorosError;
import org.khoros.community.KhorosClient;
import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.LiqlQuery;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises {@link HttpTransport} against an in-process HTTP server.
 */
class HttpTransportTest {

    private record Captured(String method, String path, String query, String contentType,
                            String sessionKey, String body) {}

    private HttpServer server;
    private final AtomicReference<Captured> captured = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{\"status\":\"success\"}";

    private HttpTransport transport;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        transport = HttpTransport.builder().requestTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        var headers = exchange.getRequestHeaders();
        var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        captured.set(new Captured(exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
                exchange.getRequestURI().getRawQuery(), headers.getFirst("Content-Type"),
                headers.getFirst("li-api-session-key"), body));
        var bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (var out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Test
    void getReturnsStatusBodyAndHeaders() {
        var response = transport.get(baseUrl + "/api/2.0/boards?limit=5",
                Map.of("li-api-session-key", "AbC-123"));

        assertEquals(200, response.statusCode());
        assertEquals("{\"status\":\"success\"}", response.body());
        assertEquals("application/json", response.header("content-type").orElseThrow());
        var request = captured.get();
        assertEquals("GET", request.method());
        assertEquals("/api/2.0/boards", request.path());
        assertEquals("limit=5", request.query());
        assertEquals("AbC-123", request.sessionKey());
    }

    @Test
    void postsJsonBodyWithImpliedContentType() {
        transport.post(baseUrl + "/api/2.0/boards",
                RequestBody.json(Map.of("data", Map.of("type", "board"))), Map.of());

        var request = captured.get();
        assertEquals("POST", request.method());
        assertEquals("application/json", request.contentType());
        assertEquals("{\"data\":{\"type\":\"board\"}}", request.body());
    }

    @Test
    void postsFormBody() {
        transport.post(baseUrl + "/restapi/vc/categories/add",
                RequestBody.form(Map.of("category.id", "games")), Map.of());

        var request = captured.get();
        assertEquals("application/x-www-form-urlencoded", request.contentType());
        assertEquals("category.id=games", request.body());
    }

    @Test
    void multipartBodyCarriesItsOwnBoundary() {
        var multipart = MultipartBody.builder()
                .boundary("test-boundary")
                .jsonField("api.request", Map.of("data", Map.of("type", "message")))
                .file("attachment1", "notes.txt", "hello".getBytes(StandardCharsets.UTF_8), "text/plain")
                .build();

        transport.post(baseUrl + "/api/2.0/messages", RequestBody.multipart(multipart), Map.of());

        var request = captured.get();
        assertEquals("multipart/form-data; boundary=test-boundary", request.contentType());
        assertTrue(request.body().contains("name=\"api.request\""));
        assertTrue(request.body().contains("filename=\"notes.txt\""));
        assertTrue(request.body().endsWith("--test-boundary--\r\n"));
    }

    @Test
    void putSendsBody() {
        transport.put(baseUrl + "/api/2.0/grouphubs/hub", RequestBody.json(Map.of("title", "New")), Map.of());

        assertEquals("PUT", captured.get().method());
        assertEquals("{\"title\":\"New\"}", captured.get().body());
    }

    @Test
    void deleteSendsNoBody() {
        status = 200;
        responseBody = "";

        var response = transport.delete(baseUrl + "/api/2.0/users/42", Map.of());

        assertEquals(200, response.statusCode());
        assertEquals("DELETE", captured.get().method());
        assertEquals("", captured.get().body());
    }

    @Test
    void errorStatusIsReturnedNotRaised() {
        status = 500;
        responseBody = "{\"status\":\"error\",\"message\":\"boom\"}";

        var response = transport.get(baseUrl + "/api/2.0/search", Map.of());

        assertEquals(500, response.statusCode());
        assertFalse(response.isSuccessful());
    }

    @Test
    void refusedConnectionBecomesConnectionError() throws IOException {
        int port;
        try (var socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        var ex = assertThrows(KhorosException.class,
                () -> transport.get("http://127.0.0.1:" + port + "/api/2.0/search", Map.of()));

        assertTrue(ex.isConnectionFailure());
        assertEquals(1, ex.attempts());
        assertNotNull(ex.getCause());
    }

    @Test
    void malformedUrlBecomesValidationError() {
        var ex = assertThrows(KhorosException.class,
                () -> transport.get("http://exa mple.com/api", Map.of()));

        assertEquals(KhorosError.CODE_INVALID_URL, ex.code());
    }

    @Test
    void unencodablePayloadIsInvalidPayloadValue() {
        var ex = assertThrows(KhorosException.class,
                () -> transport.post(baseUrl + "/api/2.0/boards", RequestBody.json(new Unencodable()), Map.of()));

        assertEquals(KhorosError.CODE_INVALID_PAYLOAD_VALUE, ex.code());
        assertNull(captured.get());
    }

    public static final class Unencodable {
        public String getTitle() {
            throw new IllegalStateException("not readable");
        }
    }

    // -----------------------------------------------------------------------
    // LiQL over HTTP
    // -----------------------------------------------------------------------

    private KhorosClient client() {
        return KhorosClient.builder()
                .communityUrl(baseUrl)
                .oauthAccessToken("token")
                .transport(transport)
                .initialBackoff(Duration.ZERO)
                .build();
    }

    @Test
    void liqlComparisonOperatorReachesServer() {
        responseBody = "{\"status\":\"success\",\"data\":{\"items\":[{\"id\":\"9\"}]}}";
        var query = LiqlQuery.builder().select("id").from("messages").where("kudos.sum(weight)", ">", 5).build();

        var items = client().liql().performQueryForItems(query);

        assertEquals("9", items.get(0).get("id"));
        assertEquals("/api/2.0/search", captured.get().path());
        assertEquals("q=SELECT+id+FROM+messages+WHERE+kudos.sum%28weight%29+%3E+5", captured.get().query());
    }

    @Test
    void liqlLiteralWithAmpersandStaysInOneParameter() {
        var query = LiqlQuery.builder().select("id").from("boards").where("title", "Q&A").build();

        client().liql().performQuery(query, true);

        assertEquals("q=SELECT+id+FROM+boards+WHERE+title+%3D+%27Q%26A%27", captured.get().query());
    }

    @Test
    void builderRejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> HttpTransport.builder().requestTimeout(Duration.ZERO).build());
    }
}
