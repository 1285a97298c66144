package org.khoros.community;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.testing.FakeTransport;
import org.khoros.community.transport.ApiResponse;
import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.RequestBody;
import org.khoros.community.transport.RetryableTransport;

import java.net.ConnectException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RequestDispatcher} against a {@link FakeTransport}.
 */
class RequestDispatcherTest {

    private static final String BASE = "https://community.example.com";

    FakeTransport transport;
    RequestDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        transport = FakeTransport.create();
        var session = Session.of(BASE, AuthType.SESSION_KEY).withToken("SessionKey");
        dispatcher = RequestDispatcher.of(session, transport);
    }

    // -----------------------------------------------------------------------
    // URL construction
    // -----------------------------------------------------------------------

    @Nested
    class Urls {

        @Test
        void relativePathsResolveAgainstV2Base() {
            assertEquals(BASE + "/api/2.0/boards", dispatcher.resolve("boards"));
            assertEquals(BASE + "/api/2.0/boards", dispatcher.resolve("/boards"));
            assertEquals("https://other.example.com/x", dispatcher.resolve("https://other.example.com/x"));
        }

        @Test
        void v1UrlsUseV1Base() {
            assertEquals(BASE + "/restapi/vc/users/online/count", dispatcher.v1Url("users/online/count"));
        }

        @Test
        void jsonQueryIsAddedOnlyToV1Urls() {
            assertEquals(BASE + "/restapi/vc/users?restapi.response_format=json",
                    RequestDispatcher.withJsonQuery(BASE + "/restapi/vc/users", true));
            assertEquals(BASE + "/restapi/vc/users?a=1&restapi.response_format=json",
                    RequestDispatcher.withJsonQuery(BASE + "/restapi/vc/users?a=1", true));
            assertEquals(BASE + "/api/2.0/boards",
                    RequestDispatcher.withJsonQuery(BASE + "/api/2.0/boards", true));
            assertEquals(BASE + "/restapi/vc/users",
                    RequestDispatcher.withJsonQuery(BASE + "/restapi/vc/users", false));
        }

        @Test
        void explicitFormatIsKept() {
            var url = BASE + "/restapi/vc/users?restapi.response_format=xml";

            assertEquals(url, RequestDispatcher.withJsonQuery(url, true));
        }

        @Test
        void requestCarriesSessionHeaders() {
            var request = dispatcher.request(HttpMethod.POST, "messages", RequestBody.json(Map.of("a", 1)), null);

            assertEquals("SessionKey", request.header("li-api-session-key"));
            assertEquals("application/json", request.header("content-type"));
            assertTrue(request.expectJson());
        }

        @Test
        void missingSessionIsReported() {
            var unbound = new RequestDispatcher(() -> null, transport, null);

            var ex = assertThrows(KhorosException.class, () -> unbound.resolve("boards"));
            assertEquals(KhorosError.CODE_MISSING_REQUIRED_DATA, ex.code());
        }
    }

    // -----------------------------------------------------------------------
    // Raising vs. structured delivery
    // -----------------------------------------------------------------------

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        void successWithoutFieldsIsOutcome() {
            var delivery = dispatcher.send(HttpMethod.POST, "boards", RequestBody.json(Map.of()), ReturnFields.none());

            assertTrue(delivery.isSuccess());
            transport.assertRequested(HttpMethod.POST, "/api/2.0/boards");
        }

        @Test
        void httpErrorWithoutFieldsRaisesVerbSpecificError() {
            transport.enqueue(404, "{\"status\":\"error\",\"message\":\"Board not found\"}");

            var ex = assertThrows(KhorosException.class,
                    () -> dispatcher.send(HttpMethod.PUT, "boards/x", RequestBody.json(Map.of()), ReturnFields.none()));

            assertEquals(KhorosError.CODE_PUT_REQUEST, ex.code());
            assertEquals(404, ex.statusCode());
            assertTrue(ex.getMessage().contains("Board not found"));
        }

        @Test
        void httpErrorWithFieldsIsDelivered() {
            transport.enqueue(404, "{\"status\":\"error\",\"http_code\":404,\"message\":\"Board not found\"}");
            var fields = ReturnFields.builder().returnHttpCode().returnStatus().returnErrorMessages().build();

            var delivery = dispatcher.send(HttpMethod.GET, "boards/x", RequestBody.empty(), fields);

            assertEquals(List.of(404, "error", "Board not found"), delivery.values());
        }

        @Test
        void errorBodyWithSuccessfulStatusIsFalseOutcome() {
            transport.enqueue(200, "{\"status\":\"error\",\"message\":\"Nope\"}");

            var delivery = dispatcher.send(HttpMethod.POST, "boards", RequestBody.json(Map.of()), ReturnFields.none());

            assertFalse(delivery.isSuccess());
        }

        @Test
        void fullResponseIsUntouched() {
            transport.enqueue(500, "<html>oops</html>");

            var delivery = dispatcher.send(HttpMethod.GET, "boards", RequestBody.empty(), ReturnFields.full());

            assertEquals(500, delivery.response().statusCode());
            assertEquals("<html>oops</html>", delivery.response().body());
        }

        @Test
        void callerHeadersAreMerged() {
            dispatcher.send(HttpMethod.GET, "boards", RequestBody.empty(), Map.of("X-Custom", "Value"),
                    ReturnFields.none());

            var request = transport.lastRequest();
            assertEquals("value", request.header("x-custom"));
            assertEquals("SessionKey", request.header("li-api-session-key"));
        }

        @Test
        void nonJsonSuccessBodyIsReturnedWithWarning() {
            transport.enqueue(200, "not json at all");

            var response = dispatcher.get("boards");

            assertEquals("not json at all", response.body());
        }

        @Test
        void sendForResultNeverRaises() {
            transport.enqueue(500, "{\"status\":\"error\",\"message\":\"Boom\"}");

            var result = dispatcher.sendForResult(HttpMethod.POST, "messages", RequestBody.json(Map.of()));

            assertFalse(result.isSuccess());
            assertEquals("Boom", result.errorMessage(false).text());
        }
    }

    // -----------------------------------------------------------------------
    // Community API v1
    // -----------------------------------------------------------------------

    @Nested
    class V1 {

        @Test
        void getParamsTravelInUri() {
            transport.enqueue(200, "{\"response\":{\"status\":\"success\",\"value\":{\"type\":\"int\",\"$\":12}}}");
            var params = new LinkedHashMap<String, Object>();
            params.put("a", "x y");
            params.put("b", 2);

            var result = dispatcher.v1Result("users/online/count", params, HttpMethod.GET);

            assertEquals(12, result.value());
            var request = transport.lastRequest();
            assertEquals(BASE + "/restapi/vc/users/online/count?a=x+y&b=2&restapi.response_format=json",
                    request.url());
            assertInstanceOf(RequestBody.Empty.class, request.body());
        }

        @Test
        void postParamsTravelAsForm() {
            dispatcher.makeV1Request("categories/add", Map.of("category.id", "products"), HttpMethod.POST);

            var request = transport.assertRequested(HttpMethod.POST, "/restapi/vc/categories/add");
            var body = assertInstanceOf(RequestBody.UrlEncoded.class, request.body());
            assertEquals("category.id=products", body.encoded());
            assertEquals("application/x-www-form-urlencoded", request.header("content-type"));
        }

        @Test
        void postParamsCanTravelInUri() {
            dispatcher.makeV1Request("authentication/sessions/login", Map.of("sso.authentication_token", "t"),
                    HttpMethod.POST, true, true);

            assertTrue(transport.lastRequest().url().contains("?sso.authentication_token=t"));
        }

        @Test
        void deleteIsUnsupported() {
            var ex = assertThrows(KhorosException.class,
                    () -> dispatcher.makeV1Request("messages/id/1", null, HttpMethod.DELETE));

            assertEquals(KhorosError.CODE_UNSUPPORTED, ex.code());
            transport.assertRequestCount(0);
        }

        @Test
        void xmlIsNotExpectedAsJsonWhenJsonIsNotPreferred() {
            var xmlSession = new Session(BASE, AuthType.SESSION_KEY, "k", null, false, true);
            var xmlDispatcher = RequestDispatcher.of(xmlSession, transport);
            transport.enqueue(200, "<response status=\"success\"><value type=\"int\">3</value></response>");

            var result = xmlDispatcher.v1Result("users/online/count", null, HttpMethod.GET);

            assertEquals(3, result.value());
            assertFalse(transport.lastRequest().expectJson());
            assertFalse(transport.lastRequest().url().contains("response_format"));
        }
    }

    // -----------------------------------------------------------------------
    // Retrying
    // -----------------------------------------------------------------------

    @Nested
    class Retrying {

        RequestDispatcher retrying;

        @BeforeEach
        void setUp() {
            var retry = RetryableTransport.builder()
                    .delegate(transport)
                    .maxAttempts(3)
                    .initialBackoff(Duration.ZERO)
                    .build();
            retrying = RequestDispatcher.of(Session.of(BASE, AuthType.SESSION_KEY).withToken("k"), retry);
        }

        @Test
        void exhaustedTransientStatusRaisesWithAttempts() {
            transport.defaultResponse(ApiResponse.of(503, "{\"status\":\"error\",\"message\":\"Unavailable\"}"));

            var ex = assertThrows(KhorosException.class, () -> retrying.get("boards"));

            assertEquals(KhorosError.CODE_GET_REQUEST, ex.code());
            assertEquals(503, ex.statusCode());
            assertEquals(3, ex.attempts());
            transport.assertRequestCount(3);
        }

        @Test
        void connectionFailuresRaiseConnectionError() {
            for (int i = 0; i < 3; i++) {
                transport.enqueueFailure(new KhorosException(new KhorosError.ConnectionError(
                        HttpMethod.GET, BASE, 1, null, new ConnectException("refused"))));
            }

            var ex = assertThrows(KhorosException.class, () -> retrying.get("boards"));

            assertTrue(ex.isConnectionFailure());
            assertEquals(3, ex.attempts());
            var error = assertInstanceOf(KhorosError.ConnectionError.class, ex.error());
            assertEquals(3, error.failedAttempts().size());
            assertEquals("ConnectException", error.failedAttempts().get(0).errorType());
        }

        @Test
        void deletesAreAttemptedOnce() {
            transport.defaultResponse(ApiResponse.of(503, "{}"));

            assertThrows(KhorosException.class, () -> retrying.delete("messages/1"));

            transport.assertRequestCount(1);
        }
    }
}
