package org.khoros.community;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.config.KhorosSettings;
import org.khoros.community.testing.FakeTransport;
import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.RequestBody;

import static org.junit.jupiter.api.Assertions.*;

class SessionAuthenticatorTest {

    private static final String BASE = "https://community.example.com";
    private static final String KEY_RESPONSE =
            "{\"response\":{\"status\":\"success\",\"value\":{\"type\":\"string\",\"$\":\"NewSessionKey\"}}}";

    FakeTransport transport;
    SessionAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        transport = FakeTransport.create();
        authenticator = new SessionAuthenticator(RequestDispatcher.of(Session.of(BASE, AuthType.SESSION_KEY), transport));
    }

    @Test
    void sessionKeyLoginPostsCredentialsAsForm() {
        transport.enqueue(200, KEY_RESPONSE);
        var settings = KhorosSettings.builder().communityUrl(BASE).sessionAuth("admin", "p@ss word").build();

        var session = authenticator.authenticate(Session.of(settings), settings);

        assertEquals("NewSessionKey", session.token());
        var request = transport.assertRequested(HttpMethod.POST, "/restapi/vc/authentication/sessions/login");
        var body = assertInstanceOf(RequestBody.UrlEncoded.class, request.body());
        assertEquals("user.login=admin&user.password=p%40ss+word", body.encoded());
        assertNull(request.header("li-api-session-key"));
    }

    @Test
    void xmlLoginResponseIsAccepted() {
        transport.enqueue(200, "<response status=\"success\"><value type=\"string\">XmlKey</value></response>");

        assertEquals("XmlKey", authenticator.sessionKey("admin", "pw"));
    }

    @Test
    void failedLoginRaisesSessionAuthError() {
        transport.enqueue(200, "{\"response\":{\"status\":\"error\",\"error\":{\"code\":303,"
                + "\"message\":\"User authentication failed.\"}}}");

        var ex = assertThrows(KhorosException.class, () -> authenticator.sessionKey("admin", "wrong"));

        assertEquals(KhorosError.CODE_SESSION_AUTH, ex.code());
        assertTrue(ex.getMessage().contains("User authentication failed."));
    }

    @Test
    void httpErrorDuringLoginRaisesSessionAuthError() {
        transport.enqueue(500, "<html><body><h1>Internal error</h1></body></html>");

        var ex = assertThrows(KhorosException.class, () -> authenticator.sessionKey("admin", "pw"));

        assertEquals(KhorosError.CODE_SESSION_AUTH, ex.code());
        assertTrue(ex.getMessage().contains("Internal error"));
    }

    @Test
    void missingCredentialsRaiseMissingAuthData() {
        var settings = KhorosSettings.builder().communityUrl(BASE).build();

        var ex = assertThrows(KhorosException.class,
                () -> authenticator.authenticate(Session.of(settings), settings));

        assertEquals(KhorosError.CODE_MISSING_AUTH_DATA, ex.code());
        transport.assertRequestCount(0);
    }

    @Test
    void ssoTokenTravelsInUri() {
        transport.enqueue(200, KEY_RESPONSE);
        var settings = KhorosSettings.builder().communityUrl(BASE).authType(AuthType.SSO).ssoToken("sso-token").build();

        var session = authenticator.authenticate(Session.of(settings), settings);

        assertEquals("NewSessionKey", session.token());
        assertTrue(transport.lastRequest().url().contains("sso.authentication_token=sso-token"));
    }

    @Test
    void failedSsoRaisesSsoAuthError() {
        transport.enqueue(200, "{\"response\":{\"status\":\"error\",\"error\":{\"message\":\"Invalid token\"}}}");

        var ex = assertThrows(KhorosException.class, () -> authenticator.ssoSessionKey("bad"));

        assertEquals(KhorosError.CODE_SSO_AUTH, ex.code());
    }

    @Test
    void oauthUsesAccessTokenWithoutRequest() {
        var settings = KhorosSettings.builder()
                .communityUrl(BASE).authType(AuthType.OAUTH2).oauthAccessToken("access").build();

        var session = authenticator.authenticate(Session.of(BASE, AuthType.OAUTH2), settings);

        assertEquals("access", session.token());
        transport.assertRequestCount(0);
    }

    @Test
    void invalidateLogsOutAndClearsToken() {
        var session = Session.of(BASE, AuthType.SESSION_KEY).withToken("key");

        var loggedOut = authenticator.invalidate(session);

        assertFalse(loggedOut.isAuthenticated());
        transport.assertRequested(HttpMethod.POST, "/restapi/vc/authentication/sessions/logout");
    }

    @Test
    void failedLogoutStillClearsToken() {
        transport.enqueue(500, "{\"response\":{\"status\":\"error\",\"error\":{\"message\":\"Down\"}}}");

        var loggedOut = authenticator.invalidate(Session.of(BASE, AuthType.SESSION_KEY).withToken("key"));

        assertNull(loggedOut.token());
    }

    @Test
    void invalidatingUnauthenticatedSessionSendsNothing() {
        authenticator.invalidate(Session.of(BASE, AuthType.SESSION_KEY));

        transport.assertRequestCount(0);
    }
}
