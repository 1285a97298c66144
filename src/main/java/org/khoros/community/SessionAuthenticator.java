package org.khoros.community;

import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.config.KhorosSettings;
import org.khoros.community.transport.HttpMethod;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Obtains and invalidates session keys through the v1 authentication endpoints.
 *
 * <p>Sessions are immutable: a successful login returns a new {@link Session}
 * holding the key. OAuth 2.0 sessions use the configured access token directly.
 */
public final class SessionAuthenticator {

    private static final System.Logger logger = System.getLogger(SessionAuthenticator.class.getName());

    static final String LOGIN_ENDPOINT = "authentication/sessions/login";
    static final String LOGOUT_ENDPOINT = "authentication/sessions/logout";

    private final RequestDispatcher dispatcher;

    public SessionAuthenticator(RequestDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /**
     * Authenticate according to the session's auth type.
     *
     * @throws KhorosException with code {@code missing_auth_data} when the settings lack
     *                         the credentials for that type
     */
    public Session authenticate(Session session, KhorosSettings settings) {
        return switch (session.authType()) {
            case SESSION_KEY -> {
                if (settings.sessionUsername() == null || settings.sessionPassword() == null) {
                    throw missingAuth("The 'session_auth' authentication type was specified but no username and password were found.");
                }
                yield session.withToken(sessionKey(settings.sessionUsername(), settings.sessionPassword()));
            }
            case SSO -> {
                if (settings.ssoToken() == null) {
                    throw missingAuth("The 'sso' authentication type was specified but no SSO token was found.");
                }
                yield session.withToken(ssoSessionKey(settings.ssoToken()));
            }
            case OAUTH2 -> {
                if (settings.oauthAccessToken() == null) {
                    throw missingAuth("The 'oauth2' authentication type was specified but no access token was found.");
                }
                yield session.withToken(settings.oauthAccessToken());
            }
        };
    }

    /**
     * Log in with a username and password.
     *
     * @return the session key
     * @throws KhorosException with code {@code session_auth_error}
     */
    public String sessionKey(String username, String password) {
        var params = new LinkedHashMap<String, String>();
        params.put("user.login", username);
        params.put("user.password", password);
        var result = login(params, HttpMethod.POST, false);
        var key = result.value();
        if (!result.isSuccess() || key == null) {
            throw authFailure(KhorosError.CODE_SESSION_AUTH, "Failed to retrieve the session key", result);
        }
        logger.log(System.Logger.Level.DEBUG, "Obtained a session key for user {0}", username);
        return key.toString();
    }

    /**
     * Exchange a single sign-on token for a session key.
     *
     * @throws KhorosException with code {@code sso_auth_error}
     */
    public String ssoSessionKey(String ssoToken) {
        var result = login(Map.of("sso.authentication_token", ssoToken), HttpMethod.POST, true);
        var key = result.value();
        if (!result.isSuccess() || key == null) {
            throw authFailure(KhorosError.CODE_SSO_AUTH, "Failed to retrieve the SSO session key", result);
        }
        logger.log(System.Logger.Level.DEBUG, "Obtained a session key through SSO");
        return key.toString();
    }

    /** Invalidate the session key; returns the session without a token. */
    public Session invalidate(Session session) {
        if (!session.isAuthenticated() || session.authType() == AuthType.OAUTH2) {
            return session.withToken(null);
        }
        var result = dispatcher.v1Result(LOGOUT_ENDPOINT, Map.of(), HttpMethod.POST);
        if (!result.isSuccess()) {
            logger.log(System.Logger.Level.WARNING, "The session could not be invalidated: {0}",
                    result.errorMessage(false));
        }
        return session.withToken(null);
    }

    private NormalizedResult login(Map<String, ?> params, HttpMethod method, boolean paramsInUri) {
        var response = dispatcher.makeV1Request(LOGIN_ENDPOINT, params, method, paramsInUri, false);
        return dispatcher.normalizer().normalizeV1(method, response);
    }

    private static KhorosException missingAuth(String message) {
        return new KhorosException(new KhorosError.AuthError(KhorosError.CODE_MISSING_AUTH_DATA, message));
    }

    private static KhorosException authFailure(String code, String prefix, NormalizedResult result) {
        var detail = result.isSuccess() ? "no session key was returned" : result.errorMessage(false).text();
        return new KhorosException(new KhorosError.AuthError(code, prefix + ": " + detail));
    }
}
