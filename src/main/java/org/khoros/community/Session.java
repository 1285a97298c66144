package org.khoros.community;

import org.khoros.community.config.KhorosSettings;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * One connection to a community: base URL, authentication type and the current token.
 *
 * <p>A session is immutable. Authenticating or logging out produces a new session
 * via {@link #withToken(String)}; request code only ever reads it.
 *
 * @param baseUrl         community URL with scheme and no trailing slash
 * @param authType        authentication type
 * @param token           session key or OAuth access token, or {@code null} before authentication
 * @param tenantId        tenant identifier, may be {@code null}
 * @param preferJson      whether v1 responses are requested in JSON
 * @param translateErrors whether error messages are passed through {@link ErrorTranslations}
 */
public record Session(
        String baseUrl,
        AuthType authType,
        String token,
        String tenantId,
        boolean preferJson,
        boolean translateErrors
) {

    static final String V1_PATH = "/restapi/vc";
    static final String V2_PATH = "/api/2.0";

    public Session {
        baseUrl = normalizeUrl(baseUrl);
        Objects.requireNonNull(authType, "authType must not be null");
        if (token != null && token.isBlank()) token = null;
    }

    /** An unauthenticated session with JSON preferred and error translation enabled. */
    public static Session of(String baseUrl, AuthType authType) {
        return new Session(baseUrl, authType, null, null, true, true);
    }

    /**
     * Build a session from loaded settings. OAuth 2.0 sessions start with the
     * configured access token; session-key and SSO sessions start unauthenticated.
     */
    public static Session of(KhorosSettings settings) {
        if (settings.communityUrl() == null) {
            throw KhorosError.missingData("The community URL must be configured");
        }
        var token = settings.authType() == AuthType.OAUTH2 ? settings.oauthAccessToken() : null;
        return new Session(settings.communityUrl(), settings.authType(), token,
                settings.tenantId(), settings.preferJson(), settings.translateErrors());
    }

    /** Base URL of the Community API v1. */
    public String v1Base() {
        return baseUrl + V1_PATH;
    }

    /** Base URL of the Community API v2. */
    public String v2Base() {
        return baseUrl + V2_PATH;
    }

    public boolean isAuthenticated() {
        return token != null;
    }

    public Session withToken(String newToken) {
        return new Session(baseUrl, authType, newToken, tenantId, preferJson, translateErrors);
    }

    public Session withTranslateErrors(boolean enabled) {
        return new Session(baseUrl, authType, token, tenantId, preferJson, enabled);
    }

    /**
     * Validate and normalize a community URL: a missing scheme defaults to {@code https},
     * only {@code http} and {@code https} are accepted, and trailing slashes are removed.
     *
     * @throws KhorosError.KhorosException with code {@code invalid_url}
     */
    public static String normalizeUrl(String url) {
        if (url == null || url.isBlank()) {
            throw KhorosError.validation(KhorosError.CODE_INVALID_URL, "The community URL must not be empty");
        }
        var candidate = url.strip();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        try {
            var uri = new URI(candidate);
            var scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw KhorosError.validation(KhorosError.CODE_INVALID_URL,
                        "The community URL must use http or https: " + url);
            }
            if (uri.getHost() == null) {
                throw KhorosError.validation(KhorosError.CODE_INVALID_URL,
                        "The community URL has no host: " + url);
            }
        } catch (URISyntaxException e) {
            throw new KhorosError.KhorosException(new KhorosError.ValidationError(
                    KhorosError.CODE_INVALID_URL, "Invalid community URL: " + url), e);
        }
        while (candidate.endsWith("/")) {
            candidate = candidate.substring(0, candidate.length() - 1);
        }
        return candidate;
    }

    @Override
    public String toString() {
        return "Session[" + baseUrl + ", " + authType + (token != null ? ", authenticated" : "") + "]";
    }
}
