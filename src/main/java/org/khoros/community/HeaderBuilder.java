package org.khoros.community;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Assembles the headers for one request.
 *
 * <p>Defaults are the session's authentication header and
 * {@code content-type: application/json}. Caller headers overwrite defaults
 * case-insensitively. Keys and values are lower-cased, except the values of
 * authentication headers, which are passed through untouched. A multipart request
 * carries no {@code content-type}; the transport writes it with the boundary.
 */
public final class HeaderBuilder {

    public static final String SESSION_KEY_HEADER = "li-api-session-key";
    public static final String AUTHORIZATION_HEADER = "authorization";
    public static final String CONTENT_TYPE_HEADER = "content-type";

    private static final Set<String> VERBATIM_HEADERS = Set.of(SESSION_KEY_HEADER, AUTHORIZATION_HEADER);

    private HeaderBuilder() {}

    /**
     * Build the final header map.
     *
     * @param session   the session supplying the auth token, may be unauthenticated
     * @param extra     caller-supplied headers, may be {@code null}
     * @param multipart whether the body is multipart
     */
    public static Map<String, String> build(Session session, Map<String, String> extra, boolean multipart) {
        var headers = new LinkedHashMap<String, String>();
        headers.putAll(authHeaders(session));
        headers.put(CONTENT_TYPE_HEADER, "application/json");
        if (extra != null) {
            headers.putAll(normalize(extra));
        }
        if (multipart) {
            headers.remove(CONTENT_TYPE_HEADER);
        }
        return headers;
    }

    /** The authentication header for a session, empty when it holds no token. */
    public static Map<String, String> authHeaders(Session session) {
        if (session == null || !session.isAuthenticated()) {
            return Map.of();
        }
        if (session.authType() == AuthType.OAUTH2) {
            return Map.of(AUTHORIZATION_HEADER, "Bearer " + session.token());
        }
        return Map.of(SESSION_KEY_HEADER, session.token());
    }

    /** Lower-case header keys and values, leaving authentication values as given. */
    public static Map<String, String> normalize(Map<String, String> headers) {
        var normalized = new LinkedHashMap<String, String>();
        headers.forEach((name, value) -> {
            var key = name.toLowerCase(Locale.ROOT);
            var val = value == null || VERBATIM_HEADERS.contains(key) ? value : value.toLowerCase(Locale.ROOT);
            normalized.put(key, val);
        });
        return normalized;
    }
}
