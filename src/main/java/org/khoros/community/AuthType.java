package org.khoros.community;

import java.util.Locale;

/**
 * How a session authenticates against the community.
 */
public enum AuthType {

    /** A session key obtained by logging in with a username and password. */
    SESSION_KEY("session_auth"),

    /** An OAuth 2.0 access token sent as a bearer token. */
    OAUTH2("oauth2"),

    /** A session key obtained through a single sign-on token. */
    SSO("sso");

    private final String configValue;

    AuthType(String configValue) {
        this.configValue = configValue;
    }

    /** The value used for this type in helper files and environment variables. */
    public String configValue() {
        return configValue;
    }

    /**
     * Parse a configured auth type. Accepts the config value ({@code session_auth}),
     * the short form ({@code session}) or the enum name.
     *
     * @throws KhorosError.KhorosException with code {@code invalid_helper_file} for unknown values
     */
    public static AuthType fromConfig(String value) {
        var normalized = value == null ? "" : value.strip().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "session_auth", "session", "session_key" -> SESSION_KEY;
            case "oauth2", "oauth", "oauth_2" -> OAUTH2;
            case "sso", "sso_auth" -> SSO;
            default -> throw KhorosError.validation(KhorosError.CODE_INVALID_HELPER_FILE,
                    "Unknown authentication type: '" + value + "'");
        };
    }
}
