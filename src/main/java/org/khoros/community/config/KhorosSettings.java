package org.khoros.community.config;

import org.khoros.community.AuthType;

import java.time.Duration;

/**
 * Connection and authentication settings for a community.
 *
 * <p>Settings come from code ({@link #builder()}), a helper file ({@link HelperConfig})
 * or environment variables ({@link EnvironmentConfig}). Secrets are never printed by
 * {@link #toString()}.
 */
public record KhorosSettings(
        String communityUrl,
        String tenantId,
        AuthType authType,
        String sessionUsername,
        String sessionPassword,
        String oauthClientId,
        String oauthClientSecret,
        String oauthRedirectUrl,
        String oauthAccessToken,
        String ssoToken,
        boolean preferJson,
        boolean translateErrors,
        Duration requestTimeout,
        int maxAttempts
) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public KhorosSettings {
        if (authType == null) authType = AuthType.SESSION_KEY;
        if (requestTimeout == null) requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder pre-populated with these settings. */
    public Builder toBuilder() {
        return new Builder()
                .communityUrl(communityUrl)
                .tenantId(tenantId)
                .authType(authType)
                .sessionAuth(sessionUsername, sessionPassword)
                .oauthClientId(oauthClientId)
                .oauthClientSecret(oauthClientSecret)
                .oauthRedirectUrl(oauthRedirectUrl)
                .oauthAccessToken(oauthAccessToken)
                .ssoToken(ssoToken)
                .preferJson(preferJson)
                .translateErrors(translateErrors)
                .requestTimeout(requestTimeout)
                .maxAttempts(maxAttempts);
    }

    @Override
    public String toString() {
        return "KhorosSettings[communityUrl=" + communityUrl
                + ", tenantId=" + tenantId
                + ", authType=" + authType
                + ", sessionUsername=" + sessionUsername
                + ", oauthClientId=" + oauthClientId
                + ", preferJson=" + preferJson
                + ", translateErrors=" + translateErrors + "]";
    }

    public static final class Builder {
        private String communityUrl;
        private String tenantId;
        private AuthType authType = AuthType.SESSION_KEY;
        private String sessionUsername;
        private String sessionPassword;
        private String oauthClientId;
        private String oauthClientSecret;
        private String oauthRedirectUrl;
        private String oauthAccessToken;
        private String ssoToken;
        private boolean preferJson = true;
        private boolean translateErrors = true;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

        private Builder() {}

        /** Community base URL, e.g. {@code https://community.example.com}. */
        public Builder communityUrl(String communityUrl) {
            this.communityUrl = communityUrl;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder authType(AuthType authType) {
            this.authType = authType;
            return this;
        }

        /** Username and password used to obtain a session key. */
        public Builder sessionAuth(String username, String password) {
            this.sessionUsername = username;
            this.sessionPassword = password;
            return this;
        }

        public Builder oauthClientId(String oauthClientId) {
            this.oauthClientId = oauthClientId;
            return this;
        }

        public Builder oauthClientSecret(String oauthClientSecret) {
            this.oauthClientSecret = oauthClientSecret;
            return this;
        }

        public Builder oauthRedirectUrl(String oauthRedirectUrl) {
            this.oauthRedirectUrl = oauthRedirectUrl;
            return this;
        }

        /** An already issued OAuth 2.0 access token. */
        public Builder oauthAccessToken(String oauthAccessToken) {
            this.oauthAccessToken = oauthAccessToken;
            return this;
        }

        public Builder ssoToken(String ssoToken) {
            this.ssoToken = ssoToken;
            return this;
        }

        /** Whether v1 responses should be requested in JSON (default: true). */
        public Builder preferJson(boolean preferJson) {
            this.preferJson = preferJson;
            return this;
        }

        /** Whether known error messages are replaced with clearer text (default: true). */
        public Builder translateErrors(boolean translateErrors) {
            this.translateErrors = translateErrors;
            return this;
        }

        /** Per-request timeout (default: 30s). */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /** Total attempts per retryable request, including the first (default: 3). */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public KhorosSettings build() {
            return new KhorosSettings(communityUrl, tenantId, authType, sessionUsername, sessionPassword,
                    oauthClientId, oauthClientSecret, oauthRedirectUrl, oauthAccessToken, ssoToken,
                    preferJson, translateErrors, requestTimeout, maxAttempts);
        }
    }
}
