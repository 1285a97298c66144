package org.khoros.community.config;

import org.junit.jupiter.api.Test;
import org.khoros.community.AuthType;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentConfigTest {

    private static EnvironmentConfig env(Map<String, String> vars) {
        return EnvironmentConfig.of(vars::get);
    }

    @Test
    void readsStandardVariables() {
        var settings = env(Map.of(
                "KHOROS_URL", "https://community.example.com",
                "KHOROS_TENANT_ID", "example12345",
                "KHOROS_DEFAULT_AUTH", "session_auth",
                "KHOROS_SESSION_USER", "api_user",
                "KHOROS_SESSION_PW", "pw",
                "KHOROS_PREFER_JSON", "no")).load();

        assertEquals("https://community.example.com", settings.communityUrl());
        assertEquals("example12345", settings.tenantId());
        assertEquals(AuthType.SESSION_KEY, settings.authType());
        assertEquals("api_user", settings.sessionUsername());
        assertEquals("pw", settings.sessionPassword());
        assertFalse(settings.preferJson());
    }

    @Test
    void blankValuesCountAsUndefined() {
        var vars = new HashMap<String, String>();
        vars.put("KHOROS_URL", "   ");
        vars.put("KHOROS_TENANT_ID", null);

        var config = env(vars);

        assertFalse(config.isConfigured());
        assertTrue(config.variables().isEmpty());
    }

    @Test
    void valuesAreTrimmed() {
        var config = env(Map.of("KHOROS_OAUTH_TOKEN", "  token  "));

        assertEquals(Map.of("KHOROS_OAUTH_TOKEN", "token"), config.variables());
    }

    @Test
    void customNamesReplaceStandardOnes() {
        var config = env(Map.of("COMMUNITY_URL", "https://other.example.com", "KHOROS_URL", "ignored"))
                .withCustomNames(Map.of("KHOROS_URL", "COMMUNITY_URL", "NOT_A_KHOROS_VAR", "X"));

        assertEquals("https://other.example.com", config.load().communityUrl());
        assertFalse(config.variables().containsKey("NOT_A_KHOROS_VAR"));
    }

    @Test
    void overlayKeepsBaseValuesForUndefinedVariables() {
        var base = KhorosSettings.builder()
                .communityUrl("https://base.example.com")
                .sessionAuth("base_user", "base_pw")
                .requestTimeout(Duration.ofSeconds(5))
                .build();

        var merged = env(Map.of("KHOROS_SESSION_PW", "env_pw", "KHOROS_TRANSLATE_ERRORS", "false")).overlay(base);

        assertEquals("https://base.example.com", merged.communityUrl());
        assertEquals("base_user", merged.sessionUsername());
        assertEquals("env_pw", merged.sessionPassword());
        assertFalse(merged.translateErrors());
        assertEquals(Duration.ofSeconds(5), merged.requestTimeout());
    }

    @Test
    void oauthVariables() {
        var settings = env(Map.of(
                "KHOROS_DEFAULT_AUTH", "oauth2",
                "KHOROS_OAUTH_ID", "id",
                "KHOROS_OAUTH_SECRET", "secret",
                "KHOROS_OAUTH_REDIRECT_URL", "http://localhost/cb",
                "KHOROS_OAUTH_TOKEN", "tok")).load();

        assertEquals(AuthType.OAUTH2, settings.authType());
        assertEquals("id", settings.oauthClientId());
        assertEquals("secret", settings.oauthClientSecret());
        assertEquals("http://localhost/cb", settings.oauthRedirectUrl());
        assertEquals("tok", settings.oauthAccessToken());
    }
}
