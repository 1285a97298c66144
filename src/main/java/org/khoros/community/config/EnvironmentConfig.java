package org.khoros.community.config;

import org.khoros.community.AuthType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads {@link KhorosSettings} from {@code KHOROS_*} environment variables.
 *
 * <p>A variable is considered set only when it is defined and its trimmed value is
 * non-empty. Variables can be renamed with {@link #withCustomNames(Map)}, keyed by
 * the standard name.
 */
public final class EnvironmentConfig {

    public static final String URL = "KHOROS_URL";
    public static final String TENANT_ID = "KHOROS_TENANT_ID";
    public static final String DEFAULT_AUTH = "KHOROS_DEFAULT_AUTH";
    public static final String OAUTH_ID = "KHOROS_OAUTH_ID";
    public static final String OAUTH_SECRET = "KHOROS_OAUTH_SECRET";
    public static final String OAUTH_REDIRECT_URL = "KHOROS_OAUTH_REDIRECT_URL";
    public static final String OAUTH_TOKEN = "KHOROS_OAUTH_TOKEN";
    public static final String SESSION_USER = "KHOROS_SESSION_USER";
    public static final String SESSION_PW = "KHOROS_SESSION_PW";
    public static final String SSO_TOKEN = "KHOROS_SSO_TOKEN";
    public static final String PREFER_JSON = "KHOROS_PREFER_JSON";
    public static final String TRANSLATE_ERRORS = "KHOROS_TRANSLATE_ERRORS";

    public static final List<String> VARIABLE_NAMES = List.of(
            URL, TENANT_ID, DEFAULT_AUTH, OAUTH_ID, OAUTH_SECRET, OAUTH_REDIRECT_URL, OAUTH_TOKEN,
            SESSION_USER, SESSION_PW, SSO_TOKEN, PREFER_JSON, TRANSLATE_ERRORS);

    private static final Set<String> TRUE_VALUES = Set.of("yes", "true", "on", "1");

    private final Function<String, String> envLookup;
    private final Map<String, String> names;

    private EnvironmentConfig(Function<String, String> envLookup, Map<String, String> names) {
        this.envLookup = envLookup;
        this.names = names;
    }

    /** Reads the process environment. */
    public static EnvironmentConfig system() {
        return of(System::getenv);
    }

    /** Reads variables through the given lookup; {@code null} means undefined. */
    public static EnvironmentConfig of(Function<String, String> envLookup) {
        var names = new LinkedHashMap<String, String>();
        VARIABLE_NAMES.forEach(name -> names.put(name, name));
        return new EnvironmentConfig(envLookup, names);
    }

    /**
     * Replace standard variable names with custom ones, e.g.
     * {@code Map.of("KHOROS_URL", "COMMUNITY_URL")}. Unknown standard names are ignored.
     */
    public EnvironmentConfig withCustomNames(Map<String, String> customNames) {
        var renamed = new LinkedHashMap<>(names);
        customNames.forEach((standard, custom) -> {
            if (renamed.containsKey(standard) && custom != null && !custom.isBlank()) {
                renamed.put(standard, custom.strip());
            }
        });
        return new EnvironmentConfig(envLookup, renamed);
    }

    /** The defined variables, keyed by their standard name. */
    public Map<String, String> variables() {
        var found = new LinkedHashMap<String, String>();
        names.forEach((standard, actual) -> {
            var value = envLookup.apply(actual);
            if (value != null && !value.isBlank()) {
                found.put(standard, value.strip());
            }
        });
        return found;
    }

    /** Whether any Khoros variable is set. */
    public boolean isConfigured() {
        return !variables().isEmpty();
    }

    /** Settings built from the environment alone. */
    public KhorosSettings load() {
        return overlay(KhorosSettings.builder()).build();
    }

    /** Settings from {@code base} with any defined variables taking precedence. */
    public KhorosSettings overlay(KhorosSettings base) {
        return overlay(base.toBuilder()).build();
    }

    private KhorosSettings.Builder overlay(KhorosSettings.Builder builder) {
        var vars = variables();
        if (vars.containsKey(URL)) builder.communityUrl(vars.get(URL));
        if (vars.containsKey(TENANT_ID)) builder.tenantId(vars.get(TENANT_ID));
        if (vars.containsKey(DEFAULT_AUTH)) builder.authType(AuthType.fromConfig(vars.get(DEFAULT_AUTH)));
        if (vars.containsKey(OAUTH_ID)) builder.oauthClientId(vars.get(OAUTH_ID));
        if (vars.containsKey(OAUTH_SECRET)) builder.oauthClientSecret(vars.get(OAUTH_SECRET));
        if (vars.containsKey(OAUTH_REDIRECT_URL)) builder.oauthRedirectUrl(vars.get(OAUTH_REDIRECT_URL));
        if (vars.containsKey(OAUTH_TOKEN)) builder.oauthAccessToken(vars.get(OAUTH_TOKEN));
        if (vars.containsKey(SSO_TOKEN)) builder.ssoToken(vars.get(SSO_TOKEN));
        if (vars.containsKey(PREFER_JSON)) builder.preferJson(isTrue(vars.get(PREFER_JSON)));
        if (vars.containsKey(TRANSLATE_ERRORS)) builder.translateErrors(isTrue(vars.get(TRANSLATE_ERRORS)));
        if (vars.containsKey(SESSION_USER) || vars.containsKey(SESSION_PW)) {
            var current = builder.build();
            builder.sessionAuth(vars.getOrDefault(SESSION_USER, current.sessionUsername()),
                    vars.getOrDefault(SESSION_PW, current.sessionPassword()));
        }
        return builder;
    }

    private static boolean isTrue(String value) {
        return TRUE_VALUES.contains(value.toLowerCase(Locale.ROOT));
    }
}
