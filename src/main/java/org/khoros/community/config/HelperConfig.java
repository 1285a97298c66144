package org.khoros.community.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.khoros.community.AuthType;
import org.khoros.community.KhorosError;
import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.transport.Json;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Loads {@link KhorosSettings} from a YAML or JSON helper file.
 *
 * <pre>{@code
 * connection:
 *   community_url: https://community.example.com
 *   tenant_id: example12345
 *   default_auth_type: session_auth
 *   session_auth:
 *     username: api_user
 *     password: secret
 * prefer_json: yes
 * translate_errors: yes
 * }</pre>
 *
 * <p>Booleans may be written as YAML booleans or as {@code yes}/{@code no} strings.
 * Missing keys keep the {@link KhorosSettings.Builder} defaults.
 */
public final class HelperConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Set<String> TRUE_VALUES = Set.of("yes", "true", "on", "1");

    private HelperConfig() {}

    /**
     * Load settings from a helper file. The format is chosen by extension:
     * {@code .yml}/{@code .yaml} or {@code .json}.
     *
     * @throws KhorosException with code {@code invalid_helper_file} for an unknown
     *                         extension, a missing file or unparseable content
     */
    public static KhorosSettings load(Path path) {
        var mapper = mapperFor(path);
        try (InputStream in = Files.newInputStream(path)) {
            return fromTree(mapper.readTree(in));
        } catch (NoSuchFileException e) {
            throw new KhorosException(new KhorosError.ValidationError(
                    KhorosError.CODE_INVALID_HELPER_FILE, "Helper file not found: " + path), e);
        } catch (IOException e) {
            throw new KhorosException(new KhorosError.ValidationError(
                    KhorosError.CODE_INVALID_HELPER_FILE, "Failed to parse helper file: " + path), e);
        }
    }

    /** Map an already parsed helper tree to settings. */
    public static KhorosSettings fromTree(JsonNode root) {
        return apply(root, KhorosSettings.builder()).build();
    }

    static KhorosSettings.Builder apply(JsonNode root, KhorosSettings.Builder builder) {
        if (root == null || !root.isObject()) {
            throw KhorosError.validation(KhorosError.CODE_INVALID_HELPER_FILE,
                    "The helper file must contain a mapping at the top level");
        }

        // --- connection ---
        var connection = root.path("connection");
        var url = textOrNull(connection, "community_url");
        if (url != null) builder.communityUrl(url);
        var tenant = textOrNull(connection, "tenant_id");
        if (tenant != null) builder.tenantId(tenant);
        var authType = textOrNull(connection, "default_auth_type");
        if (authType != null) builder.authType(AuthType.fromConfig(authType));

        var session = connection.path("session_auth");
        if (session.isObject()) {
            builder.sessionAuth(textOrNull(session, "username"), textOrNull(session, "password"));
        }

        var oauth = connection.path("oauth2");
        if (oauth.isObject()) {
            builder.oauthClientId(textOrNull(oauth, "client_id"))
                    .oauthClientSecret(textOrNull(oauth, "client_secret"))
                    .oauthRedirectUrl(textOrNull(oauth, "redirect_url"))
                    .oauthAccessToken(textOrNull(oauth, "access_token"));
        }

        var sso = connection.path("sso");
        if (sso.isObject()) {
            builder.ssoToken(textOrNull(sso, "token"));
        }

        // --- construct ---
        if (root.has("prefer_json")) builder.preferJson(toBoolean(root.get("prefer_json")));
        if (root.has("translate_errors")) builder.translateErrors(toBoolean(root.get("translate_errors")));

        return builder;
    }

    private static ObjectMapper mapperFor(Path path) {
        var name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yml") || name.endsWith(".yaml")) {
            return YAML_MAPPER;
        }
        if (name.endsWith(".json")) {
            return Json.mapper();
        }
        throw KhorosError.validation(KhorosError.CODE_INVALID_HELPER_FILE,
                "The helper file must be a YAML (.yml/.yaml) or JSON (.json) file: " + path);
    }

    static String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        var text = value.asText().strip();
        return text.isEmpty() ? null : text;
    }

    static boolean toBoolean(JsonNode node) {
        if (node.isBoolean()) return node.booleanValue();
        return TRUE_VALUES.contains(node.asText().strip().toLowerCase(Locale.ROOT));
    }
}
