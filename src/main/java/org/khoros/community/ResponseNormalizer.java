package org.khoros.community;

import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.transport.ApiResponse;
import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.XmlTree;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts raw v1 and v2 responses into {@link NormalizedResult}s and projects them
 * into {@link Delivery} values.
 *
 * <p>v2 bodies carry {@code status}, {@code http_code}, {@code message},
 * {@code developer_message} and a {@code data} object. v1 bodies are wrapped in a
 * {@code response} element, as JSON or as XML, with typed values of the form
 * {@code {"type": "int", "$": 544}}.
 */
public final class ResponseNormalizer {

    private static final Set<String> SUCCESS_VALUES = Set.of("success", "successful");

    private static final Pattern HTML_TITLE = Pattern.compile("<body><h1>(.*?)</h1>", Pattern.DOTALL);
    private static final Pattern HTML_DESCRIPTION = Pattern.compile("description</b>\\s*<u>(.*?)</u>", Pattern.DOTALL);

    private static final int MAX_DETAIL_LENGTH = 500;

    private final ErrorTranslations translations;
    private final boolean translate;

    public ResponseNormalizer(ErrorTranslations translations, boolean translate) {
        this.translations = translations != null ? translations : ErrorTranslations.none();
        this.translate = translate;
    }

    /** A normalizer honouring the session's {@code translateErrors} flag. */
    public static ResponseNormalizer forSession(Session session, ErrorTranslations translations) {
        return new ResponseNormalizer(translations, session.translateErrors());
    }

    // --- Normalization ---

    /** Normalize a response of either API generation, detecting v1 by its {@code response} wrapper. */
    public NormalizedResult normalize(HttpMethod method, ApiResponse response) {
        if (isHtml(response)) {
            return nonJsonResult(method, response);
        }
        if (response.looksLikeXml()) {
            return normalizeV1(method, response);
        }
        var body = response.jsonObject();
        if (body.isPresent() && body.get().get("response") instanceof Map<?, ?>) {
            return normalizeV1(method, response);
        }
        return normalizeV2(method, response);
    }

    /** Normalize a Community API v2 response. */
    public NormalizedResult normalizeV2(HttpMethod method, ApiResponse response) {
        var body = response.jsonObject().orElse(null);
        if (body == null) {
            return nonJsonResult(method, response);
        }

        var status = statusOf(body.get("status"), response);
        var httpCode = intOr(body.get("http_code"), response.statusCode());
        var data = body.get("data");
        var dataMap = data instanceof Map<?, ?> m ? m : Map.of();

        String message = null;
        String developerMessage = null;
        if (!NormalizedResult.SUCCESS.equals(status)) {
            message = translated(stringOr(body.get("message"), ""));
            var dev = body.containsKey("developer_message")
                    ? body.get("developer_message") : dataMap.get("developer_message");
            developerMessage = translated(stringOr(dev, ""));
        }

        return new NormalizedResult(method, response, status, httpCode, message, developerMessage, data,
                stringOr(dataMap.get("id"), null),
                stringOr(dataMap.get("view_href"), null),
                stringOr(dataMap.get("href"), null),
                null);
    }

    /**
     * Normalize a Community API v1 response given as JSON or as raw XML.
     *
     * @throws KhorosException with code {@code response_decode_error} for malformed XML
     */
    public NormalizedResult normalizeV1(HttpMethod method, ApiResponse response) {
        Map<?, ?> tree;
        if (isHtml(response)) {
            return nonJsonResult(method, response);
        }
        if (response.looksLikeXml()) {
            try {
                tree = XmlTree.parse(response.body());
            } catch (IllegalArgumentException e) {
                throw new KhorosException(new KhorosError.ResponseError(
                        KhorosError.CODE_RESPONSE_DECODE, "Failed to parse the XML response: " + e.getMessage()), e);
            }
        } else {
            var body = response.jsonObject().orElse(null);
            if (body == null) {
                return nonJsonResult(method, response);
            }
            tree = body;
        }

        var inner = tree.get("response") instanceof Map<?, ?> m ? m : tree;
        var status = statusOf(inner.get("status"), response);

        String message = null;
        if (!NormalizedResult.SUCCESS.equals(status)) {
            var error = inner.get("error") instanceof Map<?, ?> e ? e : Map.of();
            message = translated(stringOr(typedValue(error.get("message")), ""));
        }

        String id = null;
        String apiUrl = null;
        var entity = firstEntity(inner);
        if (entity != null) {
            id = stringOr(typedValue(entity.get("id")), null);
            apiUrl = stringOr(entity.get("href"), null);
        }

        return new NormalizedResult(method, response, status, response.statusCode(), message, null,
                inner, id, null, apiUrl, typedValue(inner.get("value")));
    }

    /** Project a result according to the selected fields. */
    public Delivery deliver(NormalizedResult result, ReturnFields fields) {
        return Delivery.project(result, fields);
    }

    /**
     * The best available error text for a failed response: the platform message,
     * a condensed HTML error page, or the abbreviated body.
     */
    public String errorDetail(ApiResponse response) {
        var body = response.jsonObject();
        if (body.isPresent() || (response.looksLikeXml() && !isHtml(response))) {
            try {
                var result = normalize(null, response);
                if (!result.isSuccess()) {
                    var text = result.errorMessage(false).text();
                    if (text != null && !text.isEmpty()) return text;
                }
            } catch (KhorosException e) {
                // not a recognizable error document
                return abbreviate(response.body());
            }
        }
        var html = condenseHtmlError(response.body());
        return html != null ? html : abbreviate(response.body());
    }

    // --- Helpers ---

    private NormalizedResult nonJsonResult(HttpMethod method, ApiResponse response) {
        var success = response.isSuccessful();
        String message = null;
        if (!success) {
            var html = condenseHtmlError(response.body());
            message = translated(html != null ? html : abbreviate(response.body()));
        }
        return new NormalizedResult(method, response, success ? NormalizedResult.SUCCESS : NormalizedResult.ERROR,
                response.statusCode(), message, null, null, null, null, null, null);
    }

    private static boolean isHtml(ApiResponse response) {
        var head = response.body().stripLeading();
        head = head.substring(0, Math.min(head.length(), 15)).toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html");
    }

    private String translated(String message) {
        return translate ? translations.translate(message) : message;
    }

    private static String statusOf(Object status, ApiResponse response) {
        if (status == null) {
            return response.isSuccessful() ? NormalizedResult.SUCCESS : NormalizedResult.ERROR;
        }
        var text = String.valueOf(status).strip().toLowerCase(Locale.ROOT);
        return SUCCESS_VALUES.contains(text) ? NormalizedResult.SUCCESS : NormalizedResult.ERROR;
    }

    /** The first nested object that looks like an entity ({@code type} plus {@code id}). */
    private static Map<?, ?> firstEntity(Map<?, ?> inner) {
        for (var entry : inner.entrySet()) {
            if ("value".equals(entry.getKey()) || "error".equals(entry.getKey())) continue;
            if (entry.getValue() instanceof Map<?, ?> candidate && candidate.containsKey("id")) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Unwrap a v1 typed value. {@code {"type": "int", "$": "544"}} becomes the Integer 544;
     * {@code long}, {@code boolean}, {@code float} and {@code double} are coerced likewise.
     * Anything else is returned as is.
     */
    public static Object typedValue(Object value) {
        if (!(value instanceof Map<?, ?> map) || !map.containsKey("$")) {
            return value;
        }
        var raw = map.get("$");
        var type = String.valueOf(map.get("type")).toLowerCase(Locale.ROOT);
        if (raw == null) return null;
        try {
            return switch (type) {
                case "int", "integer" -> raw instanceof Number n ? n.intValue() : Integer.parseInt(raw.toString().strip());
                case "long" -> raw instanceof Number n ? n.longValue() : Long.parseLong(raw.toString().strip());
                case "boolean" -> raw instanceof Boolean b ? b : Boolean.parseBoolean(raw.toString().strip());
                case "float", "double" -> raw instanceof Number n ? n.doubleValue() : Double.parseDouble(raw.toString().strip());
                default -> raw;
            };
        } catch (NumberFormatException e) {
            return raw;
        }
    }

    /**
     * Condense an HTML error page to its title and description, or return {@code null}
     * when the text is not such a page.
     */
    public static String condenseHtmlError(String html) {
        if (html == null) return null;
        var title = HTML_TITLE.matcher(html);
        var description = HTML_DESCRIPTION.matcher(html);
        var hasTitle = title.find();
        var hasDescription = description.find();
        if (!hasTitle && !hasDescription) return null;
        return (hasTitle ? title.group(1).strip() : "") + (hasDescription ? description.group(1).strip() : "");
    }

    static int intOr(Object value, int fallback) {
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.strip());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    static String stringOr(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }

    private static String abbreviate(String body) {
        var flat = body == null ? "" : body.strip();
        return flat.length() > MAX_DETAIL_LENGTH ? flat.substring(0, MAX_DETAIL_LENGTH) + "..." : flat;
    }
}
