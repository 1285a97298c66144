package org.khoros.community.transport;

import org.khoros.community.KhorosError;
import org.khoros.community.KhorosError.KhorosException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A transport-level HTTP response: status code, headers and raw body text.
 *
 * <p>{@link #json()} decodes the body on demand. Callers that asked for a JSON
 * response receive it even when the body is not valid JSON, so that it can be
 * inspected manually.
 */
public final class ApiResponse {

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final int attempts;
    private volatile Object decoded;

    public ApiResponse(int statusCode, Map<String, List<String>> headers, String body) {
        this(statusCode, headers, body, 1);
    }

    private ApiResponse(int statusCode, Map<String, List<String>> headers, String body, int attempts) {
        this.statusCode = statusCode;
        this.attempts = attempts;
        var sorted = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) sorted.putAll(headers);
        this.headers = sorted;
        this.body = body != null ? body : "";
    }

    public static ApiResponse of(int statusCode, String body) {
        return new ApiResponse(statusCode, Map.of(), body);
    }

    public int statusCode() {
        return statusCode;
    }

    /** How many attempts the transport made before settling on this response. */
    public int attempts() {
        return attempts;
    }

    ApiResponse withAttempts(int attempts) {
        return new ApiResponse(statusCode, headers, body, attempts);
    }

    public String body() {
        return body;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /** First value of the named header (case-insensitive). */
    public Optional<String> header(String name) {
        var values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /** Whether the status code is 2xx. */
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** Whether the body looks like XML rather than JSON. */
    public boolean looksLikeXml() {
        var contentType = header("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        return contentType.contains("xml") || body.stripLeading().startsWith("<");
    }

    /**
     * The decoded JSON body.
     *
     * @throws KhorosException with code {@code response_decode_error} if the body is not JSON
     */
    public Object json() {
        var result = decoded;
        if (result == null) {
            try {
                result = Json.decode(body);
            } catch (IllegalArgumentException e) {
                throw new KhorosException(new KhorosError.ResponseError(
                        KhorosError.CODE_RESPONSE_DECODE,
                        "Failed to convert the response to JSON: " + e.getMessage()), e);
            }
            decoded = result;
        }
        return result;
    }

    /** The decoded JSON body as an object, or empty when it is not a JSON object. */
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> jsonObject() {
        try {
            var value = json();
            return value instanceof Map<?, ?> m ? Optional.of((Map<String, Object>) m) : Optional.empty();
        } catch (KhorosException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "ApiResponse[" + statusCode + ", " + body.length() + " chars]";
    }
}
