package org.khoros.community.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one HTTP call: verb, absolute target URL, normalized headers and body.
 *
 * <p>Header keys are stored lower-case. A multipart body never carries a
 * {@code content-type} header; the transport generates the boundary itself.
 */
public record ApiRequest(
        HttpMethod method,
        String url,
        Map<String, String> headers,
        RequestBody body,
        boolean expectJson
) {

    public ApiRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        if (body == null) body = RequestBody.empty();
        var normalized = new LinkedHashMap<String, String>();
        if (headers != null) {
            headers.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        }
        if (body instanceof RequestBody.Multipart) {
            normalized.remove("content-type");
        }
        headers = Collections.unmodifiableMap(normalized);
    }

    public static ApiRequest get(String url, Map<String, String> headers) {
        return new ApiRequest(HttpMethod.GET, url, headers, RequestBody.empty(), true);
    }

    public static ApiRequest delete(String url, Map<String, String> headers) {
        return new ApiRequest(HttpMethod.DELETE, url, headers, RequestBody.empty(), false);
    }

    public ApiRequest withExpectJson(boolean expectJson) {
        return new ApiRequest(method, url, headers, body, expectJson);
    }

    /** Returns a header value by case-insensitive name, or {@code null}. */
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        // header values may carry credentials
        return method + " " + url;
    }
}
