package org.khoros.community.transport;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The payload of an {@link ApiRequest}.
 */
public sealed interface RequestBody {

    /** The content type implied by the body, or {@code null} when the headers decide. */
    String impliedContentType();

    static RequestBody empty() {
        return Empty.INSTANCE;
    }

    static RequestBody json(Object payload) {
        return new JsonPayload(payload);
    }

    static RequestBody text(String text) {
        return new Text(text);
    }

    static RequestBody form(Map<String, ?> fields) {
        return new UrlEncoded(encodeForm(fields));
    }

    static RequestBody multipart(MultipartBody body) {
        return new Multipart(body);
    }

    /** URL-encodes a map into {@code key=value&key=value} form. */
    static String encodeForm(Map<String, ?> fields) {
        return fields.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    /** No body; some endpoints are invoked with headers only. */
    final class Empty implements RequestBody {
        private static final Empty INSTANCE = new Empty();

        private Empty() {}

        @Override
        public String impliedContentType() {
            return null;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    /** A JSON-serializable payload (maps, lists, strings, numbers, booleans). */
    record JsonPayload(Object payload) implements RequestBody {
        public JsonPayload {
            Objects.requireNonNull(payload, "payload must not be null");
            if (payload instanceof Map<?, ?> m) payload = new LinkedHashMap<>(m);
        }

        @Override
        public String impliedContentType() {
            return "application/json";
        }

        public String encode() {
            return Json.encode(payload);
        }
    }

    /** A plaintext payload. */
    record Text(String text) implements RequestBody {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String impliedContentType() {
            return "text/plain";
        }
    }

    /** An already URL-encoded form payload. */
    record UrlEncoded(String encoded) implements RequestBody {
        public UrlEncoded {
            Objects.requireNonNull(encoded, "encoded must not be null");
        }

        @Override
        public String impliedContentType() {
            return "application/x-www-form-urlencoded";
        }
    }

    /** A multipart/form-data payload; the boundary is owned by the body itself. */
    record Multipart(MultipartBody body) implements RequestBody {
        public Multipart {
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public String impliedContentType() {
            return null;
        }
    }
}
