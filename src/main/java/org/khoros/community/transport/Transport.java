package org.khoros.community.transport;

import java.util.Map;

/**
 * Transport interface for community API communication.
 *
 * <p>Abstracts the HTTP communication layer, enabling alternative implementations
 * for testing or decoration (see {@link RetryableTransport}).
 *
 * <p>A transport returns every HTTP response it receives, whatever the status code.
 * Only transport-level failures (connection refused, DNS failure, timeout) are
 * raised, as a {@code KhorosException} carrying a connection error.
 */
public interface Transport {

    /**
     * Perform one HTTP request.
     *
     * @param request the fully built request
     * @return the HTTP response
     */
    ApiResponse send(ApiRequest request);

    /** Perform an HTTP GET request against an absolute URL. */
    default ApiResponse get(String url, Map<String, String> headers) {
        return send(ApiRequest.get(url, headers));
    }

    /** Perform an HTTP POST request against an absolute URL. */
    default ApiResponse post(String url, RequestBody body, Map<String, String> headers) {
        return send(new ApiRequest(HttpMethod.POST, url, headers, body, true));
    }

    /** Perform an HTTP PUT request against an absolute URL. */
    default ApiResponse put(String url, RequestBody body, Map<String, String> headers) {
        return send(new ApiRequest(HttpMethod.PUT, url, headers, body, true));
    }

    /** Perform an HTTP DELETE request against an absolute URL. */
    default ApiResponse delete(String url, Map<String, String> headers) {
        return send(ApiRequest.delete(url, headers));
    }
}
