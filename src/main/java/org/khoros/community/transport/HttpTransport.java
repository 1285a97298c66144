package org.khoros.community.transport;

import org.khoros.community.KhorosError;
import org.khoros.community.KhorosError.KhorosException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * HTTP transport implementation using {@link java.net.http.HttpClient}.
 *
 * <p>Serializes the request body, applies the request headers and returns the
 * raw response. Multipart bodies get their {@code Content-Type} (with boundary)
 * from the body itself. Each call is a single attempt; see {@link RetryableTransport}.
 */
public final class HttpTransport implements Transport {

    private static final System.Logger logger = System.getLogger(HttpTransport.class.getName());

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    // Managed by HttpClient itself
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    private HttpTransport(Builder builder) {
        this.httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder()
                        .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
        this.requestTimeout = builder.requestTimeout != null
                ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HttpTransport create() {
        return builder().build();
    }

    @Override
    public ApiResponse send(ApiRequest request) {
        var requestBuilder = newRequest(request);
        try {
            request.headers().forEach((name, value) -> {
                if (value != null && !RESTRICTED_HEADERS.contains(name)) {
                    requestBuilder.header(name, value);
                }
            });

            var body = request.body();
            var contentType = request.header("content-type");
            if (contentType == null && body.impliedContentType() != null) {
                requestBuilder.header("content-type", body.impliedContentType());
            }
            requestBuilder.method(request.method().name(), publisherFor(body, requestBuilder));

            logger.log(System.Logger.Level.DEBUG, "Sending {0}", request);

            var response = httpClient.send(requestBuilder.build(),
                    HttpResponse.BodyHandlers.ofString());

            return new ApiResponse(response.statusCode(), response.headers().map(), response.body());

        } catch (IOException e) {
            throw connectionFailure(request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw connectionFailure(request, e);
        }
    }

    private HttpRequest.Builder newRequest(ApiRequest request) {
        try {
            return HttpRequest.newBuilder()
                    .uri(URI.create(request.url()))
                    .timeout(requestTimeout);
        } catch (IllegalArgumentException e) {
            throw new KhorosException(new KhorosError.ValidationError(
                    KhorosError.CODE_INVALID_URL, "Invalid request URL: " + request.url()), e);
        }
    }

    private static HttpRequest.BodyPublisher publisherFor(RequestBody body, HttpRequest.Builder requestBuilder) {
        if (body instanceof RequestBody.JsonPayload json) {
            try {
                return HttpRequest.BodyPublishers.ofString(json.encode());
            } catch (IllegalArgumentException e) {
                throw new KhorosException(new KhorosError.ValidationError(
                        KhorosError.CODE_INVALID_PAYLOAD_VALUE, e.getMessage()), e);
            }
        }
        if (body instanceof RequestBody.Text text) {
            return HttpRequest.BodyPublishers.ofString(text.text());
        }
        if (body instanceof RequestBody.UrlEncoded form) {
            return HttpRequest.BodyPublishers.ofString(form.encoded());
        }
        if (body instanceof RequestBody.Multipart multipart) {
            requestBuilder.setHeader("content-type", multipart.body().contentType());
            return HttpRequest.BodyPublishers.ofByteArray(multipart.body().toByteArray());
        }
        return HttpRequest.BodyPublishers.noBody();
    }

    private static KhorosException connectionFailure(ApiRequest request, Exception e) {
        var attempt = new KhorosError.FailedAttempt(1, e.getClass().getSimpleName(),
                e.getMessage() != null ? e.getMessage() : "no detail");
        return new KhorosException(new KhorosError.ConnectionError(
                request.method(), request.url(), 1, List.of(attempt), e));
    }

    public static final class Builder {
        private HttpClient httpClient;
        private Duration requestTimeout;

        private Builder() {}

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public HttpTransport build() {
            if (requestTimeout != null && (requestTimeout.isNegative() || requestTimeout.isZero())) {
                throw new IllegalArgumentException("requestTimeout must be positive");
            }
            return new HttpTransport(this);
        }
    }
}
