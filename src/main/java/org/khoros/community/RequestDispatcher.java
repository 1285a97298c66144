package org.khoros.community;

import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.transport.ApiRequest;
import org.khoros.community.transport.ApiResponse;
import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.RequestBody;
import org.khoros.community.transport.Transport;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds, sends and checks API requests.
 *
 * <p>Every request is resolved against the current {@link Session}: relative paths go
 * to the v2 base, headers come from {@link HeaderBuilder}, and v1 URLs ask for JSON
 * when the session prefers it. Retrying is the job of the {@link Transport}
 * (see {@link org.khoros.community.transport.RetryableTransport}).
 *
 * <p>Failures raise by default: a non-2xx response becomes a verb-specific
 * {@link KhorosError.RequestError}. Passing {@code raiseOnError = false}, or any
 * selected {@link ReturnFields}, returns the response for inspection instead.
 */
public final class RequestDispatcher {

    private static final System.Logger logger = System.getLogger(RequestDispatcher.class.getName());

    static final String V1_MARKER = "restapi/vc";
    static final String V1_FORMAT_PARAM = "restapi.response_format";

    private final Supplier<Session> sessionSource;
    private final Transport transport;
    private final ErrorTranslations translations;

    public RequestDispatcher(Supplier<Session> sessionSource, Transport transport, ErrorTranslations translations) {
        this.sessionSource = Objects.requireNonNull(sessionSource, "sessionSource must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.translations = translations != null ? translations : ErrorTranslations.defaults();
    }

    /** A dispatcher bound to one fixed session. */
    public static RequestDispatcher of(Session session, Transport transport) {
        Objects.requireNonNull(session, "session must not be null");
        return new RequestDispatcher(() -> session, transport, ErrorTranslations.defaults());
    }

    public Session session() {
        var session = sessionSource.get();
        if (session == null) {
            throw KhorosError.missingData("No session is configured; the base URL must be set before dispatching");
        }
        return session;
    }

    public Transport transport() {
        return transport;
    }

    public ErrorTranslations translations() {
        return translations;
    }

    /** A normalizer honouring the current session's translation setting. */
    public ResponseNormalizer normalizer() {
        return ResponseNormalizer.forSession(session(), translations);
    }

    // --- Raw requests ---

    public ApiResponse get(String uri) {
        return get(uri, null, true);
    }

    public ApiResponse get(String uri, Map<String, String> headers, boolean raiseOnError) {
        return execute(request(HttpMethod.GET, uri, RequestBody.empty(), headers), raiseOnError);
    }

    public ApiResponse post(String uri, RequestBody body) {
        return post(uri, body, null, true);
    }

    public ApiResponse post(String uri, RequestBody body, Map<String, String> headers, boolean raiseOnError) {
        return execute(request(HttpMethod.POST, uri, body, headers), raiseOnError);
    }

    public ApiResponse put(String uri, RequestBody body) {
        return put(uri, body, null, true);
    }

    public ApiResponse put(String uri, RequestBody body, Map<String, String> headers, boolean raiseOnError) {
        return execute(request(HttpMethod.PUT, uri, body, headers), raiseOnError);
    }

    /** Single attempt; deletions are never retried. */
    public ApiResponse delete(String uri) {
        return delete(uri, null, true);
    }

    public ApiResponse delete(String uri, Map<String, String> headers, boolean raiseOnError) {
        return execute(request(HttpMethod.DELETE, uri, RequestBody.empty(), headers), raiseOnError);
    }

    /**
     * Send a request.
     *
     * <p>When a JSON response was requested, the body is decoded eagerly; a body that
     * is not JSON is logged as a warning and the response is still returned.
     *
     * @throws KhorosException with a {@link KhorosError.RequestError} for a non-2xx
     *                         response when {@code raiseOnError} is set, or with a
     *                         {@link KhorosError.ConnectionError} from the transport
     */
    public ApiResponse execute(ApiRequest request, boolean raiseOnError) {
        logger.log(System.Logger.Level.DEBUG, "Dispatching {0}", request);
        var response = transport.send(request);

        if (!response.isSuccessful()) {
            if (raiseOnError) {
                throw new KhorosException(new KhorosError.RequestError(request.method(),
                        response.statusCode(), normalizer().errorDetail(response), response.attempts()));
            }
            return response;
        }

        if (request.expectJson() && !response.looksLikeXml() && !response.body().isBlank()) {
            try {
                response.json();
            } catch (KhorosException e) {
                logger.log(System.Logger.Level.WARNING,
                        "{0} returned a body that could not be converted to JSON: {1}", request, e.getMessage());
            }
        }
        return response;
    }

    // --- Normalized requests ---

    /**
     * Send a request and deliver the normalized outcome.
     *
     * <p>With {@link ReturnFields#none()} a non-2xx response raises and the result is
     * a success flag. With any field selected, errors are delivered, not raised.
     */
    public Delivery send(HttpMethod method, String uri, RequestBody body, ReturnFields fields) {
        return send(method, uri, body, null, fields);
    }

    public Delivery send(HttpMethod method, String uri, RequestBody body,
                         Map<String, String> headers, ReturnFields fields) {
        var response = execute(request(method, uri, body, headers), !fields.isStructured());
        if (fields.fullResponse()) {
            return new Delivery.Full(response);
        }
        var normalizer = normalizer();
        return normalizer.deliver(normalizer.normalize(method, response), fields);
    }

    /** Send a request and normalize the response without raising for HTTP errors. */
    public NormalizedResult sendForResult(HttpMethod method, String uri, RequestBody body) {
        var response = execute(request(method, uri, body, null), false);
        return normalizer().normalize(method, response);
    }

    // --- Community API v1 ---

    public ApiResponse makeV1Request(String endpoint, Map<String, ?> params, HttpMethod method) {
        return makeV1Request(endpoint, params, method, false, true);
    }

    /**
     * Perform a Community API v1 request. Parameters travel in the URI for GET (and when
     * {@code paramsInUri} is set), otherwise as a form-encoded body.
     *
     * @param endpoint the endpoint relative to the v1 base, e.g. {@code categories/add}
     * @throws KhorosException with code {@code unsupported} for DELETE
     */
    public ApiResponse makeV1Request(String endpoint, Map<String, ?> params, HttpMethod method,
                                     boolean paramsInUri, boolean raiseOnError) {
        Objects.requireNonNull(method, "method must not be null");
        if (method == HttpMethod.DELETE) {
            throw KhorosError.validation(KhorosError.CODE_UNSUPPORTED,
                    "DELETE requests are not supported by the Community API v1");
        }
        var url = v1Url(endpoint);
        var body = RequestBody.empty();
        if (params != null && !params.isEmpty()) {
            if (method == HttpMethod.GET || paramsInUri) {
                url = appendQuery(url, RequestBody.encodeForm(params));
            } else {
                body = RequestBody.form(params);
            }
        }
        return execute(request(method, url, body, null), raiseOnError);
    }

    /** Normalize the result of a v1 request. */
    public NormalizedResult v1Result(String endpoint, Map<String, ?> params, HttpMethod method) {
        var response = makeV1Request(endpoint, params, method, false, false);
        return normalizer().normalizeV1(method, response);
    }

    // --- URL and request construction ---

    /**
     * Build a request for the current session.
     *
     * @param uri     absolute URL, or a path relative to the v2 base
     * @param headers extra headers, may be {@code null}
     */
    public ApiRequest request(HttpMethod method, String uri, RequestBody body, Map<String, String> headers) {
        var session = session();
        if (body == null) body = RequestBody.empty();

        var extra = new LinkedHashMap<String, String>();
        if (body.impliedContentType() != null) {
            extra.put(HeaderBuilder.CONTENT_TYPE_HEADER, body.impliedContentType());
        }
        if (headers != null) {
            extra.putAll(HeaderBuilder.normalize(headers));
        }
        var multipart = body instanceof RequestBody.Multipart;
        var finalHeaders = HeaderBuilder.build(session, extra, multipart);

        var url = withJsonQuery(resolve(uri), session.preferJson());
        var expectJson = !url.contains(V1_MARKER) || session.preferJson();
        return new ApiRequest(method, url, finalHeaders, body, expectJson);
    }

    /** Resolve a path against the v2 base; absolute URLs are returned as given. */
    public String resolve(String uri) {
        Objects.requireNonNull(uri, "uri must not be null");
        if (isAbsolute(uri)) {
            return uri;
        }
        return session().v2Base() + "/" + stripLeadingSlash(uri);
    }

    /** Absolute URL of a v1 endpoint. */
    public String v1Url(String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        if (isAbsolute(endpoint)) {
            return endpoint;
        }
        return session().v1Base() + "/" + stripLeadingSlash(endpoint);
    }

    /**
     * Add {@code restapi.response_format=json} to a v1 URL that does not already choose
     * a format. Other URLs are returned unchanged.
     */
    public static String withJsonQuery(String url, boolean json) {
        if (!json || !url.contains(V1_MARKER) || url.contains(V1_FORMAT_PARAM)) {
            return url;
        }
        return appendQuery(url, V1_FORMAT_PARAM + "=json");
    }

    static String appendQuery(String url, String query) {
        if (query == null || query.isEmpty()) return url;
        var separator = url.contains("?") ? (url.endsWith("?") || url.endsWith("&") ? "" : "&") : "?";
        return url + separator + query;
    }

    private static boolean isAbsolute(String uri) {
        return uri.startsWith("http://") || uri.startsWith("https://");
    }

    private static String stripLeadingSlash(String path) {
        var result = path;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        return result;
    }
}
