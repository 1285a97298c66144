package org.khoros.community;

import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.transport.ApiResponse;
import org.khoros.community.transport.HttpMethod;

import java.util.Optional;

/**
 * A v1 or v2 response reduced to one contract: status, HTTP code, error text and the
 * commonly requested values.
 *
 * @param method           the verb of the request, used when building errors
 * @param response         the transport response this result was read from
 * @param status           {@code "success"} or {@code "error"}
 * @param httpCode         the HTTP code reported by the body, else the response status
 * @param message          the platform error message (translated), {@code null} on success
 * @param developerMessage the developer message (translated), {@code null} on success
 * @param data             the {@code data} tree of a v2 response, or the {@code response} tree of a v1 response
 * @param id               {@code data.id}
 * @param url              {@code data.view_href}
 * @param apiUrl           {@code data.href}
 * @param value            the typed {@code value} of a v1 response
 */
public record NormalizedResult(
        HttpMethod method,
        ApiResponse response,
        String status,
        int httpCode,
        String message,
        String developerMessage,
        Object data,
        String id,
        String url,
        String apiUrl,
        Object value
) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    /** The error text, or {@code null} on success. */
    public ErrorMessage errorMessage(boolean splitErrors) {
        if (isSuccess()) return null;
        return ErrorMessage.of(message, developerMessage, splitErrors);
    }

    /** The value of one projectable field. */
    public Object field(ReturnFields.Field field, boolean splitErrors) {
        return switch (field) {
            case ID -> id;
            case URL -> url;
            case API_URL -> apiUrl;
            case HTTP_CODE -> httpCode;
            case STATUS -> status;
            case ERROR_MESSAGE -> {
                var error = errorMessage(splitErrors);
                yield error instanceof ErrorMessage.Combined combined ? combined.text() : error;
            }
        };
    }

    /** The failure as a {@link KhorosError}, empty on success. */
    public Optional<KhorosError> error() {
        if (isSuccess()) return Optional.empty();
        var attempts = response != null ? response.attempts() : 1;
        var verb = method != null ? method : HttpMethod.GET;
        return Optional.of(new KhorosError.RequestError(verb, httpCode, errorMessage(false).text(), attempts));
    }

    /**
     * Return this result when it succeeded.
     *
     * @throws KhorosException carrying {@link #error()} otherwise
     */
    public NormalizedResult orThrow() {
        var error = error();
        if (error.isPresent()) {
            throw new KhorosException(error.get());
        }
        return this;
    }
}
