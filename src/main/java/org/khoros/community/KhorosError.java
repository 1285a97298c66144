package org.khoros.community;

import org.khoros.community.transport.HttpMethod;

import java.util.List;

/**
 * Structured error types for the Khoros SDK.
 *
 * <p>Uses a sealed interface hierarchy so that the exception path
 * ({@link KhorosException}) and the structured-result path
 * ({@link NormalizedResult#error()}) are built from the same taxonomy.
 */
public sealed interface KhorosError {

    String code();
    String message();

    // Error code constants
    String CODE_API_CONNECTION = "api_connection_error";
    String CODE_GET_REQUEST = "get_request_error";
    String CODE_POST_REQUEST = "post_request_error";
    String CODE_PUT_REQUEST = "put_request_error";
    String CODE_DELETE_REQUEST = "delete_request_error";
    String CODE_RESPONSE_DECODE = "response_decode_error";
    String CODE_LIQL_PARSE = "liql_parse_error";
    String CODE_MISSING_AUTH_DATA = "missing_auth_data";
    String CODE_SESSION_AUTH = "session_auth_error";
    String CODE_SSO_AUTH = "sso_auth_error";
    String CODE_MISSING_REQUIRED_DATA = "missing_required_data";
    String CODE_INVALID_URL = "invalid_url";
    String CODE_INVALID_NODE_TYPE = "invalid_node_type";
    String CODE_NODE_TYPE_NOT_FOUND = "node_type_not_found";
    String CODE_NODE_ID_NOT_FOUND = "node_id_not_found";
    String CODE_INVALID_STRUCTURE_TYPE = "invalid_structure_type";
    String CODE_INVALID_FIELD = "invalid_field";
    String CODE_INVALID_OPERATOR = "invalid_operator";
    String CODE_OPERATOR_MISMATCH = "operator_mismatch";
    String CODE_INVALID_PAYLOAD_VALUE = "invalid_payload_value";
    String CODE_DATA_MISMATCH = "data_mismatch";
    String CODE_INVALID_HELPER_FILE = "invalid_helper_file";
    String CODE_UNSUPPORTED = "unsupported";

    /** A single failed attempt recorded by the retrying transport. */
    record FailedAttempt(int attempt, String errorType, String detail) {
        @Override
        public String toString() {
            return "attempt " + attempt + ": " + errorType + ": " + detail;
        }
    }

    /** The request could not be completed because of connection failures or timeouts. */
    record ConnectionError(
            HttpMethod method,
            String url,
            int attempts,
            List<FailedAttempt> failedAttempts,
            Throwable cause
    ) implements ConnectionFailure {
        public ConnectionError {
            failedAttempts = failedAttempts != null ? List.copyOf(failedAttempts) : List.of();
        }

        @Override
        public String code() {
            return CODE_API_CONNECTION;
        }

        @Override
        public String message() {
            var sb = new StringBuilder("The ").append(method).append(" request to ").append(url)
                    .append(" could not be completed after ").append(attempts)
                    .append(attempts == 1 ? " attempt" : " attempts")
                    .append(" due to connection aborts and/or timeouts");
            if (!failedAttempts.isEmpty()) {
                sb.append(" (last error: ").append(failedAttempts.get(failedAttempts.size() - 1)).append(")");
            }
            return sb.toString();
        }

        @Override
        public String toString() {
            return "khoros: connection: " + message();
        }
    }

    /** Marker for connection-class failures. */
    sealed interface ConnectionFailure extends KhorosError permits ConnectionError {
        int attempts();
    }

    /** A non-successful HTTP response for a specific request verb. */
    record RequestError(HttpMethod method, int statusCode, String detail, int attempts) implements KhorosError {
        @Override
        public String code() {
            return switch (method) {
                case GET -> CODE_GET_REQUEST;
                case POST -> CODE_POST_REQUEST;
                case PUT -> CODE_PUT_REQUEST;
                case DELETE -> CODE_DELETE_REQUEST;
            };
        }

        @Override
        public String message() {
            if (statusCode <= 0 && (detail == null || detail.isEmpty())) {
                return "The " + method + " request did not return a successful response.";
            }
            var sb = new StringBuilder("The ").append(method).append(" request ");
            if (statusCode > 0) {
                sb.append("returned the ").append(statusCode).append(" status code");
            } else {
                sb.append("failed");
            }
            if (detail != null && !detail.isEmpty()) {
                sb.append(" with the following message: ").append(detail);
            } else {
                sb.append('.');
            }
            if (attempts > 1) {
                sb.append(" (").append(attempts).append(" attempts)");
            }
            return sb.toString();
        }

        @Override
        public String toString() {
            return "khoros: " + code() + ": " + message();
        }
    }

    /** The response could not be interpreted. */
    record ResponseError(String code, String message) implements KhorosError {
        @Override
        public String toString() {
            return "khoros: response: " + message;
        }
    }

    /** Authentication data is missing or authentication failed. */
    record AuthError(String code, String message) implements KhorosError {
        @Override
        public String toString() {
            return "khoros: auth: " + message;
        }
    }

    /** Client-side validation error. */
    record ValidationError(String code, String message) implements KhorosError {
        @Override
        public String toString() {
            return "khoros: validation: " + message;
        }
    }

    /** Khoros exception wrapping a {@link KhorosError}. */
    final class KhorosException extends RuntimeException {
        private final KhorosError error;

        public KhorosException(KhorosError error) {
            super(error.toString());
            this.error = error;
            if (error instanceof ConnectionError ce && ce.cause() != null) {
                initCause(ce.cause());
            }
        }

        public KhorosException(KhorosError error, Throwable cause) {
            super(error.toString(), cause);
            this.error = error;
        }

        public KhorosError error() {
            return error;
        }

        public String code() {
            return error.code();
        }

        public boolean isConnectionFailure() {
            return error instanceof ConnectionFailure;
        }

        public boolean isRequestError() {
            return error instanceof RequestError;
        }

        /** The HTTP status code carried by the error, or {@code -1} if there is none. */
        public int statusCode() {
            return error instanceof RequestError re ? re.statusCode() : -1;
        }

        /** The number of attempts made before giving up, or {@code 0} if not applicable. */
        public int attempts() {
            if (error instanceof ConnectionFailure cf) return cf.attempts();
            if (error instanceof RequestError re) return re.attempts();
            return 0;
        }
    }

    static KhorosException validation(String code, String message) {
        return new KhorosException(new ValidationError(code, message));
    }

    static KhorosException missingData(String message) {
        return validation(CODE_MISSING_REQUIRED_DATA, message);
    }
}
