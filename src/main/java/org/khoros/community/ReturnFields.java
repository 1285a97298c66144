package org.khoros.community;

import java.util.ArrayList;
import java.util.List;

/**
 * Which values an operation hands back instead of a plain success flag.
 *
 * <p>With nothing selected the operation returns whether it succeeded and raises on
 * HTTP errors. Selecting any field (or {@code fullResponse}) switches to the
 * structured path: errors are reported in the returned values, not thrown.
 *
 * <pre>{@code
 * var fields = ReturnFields.builder().returnId().returnErrorMessages().build();
 * }</pre>
 */
public record ReturnFields(
        boolean fullResponse,
        boolean returnId,
        boolean returnUrl,
        boolean returnApiUrl,
        boolean returnHttpCode,
        boolean returnStatus,
        boolean returnErrorMessages,
        boolean splitErrors
) {

    /** A projectable field, in delivery order. */
    public enum Field {
        ID, URL, API_URL, HTTP_CODE, STATUS, ERROR_MESSAGE
    }

    private static final ReturnFields NONE = new ReturnFields(false, false, false, false, false, false, false, false);

    /** Nothing selected: plain success flag, errors raised. */
    public static ReturnFields none() {
        return NONE;
    }

    /** The raw response, unprocessed. */
    public static ReturnFields full() {
        return builder().fullResponse().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The selected fields in delivery order: id, url, api_url, http_code, status, error_message. */
    public List<Field> selected() {
        var fields = new ArrayList<Field>(6);
        if (returnId) fields.add(Field.ID);
        if (returnUrl) fields.add(Field.URL);
        if (returnApiUrl) fields.add(Field.API_URL);
        if (returnHttpCode) fields.add(Field.HTTP_CODE);
        if (returnStatus) fields.add(Field.STATUS);
        if (returnErrorMessages) fields.add(Field.ERROR_MESSAGE);
        return fields;
    }

    /** Whether the caller asked for structured results rather than exceptions. */
    public boolean isStructured() {
        return fullResponse || !selected().isEmpty();
    }

    public static final class Builder {
        private boolean fullResponse;
        private boolean returnId;
        private boolean returnUrl;
        private boolean returnApiUrl;
        private boolean returnHttpCode;
        private boolean returnStatus;
        private boolean returnErrorMessages;
        private boolean splitErrors;

        private Builder() {}

        public Builder fullResponse() {
            this.fullResponse = true;
            return this;
        }

        public Builder returnId() {
            this.returnId = true;
            return this;
        }

        public Builder returnUrl() {
            this.returnUrl = true;
            return this;
        }

        public Builder returnApiUrl() {
            this.returnApiUrl = true;
            return this;
        }

        public Builder returnHttpCode() {
            this.returnHttpCode = true;
            return this;
        }

        public Builder returnStatus() {
            this.returnStatus = true;
            return this;
        }

        public Builder returnErrorMessages() {
            this.returnErrorMessages = true;
            return this;
        }

        /** Keep message and developer message apart instead of joining them. */
        public Builder splitErrors() {
            this.splitErrors = true;
            return this;
        }

        public ReturnFields build() {
            return new ReturnFields(fullResponse, returnId, returnUrl, returnApiUrl,
                    returnHttpCode, returnStatus, returnErrorMessages, splitErrors);
        }
    }
}
