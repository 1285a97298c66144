package org.khoros.community.transport;

/** HTTP verbs used against the community APIs. */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE;

    /** Whether a failed call with this verb may be re-attempted automatically. */
    public boolean isRetryable() {
        return this != DELETE;
    }
}
