package org.khoros.community.transport;

import org.khoros.community.KhorosError;
import org.khoros.community.KhorosError.KhorosException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Transport decorator that retries requests failing with a connection error or
 * a transient HTTP status (429, 502, 503, 504).
 *
 * <p>Uses exponential backoff with jitter. DELETE requests are sent exactly once.
 * When every attempt fails at the connection level a {@link KhorosError.ConnectionError}
 * listing each failed attempt is raised. When the last attempt still returns a
 * transient status, that response is returned with {@link ApiResponse#attempts()} set,
 * so the caller can report how many attempts were made.
 *
 * <pre>{@code
 * var transport = RetryableTransport.builder()
 *     .delegate(HttpTransport.create())
 *     .maxAttempts(3)
 *     .initialBackoff(Duration.ofMillis(200))
 *     .build();
 * }</pre>
 */
public final class RetryableTransport implements Transport {

    private static final System.Logger logger = System.getLogger(RetryableTransport.class.getName());

    /** HTTP statuses treated as transient failures. */
    public static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 502, 503, 504);

    private final Transport delegate;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    private RetryableTransport(Builder builder) {
        this.delegate = builder.delegate;
        this.maxAttempts = builder.maxAttempts;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public ApiResponse send(ApiRequest request) {
        if (!request.method().isRetryable()) {
            return delegate.send(request);
        }

        var failures = new ArrayList<KhorosError.FailedAttempt>();
        KhorosException lastConnectionFailure = null;
        ApiResponse lastResponse = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                var response = delegate.send(request);
                if (!TRANSIENT_STATUSES.contains(response.statusCode())) {
                    return attempt == 1 ? response : response.withAttempts(attempt);
                }
                lastResponse = response.withAttempts(attempt);
                lastConnectionFailure = null;
                failures.add(new KhorosError.FailedAttempt(attempt, "HTTP " + response.statusCode(),
                        abbreviate(response.body())));
            } catch (KhorosException e) {
                if (!e.isConnectionFailure()) {
                    throw e;
                }
                lastConnectionFailure = e;
                lastResponse = null;
                failures.add(new KhorosError.FailedAttempt(attempt, causeType(e), causeMessage(e)));
            }

            logger.log(System.Logger.Level.WARNING,
                    "{0} failed (attempt {1}/{2}): {3}",
                    request, attempt, maxAttempts, failures.get(failures.size() - 1));

            if (attempt < maxAttempts && !pause(attempt - 1)) {
                break;
            }
        }

        if (lastResponse != null) {
            return lastResponse;
        }
        var cause = lastConnectionFailure != null ? lastConnectionFailure.getCause() : null;
        throw new KhorosException(new KhorosError.ConnectionError(
                request.method(), request.url(), failures.size(), failures, cause));
    }

    /** Sleeps before the next attempt; returns {@code false} if interrupted. */
    private boolean pause(int retryIndex) {
        long backoffMs = calculateBackoff(retryIndex);
        if (backoffMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMs);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    long calculateBackoff(int retryIndex) {
        long baseMs = initialBackoff.toMillis() * (1L << Math.min(retryIndex, 30));
        long cappedMs = Math.min(baseMs, maxBackoff.toMillis());
        // Add jitter: 50-100% of the calculated backoff
        return cappedMs / 2 + ThreadLocalRandom.current().nextLong(cappedMs / 2 + 1);
    }

    private static String causeType(KhorosException e) {
        if (e.error() instanceof KhorosError.ConnectionError ce && !ce.failedAttempts().isEmpty()) {
            return ce.failedAttempts().get(0).errorType();
        }
        return e.getCause() != null ? e.getCause().getClass().getSimpleName() : "ConnectionError";
    }

    private static String causeMessage(KhorosException e) {
        if (e.error() instanceof KhorosError.ConnectionError ce && !ce.failedAttempts().isEmpty()) {
            return ce.failedAttempts().get(0).detail();
        }
        return e.getMessage();
    }

    private static String abbreviate(String body) {
        var flat = body.strip().replace('\n', ' ');
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }

    public static final class Builder {
        private Transport delegate;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(10);

        private Builder() {}

        /** The underlying transport to delegate to. */
        public Builder delegate(Transport delegate) {
            this.delegate = delegate;
            return this;
        }

        /** Total number of attempts including the first (default: 3). Set to 1 to disable retries. */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /** Initial backoff duration before the first retry (default: 200ms). Zero disables the delay. */
        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        /** Maximum backoff duration cap (default: 10s). */
        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public RetryableTransport build() {
            Objects.requireNonNull(delegate, "delegate transport must not be null");
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
            Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
            Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
            if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
                throw new IllegalArgumentException("backoff durations must not be negative");
            }
            return new RetryableTransport(this);
        }
    }
}
