package org.khoros.community.transport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.khoros.community.KhorosError;
import org.khoros.community.KhorosError.KhorosException;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryableTransportTest {

    private static final String URL = "https://community.example.com/api/2.0/boards";

    @Mock
    Transport delegate;

    private RetryableTransport retrying(int maxAttempts) {
        return RetryableTransport.builder()
                .delegate(delegate)
                .maxAttempts(maxAttempts)
                .initialBackoff(Duration.ZERO)
                .build();
    }

    private static ApiRequest get() {
        return ApiRequest.get(URL, Map.of());
    }

    private static KhorosException connectionRefused() {
        var cause = new ConnectException("Connection refused");
        return new KhorosException(new KhorosError.ConnectionError(HttpMethod.GET, URL, 1,
                List.of(new KhorosError.FailedAttempt(1, "ConnectException", "Connection refused")), cause));
    }

    // -----------------------------------------------------------------------
    // Builder validation
    // -----------------------------------------------------------------------

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        void builderRequiresDelegate() {
            assertThrows(NullPointerException.class, () -> RetryableTransport.builder().build());
        }

        @Test
        void builderRejectsZeroAttempts() {
            assertThrows(IllegalArgumentException.class,
                    () -> RetryableTransport.builder().delegate(delegate).maxAttempts(0).build());
        }

        @Test
        void builderRejectsNegativeBackoff() {
            assertThrows(IllegalArgumentException.class,
                    () -> RetryableTransport.builder()
                            .delegate(delegate)
                            .initialBackoff(Duration.ofMillis(-1))
                            .build());
        }

        @Test
        void defaultsToThreeAttempts() {
            assertEquals(3, RetryableTransport.builder().delegate(delegate).build().maxAttempts());
        }
    }

    // -----------------------------------------------------------------------
    // Retry behavior
    // -----------------------------------------------------------------------

    @Nested
    @DisplayName("Retry behavior")
    class RetryTests {

        @Test
        void successOnFirstAttemptDoesNotRetry() {
            when(delegate.send(any())).thenReturn(ApiResponse.of(200, "{}"));

            var response = retrying(3).send(get());

            assertEquals(200, response.statusCode());
            assertEquals(1, response.attempts());
            verify(delegate, times(1)).send(any());
        }

        @Test
        void transientStatusIsRetriedUntilSuccess() {
            when(delegate.send(any()))
                    .thenReturn(ApiResponse.of(503, "unavailable"))
                    .thenReturn(ApiResponse.of(200, "{}"));

            var response = retrying(3).send(get());

            assertEquals(200, response.statusCode());
            assertEquals(2, response.attempts());
            verify(delegate, times(2)).send(any());
        }

        @Test
        void exhaustedTransientStatusReturnsLastResponseWithAttemptCount() {
            when(delegate.send(any())).thenReturn(ApiResponse.of(429, "slow down"));

            var response = retrying(3).send(get());

            assertEquals(429, response.statusCode());
            assertEquals(3, response.attempts());
            verify(delegate, times(3)).send(any());
        }

        @Test
        void nonTransientErrorStatusIsNotRetried() {
            when(delegate.send(any())).thenReturn(ApiResponse.of(404, "missing"));

            var response = retrying(3).send(get());

            assertEquals(404, response.statusCode());
            verify(delegate, times(1)).send(any());
        }

        @Test
        void connectionFailureIsRetriedThenRaisedWithAttemptCount() {
            when(delegate.send(any())).thenThrow(connectionRefused());

            var ex = assertThrows(KhorosException.class, () -> retrying(4).send(get()));

            assertTrue(ex.isConnectionFailure());
            assertEquals(KhorosError.CODE_API_CONNECTION, ex.code());
            assertEquals(4, ex.attempts());
            var error = (KhorosError.ConnectionError) ex.error();
            assertEquals(4, error.failedAttempts().size());
            assertEquals("ConnectException", error.failedAttempts().get(3).errorType());
            assertInstanceOf(ConnectException.class, ex.getCause());
            verify(delegate, times(4)).send(any());
        }

        @Test
        void connectionFailureThenSuccessReturnsResponse() {
            when(delegate.send(any()))
                    .thenThrow(connectionRefused())
                    .thenReturn(ApiResponse.of(201, "{}"));

            var response = retrying(3).send(get());

            assertEquals(201, response.statusCode());
            assertEquals(2, response.attempts());
        }

        @Test
        void nonConnectionErrorsAreNotRetried() {
            when(delegate.send(any())).thenThrow(
                    new KhorosException(new KhorosError.ValidationError(KhorosError.CODE_INVALID_URL, "bad")));

            var ex = assertThrows(KhorosException.class, () -> retrying(3).send(get()));

            assertEquals(KhorosError.CODE_INVALID_URL, ex.code());
            verify(delegate, times(1)).send(any());
        }

        @Test
        void deleteIsSentExactlyOnce() {
            when(delegate.send(any())).thenReturn(ApiResponse.of(503, ""));

            var response = retrying(3).send(ApiRequest.delete(URL + "/my-board", Map.of()));

            assertEquals(503, response.statusCode());
            verify(delegate, times(1)).send(any());
        }

        @Test
        void singleAttemptDisablesRetries() {
            when(delegate.send(any())).thenThrow(connectionRefused());

            var ex = assertThrows(KhorosException.class, () -> retrying(1).send(get()));

            assertEquals(1, ex.attempts());
            verify(delegate, times(1)).send(any());
        }
    }

    // -----------------------------------------------------------------------
    // Backoff
    // -----------------------------------------------------------------------

    @Nested
    @DisplayName("Backoff")
    class BackoffTests {

        @Test
        void backoffGrowsExponentiallyWithJitter() {
            var transport = RetryableTransport.builder()
                    .delegate(delegate)
                    .initialBackoff(Duration.ofMillis(200))
                    .maxBackoff(Duration.ofSeconds(10))
                    .build();

            for (int i = 0; i < 20; i++) {
                var first = transport.calculateBackoff(0);
                assertTrue(first >= 100 && first <= 200, "first backoff was " + first);
                var third = transport.calculateBackoff(2);
                assertTrue(third >= 400 && third <= 800, "third backoff was " + third);
            }
        }

        @Test
        void backoffIsCappedAtMaximum() {
            var transport = RetryableTransport.builder()
                    .delegate(delegate)
                    .initialBackoff(Duration.ofMillis(200))
                    .maxBackoff(Duration.ofSeconds(1))
                    .build();

            var backoff = transport.calculateBackoff(12);
            assertTrue(backoff >= 500 && backoff <= 1000, "backoff was " + backoff);
        }

        @Test
        void zeroInitialBackoffMeansNoDelay() {
            var transport = RetryableTransport.builder()
                    .delegate(delegate)
                    .initialBackoff(Duration.ZERO)
                    .build();

            assertEquals(0, transport.calculateBackoff(3));
        }
    }
}
