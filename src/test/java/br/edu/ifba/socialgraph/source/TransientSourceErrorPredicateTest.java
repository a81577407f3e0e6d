package br.edu.ifba.socialgraph.source;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonParseException;

import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.ratelimit.RateLimitExceededException;
import jakarta.ws.rs.ProcessingException;

/**
 * Unit tests for {@link TransientSourceErrorPredicate}.
 *
 * Tests cover:
 * - HTTP failures classified by status
 * - I/O failures anywhere in the cause chain
 * - failures that must never be retried
 */
class TransientSourceErrorPredicateTest {

    private TransientSourceErrorPredicate predicate;

    @BeforeEach
    void setUp() {
        predicate = new TransientSourceErrorPredicate();
    }

    @Nested
    @DisplayName("HTTP failures")
    class HttpFailures {

        @Test
        @DisplayName("should retry transient statuses")
        void testTransientStatus() {
            assertTrue(predicate.test(new SourceHttpException(503, "HTTP 503", true)));
            assertTrue(predicate.test(new SourceHttpException(429, "HTTP 429", true)));
        }

        @Test
        @DisplayName("should not retry permanent statuses")
        void testPermanentStatus() {
            assertFalse(predicate.test(new SourceHttpException(404, "HTTP 404", false)));
            assertFalse(predicate.test(new SourceHttpException(401, "HTTP 401", false)));
        }

        @Test
        @DisplayName("should find an HTTP failure wrapped by the client")
        void testWrappedHttpFailure() {
            assertTrue(predicate.test(new ProcessingException(new SourceHttpException(502, "HTTP 502", true))));
        }
    }

    @Nested
    @DisplayName("I/O failures")
    class IoFailures {

        @Test
        @DisplayName("should retry connection and timeout errors")
        void testIoErrors() {
            assertTrue(predicate.test(new ConnectException("Connection refused")));
            assertTrue(predicate.test(new SocketTimeoutException("Read timed out")));
        }

        @Test
        @DisplayName("should retry I/O errors nested in a processing exception")
        void testNestedIoError() {
            assertTrue(predicate.test(new ProcessingException("failed", new IOException("reset"))));
        }

        @Test
        @DisplayName("should not retry malformed payloads")
        void testMalformedPayload() {
            assertFalse(predicate.test(new ProcessingException(new JsonParseException(null, "bad json"))));
        }
    }

    @Nested
    @DisplayName("Never retried")
    class NeverRetried {

        @Test
        @DisplayName("should not retry rate limiter exhaustion")
        void testRateLimit() {
            assertFalse(predicate.test(new RateLimitExceededException(SourceType.GITHUB, Duration.ofSeconds(1))));
        }

        @Test
        @DisplayName("should not retry unrelated failures")
        void testOther() {
            assertFalse(predicate.test(new IllegalStateException("boom")));
            assertFalse(predicate.test(null));
        }
    }
}
