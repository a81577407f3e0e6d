package br.edu.ifba.socialgraph.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.net.SocketTimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import br.edu.ifba.socialgraph.source.SourceHttpException;

/**
 * Unit tests for {@link RetryEventLogger}.
 *
 * <p>Log output itself is not captured; the tests check that the MDC keys never leak
 * past a call and that odd input is tolerated.</p>
 */
class RetryEventLoggerTest {

    private RetryEventLogger logger;

    @BeforeEach
    void setUp() {
        logger = new RetryEventLogger();
        MDC.clear();
    }

    private static void assertMdcCleared() {
        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_OPERATION));
        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_ATTEMPT));
        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_EXCEPTION));
    }

    @Nested
    @DisplayName("Retry events")
    class RetryEvents {

        @Test
        @DisplayName("logRetryAttempt clears its MDC context")
        void testAttempt() {
            logger.logRetryAttempt("github.getUser", 2, 4);

            assertMdcCleared();
        }

        @Test
        @DisplayName("logRetryExhausted clears its MDC context")
        void testExhausted() {
            logger.logRetryExhausted("reddit.getTopPosts", 4, new SourceHttpException(503, "HTTP 503", true));
            logger.logRetryExhausted("wikipedia.getPage", 4, new SocketTimeoutException("Read timed out"));

            assertMdcCleared();
        }

        @Test
        @DisplayName("logRetryExhausted tolerates a missing failure")
        void testExhaustedWithoutFailure() {
            logger.logRetryExhausted("github.getFollowers", 4, null);

            assertMdcCleared();
        }

        @Test
        @DisplayName("logRetrySuccess is quiet for first-attempt success")
        void testSuccess() {
            logger.logRetrySuccess("github.getUser", 1);
            logger.logRetrySuccess("github.getUser", 3);

            assertMdcCleared();
        }

        @Test
        @DisplayName("keys set by the caller are left alone")
        void testForeignMdcKeysSurvive() {
            MDC.put("crawl.job", "job-1");

            logger.logRetryAttempt("github.getUser", 2, 4);

            assertEquals("job-1", MDC.get("crawl.job"));
            MDC.remove("crawl.job");
        }
    }

    @Nested
    @DisplayName("Message truncation")
    class Truncation {

        @Test
        void testShortMessageUnchanged() {
            assertEquals("HTTP 503", RetryEventLogger.truncate("HTTP 503"));
            assertEquals("null", RetryEventLogger.truncate(null));
        }

        @Test
        void testLongMessageCut() {
            String truncated = RetryEventLogger.truncate("x".repeat(500));

            assertEquals(203, truncated.length());
            assertEquals("...", truncated.substring(200));
        }
    }
}
