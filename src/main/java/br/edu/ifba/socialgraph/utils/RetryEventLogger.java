package br.edu.ifba.socialgraph.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Structured logging of retried source calls.
 *
 * <p>MDC keys while a line is written:</p>
 * <ul>
 *   <li><code>retry.operation</code> the call, e.g. {@code github.getUser}</li>
 *   <li><code>retry.attempt</code> attempt number, 1-based</li>
 *   <li><code>retry.exception</code> simple class name of the failure</li>
 * </ul>
 */
@ApplicationScoped
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    static final String MDC_RETRY_OPERATION = "retry.operation";
    static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    static final String MDC_RETRY_EXCEPTION = "retry.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts) {
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
            logger.info("Retry attempt {}/{} for {}", attempt, maxAttempts, operation);
        } finally {
            clearMDC();
        }
    }

    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);
            logger.warn("Retry exhausted for {} after {} attempts: {} - {}",
                operation, totalAttempts, exceptionName, truncate(failure != null ? failure.getMessage() : null));
        } finally {
            clearMDC();
        }
    }

    public void logRetrySuccess(final String operation, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            logger.info("Retry succeeded for {} on attempt {}", operation, totalAttempts);
        } finally {
            clearMDC();
        }
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    static String truncate(final String message) {
        if (message == null) {
            return "null";
        }
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
