package br.edu.ifba.socialgraph.source;

import java.io.IOException;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Decides which failures of an outbound source call are retried.
 *
 * <p>Retried: transient {@link SourceHttpException}s and I/O failures anywhere in the
 * cause chain (connection refused, timeouts, resets). Not retried: rate limiter
 * exhaustion, permanent HTTP errors and malformed payloads.</p>
 */
public final class TransientSourceErrorPredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientSourceErrorPredicate.class);

    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof SourceException) {
                return false;
            }
            if (current instanceof SourceHttpException httpException) {
                logger.debug("HTTP {} from source, transient={}", httpException.getStatus(), httpException.isTransient());
                return httpException.isTransient();
            }
            if (current instanceof JsonProcessingException) {
                return false;
            }
            if (current instanceof IOException) {
                logger.debug("I/O failure calling source: {}", current.getMessage());
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
