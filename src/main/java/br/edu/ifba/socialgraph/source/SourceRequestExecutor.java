package br.edu.ifba.socialgraph.source;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;

import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.utils.RetryEventLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

/**
 * Runs a source request through {@link SourceGateway} and translates what escapes the
 * retry policy into the crawler's error taxonomy:
 *
 * <ul>
 *   <li>404, 410 and unparseable payloads become {@link EntityNotFoundException}</li>
 *   <li>retry-exhausted transient failures become a retryable {@link SourceUnavailableException}</li>
 *   <li>other HTTP errors become a non-retryable {@link SourceUnavailableException}</li>
 *   <li>{@link br.edu.ifba.socialgraph.ratelimit.RateLimitExceededException} passes through</li>
 * </ul>
 */
@ApplicationScoped
public class SourceRequestExecutor {

    private static final Logger LOG = Logger.getLogger(SourceRequestExecutor.class);

    private final SourceGateway gateway;
    private final RetryEventLogger retryEventLogger;
    private final TransientSourceErrorPredicate transientErrors = new TransientSourceErrorPredicate();

    @Inject
    public SourceRequestExecutor(SourceGateway gateway, RetryEventLogger retryEventLogger) {
        this.gateway = gateway;
        this.retryEventLogger = retryEventLogger;
    }

    /**
     * @param source the source being called
     * @param operation short name used in logs, e.g. {@code github.getUser}
     * @param reference the entity the call is about, used in error messages
     * @param request the HTTP call
     * @return the call's result
     */
    public <T> T call(SourceType source, String operation, String reference, Supplier<T> request) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            T result = gateway.execute(source, () -> {
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    retryEventLogger.logRetryAttempt(operation, attempt, SourceGateway.MAX_ATTEMPTS);
                }
                return request.get();
            });
            retryEventLogger.logRetrySuccess(operation, attempts.get());
            return result;
        } catch (SourceException e) {
            throw e;
        } catch (SourceHttpException | ProcessingException | WebApplicationException e) {
            throw translate(source, operation, reference, attempts.get(), e);
        }
    }

    private SourceException translate(SourceType source, String operation, String reference,
            int attempts, RuntimeException failure) {
        SourceHttpException http = findHttpFailure(failure);
        if (http != null && http.isNotFound()) {
            return new EntityNotFoundException(source,
                source.getValue() + " has no entity '" + reference + "'", failure);
        }
        if (hasCause(failure, JsonProcessingException.class)) {
            return new EntityNotFoundException(source,
                operation + " returned a malformed payload for '" + reference + "'", failure);
        }
        boolean transientFailure = transientErrors.test(failure);
        if (transientFailure) {
            retryEventLogger.logRetryExhausted(operation, attempts, failure);
        } else {
            LOG.debugf(failure, "%s failed for %s", operation, reference);
        }
        String detail = http != null ? http.getMessage() : failure.getMessage();
        return new SourceUnavailableException(source,
            operation + " failed for '" + reference + "': " + detail, transientFailure, failure);
    }

    private static SourceHttpException findHttpFailure(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SourceHttpException http) {
                return http;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        Throwable current = failure;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
