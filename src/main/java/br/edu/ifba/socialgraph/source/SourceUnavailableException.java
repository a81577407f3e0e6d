package br.edu.ifba.socialgraph.source;

import br.edu.ifba.socialgraph.core.SourceType;

/**
 * The source could not serve a request, after the adapter's own retries when the
 * failure was transient.
 */
public class SourceUnavailableException extends SourceException {

    private final boolean retryable;

    public SourceUnavailableException(SourceType source, String message, boolean retryable) {
        super(source, message);
        this.retryable = retryable;
    }

    public SourceUnavailableException(SourceType source, String message, boolean retryable, Throwable cause) {
        super(source, message, cause);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
