package br.edu.ifba.socialgraph.source;

/**
 * An external API answered with an error status.
 *
 * <p>Raised by {@link SourceResponseExceptionMapper} inside the REST clients. Transient
 * ones drive the retry policy; {@link SourceRequestExecutor} turns whatever is left
 * after retries into a {@link SourceException}.</p>
 */
public class SourceHttpException extends RuntimeException {

    private final int status;
    private final boolean transientFailure;

    public SourceHttpException(int status, String message, boolean transientFailure) {
        super(message);
        this.status = status;
        this.transientFailure = transientFailure;
    }

    public int getStatus() {
        return status;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public boolean isNotFound() {
        return status == 404 || status == 410;
    }
}
