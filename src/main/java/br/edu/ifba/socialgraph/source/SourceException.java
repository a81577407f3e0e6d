package br.edu.ifba.socialgraph.source;

import br.edu.ifba.socialgraph.core.SourceType;

/**
 * Base type for failures talking to an external source.
 */
public abstract class SourceException extends RuntimeException {

    private final SourceType source;

    protected SourceException(SourceType source, String message) {
        super(message);
        this.source = source;
    }

    protected SourceException(SourceType source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public SourceType getSource() {
        return source;
    }

    /**
     * Whether trying the same call again later may succeed.
     */
    public abstract boolean isRetryable();
}
