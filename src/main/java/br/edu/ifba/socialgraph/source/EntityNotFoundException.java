package br.edu.ifba.socialgraph.source;

import br.edu.ifba.socialgraph.core.SourceType;

/**
 * The source does not know the requested entity, or its payload could not be normalized.
 */
public class EntityNotFoundException extends SourceException {

    public EntityNotFoundException(SourceType source, String message) {
        super(source, message);
    }

    public EntityNotFoundException(SourceType source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
