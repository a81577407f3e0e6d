package br.edu.ifba.socialgraph.exception;

/**
 * Exception thrown when a job, node or path the caller asked for does not exist.
 * Mapped to HTTP 404 by {@link ResourceNotFoundExceptionMapper}.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
