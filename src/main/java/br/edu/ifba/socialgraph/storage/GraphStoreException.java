package br.edu.ifba.socialgraph.storage;

/**
 * A graph store operation failed in the backend.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
