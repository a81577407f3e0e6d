package br.edu.ifba.socialgraph.storage;

/**
 * An upsert could not converge on a single stored record for its identity key.
 *
 * <p>Merge-on-upsert makes this unexpected. When it does happen the write that raised
 * it is lost and the crawl that issued it is failed.</p>
 */
public class GraphStoreConflictException extends GraphStoreException {

    public GraphStoreConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
