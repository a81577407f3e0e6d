package br.edu.ifba.socialgraph.core;

/**
 * Outcome of an insert-or-merge write: the stored record and whether the write created it.
 */
public record UpsertResult<T>(T record, boolean created) {

    public static <T> UpsertResult<T> created(T record) {
        return new UpsertResult<>(record, true);
    }

    public static <T> UpsertResult<T> merged(T record) {
        return new UpsertResult<>(record, false);
    }
}
