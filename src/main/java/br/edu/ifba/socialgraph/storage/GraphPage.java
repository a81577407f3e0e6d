package br.edu.ifba.socialgraph.storage;

import java.util.List;

/**
 * A slice of a filtered scan plus the number of records matching the filter overall.
 */
public record GraphPage<T>(List<T> items, long total) {

    public GraphPage {
        items = List.copyOf(items);
    }
}
