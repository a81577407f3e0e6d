package br.edu.ifba.socialgraph.query;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One page of a node or edge listing. {@code page} is 1-based.
 */
public record ResultPage<T>(
    @JsonProperty("items") List<T> items,
    @JsonProperty("total") long total,
    @JsonProperty("page") int page,
    @JsonProperty("page_size") int pageSize,
    @JsonProperty("pages") long pages
) {

    static <T> ResultPage<T> of(List<T> items, long total, int page, int pageSize) {
        return new ResultPage<>(items, total, page, pageSize, (total + pageSize - 1) / pageSize);
    }
}
