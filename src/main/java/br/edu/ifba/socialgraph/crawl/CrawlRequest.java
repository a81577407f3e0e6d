package br.edu.ifba.socialgraph.crawl;

import com.fasterxml.jackson.annotation.JsonProperty;

import br.edu.ifba.socialgraph.core.SourceType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CrawlRequest(
        @NotNull(message = "Source is required")
        @JsonProperty("source") SourceType source,

        @NotBlank(message = "Start entity is required")
        @JsonProperty("start_entity") String startEntity,

        @Min(value = 1, message = "Depth must be at least 1")
        @Max(value = 5, message = "Depth must be at most 5")
        @JsonProperty("depth") Integer depth,

        @Min(value = 1, message = "max_entities must be at least 1")
        @Max(value = 5000, message = "max_entities must be at most 5000")
        @JsonProperty("max_entities") Integer maxEntities
) {

    public static final int DEFAULT_DEPTH = 2;
    public static final int DEFAULT_MAX_ENTITIES = 100;

    public int depthOrDefault() {
        return depth != null ? depth : DEFAULT_DEPTH;
    }

    public int maxEntitiesOrDefault() {
        return maxEntities != null ? maxEntities : DEFAULT_MAX_ENTITIES;
    }
}
