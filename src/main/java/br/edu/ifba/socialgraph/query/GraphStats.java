package br.edu.ifba.socialgraph.query;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GraphStats(
    @JsonProperty("total_nodes") long totalNodes,
    @JsonProperty("total_edges") long totalEdges,
    @JsonProperty("nodes_by_source") Map<String, Long> nodesBySource,
    @JsonProperty("nodes_by_type") Map<String, Long> nodesByType,
    @JsonProperty("edges_by_type") Map<String, Long> edgesByType,
    @JsonProperty("average_degree") double averageDegree,
    @JsonProperty("density") double density,
    @JsonProperty("connected_components") int connectedComponents,
    @JsonProperty("degree") DegreeSummary degree
) {

    /**
     * Undirected degree distribution. A self-loop adds two to its node.
     */
    public record DegreeSummary(
        @JsonProperty("min") int min,
        @JsonProperty("max") int max,
        @JsonProperty("mean") double mean,
        @JsonProperty("median") double median,
        @JsonProperty("isolated_nodes") long isolatedNodes
    ) {

        public static final DegreeSummary EMPTY = new DegreeSummary(0, 0, 0.0, 0.0, 0);
    }
}
