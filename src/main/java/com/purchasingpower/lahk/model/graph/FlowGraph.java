package com.purchasingpower.lahk.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Result of compiling one document: the node arena, the edge list and the two bookend ids.
 *
 * <p>{@code validationErrors} stays {@code null} until a validator has been run over the graph.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowGraph {

    @Builder.Default
    private List<GraphNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<GraphEdge> edges = new ArrayList<>();

    private int startNodeId;
    private Integer endNodeId;

    private List<String> validationErrors;

    public Optional<GraphNode> findNode(int id) {
        return nodes.stream().filter(n -> n.getId() == id).findFirst();
    }
}
