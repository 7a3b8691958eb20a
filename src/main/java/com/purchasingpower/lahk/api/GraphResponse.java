package com.purchasingpower.lahk.api;

import com.purchasingpower.lahk.model.graph.FlowGraph;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed graph with its validation messages.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphResponse {

    private boolean success;
    private String error;
    private FlowGraph graph;
    private String summary;

    @Builder.Default
    private List<String> validationErrors = new ArrayList<>();

    public static GraphResponse success(FlowGraph graph, String summary) {
        return GraphResponse.builder()
            .success(true)
            .graph(graph)
            .validationErrors(graph.getValidationErrors())
            .summary(summary)
            .build();
    }

    public static GraphResponse error(String error) {
        return GraphResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
