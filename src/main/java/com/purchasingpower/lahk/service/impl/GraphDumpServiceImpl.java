package com.purchasingpower.lahk.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.purchasingpower.lahk.model.graph.FlowGraph;
import com.purchasingpower.lahk.model.graph.GraphEdge;
import com.purchasingpower.lahk.model.graph.GraphNode;
import com.purchasingpower.lahk.service.FlowchartService;
import com.purchasingpower.lahk.service.GraphDumpService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphDumpServiceImpl implements GraphDumpService {

    private static final String UNTITLED = "untitled";

    private final FlowchartService flowchartService;
    private final ObjectMapper objectMapper;

    @Override
    public String dump(String documentText, String documentName) {
        FlowGraph graph = flowchartService.buildGraph(documentText);
        List<String> errors = graph.getValidationErrors();

        List<String> out = new ArrayList<>();
        out.add("=== LAHK GRAPH DUMP ===");
        out.add("Document: " + (Strings.isNullOrEmpty(documentName) ? UNTITLED : documentName));
        out.add("Total Nodes: " + graph.getNodes().size());
        out.add("Total Edges: " + graph.getEdges().size());
        out.add("Start Node: " + graph.getStartNodeId());
        out.add("End Node: " + (graph.getEndNodeId() != null ? graph.getEndNodeId() : "none"));
        if (errors != null && !errors.isEmpty()) {
            out.add("=== VALIDATION ERRORS ===");
            out.addAll(errors);
            out.add("");
        }

        out.add("=== NODES (id kind line seg indent text // meta) ===");
        for (GraphNode node : graph.getNodes()) {
            out.add(formatNode(node));
        }
        out.add("");

        out.add("=== EDGES (from -> to [label]) ===");
        for (GraphEdge edge : graph.getEdges()) {
            out.add(formatEdge(edge));
        }
        out.add("");

        out.add("=== JSON (copy for tooling/debugging) ===");
        out.add(toJson(graph));

        log.info("Dumped graph: {} nodes, {} edges", graph.getNodes().size(), graph.getEdges().size());
        return Joiner.on('\n').join(out);
    }

    static String formatNode(GraphNode node) {
        String line = String.format("N%3d [%-12s] L%3d S%2d I%2d \"%s\"",
                node.getId(), node.getKind().getDisplayName(), node.getLine(),
                node.getSegmentIndex(), node.getIndent(), node.getText());
        String meta = node.getMeta();
        return meta.isEmpty() ? line : line + " // " + meta;
    }

    static String formatEdge(GraphEdge edge) {
        String line = String.format("N%3d -> N%3d", edge.getFrom(), edge.getTo());
        return edge.getLabel() != null ? line + " [" + edge.getLabel() + "]" : line;
    }

    private String toJson(FlowGraph graph) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize graph", e);
            throw new IllegalStateException("Could not serialize graph: " + e.getMessage(), e);
        }
    }
}
