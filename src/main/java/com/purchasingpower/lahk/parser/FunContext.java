package com.purchasingpower.lahk.parser;

import com.purchasingpower.lahk.model.graph.GraphNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Live state of one open function block: its header and the chain of body nodes.
 *
 * @since 1.0.0
 */
@Data
public class FunContext {

    private final GraphNode header;
    private final List<Integer> bodyNodeIds = new ArrayList<>();
    private Integer lastBodyNodeId;

    public int tailId() {
        return lastBodyNodeId != null ? lastBodyNodeId : header.getId();
    }

    public void append(GraphNode node) {
        bodyNodeIds.add(node.getId());
        lastBodyNodeId = node.getId();
    }
}
