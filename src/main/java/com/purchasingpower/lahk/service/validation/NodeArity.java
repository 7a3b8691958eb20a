package com.purchasingpower.lahk.service.validation;

import com.google.common.collect.ImmutableMap;
import com.purchasingpower.lahk.model.graph.NodeKind;
import lombok.Value;

/**
 * Allowed in/out degree for one node kind. {@link #UNBOUNDED} marks an open upper bound.
 *
 * @since 1.0.0
 */
@Value
public class NodeArity {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final ImmutableMap<NodeKind, NodeArity> RULES = ImmutableMap.<NodeKind, NodeArity>builder()
            .put(NodeKind.START, new NodeArity(0, 0, 1, 1))
            .put(NodeKind.END, new NodeArity(1, 1, 0, 0))
            .put(NodeKind.PROCESS, new NodeArity(1, 1, 1, 1))
            .put(NodeKind.DECISION, new NodeArity(1, UNBOUNDED, 2, UNBOUNDED))
            .put(NodeKind.CONNECTOR, new NodeArity(1, UNBOUNDED, 1, 1))
            .put(NodeKind.INPUT, new NodeArity(1, 1, 1, 1))
            .put(NodeKind.OUTPUT, new NodeArity(1, 1, 1, 1))
            .build();

    int minIn;
    int maxIn;
    int minOut;
    int maxOut;

    public static NodeArity forKind(NodeKind kind) {
        return RULES.get(kind);
    }
}
