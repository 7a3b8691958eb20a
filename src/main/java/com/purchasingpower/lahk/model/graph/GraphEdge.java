package com.purchasingpower.lahk.model.graph;

import lombok.Value;

/**
 * Directed edge between two flowchart nodes.
 *
 * <p>Identity is the (from, to, label) triple. A blank label is stored as {@code null} so that
 * an unlabeled edge and an empty-label edge are the same edge.
 *
 * @since 1.0.0
 */
@Value
public class GraphEdge {
    int from;
    int to;
    String label;

    public static GraphEdge of(int from, int to) {
        return new GraphEdge(from, to, null);
    }

    public static GraphEdge labeled(int from, int to, String label) {
        return new GraphEdge(from, to, label == null || label.isEmpty() ? null : label);
    }
}
