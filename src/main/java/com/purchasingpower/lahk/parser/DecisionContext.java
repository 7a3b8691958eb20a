package com.purchasingpower.lahk.parser;

import com.purchasingpower.lahk.model.graph.GraphNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live state of one open decision while its branches are being read.
 *
 * @since 1.0.0
 */
@Data
public class DecisionContext {

    private final GraphNode header;
    private final List<GraphNode> branches = new ArrayList<>();

    /** Current tail per branch index, in order of first insertion. */
    private final Map<Integer, GraphNode> tails = new LinkedHashMap<>();

    private final List<String> labels;      // empty unless the header declared more than one label
    private Integer branchIndent;           // pinned on the first branch-start marker
    private boolean explicitContent;

    public DecisionContext(GraphNode header, List<String> labels) {
        this.header = header;
        this.labels = labels;
    }

    /**
     * Indentation a segment must reach to still belong to this decision.
     */
    public int cutoffIndent() {
        return branchIndent != null ? branchIndent : header.getIndent();
    }

    public boolean inRange(LogicalSegment segment) {
        return segment.getIndent() >= cutoffIndent();
    }

    /**
     * Tail of the branch inserted last, or the header when no branch has content.
     */
    public GraphNode lastTailOrHeader() {
        GraphNode last = header;
        for (GraphNode tail : tails.values()) {
            last = tail;
        }
        return last;
    }
}
