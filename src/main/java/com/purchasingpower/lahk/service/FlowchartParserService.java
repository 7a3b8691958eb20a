package com.purchasingpower.lahk.service;

import com.purchasingpower.lahk.model.graph.FlowGraph;

/**
 * Compiles Lahk markup into a flowchart graph.
 *
 * <p>Every call parses the whole document from scratch and shares no state with other calls,
 * so concurrent calls need no locking.
 *
 * @since 1.0.0
 */
public interface FlowchartParserService {

    /**
     * Parses a complete document.
     *
     * <p>Malformed text never raises; unrecognized or empty statements produce no node, and
     * structural problems are left for the validator to report.
     *
     * @param documentText full document text
     * @return graph with exactly one Start node (id 0) and a synthesized End node
     * @throws NullPointerException if documentText is null
     */
    FlowGraph parse(String documentText);
}
