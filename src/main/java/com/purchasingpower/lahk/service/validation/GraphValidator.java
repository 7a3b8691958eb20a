package com.purchasingpower.lahk.service.validation;

import com.purchasingpower.lahk.model.graph.GraphEdge;
import com.purchasingpower.lahk.model.graph.GraphNode;

import java.util.List;

/**
 * Checks a flowchart against the per-kind connectivity rules.
 *
 * <p>Rules (in, out):
 * <ul>
 *   <li>Start: 0, 1
 *   <li>End: 1, 0
 *   <li>Process, Input, Output: 1, 1
 *   <li>Decision: at least 1, at least 2
 *   <li>Connector: at least 1, exactly 1
 * </ul>
 * Function-body members are exempt.
 *
 * @since 1.0.0
 */
public interface GraphValidator {

    /**
     * Validates node in/out degrees.
     *
     * @param nodes nodes in creation order
     * @param edges edge list
     * @return result whose violations follow node order, inputs before outputs per node
     */
    ValidationResult validate(List<GraphNode> nodes, List<GraphEdge> edges);

    /**
     * Same check as {@link #validate}, reduced to the violation messages.
     */
    default List<String> validateNodeIO(List<GraphNode> nodes, List<GraphEdge> edges) {
        return validate(nodes, edges).getMessages();
    }
}
