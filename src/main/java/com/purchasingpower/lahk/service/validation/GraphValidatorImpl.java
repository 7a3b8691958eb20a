package com.purchasingpower.lahk.service.validation;

import com.google.common.base.Preconditions;
import com.purchasingpower.lahk.model.graph.GraphEdge;
import com.purchasingpower.lahk.model.graph.GraphNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Degree-counting validator. Pure: reads the node and edge lists and touches nothing else.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class GraphValidatorImpl implements GraphValidator {

    private static final String INPUTS = "inputs";
    private static final String OUTPUTS = "outputs";

    @Override
    public ValidationResult validate(List<GraphNode> nodes, List<GraphEdge> edges) {
        Preconditions.checkNotNull(nodes, "Nodes cannot be null");
        Preconditions.checkNotNull(edges, "Edges cannot be null");

        Map<Integer, Integer> inDegree = new HashMap<>();
        Map<Integer, Integer> outDegree = new HashMap<>();
        for (GraphEdge edge : edges) {
            outDegree.merge(edge.getFrom(), 1, Integer::sum);
            inDegree.merge(edge.getTo(), 1, Integer::sum);
        }

        List<ValidationResult.Violation> violations = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (node.isFunBodyMember()) {
                continue;
            }
            NodeArity rules = NodeArity.forKind(node.getKind());
            int inCount = inDegree.getOrDefault(node.getId(), 0);
            int outCount = outDegree.getOrDefault(node.getId(), 0);

            if (inCount < rules.getMinIn()) {
                violations.add(violation(node, INPUTS, inCount, "≥" + rules.getMinIn()));
            }
            if (rules.getMaxIn() != NodeArity.UNBOUNDED && inCount > rules.getMaxIn()) {
                violations.add(violation(node, INPUTS, inCount, "≤" + rules.getMaxIn()));
            }
            if (outCount < rules.getMinOut()) {
                violations.add(violation(node, OUTPUTS, outCount, "≥" + rules.getMinOut()));
            }
            if (rules.getMaxOut() != NodeArity.UNBOUNDED && outCount > rules.getMaxOut()) {
                violations.add(violation(node, OUTPUTS, outCount, "≤" + rules.getMaxOut()));
            }
        }

        log.debug("Validated {} nodes, {} violations", nodes.size(), violations.size());
        return violations.isEmpty()
                ? ValidationResult.success()
                : ValidationResult.failure(violations);
    }

    private ValidationResult.Violation violation(GraphNode node, String direction, int actual, String expected) {
        String kind = node.getKind().getDisplayName();
        String nodeInfo = String.format("N%3d [%s] L%d", node.getId(), kind, node.getLine() + 1);
        return ValidationResult.Violation.builder()
                .nodeId(node.getId())
                .kind(kind)
                .line(node.getLine())
                .direction(direction)
                .actual(actual)
                .expected(expected)
                .message(String.format("%s has %d %s (expected %s)", nodeInfo, actual, direction, expected))
                .build();
    }
}
