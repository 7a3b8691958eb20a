package com.purchasingpower.lahk.service.graph;

import com.purchasingpower.lahk.model.graph.FlowGraph;
import com.purchasingpower.lahk.model.graph.GraphEdge;
import com.purchasingpower.lahk.model.graph.GraphNode;
import com.purchasingpower.lahk.model.graph.NodeFlag;
import com.purchasingpower.lahk.model.graph.NodeKind;
import com.purchasingpower.lahk.parser.Grammar;
import com.purchasingpower.lahk.parser.InlineKey;
import com.purchasingpower.lahk.parser.LogicalSegment;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node/edge arena for a single parse.
 *
 * <p>Not thread-safe and not reusable: the parser creates one instance per document.
 * Node ids are assigned in creation order starting at 1; id 0 is the implicit Start node.
 *
 * @since 1.0.0
 */
@Slf4j
public class GraphBuilder {

    @Getter
    private final List<GraphNode> nodes = new ArrayList<>();

    @Getter
    private final List<GraphEdge> edges = new ArrayList<>();

    private final Set<GraphEdge> edgeSet = new HashSet<>();

    @Getter
    private final GraphNode startNode;

    @Getter
    private Integer endNodeId;

    private int nextId = 1;

    /** Node that default sequential wiring connects the next statement from; null means Start. */
    @Getter
    @Setter
    private GraphNode lastExecutableNode;

    /** Target of {@code loop} markers. */
    @Getter
    @Setter
    private GraphNode lastConnectorLikeNode;

    /** Nodes marked {@code next}, resolved against the following connector at the end. */
    @Getter
    private final List<GraphNode> pendingNextNodes = new ArrayList<>();

    public GraphBuilder() {
        startNode = GraphNode.builder()
                .id(0)
                .kind(NodeKind.START)
                .text("")
                .build();
        startNode.addFlag(NodeFlag.IMPLICIT_START);
        nodes.add(startNode);
    }

    public void pushEdge(GraphEdge edge) {
        if (edgeSet.add(edge)) {
            edges.add(edge);
        }
    }

    public void pushEdge(int from, int to) {
        pushEdge(GraphEdge.of(from, to));
    }

    /**
     * True when any edge, labeled or not, runs from {@code from} to {@code to}.
     */
    public boolean hasEdgeBetween(int from, int to) {
        return edges.stream().anyMatch(e -> e.getFrom() == from && e.getTo() == to);
    }

    public boolean hasOutgoing(int nodeId) {
        return edges.stream().anyMatch(e -> e.getFrom() == nodeId);
    }

    public Optional<GraphNode> findNode(int id) {
        return nodes.stream().filter(n -> n.getId() == id).findFirst();
    }

    public GraphNode lastCreatedNode() {
        return nodes.get(nodes.size() - 1);
    }

    public GraphNode makeNode(NodeKind kind, LogicalSegment segment, String text) {
        GraphNode node = GraphNode.builder()
                .id(nextId++)
                .kind(kind)
                .line(segment.getPhysicalLine())
                .segmentIndex(segment.getSegmentIndex())
                .indent(segment.getIndent())
                .text(text.trim())
                .build();
        node.appendNote(segment.getComment());
        nodes.add(node);
        return node;
    }

    /**
     * Applies the inline markers of a freshly made node.
     */
    public GraphNode finalizeNode(GraphNode node, Grammar grammar) {
        if (grammar.hasLineKey(InlineKey.LOOP) && lastConnectorLikeNode != null) {
            pushEdge(node.getId(), lastConnectorLikeNode.getId());
            node.addFlag(NodeFlag.INLINE_LOOP);
        }
        if (grammar.hasLineKey(InlineKey.NEXT)) {
            pendingNextNodes.add(node);
            node.addFlag(NodeFlag.INLINE_NEXT);
        }
        return node;
    }

    /**
     * Connects the previous statement to {@code target}.
     *
     * <p>Connectors only move the cursor; their incoming edges come from fan-in. When the cursor
     * is back at Start and Start already has its edge, the predecessor is the most recent
     * non-sentinel node other than {@code target}, so a node is never wired to itself.
     */
    public void wireSequential(GraphNode target, boolean updateLast) {
        GraphNode from = lastExecutableNode != null ? lastExecutableNode : startNode;

        if (from == startNode && hasOutgoing(startNode.getId())) {
            from = findLastNonSentinel(target).orElse(null);
            if (from == null) {
                return;
            }
        }
        if (from.isLoopOrNext()) {
            from = findPrevSequentialCandidate(from).orElse(null);
        }
        if (from != null && from.getKind() == NodeKind.DECISION) {
            from = findPrevSequentialCandidate(from).orElse(null);
        }

        if (target.getKind() != NodeKind.CONNECTOR && from != null) {
            pushEdge(from.getId(), target.getId());
        }
        if (updateLast && !target.isLoopOrNext()) {
            lastExecutableNode = target;
        }
    }

    public void wireSequential(GraphNode target) {
        wireSequential(target, true);
    }

    public GraphNode createImplicitEnd(int line, int segmentIndex, String note) {
        GraphNode implicitEnd = GraphNode.builder()
                .id(nextId++)
                .kind(NodeKind.END)
                .line(line)
                .segmentIndex(segmentIndex)
                .indent(0)
                .text("")
                .build();
        implicitEnd.addFlag(NodeFlag.IMPLICIT_END);
        implicitEnd.appendNote(note);
        nodes.add(implicitEnd);
        endNodeId = implicitEnd.getId();
        return implicitEnd;
    }

    /**
     * Wires the branch ends that converge at {@code connector}.
     *
     * <p>The window runs from the nearest earlier Decision or Connector at the connector's own
     * indentation (exclusive) up to the connector's line. Candidates are the non-sentinel nodes
     * in that window at the connector's indentation or deeper; a candidate that can reach another
     * candidate inside the window is an interior node and does not feed.
     */
    public void computeConnectorFanin(GraphNode connector) {
        int indent = connector.getIndent();
        int startLine = findFaninBoundaryLine(connector);

        List<GraphNode> window = nodes.stream()
                .filter(n -> n.getId() != connector.getId())
                .filter(n -> !n.isSentinel())
                .filter(n -> n.getIndent() >= indent)
                .filter(n -> n.getLine() > startLine && n.getLine() <= connector.getLine())
                .collect(Collectors.toList());

        Set<Integer> windowIds = window.stream().map(GraphNode::getId).collect(Collectors.toSet());
        Map<Integer, List<Integer>> successors = new HashMap<>();
        for (GraphEdge e : edges) {
            if (windowIds.contains(e.getFrom()) && windowIds.contains(e.getTo())) {
                successors.computeIfAbsent(e.getFrom(), k -> new ArrayList<>()).add(e.getTo());
            }
        }

        Set<Integer> feederIds = new LinkedHashSet<>(windowIds);
        for (GraphNode n : window) {
            if (feederIds.contains(n.getId()) && canReachFeeder(n.getId(), feederIds, successors)) {
                feederIds.remove(n.getId());
            }
        }

        for (GraphNode n : window) {
            if (n.isLoopOrNext() || !feederIds.contains(n.getId())) {
                continue;
            }
            pushEdge(n.getId(), connector.getId());
        }
        log.debug("Connector {} at line {}: window={}, feeders={}",
                connector.getId(), connector.getLine(), windowIds, feederIds);

        if (!hasOutgoing(connector.getId())) {
            nodes.stream()
                    .filter(n -> n.getId() != connector.getId())
                    .filter(n -> !n.isSentinel())
                    .filter(n -> n.getIndent() == indent && n.getLine() > connector.getLine())
                    .findFirst()
                    .ifPresent(next -> pushEdge(connector.getId(), next.getId()));
        }
    }

    private int findFaninBoundaryLine(GraphNode connector) {
        for (int line = connector.getLine() - 1; line >= 0; line--) {
            final int current = line;
            boolean boundary = nodes.stream().anyMatch(n -> n.getLine() == current
                    && n.getIndent() == connector.getIndent()
                    && (n.getKind() == NodeKind.DECISION || n.getKind() == NodeKind.CONNECTOR));
            if (boundary) {
                return current;
            }
        }
        return 0;
    }

    private static boolean canReachFeeder(int startId, Set<Integer> feederIds,
                                          Map<Integer, List<Integer>> successors) {
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(startId);
        while (!stack.isEmpty()) {
            int id = stack.pop();
            if (!visited.add(id)) {
                continue;
            }
            if (id != startId && feederIds.contains(id)) {
                return true;
            }
            for (int next : successors.getOrDefault(id, List.of())) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    /**
     * Nearest non-sentinel node created before {@code node}.
     */
    public Optional<GraphNode> findPrevSequentialCandidate(GraphNode node) {
        int idx = indexOf(node);
        for (int i = idx - 1; i >= 0; i--) {
            if (!nodes.get(i).isSentinel()) {
                return Optional.of(nodes.get(i));
            }
        }
        return Optional.empty();
    }

    private int indexOf(GraphNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getId() == node.getId()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Most recently created non-sentinel node other than {@code exclude}.
     */
    public Optional<GraphNode> findLastNonSentinel(GraphNode exclude) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            GraphNode n = nodes.get(i);
            if (!n.isSentinel() && n != exclude) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    /**
     * Connector with the smallest physical line strictly after {@code node}'s line.
     */
    public Optional<GraphNode> findNextConnector(GraphNode node) {
        GraphNode best = null;
        for (GraphNode candidate : nodes) {
            if (candidate.getKind() != NodeKind.CONNECTOR || candidate.getLine() <= node.getLine()) {
                continue;
            }
            if (best == null || candidate.getLine() < best.getLine()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    public FlowGraph build() {
        return FlowGraph.builder()
                .nodes(nodes)
                .edges(edges)
                .startNodeId(startNode.getId())
                .endNodeId(endNodeId)
                .build();
    }
}
