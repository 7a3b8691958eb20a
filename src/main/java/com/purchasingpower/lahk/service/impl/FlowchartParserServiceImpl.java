package com.purchasingpower.lahk.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.lahk.model.graph.FlowGraph;
import com.purchasingpower.lahk.model.graph.GraphEdge;
import com.purchasingpower.lahk.model.graph.GraphNode;
import com.purchasingpower.lahk.model.graph.NodeFlag;
import com.purchasingpower.lahk.model.graph.NodeKind;
import com.purchasingpower.lahk.parser.DecisionContext;
import com.purchasingpower.lahk.parser.FunContext;
import com.purchasingpower.lahk.parser.Grammar;
import com.purchasingpower.lahk.parser.GrammarResolver;
import com.purchasingpower.lahk.parser.LogicalSegment;
import com.purchasingpower.lahk.parser.NodeKey;
import com.purchasingpower.lahk.parser.Segmenter;
import com.purchasingpower.lahk.parser.SpecKey;
import com.purchasingpower.lahk.service.FlowchartParserService;
import com.purchasingpower.lahk.service.graph.GraphBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Single-pass driver that turns logical segments into a flowchart.
 *
 * <p>All mutable state (arena, cursor, decision and function stacks) lives in a {@link ParseRun}
 * created per call; the service itself is stateless.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowchartParserServiceImpl implements FlowchartParserService {

    private static final String CLOSING_BRACE = "}";
    private static final String DEFAULT_CONNECTOR_TEXT = NodeKey.CONNECTOR.getToken();

    private final Segmenter segmenter;
    private final GrammarResolver grammarResolver;

    @Override
    public FlowGraph parse(String documentText) {
        Preconditions.checkNotNull(documentText, "Document text cannot be null");

        List<LogicalSegment> segments = segmenter.collectSegments(documentText);
        FlowGraph graph = new ParseRun().run(segments);

        log.info("Parsed {} segments into {} nodes and {} edges",
                segments.size(), graph.getNodes().size(), graph.getEdges().size());
        return graph;
    }

    /**
     * State of one parse.
     */
    private final class ParseRun {

        private final GraphBuilder gb = new GraphBuilder();
        private final Deque<DecisionContext> decisionStack = new ArrayDeque<>();
        private final Deque<FunContext> funStack = new ArrayDeque<>();
        private Integer currentBranchIndex;

        FlowGraph run(List<LogicalSegment> segments) {
            for (LogicalSegment seg : segments) {
                if (seg.isCommentOnly()) {
                    gb.lastCreatedNode().appendNote(seg.getComment());
                    continue;
                }
                if (closeFun(seg)) {
                    continue;
                }
                Optional<Grammar> grammar = grammarResolver.resolve(seg);
                if (grammar.isPresent()) {
                    dispatch(seg, grammar.get());
                }
            }
            finish();
            return gb.build();
        }

        private void dispatch(LogicalSegment seg, Grammar grammar) {
            NodeKey nodeKey = grammar.getNodeKey();
            if (nodeKey == NodeKey.FUNCTION) {
                openFun(seg, grammar);
                return;
            }
            if (nodeKey == null) {
                if (grammar.hasBranchMarker()) {
                    handleBareBranchMarker(seg, grammar);
                } else {
                    handleExecutableNode(NodeKind.PROCESS, seg, grammar);
                }
                return;
            }
            switch (nodeKey) {
                case END -> handleEnd(seg, grammar);
                case INPUT -> handleExecutableNode(NodeKind.INPUT, seg, grammar);
                case OUTPUT -> handleExecutableNode(NodeKind.OUTPUT, seg, grammar);
                case DECISION -> handleDecision(seg, grammar);
                case CONNECTOR -> handleConnector(seg, grammar);
                default -> handleExecutableNode(NodeKind.PROCESS, seg, grammar);
            }
        }

        private boolean inFun() {
            return !funStack.isEmpty();
        }

        private GraphNode createNode(NodeKind kind, LogicalSegment seg, String text,
                                     Grammar grammar, boolean registerInFun) {
            GraphNode node = gb.finalizeNode(gb.makeNode(kind, seg, text), grammar);
            if (registerInFun) {
                registerInFun(node);
            }
            return node;
        }

        /**
         * Chains a node onto the innermost open function body instead of the main flow.
         */
        private void registerInFun(GraphNode node) {
            FunContext fun = funStack.peek();
            if (fun == null) {
                return;
            }
            Optional<GraphNode> from = gb.findNode(fun.tailId());
            if (from.isPresent() && !from.get().isLoopOrNext()) {
                gb.pushEdge(from.get().getId(), node.getId());
            }
            fun.append(node);
            node.setFunOwnerId(fun.getHeader().getId());
            node.addFlag(NodeFlag.FUN_BODY_MEMBER);
        }

        private void popObsoleteDecisions(LogicalSegment seg, Grammar grammar) {
            while (!decisionStack.isEmpty()) {
                DecisionContext top = decisionStack.peek();
                int cutoff = top.cutoffIndent();

                if (seg.getIndent() < cutoff) {
                    decisionStack.pop();
                    currentBranchIndex = null;
                    log.debug("Closed decision {} on dedent at line {}", top.getHeader().getId(), seg.getPhysicalLine());
                    continue;
                }
                if (seg.getIndent() == cutoff && !grammar.hasBranchMarker() && top.isExplicitContent()) {
                    decisionStack.pop();
                    gb.setLastExecutableNode(top.lastTailOrHeader());
                    currentBranchIndex = null;
                    log.debug("Closed decision {} at its branch level, line {}", top.getHeader().getId(), seg.getPhysicalLine());
                    continue;
                }
                break;
            }
        }

        private void attachBranchStart(DecisionContext ctx, GraphNode node) {
            int branchIndex = ctx.getBranches().size();
            List<String> labels = ctx.getLabels();
            String label = branchIndex < labels.size() ? labels.get(branchIndex) : null;

            gb.pushEdge(GraphEdge.labeled(ctx.getHeader().getId(), node.getId(), label));
            ctx.getBranches().add(node);
            ctx.getTails().put(branchIndex, node);
            ctx.setExplicitContent(true);
            currentBranchIndex = branchIndex;
        }

        private void attachBranchContinue(DecisionContext ctx, GraphNode node) {
            Integer branchIndex = currentBranchIndex;
            if (branchIndex == null && !ctx.getBranches().isEmpty()) {
                branchIndex = ctx.getBranches().size() - 1;
            }
            if (branchIndex != null) {
                GraphNode tail = ctx.getTails().get(branchIndex);
                if (tail != null) {
                    gb.pushEdge(tail.getId(), node.getId());
                    ctx.getTails().put(branchIndex, node);
                    ctx.setExplicitContent(true);
                    currentBranchIndex = branchIndex;
                    gb.setLastExecutableNode(node);
                    return;
                }
            }
            gb.wireSequential(node);
            currentBranchIndex = null;
        }

        private boolean wireIntoDecisionIfAny(GraphNode node, LogicalSegment seg, Grammar grammar) {
            DecisionContext ctx = decisionStack.peek();
            if (ctx == null || !grammar.hasBranchMarker() || !ctx.inRange(seg)) {
                return false;
            }
            if (grammar.getSpecKey() == SpecKey.ELSE) {
                attachBranchStart(ctx, node);
            } else {
                attachBranchContinue(ctx, node);
            }
            return true;
        }

        private void handleExecutableNode(NodeKind kind, LogicalSegment seg, Grammar grammar) {
            GraphNode node = createNode(kind, seg, grammar.getTrimmedCode(), grammar, true);
            if (wireIntoDecisionIfAny(node, seg, grammar)) {
                return;
            }
            popObsoleteDecisions(seg, grammar);
            if (!inFun()) {
                gb.wireSequential(node);
            }
        }

        private void handleBareBranchMarker(LogicalSegment seg, Grammar grammar) {
            popObsoleteDecisions(seg, grammar);
            DecisionContext ctx = decisionStack.peek();
            if (ctx == null) {
                handleExecutableNode(NodeKind.PROCESS, seg, grammar);
                return;
            }
            if (grammar.getSpecKey() == SpecKey.ELSE && ctx.getBranchIndent() == null) {
                ctx.setBranchIndent(seg.getIndent());
            }
            if (seg.getIndent() < ctx.getHeader().getIndent()) {
                handleExecutableNode(NodeKind.PROCESS, seg, grammar);
                return;
            }
            GraphNode node = createNode(NodeKind.PROCESS, seg, grammar.getTrimmedCode(), grammar, true);
            if (!wireIntoDecisionIfAny(node, seg, grammar) && !inFun()) {
                gb.wireSequential(node);
            }
        }

        private void openFun(LogicalSegment seg, Grammar grammar) {
            String afterFun = grammar.getTrimmedCode().trim();
            boolean collapsed = afterFun.startsWith("!");
            if (collapsed) {
                afterFun = afterFun.substring(1).trim();
            }
            String headerText = (collapsed ? "fun! " : "fun ") + afterFun;
            Grammar headerGrammar = grammar.toBuilder()
                    .nodeKey(null)
                    .trimmedCode(headerText)
                    .build();

            GraphNode funNode = createNode(NodeKind.PROCESS, seg, headerText, headerGrammar, false);
            funNode.addFlag(collapsed ? NodeFlag.FUN_BLOCK_COLLAPSED : NodeFlag.FUN_BLOCK_EXPANDED);
            gb.wireSequential(funNode);
            funStack.push(new FunContext(funNode));
            currentBranchIndex = null;
        }

        private boolean closeFun(LogicalSegment seg) {
            if (funStack.isEmpty()) {
                return false;
            }
            String trimmedEnd = seg.getCode().stripTrailing();
            if (!trimmedEnd.endsWith(CLOSING_BRACE)) {
                return false;
            }
            FunContext fun = funStack.pop();
            GraphNode header = fun.getHeader();

            if (!fun.getBodyNodeIds().isEmpty()) {
                header.getFunBodyIds().addAll(fun.getBodyNodeIds());

                String footerText = trimmedEnd.substring(0, trimmedEnd.length() - CLOSING_BRACE.length()).trim();
                if (footerText.isEmpty()) {
                    footerText = CLOSING_BRACE;
                }
                Grammar footerGrammar = Grammar.builder()
                        .lineKeys(List.of())
                        .trimmedCode(footerText)
                        .build();
                GraphNode footer = createNode(NodeKind.PROCESS, seg, footerText, footerGrammar, false);
                footer.setFunFooterOf(header.getId());
                footer.addFlag(NodeFlag.FUN_FOOTER);
                gb.pushEdge(fun.getLastBodyNodeId(), footer.getId());
                gb.setLastExecutableNode(footer);
            }
            log.debug("Closed function {} with {} body nodes", header.getId(), fun.getBodyNodeIds().size());
            currentBranchIndex = null;
            return true;
        }

        private void handleEnd(LogicalSegment seg, Grammar grammar) {
            DecisionContext ctx = decisionStack.peek();
            GraphNode endNode = createNode(NodeKind.END, seg, grammar.getTrimmedCode(), grammar, true);
            endNode.addFlag(NodeFlag.EXPLICIT_END);

            if (ctx != null && ctx.inRange(seg)) {
                if (grammar.hasBranchMarker()) {
                    wireIntoDecisionIfAny(endNode, seg, grammar);
                }
                gb.setLastExecutableNode(null);
                currentBranchIndex = null;
                return;
            }
            currentBranchIndex = null;
            gb.setLastExecutableNode(gb.findPrevSequentialCandidate(endNode).orElse(null));
        }

        private void handleDecision(LogicalSegment seg, Grammar grammar) {
            popObsoleteDecisions(seg, grammar);
            currentBranchIndex = null;

            String headerText = grammar.getTrimmedCode();
            List<String> labels = GrammarResolver.splitDecisionLabels(headerText);
            GraphNode decisionNode = createNode(NodeKind.DECISION, seg, headerText, grammar, true);

            DecisionContext outer = decisionStack.peek();
            if (outer != null && outer.inRange(seg) && grammar.hasBranchMarker()) {
                if (grammar.getSpecKey() == SpecKey.ELSE) {
                    attachBranchStart(outer, decisionNode);
                } else {
                    attachBranchContinue(outer, decisionNode);
                }
            } else if (!inFun()) {
                gb.wireSequential(decisionNode);
            }

            List<String> branchLabels = labels.size() > 1 ? labels : List.of();
            decisionNode.getBranchLabels().addAll(branchLabels);
            decisionStack.push(new DecisionContext(decisionNode, branchLabels));
        }

        private void handleConnector(LogicalSegment seg, Grammar grammar) {
            String text = grammar.getTrimmedCode().isEmpty() ? DEFAULT_CONNECTOR_TEXT : grammar.getTrimmedCode();
            GraphNode connector = createNode(NodeKind.CONNECTOR, seg, text, grammar, true);

            gb.setLastConnectorLikeNode(connector);
            gb.setLastExecutableNode(connector);
            popObsoleteDecisions(seg, grammar);
            gb.computeConnectorFanin(connector);
            gb.setLastExecutableNode(connector);
            if (!inFun()) {
                gb.wireSequential(connector, true);
            }
        }

        private void finish() {
            for (GraphNode node : gb.getPendingNextNodes()) {
                gb.findNextConnector(node)
                        .filter(target -> !gb.hasEdgeBetween(node.getId(), target.getId()))
                        .ifPresent(target -> gb.pushEdge(node.getId(), target.getId()));
            }

            GraphNode start = gb.getStartNode();
            List<GraphNode> nonSentinel = gb.getNodes().stream()
                    .filter(n -> !n.isSentinel())
                    .collect(Collectors.toList());
            if (!gb.hasOutgoing(start.getId()) && !nonSentinel.isEmpty()) {
                gb.pushEdge(start.getId(), nonSentinel.get(0).getId());
            }
            if (nonSentinel.size() >= 2) {
                GraphNode first = nonSentinel.get(0);
                GraphNode second = nonSentinel.get(1);
                if (second.getKind() == NodeKind.CONNECTOR && !gb.hasEdgeBetween(first.getId(), second.getId())) {
                    gb.pushEdge(first.getId(), second.getId());
                }
            }

            GraphNode fallthrough = start;
            for (GraphNode n : gb.getNodes()) {
                if (n.getKind() != NodeKind.END) {
                    fallthrough = n;
                }
            }
            String note = fallthrough == start ? "empty doc" : null;
            GraphNode implicitEnd = gb.createImplicitEnd(fallthrough.getLine(), fallthrough.getSegmentIndex(), note);
            gb.pushEdge(fallthrough.getId(), implicitEnd.getId());
        }
    }
}
