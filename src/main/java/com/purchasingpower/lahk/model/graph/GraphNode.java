package com.purchasingpower.lahk.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A single flowchart node.
 *
 * <p>Keeps its source position (line, segment index, indent) so a caller can map a rendered
 * node back to the text that produced it. Annotations are append-only: flags are a set,
 * comments accumulate in {@link #notes}, and the function/decision extensions are typed fields.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private int id;
    private NodeKind kind;

    private int line;
    private int segmentIndex;
    private int indent;

    private String text;

    @Builder.Default
    private EnumSet<NodeFlag> flags = EnumSet.noneOf(NodeFlag.class);

    @Builder.Default
    private List<String> notes = new ArrayList<>();

    private Integer funOwnerId;    // header id of the function block this node belongs to
    private Integer funFooterOf;   // header id when this node closes a function block

    @Builder.Default
    private List<Integer> funBodyIds = new ArrayList<>();

    @Builder.Default
    private List<String> branchLabels = new ArrayList<>();

    public boolean hasFlag(NodeFlag flag) {
        return flags.contains(flag);
    }

    public void addFlag(NodeFlag flag) {
        flags.add(flag);
    }

    public void appendNote(String note) {
        if (note != null && !note.isBlank()) {
            notes.add(note.trim());
        }
    }

    @JsonIgnore
    public boolean isSentinel() {
        return kind.isSentinel();
    }

    /**
     * Loop-back and forward-jump nodes are wired explicitly and never act as a default predecessor.
     */
    @JsonIgnore
    public boolean isLoopOrNext() {
        return hasFlag(NodeFlag.INLINE_LOOP) || hasFlag(NodeFlag.INLINE_NEXT);
    }

    @JsonIgnore
    public boolean isFunBodyMember() {
        return hasFlag(NodeFlag.FUN_BODY_MEMBER);
    }

    /**
     * Display form of every annotation on this node, space separated.
     */
    public String getMeta() {
        List<String> parts = new ArrayList<>(notes);
        for (NodeFlag flag : flags) {
            if (flag == NodeFlag.FUN_BODY_MEMBER && funOwnerId != null) {
                parts.add("fun-body-of=" + funOwnerId);
            } else if (flag == NodeFlag.FUN_FOOTER && funFooterOf != null) {
                parts.add("fun-footer-of=" + funFooterOf);
            } else {
                parts.add(flag.getTag());
            }
        }
        if (!funBodyIds.isEmpty()) {
            parts.add(funBodyIds.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(",", "fun-body=[", "]")));
        }
        if (!branchLabels.isEmpty()) {
            parts.add("labels: [" + String.join(", ", branchLabels) + "]");
        }
        return String.join(" ", parts);
    }
}
