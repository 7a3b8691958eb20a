package com.purchasingpower.lahk.model.graph;

/**
 * Role of a node in the flowchart.
 *
 * @since 1.0.0
 */
public enum NodeKind {
    START("Start"),
    END("End"),
    PROCESS("Process"),
    DECISION("Decision"),
    CONNECTOR("Connector"),
    INPUT("Input"),
    OUTPUT("Output");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Start and End are synthetic bookends and are skipped by most structural scans.
     */
    public boolean isSentinel() {
        return this == START || this == END;
    }
}
