package com.purchasingpower.lahk.exception;

import lombok.Getter;

/**
 * Raised when a node position cannot be mapped back to its source text.
 */
@Getter
public class NodeEditException extends RuntimeException {

    private final int line;
    private final int segmentIndex;

    public NodeEditException(String message, int line, int segmentIndex) {
        super(message);
        this.line = line;
        this.segmentIndex = segmentIndex;
    }
}
