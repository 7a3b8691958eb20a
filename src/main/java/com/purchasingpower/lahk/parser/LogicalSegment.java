package com.purchasingpower.lahk.parser;

import lombok.Builder;
import lombok.Value;

/**
 * One statement-sized chunk of source text.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class LogicalSegment {
    int physicalLine;   // 0-based
    int segmentIndex;   // position among the ':'-separated pieces of the line
    int indent;
    String raw;         // text with leading indentation removed
    String code;
    String comment;

    public boolean isCommentOnly() {
        return code.trim().isEmpty() && !comment.trim().isEmpty();
    }
}
