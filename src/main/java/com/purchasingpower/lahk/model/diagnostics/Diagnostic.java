package com.purchasingpower.lahk.model.diagnostics;

import lombok.Builder;
import lombok.Value;

/**
 * Editor-facing problem report with a 0-based line/column range.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class Diagnostic {
    int startLine;
    int startColumn;
    int endLine;
    int endColumn;
    String message;
    DiagnosticSeverity severity;
}
