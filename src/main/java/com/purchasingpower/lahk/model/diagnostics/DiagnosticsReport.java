package com.purchasingpower.lahk.model.diagnostics;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Diagnostics for one document plus the one-line status summary.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class DiagnosticsReport {
    List<Diagnostic> diagnostics;
    String summary;
    boolean parseFailed;

    public boolean isValid() {
        return diagnostics.isEmpty();
    }
}
