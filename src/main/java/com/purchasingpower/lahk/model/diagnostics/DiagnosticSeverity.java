package com.purchasingpower.lahk.model.diagnostics;

public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFORMATION
}
