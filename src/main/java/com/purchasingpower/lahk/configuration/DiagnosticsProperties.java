package com.purchasingpower.lahk.configuration;

import com.purchasingpower.lahk.model.diagnostics.DiagnosticSeverity;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DiagnosticsProperties {

    /** End column of a line-wide diagnostic range. */
    @Min(1)
    private int lineEndColumn = 1000;

    @NotNull
    private DiagnosticSeverity severity = DiagnosticSeverity.ERROR;
}
