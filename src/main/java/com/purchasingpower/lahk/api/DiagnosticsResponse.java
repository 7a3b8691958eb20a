package com.purchasingpower.lahk.api;

import com.purchasingpower.lahk.model.diagnostics.Diagnostic;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticsResponse {

    private boolean success;
    private String error;
    private String summary;

    @Builder.Default
    private List<Diagnostic> diagnostics = new ArrayList<>();

    public static DiagnosticsResponse error(String error) {
        return DiagnosticsResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
