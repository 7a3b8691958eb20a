package com.purchasingpower.lahk.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Edit response carrying the rewritten document.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditResponse {

    private boolean success;
    private String error;
    private String text;

    public static EditResponse success(String text) {
        return EditResponse.builder()
            .success(true)
            .text(text)
            .build();
    }

    public static EditResponse error(String error) {
        return EditResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
