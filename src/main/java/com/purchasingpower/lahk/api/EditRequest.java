package com.purchasingpower.lahk.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Node label edit: the node's source position plus its new text.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditRequest {

    private String text;
    private Integer line;
    private Integer segmentIndex;
    private String newText;
}
