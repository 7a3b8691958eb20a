package com.purchasingpower.lahk.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Keyword classification of one segment.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class Grammar {
    SpecKey specKey;            // nullable
    NodeKey nodeKey;            // nullable
    List<InlineKey> lineKeys;
    String trimmedCode;

    public boolean hasBranchMarker() {
        return specKey != null;
    }

    public boolean hasLineKey(InlineKey key) {
        return lineKeys.contains(key);
    }
}
