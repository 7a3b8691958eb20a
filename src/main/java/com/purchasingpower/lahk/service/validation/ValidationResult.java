package com.purchasingpower.lahk.service.validation;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of flowchart validation.
 *
 * <p>Immutable and thread-safe.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ValidationResult {
    boolean valid;
    List<Violation> violations;
    String summary;

    public static ValidationResult success() {
        return ValidationResult.builder()
                .valid(true)
                .violations(List.of())
                .summary("Graph valid ✓")
                .build();
    }

    public static ValidationResult failure(List<Violation> violations) {
        return ValidationResult.builder()
                .valid(false)
                .violations(List.copyOf(violations))
                .summary(String.format("%d graph error(s)", violations.size()))
                .build();
    }

    public List<String> getMessages() {
        return violations.stream().map(Violation::getMessage).collect(Collectors.toList());
    }

    /**
     * Single out-of-bounds degree on one node.
     */
    @Value
    @Builder
    public static class Violation {
        int nodeId;
        String kind;        // display name, e.g. "Process"
        int line;           // 0-based source line
        String direction;   // "inputs" or "outputs"
        long actual;
        String expected;    // e.g. "≥1"
        String message;     // e.g. "N  3 [Process] L4 has 0 inputs (expected ≥1)"
    }
}
