package com.purchasingpower.lahk.service;

import com.purchasingpower.lahk.configuration.LahkProperties;
import com.purchasingpower.lahk.model.diagnostics.Diagnostic;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns validator messages into line-ranged diagnostics.
 *
 * <p>The {@code L<n>} token of a message names the 1-based source line; the diagnostic covers
 * that whole line. Messages without a line token cover the whole document.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class DiagnosticMapper {

    private static final Pattern LINE_TOKEN = Pattern.compile("L(\\d+)");

    private final LahkProperties properties;

    public List<Diagnostic> toDiagnostics(List<String> messages, int documentLineCount) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String message : messages) {
            Matcher matcher = LINE_TOKEN.matcher(message);
            if (matcher.find()) {
                int line = Integer.parseInt(matcher.group(1)) - 1;
                diagnostics.add(lineWide(line, line, message));
            } else {
                diagnostics.add(documentWide(message, documentLineCount));
            }
        }
        return diagnostics;
    }

    public Diagnostic documentWide(String message, int documentLineCount) {
        return lineWide(0, Math.max(documentLineCount - 1, 0), message);
    }

    public String summarize(int errorCount) {
        return errorCount == 0 ? "Graph valid ✓" : String.format("%d graph error(s)", errorCount);
    }

    private Diagnostic lineWide(int startLine, int endLine, String message) {
        return Diagnostic.builder()
                .startLine(startLine)
                .startColumn(0)
                .endLine(endLine)
                .endColumn(properties.getDiagnostics().getLineEndColumn())
                .message(message)
                .severity(properties.getDiagnostics().getSeverity())
                .build();
    }
}
