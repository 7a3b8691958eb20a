package com.purchasingpower.lahk.service;

import com.purchasingpower.lahk.model.diagnostics.DiagnosticsReport;
import com.purchasingpower.lahk.model.graph.FlowGraph;

/**
 * Parse-and-validate entry point used by the REST layer.
 *
 * @since 1.0.0
 */
public interface FlowchartService {

    /**
     * Parses the document and stores the validator messages on the returned graph.
     *
     * @param documentText full document text
     * @return graph with {@code validationErrors} populated (empty when valid)
     * @throws com.purchasingpower.lahk.exception.DocumentTooLargeException if the document
     *         exceeds {@code lahk.max-document-chars}
     */
    FlowGraph buildGraph(String documentText);

    /**
     * Parses, validates and maps the result to editor diagnostics.
     *
     * <p>Never throws for document content: any failure becomes a single document-wide
     * {@code Parse error: ...} diagnostic.
     */
    DiagnosticsReport diagnose(String documentText);
}
