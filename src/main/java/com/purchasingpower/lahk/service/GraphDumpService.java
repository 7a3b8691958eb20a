package com.purchasingpower.lahk.service;

/**
 * Plain-text report of a compiled graph for debugging and tooling.
 *
 * @since 1.0.0
 */
public interface GraphDumpService {

    /**
     * Builds and validates the document, then renders header counts, validation errors,
     * one line per node, one line per edge and the graph as JSON.
     *
     * @param documentText full document text
     * @param documentName name shown in the report header; {@code null} means untitled
     * @return the report, lines joined with {@code \n}
     */
    String dump(String documentText, String documentName);
}
