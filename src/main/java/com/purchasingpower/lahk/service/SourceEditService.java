package com.purchasingpower.lahk.service;

/**
 * Writes an edited node label back into the source text.
 *
 * <p>Only the addressed {@code :}-separated segment changes. Its indentation, list-marker
 * prefix, leading keywords, inline markers and trailing comment are kept.
 *
 * @since 1.0.0
 */
public interface SourceEditService {

    /**
     * Rewrites one segment of a single physical line.
     *
     * @param lineText     original line
     * @param segmentIndex index of the segment within the line
     * @param newText      replacement label text
     * @return rewritten line
     * @throws com.purchasingpower.lahk.exception.NodeEditException if the segment does not exist
     *         or the new text would change the line's statement structure
     */
    String rewriteSegment(String lineText, int segmentIndex, String newText);

    /**
     * Applies {@link #rewriteSegment} to one line of a document.
     *
     * @return the full document with that line replaced
     * @throws com.purchasingpower.lahk.exception.NodeEditException if the line is out of range
     */
    String applyNodeTextEdit(String documentText, int line, int segmentIndex, String newText);
}
