package com.purchasingpower.lahk.service.impl;

import com.purchasingpower.lahk.exception.NodeEditException;
import com.purchasingpower.lahk.parser.GrammarResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Source Edit Service Tests")
class SourceEditServiceImplTest {

    private SourceEditServiceImpl editService;

    @BeforeEach
    void setUp() {
        editService = new SourceEditServiceImpl(new GrammarResolver());
    }

    @Test
    @DisplayName("Should keep indentation, node key and comment")
    void testKeepsKeyAndComment() {
        assertEquals("    dec x, y # why", editService.rewriteSegment("    dec a, b # why", 0, "x, y"));
    }

    @Test
    @DisplayName("Should rewrite only the addressed segment of a line")
    void testSecondSegment() {
        assertEquals("a: do c", editService.rewriteSegment("a: do b", 1, "c"));
        assertEquals("z: do b", editService.rewriteSegment("a: do b", 0, "z"));
    }

    @Test
    @DisplayName("Should keep branch markers and inline markers")
    void testKeepsMarkers() {
        assertEquals("    else new loop", editService.rewriteSegment("    else step loop", 0, "new"));
        assertEquals("then ii joined", editService.rewriteSegment("then ii old", 0, "joined"));
    }

    @Test
    @DisplayName("Should keep a list bullet prefix")
    void testListPrefix() {
        assertEquals("- other", editService.rewriteSegment("- item", 0, "other"));
    }

    @Test
    @DisplayName("Should trim the replacement text")
    void testTrimsNewText() {
        assertEquals("do c", editService.rewriteSegment("do b", 0, "  c  "));
    }

    @Test
    @DisplayName("Should reject a segment index past the end of the line")
    void testSegmentOutOfRange() {
        NodeEditException e = assertThrows(NodeEditException.class,
                () -> editService.rewriteSegment("a: b", 2, "c"));
        assertEquals(2, e.getSegmentIndex());
    }

    @Test
    @DisplayName("Should reject replacement text that would split the statement")
    void testForbiddenCharacters() {
        assertThrows(NodeEditException.class, () -> editService.rewriteSegment("a", 0, "b: c"));
        assertThrows(NodeEditException.class, () -> editService.rewriteSegment("a", 0, "b\nc"));
        assertThrows(NodeEditException.class, () -> editService.rewriteSegment("do a", 0, "b # c"));
    }

    @Test
    @DisplayName("Should reject a negative segment index")
    void testNegativeSegment() {
        assertThrows(IllegalArgumentException.class, () -> editService.rewriteSegment("a", -1, "b"));
    }

    @Test
    @DisplayName("Should replace one line of a document and preserve its line breaks")
    void testApplyNodeTextEdit() {
        assertEquals("a\r\nz\nc", editService.applyNodeTextEdit("a\r\nb\nc", 1, 0, "z"));
    }

    @Test
    @DisplayName("Should reject a line outside the document")
    void testInvalidLine() {
        NodeEditException e = assertThrows(NodeEditException.class,
                () -> editService.applyNodeTextEdit("a\nb", 5, 0, "z"));
        assertEquals("Invalid node line 5 for edit", e.getMessage());
        assertEquals(5, e.getLine());
    }

    @Test
    @DisplayName("Should report the line when a segment cannot be mapped")
    void testUnmappableSegment() {
        NodeEditException e = assertThrows(NodeEditException.class,
                () -> editService.applyNodeTextEdit("a\nb", 1, 3, "z"));
        assertThat(e.getMessage()).startsWith("Could not map node back to source line: ");
        assertEquals(1, e.getLine());
        assertEquals(3, e.getSegmentIndex());
    }
}
