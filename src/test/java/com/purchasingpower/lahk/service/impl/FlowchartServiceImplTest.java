package com.purchasingpower.lahk.service.impl;

import com.purchasingpower.lahk.configuration.LahkProperties;
import com.purchasingpower.lahk.exception.DocumentTooLargeException;
import com.purchasingpower.lahk.model.diagnostics.Diagnostic;
import com.purchasingpower.lahk.model.diagnostics.DiagnosticSeverity;
import com.purchasingpower.lahk.model.diagnostics.DiagnosticsReport;
import com.purchasingpower.lahk.model.graph.FlowGraph;
import com.purchasingpower.lahk.parser.GrammarResolver;
import com.purchasingpower.lahk.parser.Segmenter;
import com.purchasingpower.lahk.service.DiagnosticMapper;
import com.purchasingpower.lahk.service.FlowchartParserService;
import com.purchasingpower.lahk.service.validation.GraphValidatorImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("Flowchart Service Tests")
class FlowchartServiceImplTest {

    private LahkProperties properties;
    private DiagnosticMapper diagnosticMapper;
    private FlowchartServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new LahkProperties();
        properties.setMaxDocumentChars(200);
        diagnosticMapper = new DiagnosticMapper(properties);
        service = new FlowchartServiceImpl(
                new FlowchartParserServiceImpl(new Segmenter(), new GrammarResolver()),
                new GraphValidatorImpl(),
                diagnosticMapper,
                properties);
    }

    @Test
    @DisplayName("Should attach validation messages to the built graph")
    void testBuildGraph() {
        FlowGraph graph = service.buildGraph("dec yes, no\nelse a\nelse b\nc");

        assertEquals(6, graph.getNodes().size());
        assertThat(graph.getValidationErrors())
                .containsExactly("N  2 [Process] L2 has 0 outputs (expected ≥1)");
    }

    @Test
    @DisplayName("Should leave an empty error list for a valid graph")
    void testBuildValidGraph() {
        FlowGraph graph = service.buildGraph("a\nb");

        assertNotNull(graph.getValidationErrors());
        assertThat(graph.getValidationErrors()).isEmpty();
    }

    @Test
    @DisplayName("Should reject documents over the configured size")
    void testDocumentTooLarge() {
        String doc = "a".repeat(201);

        DocumentTooLargeException e = assertThrows(DocumentTooLargeException.class, () -> service.buildGraph(doc));
        assertEquals(201, e.getLength());
        assertEquals(200, e.getLimit());
        assertEquals("Document has 201 characters (max is 200)", e.getMessage());
    }

    @Test
    @DisplayName("Should map validation messages to line-wide diagnostics")
    void testDiagnose() {
        DiagnosticsReport report = service.diagnose("dec yes, no\nelse a\nelse b\nc");

        assertFalse(report.isParseFailed());
        assertFalse(report.isValid());
        assertEquals("1 graph error(s)", report.getSummary());
        Diagnostic diagnostic = report.getDiagnostics().get(0);
        assertEquals(1, diagnostic.getStartLine());
        assertEquals(0, diagnostic.getStartColumn());
        assertEquals(1, diagnostic.getEndLine());
        assertEquals(1000, diagnostic.getEndColumn());
        assertEquals(DiagnosticSeverity.ERROR, diagnostic.getSeverity());
    }

    @Test
    @DisplayName("Should report a valid document with the success summary")
    void testDiagnoseValid() {
        DiagnosticsReport report = service.diagnose("im name\nex greeting");

        assertTrue(report.isValid());
        assertEquals("Graph valid ✓", report.getSummary());
    }

    @Test
    @DisplayName("Should turn a parser failure into one document-wide diagnostic")
    void testDiagnoseParseFailure() {
        FlowchartParserService failingParser = mock(FlowchartParserService.class);
        when(failingParser.parse(anyString())).thenThrow(new IllegalStateException("boom"));
        FlowchartServiceImpl failing = new FlowchartServiceImpl(
                failingParser, new GraphValidatorImpl(), diagnosticMapper, properties);

        DiagnosticsReport report = failing.diagnose("a\nb\nc");

        assertTrue(report.isParseFailed());
        assertEquals("Parse error", report.getSummary());
        assertThat(report.getDiagnostics()).hasSize(1);
        Diagnostic diagnostic = report.getDiagnostics().get(0);
        assertEquals("Parse error: boom", diagnostic.getMessage());
        assertEquals(0, diagnostic.getStartLine());
        assertEquals(2, diagnostic.getEndLine());
        verify(failingParser).parse("a\nb\nc");
    }

    @Test
    @DisplayName("Should report an oversized document as a parse error diagnostic")
    void testDiagnoseTooLarge() {
        DiagnosticsReport report = service.diagnose("a".repeat(300));

        assertTrue(report.isParseFailed());
        assertThat(report.getDiagnostics().get(0).getMessage()).startsWith("Parse error: Document has 300");
    }

    @Test
    @DisplayName("Should use the configured diagnostic range and severity")
    void testConfiguredDiagnostics() {
        properties.getDiagnostics().setLineEndColumn(80);
        properties.getDiagnostics().setSeverity(DiagnosticSeverity.WARNING);

        Diagnostic diagnostic = service.diagnose("dec yes, no\nelse a\nelse b\nc").getDiagnostics().get(0);

        assertEquals(80, diagnostic.getEndColumn());
        assertEquals(DiagnosticSeverity.WARNING, diagnostic.getSeverity());
    }
}
