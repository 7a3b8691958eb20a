package com.purchasingpower.lahk.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.purchasingpower.lahk.configuration.LahkProperties;
import com.purchasingpower.lahk.exception.DocumentTooLargeException;
import com.purchasingpower.lahk.model.diagnostics.Diagnostic;
import com.purchasingpower.lahk.model.diagnostics.DiagnosticsReport;
import com.purchasingpower.lahk.model.graph.FlowGraph;
import com.purchasingpower.lahk.service.DiagnosticMapper;
import com.purchasingpower.lahk.service.FlowchartParserService;
import com.purchasingpower.lahk.service.FlowchartService;
import com.purchasingpower.lahk.service.validation.GraphValidator;
import com.purchasingpower.lahk.service.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FlowchartServiceImpl implements FlowchartService {

    private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

    private final FlowchartParserService parserService;
    private final GraphValidator graphValidator;
    private final DiagnosticMapper diagnosticMapper;
    private final LahkProperties properties;

    @Override
    public FlowGraph buildGraph(String documentText) {
        Preconditions.checkNotNull(documentText, "Document text cannot be null");
        if (documentText.length() > properties.getMaxDocumentChars()) {
            throw new DocumentTooLargeException(documentText.length(), properties.getMaxDocumentChars());
        }

        FlowGraph graph = parserService.parse(documentText);
        ValidationResult result = graphValidator.validate(graph.getNodes(), graph.getEdges());
        graph.setValidationErrors(result.getMessages());

        log.info("Built graph: {} nodes, {} edges, {}",
                graph.getNodes().size(), graph.getEdges().size(), result.getSummary());
        return graph;
    }

    @Override
    public DiagnosticsReport diagnose(String documentText) {
        Preconditions.checkNotNull(documentText, "Document text cannot be null");
        int lineCount = LINE_SPLITTER.splitToList(documentText).size();

        try {
            FlowGraph graph = buildGraph(documentText);
            List<Diagnostic> diagnostics = diagnosticMapper.toDiagnostics(graph.getValidationErrors(), lineCount);
            return DiagnosticsReport.builder()
                    .diagnostics(diagnostics)
                    .summary(diagnosticMapper.summarize(diagnostics.size()))
                    .parseFailed(false)
                    .build();
        } catch (RuntimeException e) {
            log.error("Failed to build graph for diagnostics", e);
            Diagnostic diagnostic = diagnosticMapper.documentWide("Parse error: " + e.getMessage(), lineCount);
            return DiagnosticsReport.builder()
                    .diagnostics(List.of(diagnostic))
                    .summary("Parse error")
                    .parseFailed(true)
                    .build();
        }
    }
}
