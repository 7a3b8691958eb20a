package com.purchasingpower.lahk.api;

import com.purchasingpower.lahk.exception.DocumentTooLargeException;
import com.purchasingpower.lahk.exception.NodeEditException;
import com.purchasingpower.lahk.model.diagnostics.DiagnosticsReport;
import com.purchasingpower.lahk.model.graph.FlowGraph;
import com.purchasingpower.lahk.service.DiagnosticMapper;
import com.purchasingpower.lahk.service.FlowchartService;
import com.purchasingpower.lahk.service.GraphDumpService;
import com.purchasingpower.lahk.service.SourceEditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the flowchart compiler.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/flowchart")
@RequiredArgsConstructor
public class FlowchartController {

    private final FlowchartService flowchartService;
    private final SourceEditService sourceEditService;
    private final DiagnosticMapper diagnosticMapper;
    private final GraphDumpService graphDumpService;

    /**
     * Parse and validate a document.
     *
     * POST /api/v1/flowchart/graph
     */
    @PostMapping("/graph")
    public ResponseEntity<GraphResponse> graph(@RequestBody DocumentRequest request) {
        try {
            if (request.getText() == null) {
                return ResponseEntity.badRequest()
                    .body(GraphResponse.error("Text is required"));
            }

            FlowGraph graph = flowchartService.buildGraph(request.getText());
            String summary = diagnosticMapper.summarize(graph.getValidationErrors().size());
            return ResponseEntity.ok(GraphResponse.success(graph, summary));

        } catch (DocumentTooLargeException e) {
            log.warn("Rejected document: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(GraphResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Graph build failed", e);
            return ResponseEntity.internalServerError()
                .body(GraphResponse.error("Parse error: " + e.getMessage()));
        }
    }

    /**
     * Diagnostics for a document.
     *
     * POST /api/v1/flowchart/diagnostics
     */
    @PostMapping("/diagnostics")
    public ResponseEntity<DiagnosticsResponse> diagnostics(@RequestBody DocumentRequest request) {
        if (request.getText() == null) {
            return ResponseEntity.badRequest()
                .body(DiagnosticsResponse.error("Text is required"));
        }

        DiagnosticsReport report = flowchartService.diagnose(request.getText());
        log.info("Diagnostics: {}", report.getSummary());
        return ResponseEntity.ok(DiagnosticsResponse.builder()
            .success(!report.isParseFailed())
            .summary(report.getSummary())
            .diagnostics(report.getDiagnostics())
            .build());
    }

    /**
     * Text report of the graph for debugging.
     *
     * POST /api/v1/flowchart/dump
     */
    @PostMapping("/dump")
    public ResponseEntity<DumpResponse> dump(@RequestBody DumpRequest request) {
        try {
            if (request.getText() == null) {
                return ResponseEntity.badRequest()
                    .body(DumpResponse.error("Text is required"));
            }

            String dump = graphDumpService.dump(request.getText(), request.getName());
            return ResponseEntity.ok(DumpResponse.success(dump));

        } catch (DocumentTooLargeException e) {
            log.warn("Rejected document: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(DumpResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Graph dump failed", e);
            return ResponseEntity.internalServerError()
                .body(DumpResponse.error("Parse error: " + e.getMessage()));
        }
    }

    /**
     * Write an edited node label back into the document.
     *
     * POST /api/v1/flowchart/edit
     */
    @PostMapping("/edit")
    public ResponseEntity<EditResponse> edit(@RequestBody EditRequest request) {
        try {
            if (request.getText() == null || request.getNewText() == null
                    || request.getLine() == null || request.getSegmentIndex() == null) {
                return ResponseEntity.badRequest()
                    .body(EditResponse.error("text, line, segmentIndex and newText are required"));
            }

            String edited = sourceEditService.applyNodeTextEdit(
                request.getText(), request.getLine(), request.getSegmentIndex(), request.getNewText());
            return ResponseEntity.ok(EditResponse.success(edited));

        } catch (NodeEditException | IllegalArgumentException e) {
            log.warn("Edit rejected: {}", e.getMessage());
            return ResponseEntity.badRequest()
                .body(EditResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Edit failed", e);
            return ResponseEntity.internalServerError()
                .body(EditResponse.error("Edit failed: " + e.getMessage()));
        }
    }
}
