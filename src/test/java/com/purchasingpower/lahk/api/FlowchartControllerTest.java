package com.purchasingpower.lahk.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for FlowchartController.
 *
 * Covers graph building, diagnostics and the node edit round trip over HTTP,
 * with the size limit from the test profile (4096 characters).
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class FlowchartControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private static final String DECISION_DOC =
            "do a\n: do b\n  dec c, d\n    else branch1\n    then b1b\n    else branch2\n  ii end1";

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    @Test
    void buildGraph_shouldReturnNodesAndEdges() throws Exception {
        // Given
        DocumentRequest request = new DocumentRequest();
        request.setText(DECISION_DOC);

        // When / Then
        mockMvc.perform(post("/api/v1/flowchart/graph")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.graph.nodes.length()").value(9))
            .andExpect(jsonPath("$.graph.edges.length()").value(9))
            .andExpect(jsonPath("$.graph.nodes[3].kind").value("DECISION"))
            .andExpect(jsonPath("$.graph.edges[3].label").value("c"))
            .andExpect(jsonPath("$.graph.endNodeId").value(8))
            .andExpect(jsonPath("$.validationErrors").isEmpty())
            .andExpect(jsonPath("$.summary").value("Graph valid ✓"));
    }

    @Test
    void buildGraph_shouldReportValidationErrors() throws Exception {
        DocumentRequest request = new DocumentRequest();
        request.setText("dec yes, no\nelse a\nelse b\nc");

        mockMvc.perform(post("/api/v1/flowchart/graph")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.validationErrors[0]").value("N  2 [Process] L2 has 0 outputs (expected ≥1)"))
            .andExpect(jsonPath("$.summary").value("1 graph error(s)"));
    }

    @Test
    void buildGraph_shouldRejectMissingText() throws Exception {
        mockMvc.perform(post("/api/v1/flowchart/graph")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Text is required"));
    }

    @Test
    void buildGraph_shouldRejectOversizedDocument() throws Exception {
        DocumentRequest request = new DocumentRequest();
        request.setText("a".repeat(5000));

        mockMvc.perform(post("/api/v1/flowchart/graph")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isPayloadTooLarge())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Document has 5000 characters (max is 4096)"));
    }

    @Test
    void diagnostics_shouldReturnLineRanges() throws Exception {
        DocumentRequest request = new DocumentRequest();
        request.setText("dec yes, no\nelse a\nelse b\nc");

        mockMvc.perform(post("/api/v1/flowchart/diagnostics")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.summary").value("1 graph error(s)"))
            .andExpect(jsonPath("$.diagnostics[0].startLine").value(1))
            .andExpect(jsonPath("$.diagnostics[0].endColumn").value(1000))
            .andExpect(jsonPath("$.diagnostics[0].severity").value("ERROR"));
    }

    @Test
    void diagnostics_shouldFlagOversizedDocumentAsParseError() throws Exception {
        DocumentRequest request = new DocumentRequest();
        request.setText("a".repeat(5000));

        mockMvc.perform(post("/api/v1/flowchart/diagnostics")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.summary").value("Parse error"));
    }

    @Test
    void dump_shouldReturnTextReport() throws Exception {
        // Given
        DumpRequest request = new DumpRequest();
        request.setText(DECISION_DOC);
        request.setName("decision.lahk");

        // When
        MvcResult result = mockMvc.perform(post("/api/v1/flowchart/dump")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andReturn();

        // Then
        DumpResponse response = objectMapper.readValue(
            result.getResponse().getContentAsString(), DumpResponse.class);
        assertThat(response.getDump())
            .startsWith("=== LAHK GRAPH DUMP ===\nDocument: decision.lahk\nTotal Nodes: 9\nTotal Edges: 9\n")
            .contains("N  3 [Decision    ] L  2 S 0 I 0 \"c, d\" // labels: [c, d]")
            .contains("N  3 -> N  4 [c]")
            .doesNotContain("=== VALIDATION ERRORS ===");
    }

    @Test
    void dump_shouldRejectOversizedDocument() throws Exception {
        DumpRequest request = new DumpRequest();
        request.setText("a".repeat(5000));

        mockMvc.perform(post("/api/v1/flowchart/dump")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isPayloadTooLarge())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void edit_shouldRewriteNodeText() throws Exception {
        // Given - rename the decision on line 2
        Map<String, Object> request = new HashMap<>();
        request.put("text", DECISION_DOC);
        request.put("line", 2);
        request.put("segmentIndex", 0);
        request.put("newText", "yes, no");

        // When
        MvcResult result = mockMvc.perform(post("/api/v1/flowchart/edit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andReturn();

        // Then
        EditResponse response = objectMapper.readValue(
            result.getResponse().getContentAsString(), EditResponse.class);
        assertThat(response.getText()).contains("\n  dec yes, no\n");
        assertThat(response.getText()).startsWith("do a\n: do b\n");
    }

    @Test
    void edit_shouldRejectDelimiterInNewText() throws Exception {
        Map<String, Object> request = new HashMap<>();
        request.put("text", "a\nb");
        request.put("line", 1);
        request.put("segmentIndex", 0);
        request.put("newText", "x: y");

        mockMvc.perform(post("/api/v1/flowchart/edit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void edit_shouldRejectUnknownLine() throws Exception {
        Map<String, Object> request = new HashMap<>();
        request.put("text", "a");
        request.put("line", 3);
        request.put("segmentIndex", 0);
        request.put("newText", "b");

        mockMvc.perform(post("/api/v1/flowchart/edit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid node line 3 for edit"));
    }
}
