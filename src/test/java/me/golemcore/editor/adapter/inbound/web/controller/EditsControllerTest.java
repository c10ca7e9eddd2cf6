package me.golemcore.editor.adapter.inbound.web.controller;

import me.golemcore.editor.adapter.inbound.web.dto.CreateDocumentRequest;
import me.golemcore.editor.adapter.inbound.web.dto.EditRequest;
import me.golemcore.editor.domain.component.ToolComponent;
import me.golemcore.editor.domain.exception.DocumentNotFoundException;
import me.golemcore.editor.domain.model.CircuitState;
import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.EditPhase;
import me.golemcore.editor.domain.model.EditRunResult;
import me.golemcore.editor.domain.model.RunOutcome;
import me.golemcore.editor.domain.model.ToolExecutionStats;
import me.golemcore.editor.domain.service.EditRunService;
import me.golemcore.editor.domain.service.ToolRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EditsControllerTest {

    private static final DocumentState DOCUMENT = new DocumentState("doc-1", "greet.js", "javascript",
            "function greet() { return 'hello'; }");

    private EditRunService editRunService;
    private ToolRegistryService toolRegistry;
    private EditsController controller;

    @BeforeEach
    void setUp() {
        editRunService = mock(EditRunService.class);
        toolRegistry = mock(ToolRegistryService.class);
        controller = new EditsController(editRunService, toolRegistry);
    }

    // --- runs ---

    @Test
    void shouldRunEditAndMapResult() {
        EditRunResult result = EditRunResult.builder()
                .runId("run-1")
                .outcome(RunOutcome.SUCCESS_WITH_CHANGES)
                .finalPhase(EditPhase.COMPLETE)
                .finalDocument(DOCUMENT)
                .changesCount(1)
                .summary("Edit complete after 1 change(s)")
                .build();
        when(editRunService.runEdit("doc-1", "say hello")).thenReturn(result);

        StepVerifier.create(controller.runEdit(new EditRequest("doc-1", "say hello")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("run-1", response.getBody().getRunId());
                    assertEquals("SUCCESS_WITH_CHANGES", response.getBody().getOutcome());
                    assertEquals(DOCUMENT, response.getBody().getDocument());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateMissingDocument() {
        when(editRunService.runEdit("missing", "x")).thenThrow(new DocumentNotFoundException("missing"));

        StepVerifier.create(controller.runEdit(new EditRequest("missing", "x")))
                .expectError(DocumentNotFoundException.class)
                .verify();
    }

    // --- documents ---

    @Test
    void shouldCreateDocument() {
        when(editRunService.createDocument("greet.js", "javascript", DOCUMENT.content())).thenReturn(DOCUMENT);

        StepVerifier.create(controller.createDocument(
                new CreateDocumentRequest("greet.js", "javascript", DOCUMENT.content())))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals(DOCUMENT, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnDocument() {
        when(editRunService.getDocument("doc-1")).thenReturn(DOCUMENT);

        StepVerifier.create(controller.getDocument("doc-1"))
                .assertNext(response -> assertEquals(DOCUMENT, response.getBody()))
                .verifyComplete();
    }

    // --- tools ---

    @Test
    void shouldExposeToolStatsAndCircuits() {
        ToolExecutionStats stats = new ToolExecutionStats(4, 0.75, 12.5, Map.of("replace_in_file", 4L));
        Map<String, CircuitState> circuits = Map.of("replace_in_file",
                new CircuitState(3, Instant.parse("2026-03-01T12:00:00Z"), true));
        when(toolRegistry.getStats()).thenReturn(stats);
        when(toolRegistry.getCircuitStates()).thenReturn(circuits);

        StepVerifier.create(controller.getToolStats())
                .assertNext(response -> assertEquals(stats, response.getBody()))
                .verifyComplete();
        StepVerifier.create(controller.getCircuits())
                .assertNext(response -> assertEquals(circuits, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldResetCircuitOfKnownTool() {
        when(toolRegistry.getTool("replace_in_file")).thenReturn(mock(ToolComponent.class));

        StepVerifier.create(controller.resetCircuit("replace_in_file"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        verify(toolRegistry).resetCircuit("replace_in_file");
    }

    @Test
    void shouldReturnNotFoundForUnknownTool() {
        StepVerifier.create(controller.resetCircuit("delete_file"))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
        verify(toolRegistry, never()).resetCircuit("delete_file");
    }
}
