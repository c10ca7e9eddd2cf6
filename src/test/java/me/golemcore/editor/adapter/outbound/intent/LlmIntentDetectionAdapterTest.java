package me.golemcore.editor.adapter.outbound.intent;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.editor.domain.model.EditComplexity;
import me.golemcore.editor.domain.model.IntentDecision;
import me.golemcore.editor.domain.model.LlmRequest;
import me.golemcore.editor.domain.model.LlmResponse;
import me.golemcore.editor.infrastructure.config.EditorProperties;
import me.golemcore.editor.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmIntentDetectionAdapterTest {

    private LlmPort llmPort;
    private EditorProperties properties;
    private LlmIntentDetectionAdapter adapter;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new EditorProperties();
        properties.getLlm().setModel("openai/gpt-4o-mini");
        properties.getLoop().setIntentTimeoutMs(200);
        adapter = new LlmIntentDetectionAdapter(llmPort, properties, new ObjectMapper());
    }

    // --- detect ---

    @Test
    void shouldDetectEditIntentFromJsonAnswer() {
        when(llmPort.chat(any())).thenReturn(reply(
                "{\"edit\": true, \"confidence\": 0.92, \"goal\": \" Rename greet to welcome \", \"complexity\": \"trivial\"}"));

        IntentDecision decision = adapter.detect("rename greet to welcome", "greet.js (js, 3 lines)");

        assertTrue(decision.shouldEdit());
        assertEquals(0.92, decision.confidence(), 1e-9);
        assertEquals("Rename greet to welcome", decision.goal());
        assertEquals(EditComplexity.TRIVIAL, decision.complexity());
    }

    @Test
    void shouldSendDocumentSummaryAndInstruction() {
        when(llmPort.chat(any())).thenReturn(reply("{\"edit\": false, \"confidence\": 0.8}"));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        adapter.detect("what is this?", "notes.md (markdown, 1 lines)");

        verify(llmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals("openai/gpt-4o-mini", request.getModel());
        assertEquals(0.3, request.getTemperature(), 1e-9);
        assertTrue(request.getMessages().get(0).isSystemMessage());
        assertEquals("## Document\nnotes.md (markdown, 1 lines)\n## Instruction\nwhat is this?",
                request.getMessages().get(1).getContent());
    }

    @Test
    void shouldReturnNoEditWhenOracleTimesOut() {
        when(llmPort.chat(any())).thenReturn(new CompletableFuture<>());

        IntentDecision decision = adapter.detect("rename", "doc");

        assertFalse(decision.shouldEdit());
        assertEquals(0.0, decision.confidence());
    }

    @Test
    void shouldReturnNoEditWhenOracleFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("429")));

        IntentDecision decision = adapter.detect("rename", "doc");

        assertFalse(decision.shouldEdit());
    }

    // --- parse ---

    @Test
    void shouldExtractFencedJson() {
        IntentDecision decision = adapter.parse("""
                Sure!
                ```json
                {"edit": true, "confidence": 0.7, "goal": "Add a footer"}
                ```""");

        assertTrue(decision.shouldEdit());
        assertEquals("Add a footer", decision.goal());
        assertNull(decision.complexity());
    }

    @Test
    void shouldClampConfidenceAndIgnoreUnknownComplexity() {
        IntentDecision decision = adapter.parse(
                "Answer: {\"edit\": true, \"confidence\": 1.7, \"complexity\": \"huge\"} hope that helps");

        assertEquals(1.0, decision.confidence());
        assertNull(decision.complexity());
        assertNull(decision.goal());
    }

    @Test
    void shouldKeepConfidenceOfNegativeAnswer() {
        IntentDecision decision = adapter.parse("{\"edit\": false, \"confidence\": 0.85, \"goal\": \"ignored\"}");

        assertFalse(decision.shouldEdit());
        assertEquals(0.85, decision.confidence(), 1e-9);
        assertNull(decision.goal());
    }

    @Test
    void shouldTreatUnreadableAnswerAsNoEdit() {
        assertFalse(adapter.parse("I think you want an edit.").shouldEdit());
        assertFalse(adapter.parse("{not json}").shouldEdit());
        assertFalse(adapter.parse(null).shouldEdit());
    }

    private static CompletableFuture<LlmResponse> reply(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }
}
