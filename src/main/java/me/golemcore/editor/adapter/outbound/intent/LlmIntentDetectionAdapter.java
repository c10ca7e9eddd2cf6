package me.golemcore.editor.adapter.outbound.intent;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.domain.model.EditComplexity;
import me.golemcore.editor.domain.model.IntentDecision;
import me.golemcore.editor.domain.model.LlmRequest;
import me.golemcore.editor.domain.model.LlmResponse;
import me.golemcore.editor.domain.model.Message;
import me.golemcore.editor.infrastructure.config.EditorProperties;
import me.golemcore.editor.port.outbound.IntentDetectionPort;
import me.golemcore.editor.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the oracle whether an instruction requires editing the document.
 *
 * <p>
 * The oracle answers with a small JSON object. Fenced or chatty answers are
 * tolerated by extracting the first JSON object from the text. Any failure
 * (timeout, transport error, unreadable answer) yields a no-edit decision
 * with zero confidence, so the run ends without touching the document.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmIntentDetectionAdapter implements IntentDetectionPort {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final int MAX_INSTRUCTION_CHARS = 2000;

    private static final String SYSTEM_PROMPT = """
            You decide whether a user instruction asks for changes to a document.

            Respond ONLY with valid JSON (no markdown, no explanation):

            {"edit": true, "confidence": 0.9, "goal": "Short imperative description of the change", "complexity": "simple"}

            - "edit": true when the instruction asks to create, change, fix, add, remove or rewrite content
            - "confidence": 0.0 to 1.0
            - "goal": the edit goal rephrased as one imperative sentence (omit when edit is false)
            - "complexity": one of "trivial", "simple", "moderate", "complex"
            """;

    private final LlmPort llmPort;
    private final EditorProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public IntentDecision detect(String instruction, String documentSummary) {
        String prompt = "## Document\n" + documentSummary + "\n## Instruction\n" + truncate(instruction);
        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .temperature(properties.getLlm().getIntentTemperature())
                .messages(List.of(Message.system(SYSTEM_PROMPT), Message.user(prompt)))
                .build();

        long timeoutMs = properties.getLoop().getIntentTimeoutMs();
        try {
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            IntentDecision decision = parse(response != null ? response.getContent() : null);
            log.info("[Intent] edit={}, confidence={}, complexity={}", decision.shouldEdit(),
                    String.format("%.2f", decision.confidence()), decision.complexity());
            return decision;
        } catch (TimeoutException e) {
            log.warn("[Intent] Detection timed out after {}ms", timeoutMs);
            return IntentDecision.noEdit(0.0);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Intent] Detection failed: {}", cause.getMessage());
            return IntentDecision.noEdit(0.0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Intent] Detection interrupted");
            return IntentDecision.noEdit(0.0);
        }
    }

    IntentDecision parse(String response) {
        String json = extractJson(response);
        if (json == null) {
            log.warn("[Intent] No JSON object in response");
            return IntentDecision.noEdit(0.0);
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            boolean edit = node.path("edit").asBoolean(false);
            double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.0)));
            if (!edit) {
                return IntentDecision.noEdit(confidence);
            }
            String goal = node.hasNonNull("goal") ? node.get("goal").asText().strip() : null;
            EditComplexity complexity = node.hasNonNull("complexity")
                    ? EditComplexity.fromWireName(node.get("complexity").asText())
                    : null;
            return new IntentDecision(true, confidence, goal, complexity);
        } catch (IOException e) {
            log.warn("[Intent] Unreadable JSON: {}", e.getMessage());
            return IntentDecision.noEdit(0.0);
        }
    }

    private static String extractJson(String response) {
        if (response == null || response.isBlank()) {
            return null;
        }
        Matcher fenced = FENCED_JSON.matcher(response);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        return start >= 0 && end > start ? response.substring(start, end + 1) : null;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_INSTRUCTION_CHARS ? text.substring(0, MAX_INSTRUCTION_CHARS) + "..." : text;
    }
}
