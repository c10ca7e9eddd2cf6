package me.golemcore.editor.domain.loop;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.domain.exception.OracleUnavailableException;
import me.golemcore.editor.domain.model.Checkpoint;
import me.golemcore.editor.domain.model.CompletionVerdict;
import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.EditComplexity;
import me.golemcore.editor.domain.model.EditEventType;
import me.golemcore.editor.domain.model.EditGoal;
import me.golemcore.editor.domain.model.EditPhase;
import me.golemcore.editor.domain.model.EditRunResult;
import me.golemcore.editor.domain.model.GoalStatus;
import me.golemcore.editor.domain.model.IntentDecision;
import me.golemcore.editor.domain.model.IterationRecord;
import me.golemcore.editor.domain.model.LlmChunk;
import me.golemcore.editor.domain.model.LlmRequest;
import me.golemcore.editor.domain.model.LlmResponse;
import me.golemcore.editor.domain.model.Message;
import me.golemcore.editor.domain.model.ParseResult;
import me.golemcore.editor.domain.model.RunOutcome;
import me.golemcore.editor.domain.model.SubGoal;
import me.golemcore.editor.domain.model.ToolContext;
import me.golemcore.editor.domain.model.ToolInvocation;
import me.golemcore.editor.domain.model.ToolResult;
import me.golemcore.editor.domain.model.VerificationResult;
import me.golemcore.editor.domain.parser.ToolInvocationParser;
import me.golemcore.editor.domain.service.CheckpointManager;
import me.golemcore.editor.domain.service.CompletionDetector;
import me.golemcore.editor.domain.service.ComplexityEstimator;
import me.golemcore.editor.domain.service.EditEventPublisher;
import me.golemcore.editor.domain.service.EditPromptBuilder;
import me.golemcore.editor.domain.service.EditVerifier;
import me.golemcore.editor.domain.service.GoalPlanner;
import me.golemcore.editor.domain.service.RationaleExtractor;
import me.golemcore.editor.domain.service.ToolFailureGuidance;
import me.golemcore.editor.domain.service.ToolRegistryService;
import me.golemcore.editor.domain.service.TranscriptTrimmer;
import me.golemcore.editor.port.outbound.IntentDetectionPort;
import me.golemcore.editor.port.outbound.LlmPort;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Autonomous edit loop.
 *
 * <p>
 * One run moves through {@code IDLE -> DETECTING -> PLANNING -> EXECUTING}
 * and ends in {@code COMPLETE}, {@code BLOCKED} or {@code ERROR}. Each
 * iteration asks the oracle for one tool call, evaluates completion on the
 * raw response, executes the call through the registry and, when the
 * document changed, verifies and checkpoints the new state. Tool and parse
 * failures are fed back to the oracle as corrective guidance; only an
 * unreachable oracle ends the run in {@code ERROR}.
 *
 * <p>
 * A run is single-threaded and owns its document state. Instances are
 * stateless between runs and may serve concurrent runs.
 */
@Slf4j
public class EditOrchestrator {

    private static final int SUMMARY_PREVIEW_LINES = 20;

    private final LlmPort llmPort;
    private final IntentDetectionPort intentDetection;
    private final ToolRegistryService toolRegistry;
    private final ToolInvocationParser parser;
    private final CompletionDetector completionDetector;
    private final GoalPlanner goalPlanner;
    private final EditVerifier verifier;
    private final EditPromptBuilder promptBuilder;
    private final EditEventPublisher events;
    private final EditLoopConfig config;
    private final TranscriptTrimmer transcriptTrimmer;
    private final Clock clock;

    public EditOrchestrator(LlmPort llmPort, IntentDetectionPort intentDetection, ToolRegistryService toolRegistry,
            ToolInvocationParser parser, CompletionDetector completionDetector, GoalPlanner goalPlanner,
            EditVerifier verifier, EditPromptBuilder promptBuilder, EditEventPublisher events,
            EditLoopConfig config) {
        this(llmPort, intentDetection, toolRegistry, parser, completionDetector, goalPlanner, verifier,
                promptBuilder, events, config, Clock.systemUTC());
    }

    // Visible for testing
    public EditOrchestrator(LlmPort llmPort, IntentDetectionPort intentDetection, ToolRegistryService toolRegistry,
            ToolInvocationParser parser, CompletionDetector completionDetector, GoalPlanner goalPlanner,
            EditVerifier verifier, EditPromptBuilder promptBuilder, EditEventPublisher events,
            EditLoopConfig config, Clock clock) {
        this.llmPort = llmPort;
        this.intentDetection = intentDetection;
        this.toolRegistry = toolRegistry;
        this.parser = parser;
        this.completionDetector = completionDetector;
        this.goalPlanner = goalPlanner;
        this.verifier = verifier;
        this.promptBuilder = promptBuilder;
        this.events = events;
        this.config = config != null ? config : EditLoopConfig.defaults();
        this.transcriptTrimmer = new TranscriptTrimmer(this.config.getTranscriptMaxMessages(),
                this.config.getTranscriptKeepRecent());
        this.clock = clock;
    }

    // ==================== Entry points ====================

    /**
     * Runs intent detection for the instruction and, when an edit is
     * warranted, the full edit loop.
     */
    public EditRunResult run(String instruction, DocumentState document) {
        String runId = UUID.randomUUID().toString();
        long startMs = clock.millis();
        log.info("[EditLoop] Run {} started for document '{}'", runId, document.displayName());
        events.emit(runId, document.id(), null, EditEventType.START, Map.of("instruction", instruction));

        phase(runId, document, EditPhase.DETECTING);
        IntentDecision decision;
        try {
            decision = intentDetection.detect(instruction, documentSummary(document));
        } catch (RuntimeException e) {
            log.error("[EditLoop] Intent detection failed for run {}: {}", runId, e.getMessage(), e);
            return errorResult(runId, null, document, List.of(), List.of(), startMs,
                    "Intent detection failed: " + e.getMessage());
        }

        if (decision == null || !decision.shouldEdit() || decision.confidence() <= config.getIntentThreshold()) {
            double confidence = decision != null ? decision.confidence() : 0.0;
            log.info("[EditLoop] Run {}: no edit intended (confidence {})", runId, confidence);
            EditRunResult result = EditRunResult.builder()
                    .runId(runId)
                    .outcome(RunOutcome.NO_EDIT_INTENDED)
                    .finalPhase(EditPhase.COMPLETE)
                    .originalDocument(document)
                    .finalDocument(document)
                    .summary("No edit intended")
                    .durationMs(clock.millis() - startMs)
                    .build();
            events.emit(runId, document.id(), null, EditEventType.COMPLETE,
                    Map.of("outcome", result.getOutcome().name(), "confidence", confidence));
            return result;
        }

        String description = decision.goal() != null && !decision.goal().isBlank() ? decision.goal() : instruction;
        EditComplexity complexity = decision.complexity() != null
                ? decision.complexity()
                : ComplexityEstimator.estimate(description, document.content());
        return execute(runId, EditGoal.of(description, complexity), document, startMs);
    }

    /**
     * Runs the edit loop for an already decided goal, skipping detection.
     */
    public EditRunResult run(EditGoal goal, DocumentState document) {
        String runId = UUID.randomUUID().toString();
        long startMs = clock.millis();
        log.info("[EditLoop] Run {} started for document '{}'", runId, document.displayName());
        events.emit(runId, document.id(), null, EditEventType.START, Map.of("goal", goal.getDescription()));
        return execute(runId, goal, document, startMs);
    }

    // ==================== Loop ====================

    private EditRunResult execute(String runId, EditGoal goal, DocumentState document, long startMs) {
        phase(runId, document, EditPhase.PLANNING);
        List<SubGoal> subGoals = goalPlanner.plan(goal);
        events.emit(runId, document.id(), null, EditEventType.PLAN, Map.of(
                "complexity", goal.getComplexity().wireName(),
                "subGoals", subGoals.stream().map(SubGoal::getDescription).toList()));
        log.debug("[EditLoop] Run {} planned {} sub-goal(s), complexity {}", runId, subGoals.size(),
                goal.getComplexity());

        RunState run = new RunState(runId, goal, document, subGoals, startMs + config.getTotalTimeoutMs(),
                config.isEnableCheckpoints() ? new CheckpointManager(config.getMaxCheckpoints(), clock) : null);
        run.transcript.add(Message.system(promptBuilder.systemPrompt(goal, document)));
        checkpoint(run, 0, "Initial state");

        phase(runId, document, EditPhase.EXECUTING);
        try {
            while (run.iteration < config.getMaxIterations()) {
                if (deadlineExceeded(run)) {
                    return finish(run, EditPhase.BLOCKED, "Total timeout exceeded", startMs);
                }
                Optional<EditRunResult> result = iterate(run, startMs);
                if (result.isPresent()) {
                    return result.get();
                }
                run.transcript = transcriptTrimmer.trim(run.transcript);
                run.iteration++;
            }
            return finish(run, EditPhase.BLOCKED,
                    "Max iterations (" + config.getMaxIterations() + ") reached without completion", startMs);
        } catch (OracleUnavailableException e) {
            log.error("[EditLoop] Run {} aborted: {}", runId, e.getMessage(), e);
            return errorResult(runId, goal, run.current, run.records, checkpoints(run), startMs, e.getMessage(),
                    run);
        }
    }

    private Optional<EditRunResult> iterate(RunState run, long startMs) {
        int step = run.iteration;
        long iterationStart = clock.millis();
        GoalPlanner.updateProgress(run.subGoals, run.changes, false);
        events.emit(run.runId, run.current.id(), step, EditEventType.ITERATION_START,
                Map.of("maxIterations", config.getMaxIterations(), "changes", run.changes));

        run.transcript.add(Message.user(promptBuilder.iterationPrompt(EditPromptBuilder.IterationContext.builder()
                .iteration(step)
                .maxIterations(config.getMaxIterations())
                .changesApplied(run.changes)
                .goal(run.goal)
                .subGoals(run.subGoals)
                .original(run.original)
                .current(run.current)
                .lastToolName(run.lastToolName)
                .lastResult(run.lastResult)
                .lastVerification(run.lastVerification)
                .focus(run.focus)
                .build())));

        OracleReply reply = callOracle(run);
        String text = reply.text();
        String rationale = RationaleExtractor.extract(text);
        if (!text.isBlank()) {
            run.transcript.add(Message.assistant(text));
        }
        events.emit(run.runId, run.current.id(), step, EditEventType.THINKING, Map.of("rationale", rationale));

        ParseResult parsed;
        if (reply.timedOut()) {
            parsed = acceptPartial(text);
            if (parsed == null) {
                record(run, IterationRecord.builder().step(step).rationale(rationale)
                        .durationMs(clock.millis() - iterationStart).status(GoalStatus.BLOCKED)
                        .note("Oracle timed out without a usable response"));
                return Optional.of(finish(run, EditPhase.BLOCKED, "Oracle timed out", startMs));
            }
            log.warn("[EditLoop] Run {} accepting partial oracle response at iteration {}", run.runId, step);
        } else {
            parsed = parser.parse(text);
        }

        if (deadlineExceeded(run)) {
            record(run, IterationRecord.builder().step(step).rationale(rationale)
                    .durationMs(clock.millis() - iterationStart).status(GoalStatus.BLOCKED)
                    .note("Total timeout exceeded"));
            return Optional.of(finish(run, EditPhase.BLOCKED, "Total timeout exceeded", startMs));
        }
        if (parsed.hasCorrections()) {
            log.debug("[EditLoop] Parse corrections: {}", parsed.corrections());
        }

        String contentAtEvaluation = run.current.content();
        CompletionVerdict verdict = completionDetector.evaluate(parser.prose(text), parsed.isSuccess(), run.changes,
                step, run.previousContent, contentAtEvaluation);
        run.previousContent = contentAtEvaluation;
        log.debug("[EditLoop] Iteration {} verdict: {} ({})", step, verdict.reason(),
                String.format("%.2f", verdict.confidence()));

        IterationRecord.IterationRecordBuilder record = IterationRecord.builder()
                .step(step)
                .rationale(rationale)
                .verdict(verdict)
                .parseCorrections(parsed.corrections());

        if (verdict.complete()) {
            if (parsed.isSuccess()) {
                applyTool(run, parsed, record);
            }
            record(run, record.durationMs(clock.millis() - iterationStart).status(GoalStatus.ACHIEVED));
            return Optional.of(finish(run, EditPhase.COMPLETE, verdict.reason(), startMs));
        }

        if (verdict.rejected() && !parsed.isSuccess()) {
            log.info("[EditLoop] Run {} rejected premature completion claim", run.runId);
            run.transcript.add(Message.user(ToolFailureGuidance.forPrematureClaim(run.current)));
            record(run, record.durationMs(clock.millis() - iterationStart).status(GoalStatus.IN_PROGRESS)
                    .note(verdict.reason()));
            return Optional.empty();
        }

        if (!parsed.isSuccess()) {
            record.durationMs(clock.millis() - iterationStart).note(parsed.failureReason());
            if (run.changes == 0) {
                log.warn("[EditLoop] Run {} blocked: {}", run.runId, parsed.failureReason());
                record(run, record.status(GoalStatus.BLOCKED));
                return Optional.of(finish(run, EditPhase.BLOCKED,
                        "No tool call could be parsed: " + parsed.failureReason(), startMs));
            }
            record(run, record.status(GoalStatus.ACHIEVED));
            return Optional.of(finish(run, EditPhase.COMPLETE,
                    "Oracle stopped calling tools after " + run.changes + " change(s)", startMs));
        }

        ToolResult result = applyTool(run, parsed, record);
        if (!result.isSuccess()) {
            run.transcript.add(Message.user(ToolFailureGuidance.forFailure(result, run.current)));
        }
        record(run, record.durationMs(clock.millis() - iterationStart).status(GoalStatus.IN_PROGRESS));
        return Optional.empty();
    }

    // ==================== Tool execution ====================

    private ToolResult applyTool(RunState run, ParseResult parsed, IterationRecord.IterationRecordBuilder record) {
        ToolInvocation invocation = parsed.invocation();
        int step = run.iteration;
        Map<String, Object> callPayload = new LinkedHashMap<>();
        callPayload.put("tool", invocation.toolName());
        callPayload.put("parameters", invocation.parameters().keySet());
        callPayload.put("confidence", parsed.confidence());
        events.emit(run.runId, run.current.id(), step, EditEventType.TOOL_CALL, callPayload);

        ToolResult result = toolRegistry.execute(invocation.toolName(), invocation.parameters(),
                new ToolContext(run.runId, run.current));
        run.lastToolName = invocation.toolName();
        run.lastResult = result;
        run.lastVerification = null;
        if (invocation instanceof ToolInvocation.Patch patch && !patch.blocks().isEmpty()) {
            run.focus = patch.blocks().get(0).search();
        } else if (invocation instanceof ToolInvocation.Search search) {
            run.focus = search.pattern();
        }
        record.invocation(invocation).toolResult(result);

        Map<String, Object> resultPayload = new LinkedHashMap<>();
        resultPayload.put("tool", invocation.toolName());
        resultPayload.put("success", result.isSuccess());
        resultPayload.put("message", result.getMessage());
        resultPayload.put("attempts", result.getAttempts());
        resultPayload.put("failureKind", result.getFailureKind() != null ? result.getFailureKind().name() : null);
        events.emit(run.runId, run.current.id(), step, EditEventType.TOOL_RESULT, resultPayload);

        if (!result.isSuccess()) {
            log.info("[EditLoop] Iteration {}: {} failed: {}", step, invocation.toolName(), result.getMessage());
            return result;
        }
        if (!result.hasNewContent() || result.getNewContent().equals(run.current.content())) {
            return result;
        }

        DocumentState before = run.current;
        run.current = before.withContent(result.getNewContent());
        run.changes++;
        VerificationResult verification = verifier.verify(before.content(), run.current.content(),
                run.goal.getDescription(), run.current.language(), run.goal.getComplexity());
        run.lastVerification = verification;
        record.verification(verification);
        log.info("[EditLoop] Iteration {}: {} applied ({}), change #{}", step, invocation.toolName(),
                verification.getDiffSummary(), run.changes);

        events.emit(run.runId, run.current.id(), step, EditEventType.CONTENT_CHANGE, Map.of(
                "content", run.current.content(),
                "diff", verification.getDiffSummary()));
        events.emit(run.runId, run.current.id(), step, EditEventType.VERIFICATION, Map.of(
                "confidence", verification.getConfidence(),
                "syntaxValid", verification.isSyntaxValid(),
                "warnings", verification.getWarnings()));
        checkpoint(run, step, "After " + invocation.toolName());
        return result;
    }

    private ParseResult acceptPartial(String text) {
        if (text.isBlank()) {
            return null;
        }
        if (PartialResponseRecovery.isTruncatedOverwrite(text)) {
            return PartialResponseRecovery.completeOverwrite(text)
                    .map(parser::parse)
                    .filter(ParseResult::isSuccess)
                    .orElse(null);
        }
        ParseResult parsed = parser.parse(text);
        return parsed.isSuccess() ? parsed : null;
    }

    // ==================== Oracle ====================

    private OracleReply callOracle(RunState run) {
        int retries = 0;
        while (true) {
            long remaining = run.deadlineMs - clock.millis();
            long timeoutMs = Math.max(1, Math.min(config.getIterationTimeoutMs(), remaining));
            LlmRequest request = LlmRequest.builder()
                    .model(config.getModel())
                    .messages(new ArrayList<>(run.transcript))
                    .temperature(config.getTemperature())
                    .build();
            try {
                OracleReply reply = config.isStreamResponses() && llmPort.supportsStreaming()
                        ? stream(request, timeoutMs)
                        : complete(request, timeoutMs);
                if (reply.text().isBlank() && !reply.timedOut() && retries < config.getOracleRetries()) {
                    retries++;
                    log.warn("[EditLoop] Empty oracle response, retrying ({}/{})", retries,
                            config.getOracleRetries());
                    continue;
                }
                return reply;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OracleUnavailableException("Oracle call interrupted", e);
            } catch (ExecutionException | RuntimeException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                if (retries < config.getOracleRetries()) {
                    retries++;
                    log.warn("[EditLoop] Oracle call failed, retrying ({}/{}): {}", retries,
                            config.getOracleRetries(), cause.getMessage());
                    continue;
                }
                throw new OracleUnavailableException("Oracle call failed: " + cause.getMessage(), cause);
            }
        }
    }

    private OracleReply complete(LlmRequest request, long timeoutMs)
            throws InterruptedException, ExecutionException {
        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        try {
            LlmResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return new OracleReply(response != null && response.getContent() != null ? response.getContent() : "",
                    false);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[EditLoop] Oracle call timed out after {}ms", timeoutMs);
            return new OracleReply("", true);
        }
    }

    private OracleReply stream(LlmRequest request, long timeoutMs) {
        StringBuffer buffer = new StringBuffer();
        AtomicBoolean completed = new AtomicBoolean();
        llmPort.chatStream(request)
                .doOnNext(chunk -> appendChunk(buffer, chunk))
                .doOnComplete(() -> completed.set(true))
                .take(Duration.ofMillis(timeoutMs))
                .blockLast();
        if (!completed.get()) {
            log.warn("[EditLoop] Oracle stream cut off after {}ms with {} chars", timeoutMs, buffer.length());
        }
        return new OracleReply(buffer.toString(), !completed.get());
    }

    private static void appendChunk(StringBuffer buffer, LlmChunk chunk) {
        if (chunk != null && chunk.getText() != null) {
            buffer.append(chunk.getText());
        }
    }

    // ==================== Results ====================

    private EditRunResult finish(RunState run, EditPhase phase, String reason, long startMs) {
        boolean complete = phase == EditPhase.COMPLETE;
        RunOutcome outcome = complete && run.changes > 0 ? RunOutcome.SUCCESS_WITH_CHANGES : RunOutcome.BLOCKED;
        GoalPlanner.updateProgress(run.subGoals, run.changes, outcome == RunOutcome.SUCCESS_WITH_CHANGES);
        phase(run.runId, run.current, phase);

        String summary = outcome == RunOutcome.SUCCESS_WITH_CHANGES
                ? "Applied " + run.changes + " change(s) in " + run.records.size() + " iteration(s): " + reason
                : reason;
        EditRunResult result = EditRunResult.builder()
                .runId(run.runId)
                .outcome(outcome)
                .finalPhase(phase)
                .goal(run.goal)
                .subGoals(List.copyOf(run.subGoals))
                .originalDocument(run.original)
                .finalDocument(run.current)
                .iterations(List.copyOf(run.records))
                .checkpoints(checkpoints(run))
                .changesCount(run.changes)
                .summary(summary)
                .durationMs(clock.millis() - startMs)
                .build();

        log.info("[EditLoop] Run {} finished: {} after {} iteration(s), {} change(s) - {}", run.runId, outcome,
                run.records.size(), run.changes, reason);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("outcome", outcome.name());
        payload.put("changes", run.changes);
        payload.put("summary", summary);
        events.emit(run.runId, run.current.id(), null, EditEventType.COMPLETE, payload);
        return result;
    }

    private EditRunResult errorResult(String runId, EditGoal goal, DocumentState document,
            List<IterationRecord> records, List<Checkpoint> checkpoints, long startMs, String message) {
        return errorResult(runId, goal, document, records, checkpoints, startMs, message, null);
    }

    private EditRunResult errorResult(String runId, EditGoal goal, DocumentState document,
            List<IterationRecord> records, List<Checkpoint> checkpoints, long startMs, String message,
            RunState run) {
        phase(runId, document, EditPhase.ERROR);
        events.emit(runId, document.id(), null, EditEventType.ERROR, Map.of("message", message));
        return EditRunResult.builder()
                .runId(runId)
                .outcome(RunOutcome.ERROR)
                .finalPhase(EditPhase.ERROR)
                .goal(goal)
                .subGoals(run != null ? List.copyOf(run.subGoals) : List.of())
                .originalDocument(run != null ? run.original : document)
                .finalDocument(document)
                .iterations(List.copyOf(records))
                .checkpoints(checkpoints)
                .changesCount(run != null ? run.changes : 0)
                .summary("Run failed")
                .errorMessage(message)
                .durationMs(clock.millis() - startMs)
                .build();
    }

    // ==================== Helpers ====================

    private void record(RunState run, IterationRecord.IterationRecordBuilder builder) {
        run.records.add(builder.build());
    }

    private void checkpoint(RunState run, int iteration, String description) {
        if (run.checkpoints == null) {
            return;
        }
        Checkpoint checkpoint = run.checkpoints.create(run.current, iteration, description);
        events.emit(run.runId, run.current.id(), iteration, EditEventType.CHECKPOINT,
                Map.of("checkpointId", checkpoint.id(), "description", description));
    }

    private static List<Checkpoint> checkpoints(RunState run) {
        return run.checkpoints != null ? run.checkpoints.list() : List.of();
    }

    private void phase(String runId, DocumentState document, EditPhase phase) {
        events.emit(runId, document.id(), null, EditEventType.PHASE_CHANGE, Map.of("phase", phase.name()));
    }

    private boolean deadlineExceeded(RunState run) {
        return clock.millis() >= run.deadlineMs;
    }

    static String documentSummary(DocumentState document) {
        String[] lines = document.content().split("\n", -1);
        StringBuilder sb = new StringBuilder();
        sb.append(document.displayName()).append(" (")
                .append(document.language() != null ? document.language() : "text").append(", ")
                .append(lines.length).append(" lines)\n");
        for (int i = 0; i < Math.min(lines.length, SUMMARY_PREVIEW_LINES); i++) {
            sb.append(lines[i]).append('\n');
        }
        if (lines.length > SUMMARY_PREVIEW_LINES) {
            sb.append("...\n");
        }
        return sb.toString();
    }

    private record OracleReply(String text, boolean timedOut) {
    }

    /**
     * Mutable state of one run. Confined to the thread executing the run.
     */
    private static final class RunState {
        private final String runId;
        private final EditGoal goal;
        private final DocumentState original;
        private final List<SubGoal> subGoals;
        private final long deadlineMs;
        private final CheckpointManager checkpoints;
        private final List<IterationRecord> records = new ArrayList<>();

        private List<Message> transcript = new ArrayList<>();
        private DocumentState current;
        private String previousContent;
        private int iteration;
        private int changes;
        private String lastToolName;
        private ToolResult lastResult;
        private VerificationResult lastVerification;
        private String focus;

        private RunState(String runId, EditGoal goal, DocumentState original, List<SubGoal> subGoals,
                long deadlineMs, CheckpointManager checkpoints) {
            this.runId = runId;
            this.goal = goal;
            this.original = original;
            this.current = original;
            this.previousContent = original.content();
            this.subGoals = subGoals;
            this.deadlineMs = deadlineMs;
            this.checkpoints = checkpoints;
        }
    }
}
