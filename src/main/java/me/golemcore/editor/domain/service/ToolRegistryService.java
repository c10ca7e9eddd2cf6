package me.golemcore.editor.domain.service;

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
import me.golemcore.editor.domain.component.ToolComponent;
import me.golemcore.editor.domain.model.CircuitState;
import me.golemcore.editor.domain.model.ToolContext;
import me.golemcore.editor.domain.model.ToolExecutionStats;
import me.golemcore.editor.domain.model.ToolFailureKind;
import me.golemcore.editor.domain.model.ToolInvocation;
import me.golemcore.editor.domain.model.ToolResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry and executor for document tools.
 *
 * <p>
 * Every call goes through the same pipeline: name lookup, circuit check,
 * schema validation, then up to {@link RetryPolicy#maxAttempts()} attempts,
 * each bounded by the tool's timeout. Exceptions and timeouts are retried
 * with exponential backoff and count against the circuit; results returned
 * by the tool itself (success or an expected failure) are final. Nothing here
 * throws to the caller: every outcome is a {@link ToolResult}.
 */
@Slf4j
public class ToolRegistryService {

    private final Map<String, ToolComponent> toolRegistry = new ConcurrentHashMap<>();
    private final CircuitBreaker circuitBreaker;
    private final ToolParameterValidator validator;
    private final Map<String, RetryPolicy> policies;
    private final Executor parallelExecutor;
    private final Clock clock;

    private final AtomicLong totalExecutions = new AtomicLong();
    private final AtomicLong successfulExecutions = new AtomicLong();
    private final AtomicLong totalExecutionTimeMs = new AtomicLong();
    private final Map<String, AtomicLong> executionsByTool = new ConcurrentHashMap<>();

    public ToolRegistryService(Collection<ToolComponent> tools, CircuitBreaker circuitBreaker,
            ToolParameterValidator validator, Map<String, RetryPolicy> policies, Executor parallelExecutor,
            Clock clock) {
        this.circuitBreaker = circuitBreaker;
        this.validator = validator;
        this.policies = policies != null ? Map.copyOf(policies) : Map.of();
        this.parallelExecutor = parallelExecutor;
        this.clock = clock;
        if (tools != null) {
            tools.forEach(this::registerTool);
        }
    }

    public void registerTool(ToolComponent tool) {
        toolRegistry.put(tool.getToolName(), tool);
        log.debug("[Tools] Registered tool: {}", tool.getToolName());
    }

    public ToolComponent getTool(String name) {
        return toolRegistry.get(name);
    }

    public List<String> getToolNames() {
        return new ArrayList<>(new TreeMap<>(toolRegistry).keySet());
    }

    public RetryPolicy policyFor(String toolName) {
        return policies.getOrDefault(toolName, RetryPolicy.DEFAULT);
    }

    // ==================== Execution ====================

    public ToolResult execute(String toolName, Map<String, Object> parameters, ToolContext context) {
        String name = sanitizeToolName(toolName);
        ToolComponent tool = name != null ? toolRegistry.get(name) : null;
        if (tool == null) {
            String available = String.join(", ", getToolNames());
            return named(ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + toolName + ". Available tools: " + available), toolName, 0);
        }
        if (!tool.isEnabled()) {
            return named(ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Tool is disabled: " + name), name, 0);
        }

        if (circuitBreaker.isOpen(name)) {
            log.warn("[Tools] Circuit open for '{}', call short-circuited", name);
            return named(ToolResult.failure(ToolFailureKind.CIRCUIT_OPEN,
                    "Tool " + name + " temporarily disabled due to repeated failures"), name, 0);
        }

        Map<String, Object> params = parameters != null ? parameters : Map.of();
        List<String> errors = validator.validate(tool.getDefinition(), params);
        if (!errors.isEmpty()) {
            return named(ToolResult.failure(ToolFailureKind.VALIDATION,
                    "Invalid parameters for " + name + ": " + String.join("; ", errors),
                    Map.of("errors", errors)), name, 0);
        }

        return executeWithRetry(tool, name, params, context);
    }

    /**
     * Executes a batch. Parallel-safe tools are dispatched concurrently;
     * sequential tools run in declared order, each seeing the document
     * produced by the previous one. A failed sequential call that mutates the
     * document stops the remaining sequential calls. Results list the
     * parallel calls first, then the sequential ones that ran.
     */
    public List<ToolResult> executeMany(List<ToolInvocation> invocations, ToolContext context) {
        List<ToolInvocation> parallel = new ArrayList<>();
        List<ToolInvocation> sequential = new ArrayList<>();
        for (ToolInvocation invocation : invocations) {
            if (isParallelSafe(invocation.toolName())) {
                parallel.add(invocation);
            } else {
                sequential.add(invocation);
            }
        }

        List<CompletableFuture<ToolResult>> futures = new ArrayList<>();
        for (ToolInvocation invocation : parallel) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> execute(invocation.toolName(), invocation.parameters(), context), parallelExecutor));
        }

        List<ToolResult> sequentialResults = new ArrayList<>();
        ToolContext current = context;
        for (ToolInvocation invocation : sequential) {
            ToolResult result = execute(invocation.toolName(), invocation.parameters(), current);
            sequentialResults.add(result);
            if (result.hasNewContent()) {
                current = current.withDocument(current.document().withContent(result.getNewContent()));
            } else if (!result.isSuccess() && mutatesDocument(invocation.toolName())) {
                int skipped = sequential.size() - sequentialResults.size();
                if (skipped > 0) {
                    log.warn("[Tools] {} failed, skipping {} remaining sequential call(s)",
                            invocation.toolName(), skipped);
                }
                break;
            }
        }

        List<ToolResult> results = new ArrayList<>();
        for (CompletableFuture<ToolResult> future : futures) {
            results.add(future.join());
        }
        results.addAll(sequentialResults);
        return results;
    }

    private ToolResult executeWithRetry(ToolComponent tool, String name, Map<String, Object> params,
            ToolContext context) {
        RetryPolicy policy = policyFor(name);
        ToolFailureKind lastKind = ToolFailureKind.TRANSIENT;
        String lastError = "unknown";
        int attempt = 0;

        while (attempt < policy.maxAttempts()) {
            attempt++;
            long start = clock.millis();
            CompletableFuture<ToolResult> future = null;
            try {
                future = tool.execute(params, context);
                ToolResult result = future.get(policy.timeoutMs(), TimeUnit.MILLISECONDS);
                if (result == null) {
                    throw new IllegalStateException("Tool returned no result");
                }
                recordExecution(name, result.isSuccess(), clock.millis() - start);
                circuitBreaker.recordSuccess(name);
                return named(result, name, attempt);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastKind = ToolFailureKind.TIMEOUT;
                lastError = "timed out after " + policy.timeoutMs() + "ms";
            } catch (ExecutionException | RuntimeException e) {
                lastKind = ToolFailureKind.TRANSIENT;
                lastError = safeCauseMessage(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                recordExecution(name, false, clock.millis() - start);
                return named(ToolResult.failure(ToolFailureKind.TRANSIENT, name + " interrupted"), name, attempt);
            }

            recordExecution(name, false, clock.millis() - start);
            circuitBreaker.recordFailure(name);
            log.warn("[Tools] {} attempt {}/{} failed: {}", name, attempt, policy.maxAttempts(), lastError);

            long delay = policy.delayAfterAttempt(attempt);
            if (delay > 0 && !sleep(delay)) {
                break;
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attempts", attempt);
        data.put("lastError", lastError);
        return named(ToolResult.failure(lastKind,
                name + " failed after " + attempt + " attempts: " + lastError, data), name, attempt);
    }

    private boolean sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Circuit & stats ====================

    public Map<String, CircuitState> getCircuitStates() {
        return circuitBreaker.snapshot();
    }

    public void resetCircuit(String toolName) {
        circuitBreaker.reset(toolName);
    }

    public ToolExecutionStats getStats() {
        long total = totalExecutions.get();
        double successRate = total == 0 ? 0.0 : (double) successfulExecutions.get() / total;
        double averageMs = total == 0 ? 0.0 : (double) totalExecutionTimeMs.get() / total;
        Map<String, Long> byTool = new TreeMap<>();
        executionsByTool.forEach((tool, count) -> byTool.put(tool, count.get()));
        return new ToolExecutionStats(total, successRate, averageMs, byTool);
    }

    private void recordExecution(String toolName, boolean success, long durationMs) {
        totalExecutions.incrementAndGet();
        if (success) {
            successfulExecutions.incrementAndGet();
        }
        totalExecutionTimeMs.addAndGet(Math.max(0, durationMs));
        executionsByTool.computeIfAbsent(toolName, key -> new AtomicLong()).incrementAndGet();
    }

    // ==================== Helpers ====================

    public boolean isParallelSafe(String toolName) {
        ToolComponent tool = toolRegistry.get(toolName);
        return tool != null && tool.getDefinition().isParallelSafe();
    }

    public boolean mutatesDocument(String toolName) {
        ToolComponent tool = toolRegistry.get(toolName);
        return tool == null || tool.getDefinition().isMutatesDocument();
    }

    private static ToolResult named(ToolResult result, String toolName, int attempts) {
        return result.toBuilder().toolName(toolName).attempts(attempts).build();
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strips special tokens that some models leak into tool names.
     */
    private static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
