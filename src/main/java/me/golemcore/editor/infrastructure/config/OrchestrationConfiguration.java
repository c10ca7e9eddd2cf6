package me.golemcore.editor.infrastructure.config;

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

import me.golemcore.editor.domain.component.ToolComponent;
import me.golemcore.editor.domain.loop.EditLoopConfig;
import me.golemcore.editor.domain.loop.EditOrchestrator;
import me.golemcore.editor.domain.model.ToolInvocation;
import me.golemcore.editor.domain.parser.ToolInvocationParser;
import me.golemcore.editor.domain.service.CircuitBreaker;
import me.golemcore.editor.domain.service.CompletionDetector;
import me.golemcore.editor.domain.service.DocumentWindowing;
import me.golemcore.editor.domain.service.EditEventPublisher;
import me.golemcore.editor.domain.service.EditPromptBuilder;
import me.golemcore.editor.domain.service.EditVerifier;
import me.golemcore.editor.domain.service.GoalPlanner;
import me.golemcore.editor.domain.service.RetryPolicy;
import me.golemcore.editor.domain.service.ToolParameterValidator;
import me.golemcore.editor.domain.service.ToolRegistryService;
import me.golemcore.editor.port.outbound.EditEventSink;
import me.golemcore.editor.port.outbound.IntentDetectionPort;
import me.golemcore.editor.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the orchestration core from {@link EditorProperties}. The domain
 * classes stay free of Spring annotations; everything is assembled here.
 */
@Configuration
public class OrchestrationConfiguration {

    // ==================== Tools ====================

    @Bean
    public CircuitBreaker circuitBreaker(EditorProperties properties, Clock clock) {
        EditorProperties.ToolsProperties tools = properties.getTools();
        return new CircuitBreaker(tools.getCircuitThreshold(), Duration.ofMillis(tools.getCircuitCooldownMs()),
                clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolExecutor(EditorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getTools().getParallelPoolSize()));
    }

    @Bean
    public ToolRegistryService toolRegistryService(List<ToolComponent> tools, CircuitBreaker circuitBreaker,
            ExecutorService toolExecutor, EditorProperties properties, Clock clock) {
        return new ToolRegistryService(tools, circuitBreaker, new ToolParameterValidator(),
                retryPolicies(properties.getTools()), toolExecutor, clock);
    }

    /**
     * Built-in reliability defaults per tool, overridden by
     * {@code editor.tools.reliability.<tool>.*}.
     */
    static Map<String, RetryPolicy> retryPolicies(EditorProperties.ToolsProperties tools) {
        Map<String, RetryPolicy> policies = new LinkedHashMap<>();
        policies.put(ToolInvocation.READ, new RetryPolicy(5_000, 2, 1_000, 2.0));
        policies.put(ToolInvocation.SEARCH, new RetryPolicy(10_000, 2, 1_000, 2.0));
        policies.put(ToolInvocation.PATCH, new RetryPolicy(30_000, 1, 1_000, 2.0));
        policies.put(ToolInvocation.OVERWRITE, new RetryPolicy(60_000, 1, 1_000, 2.0));
        tools.getReliability().forEach((tool, reliability) -> policies.put(tool, new RetryPolicy(
                reliability.getTimeoutMs(), reliability.getMaxAttempts(), reliability.getRetryDelayMs(),
                reliability.getBackoffMultiplier())));
        return policies;
    }

    // ==================== Loop ====================

    @Bean
    public ToolInvocationParser toolInvocationParser() {
        return new ToolInvocationParser();
    }

    @Bean
    public EditPromptBuilder editPromptBuilder(EditorProperties properties) {
        EditorProperties.PromptProperties prompt = properties.getPrompt();
        return new EditPromptBuilder(new DocumentWindowing(prompt.getMaxContextLines(), prompt.getMaxContextChars(),
                prompt.getWindowPadding()));
    }

    @Bean
    public EditEventPublisher editEventPublisher(Clock clock, List<EditEventSink> sinks) {
        return new EditEventPublisher(clock, sinks);
    }

    @Bean
    public EditOrchestrator editOrchestrator(LlmPort llmPort, IntentDetectionPort intentDetection,
            ToolRegistryService toolRegistryService, ToolInvocationParser parser, EditPromptBuilder promptBuilder,
            EditEventPublisher events, EditorProperties properties, Clock clock) {
        EditorProperties.LoopProperties loop = properties.getLoop();
        return new EditOrchestrator(llmPort, intentDetection, toolRegistryService, parser,
                new CompletionDetector(loop.isEarlyTermination()), new GoalPlanner(), new EditVerifier(),
                promptBuilder, events, loopConfig(properties), clock);
    }

    static EditLoopConfig loopConfig(EditorProperties properties) {
        EditorProperties.LoopProperties loop = properties.getLoop();
        return EditLoopConfig.builder()
                .model(properties.getLlm().getModel())
                .temperature(properties.getLlm().getTemperature())
                .maxIterations(loop.getMaxIterations())
                .iterationTimeoutMs(loop.getIterationTimeoutMs())
                .totalTimeoutMs(loop.getTotalTimeoutMs())
                .streamResponses(loop.isStreamResponses())
                .enableCheckpoints(loop.isEnableCheckpoints())
                .maxCheckpoints(loop.getMaxCheckpoints())
                .transcriptMaxMessages(loop.getTranscriptMaxMessages())
                .transcriptKeepRecent(loop.getTranscriptKeepRecent())
                .oracleRetries(loop.getOracleRetries())
                .intentThreshold(loop.getIntentThreshold())
                .build();
    }
}
