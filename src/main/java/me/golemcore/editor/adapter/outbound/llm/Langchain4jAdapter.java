package me.golemcore.editor.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.domain.exception.OracleUnavailableException;
import me.golemcore.editor.domain.model.LlmChunk;
import me.golemcore.editor.domain.model.LlmRequest;
import me.golemcore.editor.domain.model.LlmResponse;
import me.golemcore.editor.domain.model.Message;
import me.golemcore.editor.infrastructure.config.EditorProperties;
import me.golemcore.editor.port.outbound.LlmPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Oracle adapter backed by LangChain4j.
 *
 * <p>
 * Models are addressed as {@code provider/model}: {@code anthropic/...} uses
 * the Anthropic client, every other provider the OpenAI-compatible one.
 * Provider credentials come from {@code editor.llm.providers.<name>}. Rate
 * limits and timeouts are retried with exponential backoff.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@ConditionalOnProperty(name = "editor.llm.provider", havingValue = "langchain4j", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String DEFAULT_PROVIDER = "openai";
    private static final int ANTHROPIC_MAX_TOKENS = 8192;

    private final EditorProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : properties.getLlm().getModel();
            ChatModel chatModel = modelFor(model, request.getTemperature());
            List<ChatMessage> messages = convertMessages(request.getMessages());

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    return convertResponse(response, model);
                } catch (RuntimeException e) {
                    if (isRetryable(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Transient failure (attempt {}/{}), retrying in {}ms: {}", attempt + 1,
                                MAX_RETRIES, backoffMs, e.getMessage());
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed", e);
                        throw new OracleUnavailableException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new OracleUnavailableException("LLM chat failed: max retries exhausted", null);
        });
    }

    /**
     * Single-chunk stream over {@link #chat(LlmRequest)}; token streaming
     * support varies by provider.
     */
    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> chat(request).whenComplete((response, error) -> {
            if (error != null) {
                sink.error(error);
            } else {
                sink.next(LlmChunk.builder()
                        .text(response.getContent())
                        .done(true)
                        .build());
                sink.complete();
            }
        }));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    // ==================== Models ====================

    private ChatModel modelFor(String model, double temperature) {
        return models.computeIfAbsent(model + "@" + temperature, key -> createModel(model, temperature));
    }

    private ChatModel createModel(String model, double temperature) {
        String provider = providerOf(model);
        EditorProperties.ProviderProperties config = providerConfig(provider);
        String modelName = model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
        log.info("[LLM] Creating model {} via provider {}", modelName, provider);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // retry handled by our backoff logic
                    .maxTokens(ANTHROPIC_MAX_TOKENS)
                    .temperature(temperature)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // retry handled by our backoff logic
                .temperature(temperature)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private static String providerOf(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')) : DEFAULT_PROVIDER;
    }

    private EditorProperties.ProviderProperties providerConfig(String provider) {
        EditorProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add editor.llm.providers." + provider + ".api-key");
        }
        return config;
    }

    // ==================== Conversion ====================

    static List<ChatMessage> convertMessages(List<Message> source) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : source) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case "system" -> messages.add(SystemMessage.from(content));
            case "assistant" -> messages.add(AiMessage.from(content));
            case "user" -> messages.add(UserMessage.from(content));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    private static LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage message = response.aiMessage();
        return LlmResponse.builder()
                .content(message != null && message.text() != null ? message.text() : "")
                .model(model)
                .finishReason(response.finishReason() != null
                        ? response.finishReason().name().toLowerCase(Locale.ROOT)
                        : null)
                .build();
    }

    private static boolean isRetryable(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException || current instanceof TimeoutException
                    || current instanceof SocketTimeoutException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("timed out"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("LLM chat interrupted during retry backoff", ie);
        }
    }
}
