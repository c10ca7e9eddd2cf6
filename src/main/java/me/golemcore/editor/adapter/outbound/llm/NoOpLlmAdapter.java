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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.domain.model.LlmRequest;
import me.golemcore.editor.domain.model.LlmResponse;
import me.golemcore.editor.port.outbound.LlmPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Oracle used when no LLM is configured. Every answer is a placeholder
 * without a tool call, so runs end blocked instead of failing.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@ConditionalOnProperty(name = "editor.llm.provider", havingValue = "none")
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] chat() called but no LLM is configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content("[No LLM configured]")
                .model("none")
                .finishReason("stop")
                .build());
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
