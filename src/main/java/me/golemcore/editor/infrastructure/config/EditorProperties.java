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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the editor, bound from application.properties
 * under the {@code editor.*} prefix.
 *
 * <ul>
 * <li>{@link LlmProperties} - oracle provider and model</li>
 * <li>{@link LoopProperties} - orchestration limits and deadlines</li>
 * <li>{@link ToolsProperties} - circuit breaker and per-tool reliability</li>
 * <li>{@link PromptProperties} - document windowing</li>
 * <li>{@link StorageProperties} - document store location</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "editor")
@Data
public class EditorProperties {

    private LlmProperties llm = new LlmProperties();
    private LoopProperties loop = new LoopProperties();
    private ToolsProperties tools = new ToolsProperties();
    private PromptProperties prompt = new PromptProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String model = "openai/gpt-4o-mini";
        private double temperature = 0.4;
        private double intentTemperature = 0.3;
        private long timeoutMs = 300_000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class LoopProperties {
        private int maxIterations = 12;
        private long iterationTimeoutMs = 240_000;
        private long totalTimeoutMs = 900_000;
        private boolean streamResponses = true;
        private boolean enableCheckpoints = true;
        private int maxCheckpoints = 5;
        private boolean earlyTermination = true;
        private int transcriptKeepRecent = 4;
        private int transcriptMaxMessages = 6;
        private int oracleRetries = 1;
        private double intentThreshold = 0.6;
        private long intentTimeoutMs = 30_000;
    }

    @Data
    public static class ToolsProperties {
        private int circuitThreshold = 3;
        private long circuitCooldownMs = 60_000;
        private int parallelPoolSize = 4;
        private Map<String, ReliabilityProperties> reliability = new LinkedHashMap<>();
    }

    @Data
    public static class ReliabilityProperties {
        private long timeoutMs = 30_000;
        private int maxAttempts = 2;
        private long retryDelayMs = 1_000;
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class PromptProperties {
        private int maxContextLines = 150;
        private int maxContextChars = 8000;
        private int windowPadding = 10;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/editor";
    }
}
