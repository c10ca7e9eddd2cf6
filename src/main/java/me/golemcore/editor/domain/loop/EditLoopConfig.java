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

import lombok.Builder;
import lombok.Data;

/**
 * Limits and switches of one orchestration run.
 */
@Data
@Builder
public class EditLoopConfig {

    private String model;

    @Builder.Default
    private double temperature = 0.4;

    @Builder.Default
    private int maxIterations = 12;

    @Builder.Default
    private long iterationTimeoutMs = 240_000L;

    @Builder.Default
    private long totalTimeoutMs = 900_000L;

    @Builder.Default
    private boolean streamResponses = true;

    @Builder.Default
    private boolean enableCheckpoints = true;

    @Builder.Default
    private int maxCheckpoints = 5;

    @Builder.Default
    private int transcriptMaxMessages = 6;

    @Builder.Default
    private int transcriptKeepRecent = 4;

    @Builder.Default
    private int oracleRetries = 1;

    @Builder.Default
    private double intentThreshold = 0.6;

    public static EditLoopConfig defaults() {
        return EditLoopConfig.builder().build();
    }
}
