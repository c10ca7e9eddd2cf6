package me.golemcore.editor.domain.model;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes a document tool: name, parameter schema and the static
 * scheduling flags used by the executor.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;

    @Builder.Default
    private Map<String, ToolParameterSpec> parameters = new LinkedHashMap<>();

    /**
     * Safe to run concurrently with other parallel-safe tools.
     */
    private boolean parallelSafe;

    /**
     * Produces a new document state on success.
     */
    private boolean mutatesDocument;
}
