package me.golemcore.editor.tools;

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
import me.golemcore.editor.domain.model.ToolContext;
import me.golemcore.editor.domain.model.ToolDefinition;
import me.golemcore.editor.domain.model.ToolFailureKind;
import me.golemcore.editor.domain.model.ToolInvocation;
import me.golemcore.editor.domain.model.ToolParameterSpec;
import me.golemcore.editor.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Replaces the whole document with new content.
 */
@Component
@Slf4j
public class OverwriteDocumentTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        Map<String, ToolParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put("path", ToolParameterSpec.optionalString("Document title"));
        parameters.put("content", ToolParameterSpec.requiredString("Complete new document content"));
        return ToolDefinition.builder()
                .name(ToolInvocation.OVERWRITE)
                .description("Write the complete new document content.")
                .parameters(parameters)
                .parallelSafe(false)
                .mutatesDocument(true)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object raw = parameters.get("content");
            String content = raw != null ? raw.toString() : "";
            if (content.isBlank()) {
                return ToolResult.failure(ToolFailureKind.STRUCTURAL, "No content provided");
            }
            int lines = content.split("\n", -1).length;
            log.debug("[Tools] write_to_file: {} lines", lines);
            return ToolResult.mutation("Wrote " + lines + " lines", content);
        });
    }
}
