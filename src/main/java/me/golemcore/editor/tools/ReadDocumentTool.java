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
import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.ToolContext;
import me.golemcore.editor.domain.model.ToolDefinition;
import me.golemcore.editor.domain.model.ToolInvocation;
import me.golemcore.editor.domain.model.ToolParameterSpec;
import me.golemcore.editor.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns the current document content. Never changes the document.
 */
@Component
@Slf4j
public class ReadDocumentTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolInvocation.READ)
                .description("Read the current document content.")
                .parameters(Map.of("path", ToolParameterSpec.optionalString("Document title")))
                .parallelSafe(true)
                .mutatesDocument(false)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            DocumentState document = context.document();
            log.debug("[Tools] read_file: {} ({} lines)", document.displayName(), document.lineCount());
            return ToolResult.success("Read " + document.displayName(), Map.of(
                    "content", document.content(),
                    "lines", document.lineCount()));
        });
    }
}
