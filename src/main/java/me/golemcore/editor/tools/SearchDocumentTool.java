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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Case-insensitive regular expression search over document lines.
 */
@Component
@Slf4j
public class SearchDocumentTool implements ToolComponent {

    private static final int MAX_MATCHES = 50;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, ToolParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put("path", ToolParameterSpec.optionalString("Document title"));
        parameters.put("pattern", ToolParameterSpec.requiredString("Regular expression, matched per line"));
        return ToolDefinition.builder()
                .name(ToolInvocation.SEARCH)
                .description("Search the document for lines matching a pattern.")
                .parameters(parameters)
                .parallelSafe(true)
                .mutatesDocument(false)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String patternText = String.valueOf(parameters.get("pattern"));
            Pattern pattern;
            try {
                pattern = Pattern.compile(patternText, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                return ToolResult.failure(ToolFailureKind.STRUCTURAL, "Invalid search pattern: " + e.getDescription());
            }

            String[] lines = context.document().content().split("\n", -1);
            List<String> matches = new ArrayList<>();
            int total = 0;
            for (int i = 0; i < lines.length; i++) {
                if (pattern.matcher(lines[i]).find()) {
                    total++;
                    if (matches.size() < MAX_MATCHES) {
                        matches.add((i + 1) + ": " + lines[i]);
                    }
                }
            }
            log.debug("[Tools] search_files '{}': {} matches", patternText, total);

            StringBuilder message = new StringBuilder("Found ").append(total).append(" matches");
            for (String match : matches) {
                message.append('\n').append(match);
            }
            return ToolResult.success(message.toString(), Map.of("matches", matches, "total", total));
        });
    }
}
