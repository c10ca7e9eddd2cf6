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
import me.golemcore.editor.domain.model.PatchBlock;
import me.golemcore.editor.domain.model.ToolContext;
import me.golemcore.editor.domain.model.ToolDefinition;
import me.golemcore.editor.domain.model.ToolFailureKind;
import me.golemcore.editor.domain.model.ToolInvocation;
import me.golemcore.editor.domain.model.ToolParameterSpec;
import me.golemcore.editor.domain.model.ToolResult;
import me.golemcore.editor.domain.parser.PatchBlockParser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies SEARCH/REPLACE blocks to the document.
 *
 * <p>
 * Each block replaces the first occurrence of its search text only. When the
 * exact text is absent, a whitespace-insensitive match is tried before the
 * block is reported as not found. The call fails only when no block applies.
 */
@Component
@Slf4j
public class PatchDocumentTool implements ToolComponent {

    private static final int PREVIEW_LENGTH = 50;

    private final PatchBlockParser blockParser = new PatchBlockParser();

    @Override
    public ToolDefinition getDefinition() {
        Map<String, ToolParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put("path", ToolParameterSpec.optionalString("Document title"));
        parameters.put("content", ToolParameterSpec.requiredString("One or more SEARCH/REPLACE blocks"));
        return ToolDefinition.builder()
                .name(ToolInvocation.PATCH)
                .description("Replace exact text in the document using SEARCH/REPLACE blocks.")
                .parameters(parameters)
                .parallelSafe(false)
                .mutatesDocument(true)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> apply(String.valueOf(parameters.get("content")),
                context.document().content()));
    }

    ToolResult apply(String patch, String original) {
        List<PatchBlock> blocks = blockParser.parse(patch).blocks();
        if (blocks.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.STRUCTURAL,
                    "No SEARCH/REPLACE blocks found - use " + PatchBlockParser.SEARCH_MARKER + " / "
                            + PatchBlockParser.SEPARATOR_MARKER + " / " + PatchBlockParser.END_MARKER + " format");
        }

        String current = original;
        int applied = 0;
        int fuzzy = 0;
        List<String> notFound = new ArrayList<>();

        for (PatchBlock block : blocks) {
            int index = current.indexOf(block.search());
            if (index >= 0) {
                current = current.substring(0, index) + block.replace()
                        + current.substring(index + block.search().length());
                applied++;
                continue;
            }
            Matcher matcher = whitespaceTolerant(block.search()).matcher(current);
            if (matcher.find()) {
                current = current.substring(0, matcher.start()) + block.replace() + current.substring(matcher.end());
                applied++;
                fuzzy++;
            } else {
                notFound.add(preview(block.search()));
            }
        }

        if (applied == 0) {
            return ToolResult.failure(ToolFailureKind.STRUCTURAL,
                    "Search text not found in document. Tried: " + String.join("; ", notFound),
                    Map.of("notFound", notFound));
        }

        StringBuilder message = new StringBuilder("Applied ").append(applied).append(" replacement(s)");
        if (fuzzy > 0) {
            message.append(", ").append(fuzzy).append(" with whitespace-tolerant matching");
        }
        if (!notFound.isEmpty()) {
            message.append(", ").append(notFound.size()).append(" not found: ").append(String.join("; ", notFound));
        }
        log.debug("[Tools] replace_in_file: {}", message);
        return ToolResult.builder()
                .success(true)
                .message(message.toString())
                .newContent(current)
                .data(Map.of("applied", applied, "fuzzy", fuzzy, "notFound", notFound))
                .build();
    }

    private static Pattern whitespaceTolerant(String search) {
        String[] tokens = search.strip().split("\\s+");
        StringBuilder regex = new StringBuilder();
        for (String token : tokens) {
            if (!regex.isEmpty()) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(token));
        }
        return Pattern.compile(regex.toString());
    }

    private static String preview(String text) {
        String firstLine = text.lines().findFirst().orElse("").strip();
        if (firstLine.length() > PREVIEW_LENGTH) {
            return "\"" + firstLine.substring(0, PREVIEW_LENGTH) + "...\"";
        }
        return "\"" + firstLine + "\"";
    }
}
