package me.golemcore.editor.domain.parser;

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

import me.golemcore.editor.domain.model.PatchBlock;
import me.golemcore.editor.domain.model.ToolInvocation;

import java.util.List;

/**
 * Renders invocations back into the tag format the oracle is instructed to
 * produce. Used for prompt examples and corrective guidance.
 */
public final class ToolCallFormatter {

    private ToolCallFormatter() {
    }

    public static String format(ToolInvocation invocation) {
        StringBuilder sb = new StringBuilder();
        String name = invocation.toolName();
        sb.append('<').append(name).append(">\n");
        if (invocation.path() != null && !invocation.path().isBlank()) {
            sb.append("<path>").append(invocation.path()).append("</path>\n");
        }
        if (invocation instanceof ToolInvocation.Overwrite overwrite) {
            sb.append("<content>\n").append(overwrite.content()).append("\n</content>\n");
        } else if (invocation instanceof ToolInvocation.Patch patch) {
            String body = patch.blocks().isEmpty() ? patch.content() : formatBlocks(patch.blocks());
            sb.append("<content>\n").append(body).append("\n</content>\n");
        } else if (invocation instanceof ToolInvocation.Search search) {
            sb.append("<pattern>").append(search.pattern()).append("</pattern>\n");
        }
        sb.append("</").append(name).append('>');
        return sb.toString();
    }

    public static String formatBlock(String search, String replace) {
        return PatchBlockParser.SEARCH_MARKER + "\n"
                + search + "\n"
                + PatchBlockParser.SEPARATOR_MARKER + "\n"
                + replace + "\n"
                + PatchBlockParser.END_MARKER;
    }

    public static String formatBlocks(List<PatchBlock> blocks) {
        StringBuilder sb = new StringBuilder();
        for (PatchBlock block : blocks) {
            if (!sb.isEmpty()) {
                sb.append("\n\n");
            }
            sb.append(formatBlock(block.search(), block.replace()));
        }
        return sb.toString();
    }
}
