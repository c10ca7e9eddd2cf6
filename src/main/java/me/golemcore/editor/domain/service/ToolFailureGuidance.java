package me.golemcore.editor.domain.service;

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

import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.ToolFailureKind;
import me.golemcore.editor.domain.model.ToolInvocation;
import me.golemcore.editor.domain.model.ToolResult;
import me.golemcore.editor.domain.parser.ToolCallFormatter;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Corrective messages injected into the transcript after a failed tool call
 * or a premature completion claim.
 */
public final class ToolFailureGuidance {

    private static final int PREVIEW_LINES = 15;

    private ToolFailureGuidance() {
    }

    public static String forFailure(ToolResult result, DocumentState document) {
        String message = result.getMessage() != null ? result.getMessage() : "unknown error";
        String toolName = result.getToolName();

        if (result.getFailureKind() == ToolFailureKind.CIRCUIT_OPEN) {
            return "The tool " + toolName + " is temporarily disabled after repeated failures.\n"
                    + "Use a different tool. To change the document, write the complete new content:\n\n"
                    + writeExample(document);
        }
        if (ToolInvocation.PATCH.equals(toolName) && message.contains("not found")) {
            return "Your SEARCH text was not found in the document: " + message + "\n\n"
                    + "The document currently starts with:\n```\n" + firstLines(document.content()) + "\n```\n\n"
                    + "Copy the SEARCH text character for character from the current document, "
                    + "or use write_to_file with the complete new content instead:\n\n"
                    + writeExample(document);
        }
        if (message.contains("No SEARCH/REPLACE blocks")) {
            return "The patch was not in the expected format. Use exactly:\n\n"
                    + "<" + ToolInvocation.PATCH + ">\n<content>\n"
                    + ToolCallFormatter.formatBlock("[exact text from the document]", "[replacement text]")
                    + "\n</content>\n</" + ToolInvocation.PATCH + ">";
        }
        if (message.contains("No content provided")) {
            return "write_to_file needs the complete document inside <content>. Use:\n\n" + writeExample(document);
        }
        return "The tool call " + (toolName != null ? toolName + " " : "") + "failed: " + message + "\n"
                + "Review the current document in the next message and try again with a valid tool call.";
    }

    public static String forPrematureClaim(DocumentState document) {
        return "You claimed the goal is achieved but you didn't make any changes to the document. "
                + "You MUST use a tool to modify the document before claiming completion.\n\n"
                + "Current content:\n```\n" + document.content() + "\n```\n\n"
                + "Make the change now, for example:\n\n" + writeExample(document);
    }

    private static String writeExample(DocumentState document) {
        return ToolCallFormatter.format(new ToolInvocation.Overwrite(document.displayName(),
                "[COMPLETE NEW DOCUMENT CONTENT]"));
    }

    private static String firstLines(String content) {
        List<String> lines = Arrays.asList(content.split("\n", -1));
        String preview = lines.stream().limit(PREVIEW_LINES).collect(Collectors.joining("\n"));
        if (lines.size() > PREVIEW_LINES) {
            preview += "\n... (" + (lines.size() - PREVIEW_LINES) + " more lines)";
        }
        return preview;
    }
}
