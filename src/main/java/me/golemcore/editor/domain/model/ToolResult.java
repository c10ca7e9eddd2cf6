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

/**
 * Result of one tool execution. A successful mutating call carries the new
 * document text in {@code newContent}; everything else leaves it null.
 */
@Data
@Builder(toBuilder = true)
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String toolName;
    private String message;
    private String newContent;
    private Object data;
    private ToolFailureKind failureKind;

    @Builder.Default
    private int attempts = 1;

    /**
     * Creates a successful result without a document change.
     */
    public static ToolResult success(String message) {
        return ToolResult.builder()
                .success(true)
                .message(message)
                .build();
    }

    /**
     * Creates a successful result with structured data.
     */
    public static ToolResult success(String message, Object data) {
        return ToolResult.builder()
                .success(true)
                .message(message)
                .data(data)
                .build();
    }

    /**
     * Creates a successful result that replaces the document content.
     */
    public static ToolResult mutation(String message, String newContent) {
        return ToolResult.builder()
                .success(true)
                .message(message)
                .newContent(newContent)
                .build();
    }

    public static ToolResult failure(ToolFailureKind kind, String message) {
        return ToolResult.builder()
                .success(false)
                .failureKind(kind)
                .message(message)
                .build();
    }

    public static ToolResult failure(ToolFailureKind kind, String message, Object data) {
        return ToolResult.builder()
                .success(false)
                .failureKind(kind)
                .message(message)
                .data(data)
                .build();
    }

    public boolean hasNewContent() {
        return success && newContent != null;
    }
}
