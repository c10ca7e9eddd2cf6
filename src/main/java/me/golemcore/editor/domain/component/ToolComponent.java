package me.golemcore.editor.domain.component;

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

import me.golemcore.editor.domain.model.ToolContext;
import me.golemcore.editor.domain.model.ToolDefinition;
import me.golemcore.editor.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component interface for document tools invoked by the orchestration loop.
 * Tools receive a read-only document through {@link ToolContext} and report
 * changes only through {@link ToolResult#getNewContent()}.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition: name, parameter schema and scheduling
     * flags.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Parameters have already been validated against the
     * definition. Expected failures (such as text not found) are returned as
     * failed results; exceptions are treated as transient failures and
     * retried.
     *
     * @param parameters
     *            the execution parameters
     * @param context
     *            the current document and run
     * @return a future containing the tool result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context);

    /**
     * Returns the unique name of this tool.
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
