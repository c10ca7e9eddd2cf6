package me.golemcore.editor.domain.model;

import java.util.Map;

/**
 * Aggregated executor statistics since startup.
 */
public record ToolExecutionStats(long totalExecutions, double successRate, double averageExecutionTimeMs,
        Map<String, Long> executionsByTool) {
}
