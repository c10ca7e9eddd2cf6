package me.golemcore.editor.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * One piece of a streamed oracle response.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private boolean done;
}
