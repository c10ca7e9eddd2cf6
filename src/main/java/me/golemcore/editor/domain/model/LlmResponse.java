package me.golemcore.editor.domain.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    private String content;
    private String model;
    private String finishReason;

    public boolean isEmpty() {
        return content == null || content.isBlank();
    }
}
