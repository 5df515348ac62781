package com.deepansh.desk.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    /** Non-null when the model produces a text reply */
    private String content;

    /** Non-null when the model requests a structured action */
    private ToolCall toolCall;

    private boolean toolCallRequired;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public static LlmResponse text(String content) {
        return LlmResponse.builder().toolCallRequired(false).content(content).build();
    }

    public static LlmResponse tool(ToolCall toolCall) {
        return LlmResponse.builder().toolCallRequired(true).toolCall(toolCall).build();
    }
}
