package com.deepansh.desk.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A structured action proposed by the model. Only the first call of a
 * response is carried; handlers apply one action per iteration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** ID assigned by the provider */
    private String id;

    private String toolName;

    /** Parsed from the provider's JSON argument string */
    private Map<String, Object> arguments;

    public String nameOrEmpty() {
        return toolName != null ? toolName : "";
    }

    public Map<String, Object> argumentsOrEmpty() {
        return arguments != null ? arguments : Map.of();
    }
}
