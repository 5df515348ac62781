package com.deepansh.desk.llm;

import com.deepansh.desk.model.LlmResponse;
import com.deepansh.desk.model.Message;
import com.deepansh.desk.model.ToolDefinition;

import java.util.List;

/**
 * Stateless text-completion collaborator. Callers supply the full relevant
 * history on every call, already bounded by their history window.
 */
public interface LlmClient {

    /**
     * @param messages  system prompt followed by the retained conversation
     * @param tools     structured actions the model may request
     * @return either a text reply or a single tool call
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools);
}
