package com.deepansh.desk.support;

import com.deepansh.desk.llm.LlmClient;
import com.deepansh.desk.model.LlmResponse;
import com.deepansh.desk.model.Message;
import com.deepansh.desk.model.ToolCall;
import com.deepansh.desk.model.ToolDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * LlmClient that replays queued responses in order and records every request.
 */
public class ScriptedLlmClient implements LlmClient {

    private final Deque<Supplier<LlmResponse>> script = new ArrayDeque<>();
    private final List<List<Message>> requests = new ArrayList<>();

    public ScriptedLlmClient text(String content) {
        script.add(() -> LlmResponse.text(content));
        return this;
    }

    public ScriptedLlmClient tool(String name, Map<String, Object> arguments) {
        script.add(() -> LlmResponse.tool(new ToolCall("call_" + (script.size() + requests.size()), name, arguments)));
        return this;
    }

    public ScriptedLlmClient failure(RuntimeException e) {
        script.add(() -> {
            throw e;
        });
        return this;
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        requests.add(List.copyOf(messages));
        if (script.isEmpty()) {
            throw new IllegalStateException("No scripted response left for request #" + requests.size());
        }
        return script.poll().get();
    }

    public List<List<Message>> requests() {
        return requests;
    }

    public int remaining() {
        return script.size();
    }
}
