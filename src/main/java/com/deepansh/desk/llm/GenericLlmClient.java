package com.deepansh.desk.llm;

import com.deepansh.desk.exception.DeskException;
import com.deepansh.desk.model.LlmResponse;
import com.deepansh.desk.model.Message;
import com.deepansh.desk.model.ToolCall;
import com.deepansh.desk.model.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for any OpenAI-compatible provider.
 *
 * Status mapping:
 *
 * | Status            | Thrown             | Retried | Breaker failure |
 * |-------------------|--------------------|---------|-----------------|
 * | 401               | DeskException      | no      | no              |
 * | 429               | RuntimeException   | yes     | yes             |
 * | other 4xx         | DeskException      | no      | no              |
 * | 5xx               | RuntimeException   | yes     | yes             |
 *
 * Only the first proposed tool call is returned; form handlers apply one
 * action per iteration.
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {};

    private final LlmProperties.Provider props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProperties.Provider props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        log.debug("{} request: {} messages, {} tools [model={}]",
                providerName, messages.size(), tools == null ? 0 : tools.size(), props.getModel());

        String raw = restClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .body(requestBody(messages, tools))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.warn("{} answered {}: {}", providerName, res.getStatusCode(), body);
                    throw statusFailure(res.getStatusCode().value());
                })
                .body(String.class);

        if (raw == null || raw.isBlank()) {
            throw new DeskException(providerName + " returned an empty body");
        }
        return toResponse(readTree(raw));
    }

    private RuntimeException statusFailure(int status) {
        if (status == 401) {
            return new DeskException(providerName + " API key is invalid. Check llm.providers."
                    + providerName + ".api-key");
        }
        if (status == 429) {
            return new RuntimeException(providerName + " rate limit exceeded");
        }
        if (status >= 500) {
            return new RuntimeException(providerName + " server error [" + status + "]");
        }
        return new DeskException(providerName + " rejected the request [" + status + "]");
    }

    private Map<String, Object> requestBody(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", messages.stream()
                .map(m -> Map.of(
                        "role", m.getRole().name(),
                        "content", m.getContent() == null ? "" : m.getContent()))
                .toList());
        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private JsonNode readTree(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new DeskException(providerName + " returned malformed JSON", e);
        }
    }

    private LlmResponse toResponse(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new DeskException(providerName + " returned no choices in response");
        }

        JsonNode usage = root.path("usage");
        JsonNode message = choices.get(0).path("message");
        JsonNode calls = message.path("tool_calls");

        LlmResponse.LlmResponseBuilder response = LlmResponse.builder()
                .promptTokens(usage.path("prompt_tokens").asInt(0))
                .completionTokens(usage.path("completion_tokens").asInt(0));

        if (calls.isArray() && !calls.isEmpty()) {
            if (calls.size() > 1) {
                log.debug("{} proposed {} tool calls; keeping the first", providerName, calls.size());
            }
            return response.toolCallRequired(true).toolCall(toToolCall(calls.get(0))).build();
        }

        JsonNode content = message.path("content");
        return response.toolCallRequired(false)
                .content(content.isTextual() ? content.asText() : null)
                .build();
    }

    private ToolCall toToolCall(JsonNode call) {
        JsonNode function = call.path("function");
        String rawArguments = function.path("arguments").asText("");
        Map<String, Object> arguments;
        try {
            arguments = rawArguments.isBlank()
                    ? new LinkedHashMap<>()
                    : objectMapper.readValue(rawArguments, ARGUMENTS);
        } catch (JsonProcessingException e) {
            throw new DeskException("Failed to parse tool arguments from " + providerName, e);
        }
        return new ToolCall(
                call.path("id").asText(null),
                function.path("name").asText(null),
                arguments);
    }
}
