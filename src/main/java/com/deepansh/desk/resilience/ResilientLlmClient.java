package com.deepansh.desk.resilience;

import com.deepansh.desk.exception.CollaboratorUnavailableException;
import com.deepansh.desk.exception.DeskException;
import com.deepansh.desk.llm.LlmClient;
import com.deepansh.desk.model.LlmResponse;
import com.deepansh.desk.model.Message;
import com.deepansh.desk.model.ToolDefinition;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active LLM client that adds retry + circuit breaker.
 *
 * Retry and circuit breaker settings live in application.yml under the
 * "llmClient" instance. {@link DeskException} is on both ignore lists: a bad
 * key or malformed request is not retried and does not trip the breaker.
 *
 * Fallbacks throw {@link CollaboratorUnavailableException} so that the turn
 * boundary reports a recoverable error instead of treating a canned sentence
 * as model output.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        return delegate.chat(messages, tools);
    }

    public LlmResponse retryFallback(List<Message> messages,
                                     List<ToolDefinition> tools,
                                     Exception ex) {
        if (ex instanceof DeskException deskException) {
            throw deskException;
        }
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        throw new CollaboratorUnavailableException(
                "The language service is temporarily unreachable", ex);
    }

    public LlmResponse circuitBreakerFallback(List<Message> messages,
                                              List<ToolDefinition> tools,
                                              Exception ex) {
        if (ex instanceof DeskException deskException) {
            throw deskException;
        }
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new CollaboratorUnavailableException(
                "The language service is currently unavailable", ex);
    }
}
