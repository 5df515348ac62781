package com.deepansh.desk.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw client for the provider selected by llm.provider.
 * The resilient decorator is the bean the rest of the application sees.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LlmClientConfig {

    private final LlmProperties llmProperties;

    @PostConstruct
    public void logActiveProvider() {
        LlmProperties.Provider p = llmProperties.getProviders().get(llmProperties.getProvider().toLowerCase());
        log.info("Active LLM provider: {} [model={}]",
                llmProperties.getProvider().toUpperCase(), p != null ? p.getModel() : "<unset>");
        if (p != null && (p.getApiKey() == null || p.getApiKey().isBlank())) {
            log.warn("API key for LLM provider '{}' is not set", llmProperties.getProvider());
        }
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(ObjectMapper objectMapper,
                                     @Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        String name = llmProperties.getProvider().toLowerCase();
        return new GenericLlmClient(llmProperties.activeProvider(), objectMapper, name, builder.clone());
    }
}
