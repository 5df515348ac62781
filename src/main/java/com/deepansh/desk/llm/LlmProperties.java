package com.deepansh.desk.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generation collaborator settings, bound under the "llm" prefix.
 * Every provider speaks the chat-completions protocol; only the endpoint,
 * key and model differ.
 */
@Component
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    /** Key into {@link #providers}: openai, groq or gemini. */
    private String provider = "groq";

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 60000;

    private Map<String, Provider> providers = new LinkedHashMap<>();

    @Data
    public static class Provider {
        private String apiKey = "";
        private String baseUrl;
        private String model;
        private int maxTokens = 1024;
        private double temperature = 0.2;
    }

    public Provider activeProvider() {
        Provider p = providers.get(provider.toLowerCase());
        if (p == null) {
            throw new IllegalStateException("No settings for LLM provider '" + provider
                    + "'. Known providers: " + providers.keySet());
        }
        return p;
    }
}
