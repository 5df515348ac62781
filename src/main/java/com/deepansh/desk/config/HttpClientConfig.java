package com.deepansh.desk.config;

import com.deepansh.desk.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP transport for the LLM collaborator. A hung provider fails the call at
 * the socket timeout and the retry policy takes over.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    // One session turn issues one request at a time; a small pool suffices.
    private static final int MAX_CONNECTIONS_PER_ROUTE = 4;
    private static final int MAX_CONNECTIONS = 12;

    @Bean(destroyMethod = "close")
    public CloseableHttpClient llmHttpClient(LlmProperties llm) {
        PoolingHttpClientConnectionManager pool = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(llm.getConnectTimeoutMs()))
                        .setSocketTimeout(Timeout.ofMilliseconds(llm.getReadTimeoutMs()))
                        .build())
                .setMaxConnPerRoute(MAX_CONNECTIONS_PER_ROUTE)
                .setMaxConnTotal(MAX_CONNECTIONS)
                .build();

        log.info("LLM transport ready [provider={}, connect={}ms, read={}ms]",
                llm.getProvider(), llm.getConnectTimeoutMs(), llm.getReadTimeoutMs());

        return HttpClients.custom()
                .setConnectionManager(pool)
                .setUserAgent("expense-desk")
                .evictIdleConnections(TimeValue.ofSeconds(30))
                .build();
    }

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder(CloseableHttpClient llmHttpClient) {
        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(llmHttpClient));
    }
}
