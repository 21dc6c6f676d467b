package com.deepansh.memgraph.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HttpClient used for the semantic-search call.
 *
 * The semantic service is the only blocking external dependency, so both the
 * connect and the response timeout are bounded from configuration. A request
 * that exceeds them fails fast and the vector path degrades to no results.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder semanticSearchRestClientBuilder(MemoryProperties properties) {
        MemoryProperties.SemanticSearch cfg = properties.getSemanticSearch();
        Timeout connectTimeout = Timeout.ofMilliseconds(cfg.getConnectTimeoutMs());
        Timeout readTimeout = Timeout.ofMilliseconds(cfg.getReadTimeoutMs());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(connectTimeout)
                                        .setSocketTimeout(readTimeout)
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(readTimeout)
                        .build())
                .build();

        log.info("Semantic search HttpClient configured [baseUrl={}, connectTimeout={}ms, readTimeout={}ms]",
                cfg.getBaseUrl(), cfg.getConnectTimeoutMs(), cfg.getReadTimeoutMs());

        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient))
                .baseUrl(cfg.getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .defaultHeader("Accept", "application/json");
    }
}
