package com.example.studydesign.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient instances for the external collaborators.
 *
 * Every client has connect, response, read and write timeouts so that a hung collaborator fails
 * its pipeline stage instead of pinning a worker thread.
 */
@Configuration
public class WebClientConfig {

    /**
     * NCBI E-utilities. Abstract batches can be large.
     */
    @Bean("pubMedWebClient")
    public WebClient pubMedWebClient(
            @Value("${collaborators.pubmed.base-url:https://eutils.ncbi.nlm.nih.gov/entrez/eutils}") String baseUrl,
            @Value("${collaborators.pubmed.timeout-seconds:30}") int timeoutSeconds) {
        return build(baseUrl, 10_000, timeoutSeconds);
    }

    /**
     * LLM completion endpoint. Completions are slow.
     */
    @Bean("extractionWebClient")
    public WebClient extractionWebClient(
            @Value("${collaborators.extraction.base-url:https://llm.api.cloud.yandex.net}") String baseUrl,
            @Value("${collaborators.extraction.timeout-seconds:60}") int timeoutSeconds) {
        return build(baseUrl, 10_000, timeoutSeconds);
    }

    @Bean("reportWebClient")
    public WebClient reportWebClient(
            @Value("${collaborators.report.base-url:http://localhost:8090}") String baseUrl,
            @Value("${collaborators.report.timeout-seconds:60}") int timeoutSeconds) {
        return build(baseUrl, 5_000, timeoutSeconds);
    }

    private static WebClient build(String baseUrl, int connectTimeoutMillis, int timeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024)) // 16MB
                .build();
    }
}
