package com.example.prsync.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.TimeUnit;

/**
 * WebClient instances for the two systems of record.
 *
 * Both clients share the per-call timeout from {@code prsync.http.timeout} (default 8s).
 * Retries are not configured here: a failed call is retried on the next poll pass.
 */
@Configuration
public class WebClientConfig {

    /**
     * GitHub GraphQL endpoint, bearer token.
     */
    @Bean("githubWebClient")
    public WebClient githubWebClient(PrSyncProperties properties) {
        PrSyncProperties.Github github = properties.github();

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(github.apiUrl())
                .clientConnector(connector(properties.http().timeout()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
        if (github.token() != null && !github.token().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + github.token());
        }
        return builder.build();
    }

    /**
     * Jira Cloud REST API, basic auth with email:apiToken.
     * The base URL is left empty when the integration is disabled; callers check {@code jira.enabled()}.
     */
    @Bean("jiraWebClient")
    public WebClient jiraWebClient(PrSyncProperties properties) {
        PrSyncProperties.Jira jira = properties.jira();

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(connector(properties.http().timeout()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
        if (jira.enabled()) {
            String credentials = jira.email() + ":" + jira.apiToken();
            builder.baseUrl(jira.baseUrl())
                    .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + Base64.getEncoder()
                            .encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        return builder.build();
    }

    static ReactorClientHttpConnector connector(Duration timeout) {
        long millis = timeout.toMillis();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(millis, Integer.MAX_VALUE))
                .responseTimeout(timeout)
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(millis, TimeUnit.MILLISECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(millis, TimeUnit.MILLISECONDS)));
        return new ReactorClientHttpConnector(httpClient);
    }
}
