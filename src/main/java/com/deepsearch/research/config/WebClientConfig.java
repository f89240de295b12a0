package com.deepsearch.research.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final DeepSearchProperties properties;

    /**
     * Shared client for search provider queries and page fetches.
     * Redirects are followed until the configured hop count is reached.
     */
    @Bean
    public WebClient webClient() {
        DeepSearchProperties.Http http = properties.getHttp();
        long timeoutMillis = http.getTimeout().toMillis();
        int maxRedirects = http.getMaxRedirects();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
                .responseTimeout(http.getTimeout())
                .doOnConnected(conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                )
                .followRedirect((request, response) -> {
                    int code = response.status().code();
                    boolean redirect = code >= 300 && code < 400
                            && response.responseHeaders().contains(HttpHeaders.LOCATION);
                    return redirect && request.redirectedFrom().length < maxRedirects;
                });

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(http.getMaxInMemorySize()))
                .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
                .build();
    }
}
