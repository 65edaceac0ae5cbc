package com.williamcallahan.agentbridge.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

/**
 * HTTP and WebSocket clients used to reach the agent backend.
 */
@Configuration
public class UpstreamClientConfig {

    private static final int SOCKET_MAX_FRAME_PAYLOAD_BYTES = 4 * 1024 * 1024;

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        var upstream = appProperties.getUpstream();
        HttpClient httpClient = HttpClient.create()
            .responseTimeout(upstream.getTriggerTimeout())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) upstream.getConnectTimeout().toMillis());

        return webClientBuilder
            .baseUrl(upstream.getApiBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean
    public WebSocketClient upstreamWebSocketClient(AppProperties appProperties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                (int) appProperties.getUpstream().getConnectTimeout().toMillis());
        // Snapshot-mode buffers carry the whole answer so far and can outgrow the 64K default
        return new ReactorNettyWebSocketClient(httpClient,
            () -> WebsocketClientSpec.builder()
                .maxFramePayloadLength(SOCKET_MAX_FRAME_PAYLOAD_BYTES));
    }
}
