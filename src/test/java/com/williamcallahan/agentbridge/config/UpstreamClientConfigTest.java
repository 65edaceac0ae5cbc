package com.williamcallahan.agentbridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

class UpstreamClientConfigTest {

    @Test
    void socketClientAcceptsFramesLargerThanTheNettyDefault() {
        ReactorNettyWebSocketClient client = assertInstanceOf(ReactorNettyWebSocketClient.class,
                new UpstreamClientConfig().upstreamWebSocketClient(new AppProperties()));

        assertEquals(4 * 1024 * 1024, client.getWebsocketClientSpec().maxFramePayloadLength());
    }
}
