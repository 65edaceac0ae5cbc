package com.williamcallahan.agentbridge.service.upstream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;

import com.williamcallahan.agentbridge.config.AppProperties;
import com.williamcallahan.agentbridge.service.stream.BridgeSession;
import com.williamcallahan.agentbridge.support.ScriptedSocketConnector;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class SessionInitiatorTest {

    @Test
    void socketUriAddressesTheChatHistoryBufferWithTheIdentityToken() {
        AppProperties appProperties = new AppProperties();
        appProperties.getUpstream().setSocketBaseUrl("wss://api.enginelabs.ai");
        SessionInitiator initiator =
                new SessionInitiator(new ScriptedSocketConnector(), mock(TriggerClient.class), appProperties);
        BridgeSession session = new BridgeSession("chatcmpl-1", "GPT5", "0b6c-42", "user_2abc", "jwt", "Hi",
                HttpHeaders.EMPTY);

        assertEquals("wss://api.enginelabs.ai/engine-agent/chat-histories/0b6c-42/buffer/stream?token=user_2abc",
                initiator.socketUri(session).toString());
    }
}
