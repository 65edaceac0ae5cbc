package com.williamcallahan.agentbridge.service.upstream;

import com.williamcallahan.agentbridge.config.AppProperties;
import com.williamcallahan.agentbridge.service.stream.BridgeSession;
import com.williamcallahan.agentbridge.service.stream.SocketEventQueue;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Opens a session's backend socket and asks the backend to start producing output.
 */
@Service
public class SessionInitiator {
    private static final Logger log = LoggerFactory.getLogger(SessionInitiator.class);

    private static final String STREAM_PATH_TEMPLATE = "/engine-agent/chat-histories/{sessionId}/buffer/stream";

    private final BackendSocketConnector socketConnector;
    private final TriggerClient triggerClient;
    private final String socketBaseUrl;

    public SessionInitiator(BackendSocketConnector socketConnector, TriggerClient triggerClient,
                            AppProperties appProperties) {
        this.socketConnector = socketConnector;
        this.triggerClient = triggerClient;
        this.socketBaseUrl = appProperties.getUpstream().getSocketBaseUrl();
    }

    /**
     * Opens the session's socket and waits until it is connected.
     *
     * @param session session to open
     * @param events queue that will receive the socket's callbacks
     * @return open socket
     * @throws BackendConnectionException if the socket fails before opening
     */
    public BackendSocket openSocket(BridgeSession session, SocketEventQueue events) {
        URI socketUri = socketUri(session);
        log.debug("[{}] Opening backend socket for chat history {}", session.requestId(), session.sessionId());
        BackendSocket socket = socketConnector.connect(socketUri, events);
        log.info("[{}] Backend socket open: {}", session.requestId(), session.sessionId());
        return socket;
    }

    /**
     * Returns the trigger call for the session. Failures are logged and never surface.
     *
     * @param session session whose prompt should be generated
     * @return publisher completing once the call finished, successfully or not
     */
    public Mono<Void> trigger(BridgeSession session) {
        return triggerClient.fire(session);
    }

    URI socketUri(BridgeSession session) {
        return UriComponentsBuilder.fromUriString(socketBaseUrl)
                .path(STREAM_PATH_TEMPLATE)
                .queryParam("token", session.identityToken())
                .encode()
                .buildAndExpand(session.sessionId())
                .toUri();
    }
}
