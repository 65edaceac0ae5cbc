package com.williamcallahan.agentbridge.service.upstream;

import com.williamcallahan.agentbridge.config.AppProperties;
import com.williamcallahan.agentbridge.service.stream.SocketEventQueue;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;

/**
 * Opens backend sockets with Spring's reactive {@link WebSocketClient}.
 *
 * <p>The client exposes received frames as a {@code Flux}; each frame is copied out as text and
 * pushed onto the session's {@link SocketEventQueue}, so buffers are released on the I/O thread.</p>
 */
@Component
public class ReactorNettySocketConnector implements BackendSocketConnector {
    private static final Logger log = LoggerFactory.getLogger(ReactorNettySocketConnector.class);

    private final WebSocketClient webSocketClient;
    private final Duration connectTimeout;

    public ReactorNettySocketConnector(WebSocketClient upstreamWebSocketClient, AppProperties appProperties) {
        this.webSocketClient = upstreamWebSocketClient;
        this.connectTimeout = appProperties.getUpstream().getConnectTimeout();
    }

    @Override
    public BackendSocket connect(URI socketUri, SocketEventQueue events) {
        CompletableFuture<WebSocketSession> opened = new CompletableFuture<>();
        Disposable connection = webSocketClient.execute(socketUri, session -> {
                    opened.complete(session);
                    return session.receive()
                            .filter(message -> message.getType() == WebSocketMessage.Type.TEXT
                                    || message.getType() == WebSocketMessage.Type.BINARY)
                            .doOnNext(message -> events.offerMessage(message.getPayloadAsText()))
                            .then();
                })
                .subscribe(
                        ignored -> {},
                        failure -> {
                            if (!opened.completeExceptionally(failure)) {
                                events.offerError(failure);
                            }
                        },
                        events::offerClose);

        try {
            WebSocketSession session = opened.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Backend socket connected (sessionId={})", session.getId());
            return new ReactorNettySocket(connection, events);
        } catch (ExecutionException connectFailure) {
            connection.dispose();
            throw new BackendConnectionException("Backend socket failed before opening", connectFailure.getCause());
        } catch (TimeoutException timeout) {
            connection.dispose();
            throw new BackendConnectionException(
                    "Backend socket did not open within " + connectTimeout.toMillis() + "ms", timeout);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            connection.dispose();
            throw new BackendConnectionException("Interrupted while opening backend socket", interrupted);
        }
    }

    private static final class ReactorNettySocket implements BackendSocket {
        private final Disposable connection;
        private final SocketEventQueue events;
        private final AtomicBoolean closed = new AtomicBoolean();

        private ReactorNettySocket(Disposable connection, SocketEventQueue events) {
            this.connection = connection;
            this.events = events;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                // Cancelling the subscription tears the connection down without a completion signal
                connection.dispose();
                events.offerClose();
            }
        }
    }
}
