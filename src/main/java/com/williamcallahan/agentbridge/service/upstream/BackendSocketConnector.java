package com.williamcallahan.agentbridge.service.upstream;

import com.williamcallahan.agentbridge.service.stream.SocketEventQueue;
import java.net.URI;

/**
 * Opens backend sockets and routes their callbacks into a session's event queue.
 */
public interface BackendSocketConnector {

    /**
     * Connects and waits until the socket is open.
     *
     * @param socketUri backend stream endpoint
     * @param events queue receiving message, close and error callbacks
     * @return open socket handle
     * @throws BackendConnectionException if the socket fails or times out before opening
     */
    BackendSocket connect(URI socketUri, SocketEventQueue events);
}
