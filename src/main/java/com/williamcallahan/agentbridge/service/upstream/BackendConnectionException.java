package com.williamcallahan.agentbridge.service.upstream;

import com.williamcallahan.agentbridge.service.AgentBridgeException;

/**
 * Signals that the backend socket failed before reaching the open state.
 */
public final class BackendConnectionException extends AgentBridgeException {

    /**
     * Creates an exception with a descriptive message and root cause.
     */
    public BackendConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
