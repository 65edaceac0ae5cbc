package com.williamcallahan.agentbridge.service;

/**
 * Common supertype for failures raised while bridging a completion onto the agent backend.
 *
 * <p>Web handlers map subclasses to HTTP statuses; the streaming path turns them into in-band
 * error frames instead.</p>
 */
public class AgentBridgeException extends RuntimeException {

    public AgentBridgeException(String message) {
        super(message);
    }

    public AgentBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
