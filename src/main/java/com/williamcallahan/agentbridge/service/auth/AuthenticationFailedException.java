package com.williamcallahan.agentbridge.service.auth;

import com.williamcallahan.agentbridge.service.AgentBridgeException;

/**
 * Signals that the caller's credential could not be turned into a backend identity.
 */
public final class AuthenticationFailedException extends AgentBridgeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
