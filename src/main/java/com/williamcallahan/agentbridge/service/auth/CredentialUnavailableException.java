package com.williamcallahan.agentbridge.service.auth;

import com.williamcallahan.agentbridge.service.AgentBridgeException;

/**
 * Signals that the admin key was accepted but no backend credential is configured to serve it.
 */
public final class CredentialUnavailableException extends AgentBridgeException {

    public CredentialUnavailableException(String message) {
        super(message);
    }
}
