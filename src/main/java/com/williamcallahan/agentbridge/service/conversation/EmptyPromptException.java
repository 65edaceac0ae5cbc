package com.williamcallahan.agentbridge.service.conversation;

import com.williamcallahan.agentbridge.service.AgentBridgeException;

/**
 * Signals that a request carries no content that could be sent as a prompt.
 */
public final class EmptyPromptException extends AgentBridgeException {

    public EmptyPromptException(String message) {
        super(message);
    }
}
