package com.williamcallahan.agentbridge.service.stream;

import com.williamcallahan.agentbridge.service.AgentBridgeException;

/**
 * Wraps a failure that ended a session before its terminal signal, preserving the original cause.
 */
public final class PipelineFailureException extends AgentBridgeException {

    public PipelineFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
