package com.williamcallahan.agentbridge.service.stream;

import com.williamcallahan.agentbridge.service.AgentBridgeException;

/**
 * Signals a frame or nested buffer the decoder cannot interpret.
 *
 * <p>Always recovered locally: the offending event is skipped and the session continues.</p>
 */
public final class BackendProtocolException extends AgentBridgeException {

    public BackendProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
