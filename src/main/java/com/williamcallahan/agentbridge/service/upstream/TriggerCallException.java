package com.williamcallahan.agentbridge.service.upstream;

import com.williamcallahan.agentbridge.service.AgentBridgeException;

/**
 * Describes a failed trigger call: a non-success status or a transport failure.
 *
 * <p>Trigger failures never end a session. The exception carries the failure to the log and
 * lets callers that await the trigger inspect it.</p>
 */
public final class TriggerCallException extends AgentBridgeException {

    private final int statusCode;

    /**
     * Creates an exception for a non-success HTTP response.
     *
     * @param statusCode HTTP status returned by the trigger endpoint
     * @param bodyExcerpt leading part of the response body
     */
    public TriggerCallException(int statusCode, String bodyExcerpt) {
        super("Trigger call failed with HTTP " + statusCode + ": " + bodyExcerpt);
        this.statusCode = statusCode;
    }

    /**
     * Creates an exception for a transport-level failure.
     *
     * @param cause underlying network exception
     */
    public TriggerCallException(Throwable cause) {
        super("Trigger call failed: " + cause, cause);
        this.statusCode = -1;
    }

    /**
     * Returns the HTTP status, or {@code -1} when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
