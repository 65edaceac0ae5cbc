package com.williamcallahan.agentbridge.service.stream;

import java.util.Objects;
import org.springframework.http.HttpHeaders;

/**
 * Everything one translation pipeline needs to run a completion against the agent backend.
 *
 * @param requestId caller-facing completion id ({@code chatcmpl-...})
 * @param model backend adapter name, echoed in every envelope
 * @param sessionId backend chat-history id
 * @param identityToken user identity passed on the socket URL
 * @param authToken bearer token for the trigger call
 * @param prompt prompt text sent with the trigger call
 * @param callerHeaders original request headers; filtered before anything is forwarded
 */
public record BridgeSession(
        String requestId,
        String model,
        String sessionId,
        String identityToken,
        String authToken,
        String prompt,
        HttpHeaders callerHeaders) {

    public BridgeSession {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(identityToken, "identityToken");
        Objects.requireNonNull(authToken, "authToken");
        Objects.requireNonNull(prompt, "prompt");
        callerHeaders = callerHeaders == null ? HttpHeaders.EMPTY : callerHeaders;
    }
}
