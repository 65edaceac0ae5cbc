package com.williamcallahan.agentbridge.service.auth;

/**
 * Backend credential chosen for one request.
 *
 * @param credential raw backend credential (cookie string or token)
 * @param pooled whether it came from configuration rather than from the caller
 */
public record ResolvedCredential(String credential, boolean pooled) {}
