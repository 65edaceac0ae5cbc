package com.williamcallahan.agentbridge.service.auth;

/**
 * Turns a backend credential into the bearer token the trigger call needs.
 */
public interface CredentialExchange {

    /**
     * @param credential raw backend credential
     * @return auth token (a JWT)
     * @throws AuthenticationFailedException if no token can be obtained
     */
    String exchange(String credential);
}
