package com.williamcallahan.agentbridge.service.auth;

import com.williamcallahan.agentbridge.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maps the caller's bearer value to the backend credential used for the request.
 *
 * <p>Callers either pass a backend cookie directly or the admin key, in which case the configured
 * credential is used. Cookie strings cannot contain {@code "; "} inside a header token, so callers
 * may write it as {@code "....."}.</p>
 */
@Service
public class CredentialResolver {
    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String COOKIE_SEPARATOR_ALIAS = ".....";
    private static final String COOKIE_SEPARATOR = "; ";
    private static final String CLIENT_COOKIE_MARKER = "__client";
    private static final String SESSION_COOKIE_MARKER = "__session";

    private final AppProperties appProperties;

    public CredentialResolver(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    /**
     * Resolves the credential for an {@code Authorization} header value.
     *
     * @param authorizationHeader raw header value, may be null
     * @return credential to exchange for a backend token
     * @throws AuthenticationFailedException if the header is missing or neither a cookie nor the admin key
     * @throws CredentialUnavailableException if the admin key was used but no credential is configured
     */
    public ResolvedCredential resolve(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new AuthenticationFailedException("Authorization: Bearer <API key or cookie> is required");
        }
        String providedValue = authorizationHeader.substring(BEARER_PREFIX.length())
                .replace(COOKIE_SEPARATOR_ALIAS, COOKIE_SEPARATOR);

        if (providedValue.contains(CLIENT_COOKIE_MARKER) || providedValue.contains(SESSION_COOKIE_MARKER)) {
            log.info("Using caller-supplied backend cookie");
            return new ResolvedCredential(providedValue, false);
        }
        if (providedValue.equals(appProperties.getSecurity().getAdminKey())) {
            String configured = appProperties.getUpstream().getCredential();
            if (configured == null || configured.isBlank()) {
                log.warn("Admin key used but no upstream credential is configured");
                throw new CredentialUnavailableException("No backend credential is configured for the admin key");
            }
            log.info("Using configured backend credential");
            return new ResolvedCredential(configured, true);
        }
        throw new AuthenticationFailedException("Invalid API key or cookie");
    }
}
