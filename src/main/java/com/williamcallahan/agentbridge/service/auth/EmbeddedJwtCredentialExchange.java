package com.williamcallahan.agentbridge.service.auth;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Extracts a JWT the credential already carries: either the credential itself or the value of
 * its {@code __session} cookie.
 */
@Service
public class EmbeddedJwtCredentialExchange implements CredentialExchange {

    private static final Pattern JWT_PATTERN =
            Pattern.compile("^[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]*$");
    private static final Pattern SESSION_COOKIE_PATTERN = Pattern.compile("(?:^|;\\s*)__session=([^;\\s]+)");

    @Override
    public String exchange(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationFailedException("Empty backend credential");
        }
        String trimmed = credential.trim();
        if (JWT_PATTERN.matcher(trimmed).matches()) {
            return trimmed;
        }
        Matcher sessionCookie = SESSION_COOKIE_PATTERN.matcher(trimmed);
        if (sessionCookie.find() && JWT_PATTERN.matcher(sessionCookie.group(1)).matches()) {
            return sessionCookie.group(1);
        }
        throw new AuthenticationFailedException("Backend credential carries no session token");
    }
}
