package com.williamcallahan.agentbridge.service.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Base64;
import org.springframework.stereotype.Component;

/**
 * Reads the user identity out of a backend JWT.
 *
 * <p>Only the payload is decoded. The signature is the backend's business; the token is used
 * verbatim as a bearer credential and the backend rejects it if it is forged.</p>
 */
@Component
public class IdentityTokenExtractor {

    private static final String SUBJECT_CLAIM = "sub";

    private final ObjectMapper objectMapper;

    public IdentityTokenExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param jwt compact JWT
     * @return the {@code sub} claim
     * @throws AuthenticationFailedException if the token is malformed or has no subject
     */
    public String extractUserId(String jwt) {
        String[] parts = jwt == null ? new String[0] : jwt.split("\\.");
        if (parts.length < 2) {
            throw new AuthenticationFailedException("Invalid JWT: expected three dot-separated parts");
        }
        JsonNode payload;
        try {
            payload = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
        } catch (IllegalArgumentException | IOException decodeFailure) {
            throw new AuthenticationFailedException("Invalid JWT payload", decodeFailure);
        }
        JsonNode subject = payload == null ? null : payload.get(SUBJECT_CLAIM);
        if (subject == null || !subject.isTextual() || subject.asText().isBlank()) {
            throw new AuthenticationFailedException("JWT has no subject claim");
        }
        return subject.asText();
    }
}
