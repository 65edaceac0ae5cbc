package com.williamcallahan.agentbridge.support;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Unsigned JWTs for tests; only the payload matters to the bridge.
 */
public final class TestJwts {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private TestJwts() {}

    public static String withSubject(String subject) {
        return withPayload("{\"sub\":\"" + subject + "\",\"iat\":1700000000}");
    }

    public static String withPayload(String payloadJson) {
        return encode("{\"alg\":\"RS256\",\"typ\":\"JWT\"}") + "." + encode(payloadJson) + ".c2lnbmF0dXJl";
    }

    private static String encode(String json) {
        return ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
