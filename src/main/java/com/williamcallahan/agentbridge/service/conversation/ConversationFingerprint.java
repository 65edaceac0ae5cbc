package com.williamcallahan.agentbridge.service.conversation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-256 digest identifying a conversation history for a model.
 */
final class ConversationFingerprint {

    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final byte FIELD_SEPARATOR = 0x1F;
    private static final byte RECORD_SEPARATOR = 0x1E;

    private ConversationFingerprint() {}

    static String of(List<ConversationTurn> turns, String model) {
        MessageDigest digest = newDigest();
        update(digest, model == null ? "" : model);
        digest.update(RECORD_SEPARATOR);
        for (ConversationTurn turn : turns) {
            update(digest, turn.role());
            digest.update(FIELD_SEPARATOR);
            update(digest, turn.content().trim());
            digest.update(RECORD_SEPARATOR);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
        }
    }
}
