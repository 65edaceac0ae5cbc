package com.williamcallahan.agentbridge.service.stream;

import java.util.Optional;

/**
 * Logical buffer kinds the agent backend streams. Anything else on the wire is ignored.
 */
public enum SegmentType {
    CHAT("chat"),
    THINKING("thinking");

    private final String wireName;

    SegmentType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire type tag, matching exactly as the backend sends it.
     *
     * @param wireName buffer {@code type} value, may be null
     * @return matching segment type, or empty for unknown tags
     */
    public static Optional<SegmentType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (SegmentType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
