package com.williamcallahan.agentbridge.service.stream;

import java.util.Objects;

/**
 * Content carried by one buffer update.
 *
 * @param segmentType whether the buffer is answer text or reasoning
 * @param content text as sent by the backend, snapshot or delta
 */
public record BufferPayload(SegmentType segmentType, String content) {

    public BufferPayload {
        Objects.requireNonNull(segmentType, "segmentType");
        content = content == null ? "" : content;
    }
}
