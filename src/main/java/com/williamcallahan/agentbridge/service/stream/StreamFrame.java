package com.williamcallahan.agentbridge.service.stream;

import java.util.Objects;

/**
 * Unit of output handed to a completion sink.
 *
 * @param text content carried by the frame, empty for the finish frame
 * @param marker whether the text is a thinking-block marker rather than backend content
 * @param finish whether this frame ends the completion
 */
public record StreamFrame(String text, boolean marker, boolean finish) {

    public StreamFrame {
        Objects.requireNonNull(text, "text");
    }

    public static StreamFrame delta(String text) {
        return new StreamFrame(text, false, false);
    }

    public static StreamFrame marker(String text) {
        return new StreamFrame(text, true, false);
    }

    public static StreamFrame finishFrame() {
        return new StreamFrame("", false, true);
    }
}
