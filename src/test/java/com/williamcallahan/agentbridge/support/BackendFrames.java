package com.williamcallahan.agentbridge.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds socket frames the way the agent backend sends them: the inner buffer is JSON text
 * embedded as a string inside the outer frame.
 */
public final class BackendFrames {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BackendFrames() {}

    public static String update(String segmentType, String content) {
        ObjectNode buffer = MAPPER.createObjectNode();
        buffer.put("type", segmentType);
        buffer.putObject("chat").put("content", content);
        return updateWithRawBuffer(buffer.toString());
    }

    public static String chat(String content) {
        return update("chat", content);
    }

    public static String thinking(String content) {
        return update("thinking", content);
    }

    public static String updateWithRawBuffer(String buffer) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", "update");
        frame.put("buffer", buffer);
        return frame.toString();
    }

    public static String state(boolean inProgress) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", "state");
        frame.putObject("state").put("inProgress", inProgress);
        return frame.toString();
    }
}
