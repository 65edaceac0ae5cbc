package com.williamcallahan.agentbridge.service.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes the two JSON layers of backend socket frames.
 *
 * <p>Outer frames look like {@code {"type":"update","buffer":"<json>"}} or
 * {@code {"type":"state","state":{"inProgress":false}}}. The nested buffer looks like
 * {@code {"type":"chat","chat":{"content":"..."}}}.</p>
 */
public final class UpstreamEventDecoder {

    private static final String TYPE_UPDATE = "update";
    private static final String TYPE_STATE = "state";
    private static final String EMPTY_BUFFER = "{}";

    private final ObjectMapper objectMapper;

    public UpstreamEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Decodes an outer socket frame.
     *
     * @param frame raw text frame
     * @return decoded event
     * @throws BackendProtocolException if the frame is not a JSON object
     */
    public UpstreamEvent decodeFrame(String frame) {
        JsonNode root = readObject(frame, "socket frame");
        String type = textOrNull(root.get("type"));
        if (TYPE_UPDATE.equals(type)) {
            JsonNode buffer = root.get("buffer");
            if (buffer == null || buffer.isNull()) {
                return new UpstreamEvent.Update(EMPTY_BUFFER);
            }
            if (buffer.isObject()) {
                return new UpstreamEvent.Update(buffer.toString());
            }
            String bufferText = buffer.asText();
            return new UpstreamEvent.Update(bufferText.isEmpty() ? EMPTY_BUFFER : bufferText);
        }
        if (TYPE_STATE.equals(type)) {
            JsonNode state = root.path("state");
            return new UpstreamEvent.State(state.path("inProgress").asBoolean(false));
        }
        return new UpstreamEvent.Other(type);
    }

    /**
     * Decodes the nested buffer of an update frame.
     *
     * @param buffer nested JSON text
     * @return payload for chat or thinking buffers, empty for other buffer types
     * @throws BackendProtocolException if the buffer is not a JSON object
     */
    public Optional<BufferPayload> decodeBuffer(String buffer) {
        JsonNode root = readObject(buffer, "buffer");
        return SegmentType.fromWire(textOrNull(root.get("type")))
                .map(segmentType -> new BufferPayload(segmentType, textOrNull(root.path("chat").get("content"))));
    }

    private JsonNode readObject(String json, String layer) {
        if (json == null) {
            throw new BackendProtocolException("Missing " + layer, null);
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new BackendProtocolException("Expected a JSON object for " + layer, null);
            }
            return node;
        } catch (JsonProcessingException parseFailure) {
            throw new BackendProtocolException("Malformed " + layer + ": " + parseFailure.getOriginalMessage(),
                    parseFailure);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
