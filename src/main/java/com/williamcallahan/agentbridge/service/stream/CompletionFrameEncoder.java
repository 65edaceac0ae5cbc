package com.williamcallahan.agentbridge.service.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.williamcallahan.agentbridge.domain.completion.ChatCompletionChunk;
import com.williamcallahan.agentbridge.domain.completion.ChatCompletionResponse;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Renders frames into the OpenAI wire formats.
 *
 * <p>Event-stream frames are self-contained {@code data: <json>\n\n} lines and the stream ends
 * with a literal {@code data: [DONE]\n\n}.</p>
 */
@Component
public class CompletionFrameEncoder {

    public static final String DATA_PREFIX = "data: ";
    public static final String FRAME_SEPARATOR = "\n\n";
    public static final String DONE_FRAME = DATA_PREFIX + "[DONE]" + FRAME_SEPARATOR;
    public static final String FINISH_REASON_STOP = ChatCompletionResponse.FINISH_REASON_STOP;

    private final ObjectWriter jsonWriter;
    private final Clock clock;

    /**
     * Creates an encoder wired to the application's ObjectMapper.
     *
     * @param objectMapper JSON mapper for envelope serialization
     */
    @Autowired
    public CompletionFrameEncoder(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public CompletionFrameEncoder(ObjectMapper objectMapper, Clock clock) {
        this.jsonWriter = objectMapper.writer();
        this.clock = clock;
    }

    /**
     * Encodes a content chunk.
     *
     * @param session session the chunk belongs to
     * @param content incremental content, empty for priming and finish frames
     * @param finishReason null for all but the finish frame
     * @return encoded event-stream frame
     */
    public String chunk(BridgeSession session, String content, String finishReason) {
        ChatCompletionChunk chunk =
                ChatCompletionChunk.of(session.requestId(), epochSeconds(), session.model(), content, finishReason);
        return DATA_PREFIX + serialize(chunk) + FRAME_SEPARATOR;
    }

    /**
     * Encodes a translated frame; the finish frame carries the stop reason.
     */
    public String frame(BridgeSession session, StreamFrame frame) {
        return chunk(session, frame.text(), frame.finish() ? FINISH_REASON_STOP : null);
    }

    public String priming(BridgeSession session) {
        return chunk(session, "", null);
    }

    public String finish(BridgeSession session) {
        return frame(session, StreamFrame.finishFrame());
    }

    public String done() {
        return DONE_FRAME;
    }

    /**
     * Builds the aggregate response for non-streaming callers.
     *
     * @param session session the content belongs to
     * @param content full assistant content
     * @return completion envelope
     */
    public ChatCompletionResponse completion(BridgeSession session, String content) {
        return ChatCompletionResponse.of(session.requestId(), epochSeconds(), session.model(), content);
    }

    private long epochSeconds() {
        return clock.instant().getEpochSecond();
    }

    private String serialize(Object envelope) {
        try {
            return jsonWriter.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion chunk", e);
        }
    }
}
