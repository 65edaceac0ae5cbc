package com.williamcallahan.agentbridge.service.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class CompletionFrameEncoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CompletionFrameEncoder encoder =
            new CompletionFrameEncoder(objectMapper, Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
    private final BridgeSession session = new BridgeSession("chatcmpl-1", "GPT5", "history-1", "user_1", "jwt",
            "Hi", HttpHeaders.EMPTY);

    @Test
    void finishFrameCarriesTheStopReasonAndAnEmptyDelta() throws Exception {
        assertTrue(StreamFrame.finishFrame().finish());

        JsonNode choice = choiceOf(encoder.finish(session));

        assertEquals("stop", choice.path("finish_reason").asText());
        assertEquals("", choice.path("delta").path("content").asText(""));
    }

    @Test
    void contentFramesHaveNoFinishReason() throws Exception {
        JsonNode priming = choiceOf(encoder.priming(session));
        JsonNode delta = choiceOf(encoder.frame(session, StreamFrame.delta("Hello")));

        assertTrue(priming.path("finish_reason").isNull() || priming.path("finish_reason").isMissingNode());
        assertEquals("Hello", delta.path("delta").path("content").asText());
        assertTrue(delta.path("finish_reason").isNull() || delta.path("finish_reason").isMissingNode());
    }

    @Test
    void framesUseTheSpacedDataPrefix() {
        String frame = encoder.frame(session, StreamFrame.marker(ThinkingBlockFramer.OPEN_MARKER));

        assertTrue(frame.startsWith("data: {"), frame);
        assertTrue(frame.endsWith("}\n\n"), frame);
        assertEquals("data: [DONE]\n\n", encoder.done());
    }

    private JsonNode choiceOf(String frame) throws Exception {
        String json = frame.substring(CompletionFrameEncoder.DATA_PREFIX.length(),
                frame.length() - CompletionFrameEncoder.FRAME_SEPARATOR.length());
        return objectMapper.readTree(json).path("choices").path(0);
    }
}
