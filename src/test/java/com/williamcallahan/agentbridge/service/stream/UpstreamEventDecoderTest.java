package com.williamcallahan.agentbridge.service.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.agentbridge.support.BackendFrames;
import org.junit.jupiter.api.Test;

class UpstreamEventDecoderTest {

    private final UpstreamEventDecoder decoder = new UpstreamEventDecoder(new ObjectMapper());

    @Test
    void updateFrameCarriesTheNestedBufferText() {
        UpstreamEvent event = decoder.decodeFrame(BackendFrames.chat("Hi"));

        UpstreamEvent.Update update = assertInstanceOf(UpstreamEvent.Update.class, event);
        BufferPayload payload = decoder.decodeBuffer(update.buffer()).orElseThrow();
        assertEquals(SegmentType.CHAT, payload.segmentType());
        assertEquals("Hi", payload.content());
    }

    @Test
    void updateWithoutBufferDecodesAsEmptyObject() {
        UpstreamEvent.Update update =
                assertInstanceOf(UpstreamEvent.Update.class, decoder.decodeFrame("{\"type\":\"update\"}"));

        assertEquals("{}", update.buffer());
        assertTrue(decoder.decodeBuffer(update.buffer()).isEmpty());
    }

    @Test
    void objectBufferIsAcceptedAsWellAsText() {
        UpstreamEvent.Update update = assertInstanceOf(UpstreamEvent.Update.class,
                decoder.decodeFrame("{\"type\":\"update\",\"buffer\":{\"type\":\"thinking\",\"chat\":{\"content\":\"x\"}}}"));

        BufferPayload payload = decoder.decodeBuffer(update.buffer()).orElseThrow();
        assertEquals(SegmentType.THINKING, payload.segmentType());
        assertEquals("x", payload.content());
    }

    @Test
    void stateFrameReportsProgressFlag() {
        assertEquals(new UpstreamEvent.State(false), decoder.decodeFrame(BackendFrames.state(false)));
        assertEquals(new UpstreamEvent.State(true), decoder.decodeFrame(BackendFrames.state(true)));
        assertEquals(new UpstreamEvent.State(false), decoder.decodeFrame("{\"type\":\"state\"}"));
    }

    @Test
    void unknownFrameTypesDecodeAsOther() {
        assertEquals(new UpstreamEvent.Other("ping"), decoder.decodeFrame("{\"type\":\"ping\"}"));
    }

    @Test
    void bufferOfUnknownTypeYieldsNoPayload() {
        assertTrue(decoder.decodeBuffer("{\"type\":\"tool\",\"chat\":{\"content\":\"x\"}}").isEmpty());
    }

    @Test
    void bufferWithoutContentYieldsEmptyContent() {
        assertEquals("", decoder.decodeBuffer("{\"type\":\"chat\"}").orElseThrow().content());
    }

    @Test
    void malformedJsonIsAProtocolError() {
        assertThrows(BackendProtocolException.class, () -> decoder.decodeFrame("{not json"));
        assertThrows(BackendProtocolException.class, () -> decoder.decodeFrame("[1,2]"));
        assertThrows(BackendProtocolException.class, () -> decoder.decodeBuffer("oops"));
    }
}
