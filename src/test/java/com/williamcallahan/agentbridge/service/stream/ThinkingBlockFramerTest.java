package com.williamcallahan.agentbridge.service.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ThinkingBlockFramerTest {

    @Test
    void enteringThinkingOpensABlock() {
        ThinkingBlockFramer framer = new ThinkingBlockFramer();

        assertEquals(List.of(StreamFrame.marker(ThinkingBlockFramer.OPEN_MARKER)), framer.enter(SegmentType.THINKING));
        assertTrue(framer.isInsideThinkingBlock());
    }

    @Test
    void switchingBackToChatClosesTheBlock() {
        ThinkingBlockFramer framer = new ThinkingBlockFramer();
        framer.enter(SegmentType.THINKING);

        assertEquals(List.of(StreamFrame.marker(ThinkingBlockFramer.CLOSE_MARKER)), framer.enter(SegmentType.CHAT));
        assertFalse(framer.isInsideThinkingBlock());
    }

    @Test
    void stayingInTheSameSegmentEmitsNoMarkers() {
        ThinkingBlockFramer framer = new ThinkingBlockFramer();
        framer.enter(SegmentType.CHAT);

        assertTrue(framer.enter(SegmentType.CHAT).isEmpty());
        framer.enter(SegmentType.THINKING);
        assertTrue(framer.enter(SegmentType.THINKING).isEmpty());
    }

    @Test
    void closeOnlyEmitsWhileInsideABlock() {
        ThinkingBlockFramer framer = new ThinkingBlockFramer();
        assertTrue(framer.close().isEmpty());

        framer.enter(SegmentType.THINKING);
        assertEquals(StreamFrame.marker(ThinkingBlockFramer.CLOSE_MARKER), framer.close().orElseThrow());
        assertTrue(framer.close().isEmpty());
    }
}
