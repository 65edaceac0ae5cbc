package com.williamcallahan.agentbridge.service.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.agentbridge.support.BackendFrames;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies how socket events become output frames and when a session ends.
 */
class SessionTranslatorTest {

    private final SessionTranslator translator =
            new SessionTranslator("chatcmpl-test", new UpstreamEventDecoder(new ObjectMapper()));

    @Test
    void snapshotUpdatesProduceIncrementsAndStateEndsTheSession() {
        List<String> texts = new ArrayList<>();
        texts.addAll(textsOf(message(BackendFrames.chat("Hello"))));
        texts.addAll(textsOf(message(BackendFrames.chat("Hello world"))));
        SessionTranslator.Step last = message(BackendFrames.state(false));

        assertEquals(List.of("Hello", " world"), texts);
        assertEquals(SessionTranslator.Outcome.COMPLETED, last.outcome());
        assertTrue(last.frames().isEmpty());
        assertTrue(translator.isTerminated());
    }

    @Test
    void thinkingThenChatIsWrappedInBalancedMarkers() {
        List<String> texts = new ArrayList<>();
        texts.addAll(textsOf(message(BackendFrames.thinking("pondering"))));
        texts.addAll(textsOf(message(BackendFrames.chat("Answer"))));
        texts.addAll(textsOf(message(BackendFrames.state(false))));

        assertEquals(List.of("<think>", "pondering", "</think>", "Answer"), texts);
    }

    @Test
    void chatThinkingChatIsBracketedByExactlyOneMarkerPair() {
        List<String> texts = new ArrayList<>();
        texts.addAll(textsOf(message(BackendFrames.chat("A"))));
        texts.addAll(textsOf(message(BackendFrames.thinking("t"))));
        texts.addAll(textsOf(message(BackendFrames.thinking("tt"))));
        texts.addAll(textsOf(message(BackendFrames.chat("AB"))));
        texts.addAll(textsOf(message(BackendFrames.state(false))));

        assertEquals(List.of("A", "<think>", "t", "t", "</think>", "B"), texts);
        assertEquals(1, texts.stream().filter(ThinkingBlockFramer.OPEN_MARKER::equals).count());
        assertEquals(1, texts.stream().filter(ThinkingBlockFramer.CLOSE_MARKER::equals).count());
    }

    @Test
    void idleStateBeforeAnyUpdateIsIgnored() {
        SessionTranslator.Step stale = message(BackendFrames.state(false));

        assertEquals(SessionTranslator.Outcome.CONTINUE, stale.outcome());
        assertFalse(translator.hasReceivedUpdate());
        assertEquals(List.of("Hi"), textsOf(message(BackendFrames.chat("Hi"))));
        assertEquals(SessionTranslator.Outcome.COMPLETED, message(BackendFrames.state(false)).outcome());
    }

    @Test
    void inProgressStateKeepsTheSessionOpen() {
        message(BackendFrames.chat("Hi"));

        assertEquals(SessionTranslator.Outcome.CONTINUE, message(BackendFrames.state(true)).outcome());
    }

    @Test
    void malformedBufferCountsAsAnUpdateButProducesNothing() {
        SessionTranslator.Step step = message(BackendFrames.updateWithRawBuffer("{broken"));

        assertTrue(step.frames().isEmpty());
        assertTrue(translator.hasReceivedUpdate());
        assertEquals(SessionTranslator.Outcome.COMPLETED, message(BackendFrames.state(false)).outcome());
    }

    @Test
    void malformedOuterFrameIsSkipped() {
        SessionTranslator.Step step = message("not json at all");

        assertEquals(SessionTranslator.Outcome.CONTINUE, step.outcome());
        assertFalse(translator.hasReceivedUpdate());
    }

    @Test
    void emptyContentDoesNotSwitchSegments() {
        message(BackendFrames.thinking("hmm"));

        assertTrue(message(BackendFrames.chat("")).frames().isEmpty());
        assertEquals(List.of("</think>", "done"), textsOf(message(BackendFrames.chat("done"))));
    }

    @Test
    void socketCloseInsideThinkingBlockClosesTheBlock() {
        message(BackendFrames.thinking("hmm"));

        SessionTranslator.Step closed = translator.accept(new SocketEvent.Closed());

        assertEquals(SessionTranslator.Outcome.CLOSED, closed.outcome());
        assertEquals(List.of("</think>"), textsOf(closed));
    }

    @Test
    void socketFailureCarriesTheCause() {
        IOException cause = new IOException("connection reset");

        SessionTranslator.Step failed = translator.accept(new SocketEvent.Failed(cause));

        assertEquals(SessionTranslator.Outcome.FAILED, failed.outcome());
        assertSame(cause, failed.failure());
        assertTrue(failed.terminal());
    }

    @Test
    void abortClosesAnOpenBlockOnlyOnce() {
        message(BackendFrames.thinking("hmm"));

        assertEquals(List.of(StreamFrame.marker(ThinkingBlockFramer.CLOSE_MARKER)), translator.abort());
        assertTrue(translator.abort().isEmpty());
    }

    @Test
    void eventsAfterTerminationAreRejected() {
        translator.accept(new SocketEvent.Closed());

        assertThrows(IllegalStateException.class, () -> message(BackendFrames.chat("late")));
    }

    private SessionTranslator.Step message(String payload) {
        return translator.accept(new SocketEvent.Message(payload));
    }

    private static List<String> textsOf(SessionTranslator.Step step) {
        return step.frames().stream().map(StreamFrame::text).toList();
    }
}
