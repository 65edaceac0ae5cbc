package com.williamcallahan.agentbridge.service.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Brackets runs of thinking buffers with {@code <think>} / {@code </think>} markers.
 *
 * <p>State is shared by both segment types: a marker is only produced when the segment type of
 * consecutive non-empty buffers changes. Callers must invoke {@link #close()} before finishing a
 * session so no open marker is left unmatched.</p>
 */
public final class ThinkingBlockFramer {

    public static final String OPEN_MARKER = "<think>";
    public static final String CLOSE_MARKER = "</think>";

    private SegmentType lastSegmentType;
    private boolean insideThinkingBlock;

    /**
     * Records the segment type of the next non-empty buffer and returns the markers it requires.
     *
     * @param segmentType segment type of the incoming buffer
     * @return marker frames to emit before the buffer's content, possibly empty
     */
    public List<StreamFrame> enter(SegmentType segmentType) {
        if (segmentType == lastSegmentType) {
            return List.of();
        }
        List<StreamFrame> markers = new ArrayList<>(2);
        if (insideThinkingBlock) {
            markers.add(StreamFrame.marker(CLOSE_MARKER));
            insideThinkingBlock = false;
        }
        if (segmentType == SegmentType.THINKING) {
            markers.add(StreamFrame.marker(OPEN_MARKER));
            insideThinkingBlock = true;
        }
        lastSegmentType = segmentType;
        return markers;
    }

    /**
     * Closes a thinking block left open when the session ends.
     *
     * @return the close marker when a block was open
     */
    public Optional<StreamFrame> close() {
        if (!insideThinkingBlock) {
            return Optional.empty();
        }
        insideThinkingBlock = false;
        return Optional.of(StreamFrame.marker(CLOSE_MARKER));
    }

    public boolean isInsideThinkingBlock() {
        return insideThinkingBlock;
    }
}
