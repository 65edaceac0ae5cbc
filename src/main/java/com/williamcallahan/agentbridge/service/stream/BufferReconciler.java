package com.williamcallahan.agentbridge.service.stream;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recovers true increments from buffer updates whose semantics the backend never declares.
 *
 * <p>Each segment type is tracked independently. The first non-empty content is emitted as-is.
 * The second one decides the mode for the rest of the session: if it extends the recorded
 * content the backend is sending snapshots, otherwise it is sending deltas.</p>
 *
 * <p>The prefix test can misclassify a delta stream whose second fragment happens to start with
 * the first one. There is no protocol signal to do better, so the first decision stands.</p>
 *
 * <p>Not thread-safe; one instance belongs to one session.</p>
 */
public final class BufferReconciler {

    /** How a segment's updates relate to each other once observed. */
    public enum Mode {
        UNDETERMINED,
        SNAPSHOT,
        DELTA
    }

    private final Map<SegmentType, SegmentState> states = new EnumMap<>(SegmentType.class);

    /**
     * Computes the text that is new since the previous update of the same segment type.
     *
     * @param segmentType segment the content belongs to
     * @param content raw content carried by the update
     * @return the increment to emit; empty when nothing new arrived
     */
    public String reconcile(SegmentType segmentType, String content) {
        Objects.requireNonNull(segmentType, "segmentType");
        if (content == null || content.isEmpty()) {
            return "";
        }
        SegmentState state = states.get(segmentType);
        if (state == null) {
            states.put(segmentType, new SegmentState(content));
            return content;
        }
        if (state.mode == Mode.UNDETERMINED) {
            state.mode = content.startsWith(state.previousContent) ? Mode.SNAPSHOT : Mode.DELTA;
        }
        if (state.mode == Mode.SNAPSHOT) {
            int recordedLength = state.previousContent.length();
            if (content.length() <= recordedLength) {
                // Stale or repeated snapshot; the recorded content never shrinks
                return "";
            }
            state.previousContent = content;
            return content.substring(recordedLength);
        }
        state.previousContent = state.previousContent + content;
        return content;
    }

    /**
     * Returns the mode decided for a segment type so far.
     *
     * @param segmentType segment to inspect
     * @return decided mode, {@link Mode#UNDETERMINED} until two non-empty updates were seen
     */
    public Mode modeOf(SegmentType segmentType) {
        SegmentState state = states.get(segmentType);
        return state == null ? Mode.UNDETERMINED : state.mode;
    }

    /**
     * Returns the content reconstructed so far for a segment type.
     *
     * @param segmentType segment to inspect
     * @return accumulated content, empty when nothing was recorded
     */
    public String contentOf(SegmentType segmentType) {
        SegmentState state = states.get(segmentType);
        return state == null ? "" : state.previousContent;
    }

    private static final class SegmentState {
        private Mode mode = Mode.UNDETERMINED;
        private String previousContent;

        private SegmentState(String firstContent) {
            this.previousContent = firstContent;
        }
    }
}
