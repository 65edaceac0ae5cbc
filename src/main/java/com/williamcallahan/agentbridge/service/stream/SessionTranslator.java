package com.williamcallahan.agentbridge.service.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one session's socket events into output frames and detects when the session is over.
 *
 * <p>Both completion sinks drive the same translator, so the streamed and aggregated renditions
 * of an event sequence always carry the same text. Owned by a single session; not thread-safe.</p>
 */
public final class SessionTranslator {
    private static final Logger log = LoggerFactory.getLogger(SessionTranslator.class);

    /** How a translation step left the session. */
    public enum Outcome {
        /** Keep consuming. */
        CONTINUE,
        /** The backend reported it finished after producing content. */
        COMPLETED,
        /** The socket closed before the backend reported completion. */
        CLOSED,
        /** The socket failed. */
        FAILED
    }

    /**
     * Result of feeding one event.
     *
     * @param frames frames to emit, in order; never includes the finish frame
     * @param outcome whether the session continues
     * @param failure socket failure cause when the outcome is {@link Outcome#FAILED}
     */
    public record Step(List<StreamFrame> frames, Outcome outcome, Throwable failure) {

        public boolean terminal() {
            return outcome != Outcome.CONTINUE;
        }
    }

    private final String requestId;
    private final UpstreamEventDecoder decoder;
    private final BufferReconciler reconciler = new BufferReconciler();
    private final ThinkingBlockFramer framer = new ThinkingBlockFramer();

    private boolean receivedAnyUpdate;
    private boolean terminated;

    public SessionTranslator(String requestId, UpstreamEventDecoder decoder) {
        this.requestId = requestId;
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Feeds one socket event.
     *
     * @param event next event from the session's queue
     * @return frames produced and the resulting outcome
     * @throws IllegalStateException if the session already terminated
     */
    public Step accept(SocketEvent event) {
        if (terminated) {
            throw new IllegalStateException("Session " + requestId + " already terminated");
        }
        if (event instanceof SocketEvent.Closed) {
            return terminate(Outcome.CLOSED, null);
        }
        if (event instanceof SocketEvent.Failed failed) {
            return terminate(Outcome.FAILED, failed.cause());
        }
        SocketEvent.Message message = (SocketEvent.Message) event;
        UpstreamEvent upstreamEvent;
        try {
            upstreamEvent = decoder.decodeFrame(message.payload());
        } catch (BackendProtocolException protocolError) {
            log.debug("[{}] Skipping undecodable socket frame: {}", requestId, protocolError.getMessage());
            return proceed(List.of());
        }
        if (upstreamEvent instanceof UpstreamEvent.Update update) {
            receivedAnyUpdate = true;
            return proceed(onBuffer(update.buffer()));
        }
        if (upstreamEvent instanceof UpstreamEvent.State state) {
            if (state.inProgress()) {
                return proceed(List.of());
            }
            if (!receivedAnyUpdate) {
                log.debug("[{}] Ignoring idle state received before any update", requestId);
                return proceed(List.of());
            }
            return terminate(Outcome.COMPLETED, null);
        }
        return proceed(List.of());
    }

    /**
     * Ends the session for a reason outside the event sequence, closing any open thinking block.
     *
     * @return frames still owed to the output, possibly empty
     */
    public List<StreamFrame> abort() {
        if (terminated) {
            return List.of();
        }
        terminated = true;
        return framer.close().map(List::of).orElse(List.of());
    }

    public boolean hasReceivedUpdate() {
        return receivedAnyUpdate;
    }

    public boolean isTerminated() {
        return terminated;
    }

    private List<StreamFrame> onBuffer(String buffer) {
        Optional<BufferPayload> decoded;
        try {
            decoded = decoder.decodeBuffer(buffer);
        } catch (BackendProtocolException protocolError) {
            log.warn("[{}] Skipping undecodable buffer: {}", requestId, protocolError.getMessage());
            return List.of();
        }
        if (decoded.isEmpty() || decoded.get().content().isEmpty()) {
            return List.of();
        }
        BufferPayload payload = decoded.get();
        List<StreamFrame> frames = new ArrayList<>(framer.enter(payload.segmentType()));
        String increment = reconciler.reconcile(payload.segmentType(), payload.content());
        if (!increment.isEmpty()) {
            frames.add(StreamFrame.delta(increment));
        }
        if (log.isTraceEnabled()) {
            log.trace("[{}] {} buffer length={} mode={} increment={}", requestId, payload.segmentType().wireName(),
                    payload.content().length(), reconciler.modeOf(payload.segmentType()), increment.length());
        }
        return frames;
    }

    private Step proceed(List<StreamFrame> frames) {
        return new Step(frames, Outcome.CONTINUE, null);
    }

    private Step terminate(Outcome outcome, Throwable failure) {
        return new Step(abort(), outcome, failure);
    }
}
