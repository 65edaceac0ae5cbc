package com.williamcallahan.agentbridge.service.stream;

/**
 * Decoded backend socket frame.
 */
public sealed interface UpstreamEvent permits UpstreamEvent.Update, UpstreamEvent.State, UpstreamEvent.Other {

    /**
     * Buffer update; the nested buffer is decoded separately so a bad buffer still counts as an update.
     *
     * @param buffer raw nested JSON carried in the {@code buffer} field
     */
    record Update(String buffer) implements UpstreamEvent {}

    /**
     * Generation state change. A missing flag reads as not in progress.
     *
     * @param inProgress whether the backend is still producing output
     */
    record State(boolean inProgress) implements UpstreamEvent {}

    /**
     * Any frame type the bridge does not act on.
     *
     * @param type the frame's {@code type} value, may be null
     */
    record Other(String type) implements UpstreamEvent {}
}
