package com.williamcallahan.agentbridge.service.stream;

import java.util.Objects;

/**
 * Callback-level event observed on the backend socket.
 */
public sealed interface SocketEvent permits SocketEvent.Message, SocketEvent.Closed, SocketEvent.Failed {

    /**
     * Whether this event ends the socket's event sequence.
     */
    boolean terminal();

    /** A text frame received from the backend. */
    record Message(String payload) implements SocketEvent {
        public Message {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public boolean terminal() {
            return false;
        }
    }

    /** The socket closed, normally or not. */
    record Closed() implements SocketEvent {
        @Override
        public boolean terminal() {
            return true;
        }
    }

    /** The socket failed after it was opened. */
    record Failed(Throwable cause) implements SocketEvent {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }
}
