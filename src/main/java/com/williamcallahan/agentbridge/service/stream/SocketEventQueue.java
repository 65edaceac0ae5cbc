package com.williamcallahan.agentbridge.service.stream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bridges push-style socket callbacks into a pull-style sequence for a single consumer.
 *
 * <p>Producers (socket I/O threads) call {@link #offerMessage}, {@link #offerClose} and
 * {@link #offerError}. The owning session claims the consumer side once with {@link #claim()} and
 * then pulls with {@link #next()}, which blocks while the queue is empty. Messages come out in
 * arrival order, followed by exactly one terminal event; anything offered after the first terminal
 * event is discarded.</p>
 *
 * <p>Only one consumer per queue is supported. The queue is an owning handle of one session, not a
 * shared dispatcher.</p>
 */
public final class SocketEventQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition eventAvailable = lock.newCondition();
    private final Deque<SocketEvent> pending = new ArrayDeque<>();
    private final AtomicBoolean claimed = new AtomicBoolean();

    private boolean terminalQueued;
    private boolean terminalDelivered;

    public void offerMessage(String payload) {
        offer(new SocketEvent.Message(payload));
    }

    public void offerClose() {
        offer(new SocketEvent.Closed());
    }

    public void offerError(Throwable cause) {
        offer(new SocketEvent.Failed(cause));
    }

    private void offer(SocketEvent event) {
        lock.lock();
        try {
            if (terminalQueued) {
                return;
            }
            pending.addLast(event);
            if (event.terminal()) {
                terminalQueued = true;
            }
            eventAvailable.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claims the consumer side of this queue.
     *
     * @return this queue, for chaining
     * @throws IllegalStateException if a consumer already claimed it
     */
    public SocketEventQueue claim() {
        if (!claimed.compareAndSet(false, true)) {
            throw new IllegalStateException("Socket event queue already has a consumer");
        }
        return this;
    }

    /**
     * Pulls the next event, waiting while none is queued.
     *
     * @return the next event, or empty once the terminal event has been delivered
     * @throws InterruptedException if the consuming thread is interrupted while waiting
     */
    public Optional<SocketEvent> next() throws InterruptedException {
        if (!claimed.get()) {
            throw new IllegalStateException("Socket event queue must be claimed before consuming");
        }
        lock.lockInterruptibly();
        try {
            if (terminalDelivered) {
                return Optional.empty();
            }
            while (pending.isEmpty()) {
                eventAvailable.await();
            }
            SocketEvent event = pending.removeFirst();
            if (event.terminal()) {
                terminalDelivered = true;
                pending.clear();
            }
            return Optional.of(event);
        } finally {
            lock.unlock();
        }
    }
}
