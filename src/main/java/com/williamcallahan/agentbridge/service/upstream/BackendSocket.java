package com.williamcallahan.agentbridge.service.upstream;

/**
 * Handle to an open backend socket.
 *
 * <p>Closing is idempotent and always results in a close event on the session's queue, which is
 * how a blocked consumer is released early.</p>
 */
public interface BackendSocket extends AutoCloseable {

    @Override
    void close();
}
