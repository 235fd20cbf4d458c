package com.overlaychat.server.live;

import java.util.concurrent.CompletableFuture;

/**
 * Connection to one upstream live room. Events are delivered to the {@link LiveEventListener}
 * the client was created with, in upstream order, on the client's own reader thread.
 */
public interface LiveClient {

    void start();

    /**
     * Asks the read loop to stop. The returned future completes once it has stopped;
     * {@link #close()} must only be called after that.
     */
    CompletableFuture<Void> stop();

    /** Releases the underlying connection. Safe to call on a client that never started. */
    void close();

    boolean isRunning();
}
