package com.airmonitor.ingestion.live;

/**
 * Outbound half of an observer's duplex transport.
 * Implementations must never block the caller.
 */
public interface ObserverChannel {

    /**
     * Queues a text frame for the observer.
     *
     * @return false when the frame cannot be accepted (channel closed or outbound buffer full)
     */
    boolean trySend(String frame);

    /**
     * Closes the underlying transport. Called at most once per channel.
     */
    void close();
}
