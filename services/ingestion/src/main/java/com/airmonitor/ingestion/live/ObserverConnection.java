package com.airmonitor.ingestion.live;

import java.util.Objects;

/**
 * One observer of one device's live feed.
 *
 * <p>Identity is reference equality, so {@code equals} and {@code hashCode} stay inherited from {@code Object}.
 * A connection is used once: after {@link #close()} nothing more is ever sent on it.
 *
 * <p>Frame ordering is enforced here. The snapshot is always the first frame; live updates that race it
 * are held back (only the newest one is kept) and flushed right after it. Afterwards the connection
 * tracks the {@link FeedPosition} of the newest reading it has sent and skips anything that sorts
 * below it, so an observer never moves backwards even when change events are duplicated or
 * reordered. A reading at exactly the watermark is the same row again and is re-sent.
 */
public final class ObserverConnection {

    private final String id;
    private final String deviceId;
    private final ObserverChannel channel;

    // guarded by this
    private boolean snapshotSent;
    private boolean closed;
    private FeedPosition watermark;
    private PendingUpdate pending;

    public ObserverConnection(String id, String deviceId, ObserverChannel channel) {
        this.id = Objects.requireNonNull(id, "id");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public String id() {
        return id;
    }

    public String deviceId() {
        return deviceId;
    }

    /**
     * Sends the snapshot frame, then any update that arrived while the snapshot was loading.
     *
     * @param newest position of the newest snapshot reading, null for an empty snapshot
     * @return false when the channel rejected a frame
     */
    public synchronized boolean sendSnapshot(FeedPosition newest, String frame) {
        if (closed || snapshotSent) {
            return !closed;
        }
        snapshotSent = true;
        watermark = newest;
        if (!channel.trySend(frame)) {
            return false;
        }
        PendingUpdate held = pending;
        pending = null;
        if (held != null && !isStale(held.position())) {
            if (!channel.trySend(held.frame())) {
                return false;
            }
            watermark = held.position();
        }
        return true;
    }

    /**
     * Offers the live update frame of the reading at {@code position}.
     */
    public synchronized DeliveryOutcome sendUpdate(FeedPosition position, String frame) {
        if (closed) {
            return DeliveryOutcome.CLOSED;
        }
        if (!snapshotSent) {
            if (pending == null || position.compareTo(pending.position()) >= 0) {
                pending = new PendingUpdate(position, frame);
            }
            return DeliveryOutcome.DEFERRED;
        }
        if (isStale(position)) {
            return DeliveryOutcome.STALE;
        }
        if (!channel.trySend(frame)) {
            return DeliveryOutcome.FAILED;
        }
        watermark = position;
        return DeliveryOutcome.SENT;
    }

    /**
     * Marks the connection closed and closes its channel.
     *
     * @return true for the single call that actually closed it
     */
    public boolean close() {
        synchronized (this) {
            if (closed) {
                return false;
            }
            closed = true;
            pending = null;
        }
        channel.close();
        return true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private boolean isStale(FeedPosition position) {
        return watermark != null && position.compareTo(watermark) < 0;
    }

    @Override
    public String toString() {
        return "ObserverConnection[" + id + " -> " + deviceId + "]";
    }

    private record PendingUpdate(FeedPosition position, String frame) {}
}
