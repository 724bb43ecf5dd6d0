package com.airmonitor.ingestion.live;

/**
 * Why an observer connection ended.
 */
public enum CloseCause {
    /** The observer closed the channel. */
    CLIENT_CLOSED,
    /** The transport failed while receiving. */
    TRANSPORT_ERROR,
    /** A frame could not be delivered (transport error or outbound buffer overflow). */
    SEND_FAILED,
    /** The initial snapshot could not be loaded or encoded. */
    SNAPSHOT_FAILED,
    /** The server side terminated the session. */
    SERVER_CLOSED
}
