package io.hslite.server.room;

/** Where a candidate event came from. */
public enum EventOrigin {
    /** Built by this server for one of its clients. */
    LOCAL,
    /** Received from another server. */
    FEDERATION
}
