// file: server/src/main/java/io/hslite/server/room/RoomSubscription.java
package io.hslite.server.room;

/** Handle for a room listener; closing it stops delivery. */
public interface RoomSubscription extends AutoCloseable {

    @Override
    void close();
}
