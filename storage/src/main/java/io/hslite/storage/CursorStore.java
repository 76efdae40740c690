// file: storage/src/main/java/io/hslite/storage/CursorStore.java
package io.hslite.storage;

import java.util.Map;

/**
 * Per-device delivery cursors: (device, room) to last delivered stream position.
 */
public interface CursorStore {

    /** @return last delivered position, 0 when nothing was delivered yet */
    long cursor(String deviceId, String roomId);

    /** All cursors of one device. */
    Map<String, Long> cursors(String deviceId);

    /** Move a cursor forward. Positions at or below the current one are ignored. */
    void advanceCursor(String deviceId, String roomId, long streamPos);
}
