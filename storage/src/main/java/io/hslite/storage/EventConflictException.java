// file: storage/src/main/java/io/hslite/storage/EventConflictException.java
package io.hslite.storage;

/**
 * Two different events claim the same id. Never resolved automatically.
 */
public class EventConflictException extends IllegalStateException {
    private final String eventId;

    public EventConflictException(String eventId) {
        super("event " + eventId + " is already stored with different content");
        this.eventId = eventId;
    }

    public String eventId() {
        return eventId;
    }
}
