// file: core/src/main/java/io/hslite/core/MalformedEventException.java
package io.hslite.core;

/**
 * Raised when an event is structurally invalid: missing or mistyped fields,
 * an id that does not match its content, a bad content hash or signature.
 * <p>
 * Malformed events are hard-rejected and never stored.
 */
public class MalformedEventException extends IllegalArgumentException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
