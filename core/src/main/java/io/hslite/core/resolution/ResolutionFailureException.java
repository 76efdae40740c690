// file: core/src/main/java/io/hslite/core/resolution/ResolutionFailureException.java
package io.hslite.core.resolution;

/**
 * Internal invariant violated while resolving state (missing event, cycle
 * in the auth graph). Nothing is written when this is thrown, so the
 * resolution can be retried once the cause is fixed.
 */
public class ResolutionFailureException extends RuntimeException {

    public ResolutionFailureException(String message) {
        super(message);
    }

    public ResolutionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
