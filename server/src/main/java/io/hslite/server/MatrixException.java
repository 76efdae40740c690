// file: server/src/main/java/io/hslite/server/MatrixException.java
package io.hslite.server;

/**
 * Client-visible failure: HTTP status plus a Matrix {@code errcode}.
 */
public class MatrixException extends RuntimeException {
    private final int status;
    private final String errcode;

    public MatrixException(int status, String errcode, String message) {
        super(message);
        this.status = status;
        this.errcode = errcode;
    }

    public int status() {
        return status;
    }

    public String errcode() {
        return errcode;
    }

    public static MatrixException badJson(String message) {
        return new MatrixException(400, "M_BAD_JSON", message);
    }

    public static MatrixException invalidParam(String message) {
        return new MatrixException(400, "M_INVALID_PARAM", message);
    }

    public static MatrixException forbidden(String message) {
        return new MatrixException(403, "M_FORBIDDEN", message);
    }

    public static MatrixException notFound(String message) {
        return new MatrixException(404, "M_NOT_FOUND", message);
    }

    public static MatrixException missingPrevEvents(String message) {
        return new MatrixException(409, "M_MISSING_PREV_EVENTS", message);
    }

    public static MatrixException missingToken() {
        return new MatrixException(401, "M_MISSING_TOKEN", "missing access token");
    }

    public static MatrixException unknownToken() {
        return new MatrixException(401, "M_UNKNOWN_TOKEN", "unrecognised access token");
    }

    public static MatrixException tooLarge() {
        return new MatrixException(413, "M_TOO_LARGE", "request body too large");
    }

    public static MatrixException unknown(String message) {
        return new MatrixException(500, "M_UNKNOWN", message);
    }
}
