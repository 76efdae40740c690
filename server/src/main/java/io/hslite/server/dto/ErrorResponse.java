// file: server/src/main/java/io/hslite/server/dto/ErrorResponse.java
package io.hslite.server.dto;

/** Matrix error envelope. */
public class ErrorResponse {
    public String errcode;
    public String error;

    public static ErrorResponse of(String errcode, String error) {
        ErrorResponse r = new ErrorResponse();
        r.errcode = errcode;
        r.error = error;
        return r;
    }
}
