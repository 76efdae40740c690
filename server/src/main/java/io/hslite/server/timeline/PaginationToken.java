// file: server/src/main/java/io/hslite/server/timeline/PaginationToken.java
package io.hslite.server.timeline;

/**
 * Position between two timeline events: everything at or below {@code streamPos}
 * lies before the token. Encoded as {@code t<streamPos>}.
 */
public record PaginationToken(long streamPos) {

    public PaginationToken {
        if (streamPos < 0) throw new IllegalArgumentException("stream position must be >= 0");
    }

    public String encode() {
        return "t" + streamPos;
    }

    /**
     * @throws IllegalArgumentException when {@code token} is not a pagination token
     */
    public static PaginationToken decode(String token) {
        if (token == null || token.length() < 2 || token.charAt(0) != 't') {
            throw new IllegalArgumentException("invalid pagination token: " + token);
        }
        try {
            return new PaginationToken(Long.parseLong(token.substring(1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid pagination token: " + token, e);
        }
    }

    @Override
    public String toString() {
        return encode();
    }
}
