package io.hslite.server.timeline;

public enum Direction {
    FORWARD,
    BACKWARD;

    /** Parse the {@code dir} query parameter: "f" or "b". */
    public static Direction fromParam(String dir) {
        if (dir == null || dir.equals("b")) return BACKWARD;
        if (dir.equals("f")) return FORWARD;
        throw new IllegalArgumentException("dir must be 'f' or 'b'");
    }
}
