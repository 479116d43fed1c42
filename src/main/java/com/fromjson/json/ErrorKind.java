package com.fromjson.json;

/**
 * Failure categories a caller can branch on. Each carries the exit code the
 * command line reports for it.
 */
public enum ErrorKind {
    MALFORMED_JSON(1),
    INVALID_OPTION(2),
    DEPTH_EXCEEDED(3);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
