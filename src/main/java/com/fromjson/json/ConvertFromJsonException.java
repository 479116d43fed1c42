package com.fromjson.json;

/**
 * Base class of every failure raised while converting JSON text.
 */
public abstract class ConvertFromJsonException extends RuntimeException {
    private final ErrorKind kind;

    protected ConvertFromJsonException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ConvertFromJsonException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
