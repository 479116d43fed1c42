package com.fromjson.json;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * The input is not valid JSON.
 */
public class MalformedJsonException extends ConvertFromJsonException {
    private final int line;
    private final int column;

    public MalformedJsonException(String reason, int line, int column) {
        this(reason, line, column, null);
    }

    private MalformedJsonException(String reason, int line, int column, Throwable cause) {
        super(ErrorKind.MALFORMED_JSON,
              String.format("Conversion from JSON failed: %s (line %d, column %d)", reason, line, column),
              cause);
        this.line = line;
        this.column = column;
    }

    /**
     * Translates a Jackson failure. {@code fallback} supplies the position for
     * failures that carry none, such as exceeded stream constraints.
     */
    public static MalformedJsonException from(JsonProcessingException e, JsonLocation fallback) {
        JsonLocation location = e.getLocation() != null ? e.getLocation() : fallback;
        int line = location != null ? location.getLineNr() : -1;
        int column = location != null ? location.getColumnNr() : -1;
        return new MalformedJsonException(e.getOriginalMessage(), line, column, e);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
