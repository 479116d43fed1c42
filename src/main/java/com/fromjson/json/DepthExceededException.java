package com.fromjson.json;

/**
 * The document nests objects or arrays deeper than the active limit.
 */
public class DepthExceededException extends ConvertFromJsonException {
    private final int maxDepth;
    private final String path;

    public DepthExceededException(int maxDepth, String path, int line, int column) {
        super(ErrorKind.DEPTH_EXCEEDED,
              String.format("The maximum depth allowed for deserialization is %d. Path '%s', line %d, column %d.",
                            maxDepth, path, line, column));
        this.maxDepth = maxDepth;
        this.path = path;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public String path() {
        return path;
    }
}
