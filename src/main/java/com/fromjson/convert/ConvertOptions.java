package com.fromjson.convert;

import com.fromjson.json.JsonTreeParser;

/**
 * Settings for one conversion.
 *
 * @param asHashtable objects become ordered maps instead of {@link JsonRecord}s
 * @param noEnumerate a top-level array is one output item instead of one item per element
 * @param depth       maximum nesting of objects and arrays, inclusive
 */
public record ConvertOptions(boolean asHashtable, boolean noEnumerate, int depth) {
    public static final int DEFAULT_DEPTH = 1024;

    public ConvertOptions {
        if (depth < 1 || depth > JsonTreeParser.MAX_DEPTH_CEILING) {
            throw new InvalidOptionException(String.format(
                "Depth must be between 1 and %d, was %d", JsonTreeParser.MAX_DEPTH_CEILING, depth));
        }
    }

    public static ConvertOptions defaults() {
        return new ConvertOptions(false, false, DEFAULT_DEPTH);
    }

    public ConvertOptions withAsHashtable(boolean asHashtable) {
        return new ConvertOptions(asHashtable, noEnumerate, depth);
    }

    public ConvertOptions withNoEnumerate(boolean noEnumerate) {
        return new ConvertOptions(asHashtable, noEnumerate, depth);
    }

    public ConvertOptions withDepth(int depth) {
        return new ConvertOptions(asHashtable, noEnumerate, depth);
    }
}
