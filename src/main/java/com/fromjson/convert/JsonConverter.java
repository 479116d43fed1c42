package com.fromjson.convert;

import com.fromjson.json.JsonNode;
import com.fromjson.json.JsonTreeParser;
import com.fromjson.json.MalformedJsonException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of the library: JSON text in, output items out.
 */
public class JsonConverter {
    private static final Logger logger = LoggerFactory.getLogger(JsonConverter.class);

    private final JsonTreeParser parser;

    public JsonConverter() {
        this(new JsonTreeParser());
    }

    public JsonConverter(JsonTreeParser parser) {
        this.parser = parser;
    }

    /**
     * Converts one JSON document. Blank text yields no items.
     */
    public MutableList<Object> convert(String text, ConvertOptions options) {
        JsonNode root = parser.parse(text, options.depth());
        if (root == null) {
            return Lists.mutable.empty();
        }
        return new Materializer(options).materialize(root);
    }

    /**
     * Converts text that arrives in pieces, typically one line each.
     * <p>
     * When the first non-blank chunk is a complete document every chunk is
     * converted on its own and the items are concatenated (JSON Lines).
     * Otherwise the chunks are joined with line breaks and converted as one
     * document. A depth violation in the first chunk is reported, not retried.
     */
    public MutableList<Object> convert(List<String> chunks, ConvertOptions options) {
        int firstIndex = 0;
        while (firstIndex < chunks.size() && chunks.get(firstIndex).isBlank()) {
            firstIndex++;
        }
        if (firstIndex == chunks.size()) {
            return Lists.mutable.empty();
        }
        if (firstIndex == chunks.size() - 1) {
            return convert(chunks.get(firstIndex), options);
        }

        MutableList<Object> outputs;
        try {
            outputs = convert(chunks.get(firstIndex), options);
        } catch (MalformedJsonException e) {
            logger.debug("First of {} chunks is not a complete document, joining them", chunks.size());
            return convert(String.join("\n", chunks), options);
        }

        logger.debug("Converting {} chunks as separate documents", chunks.size());
        for (String chunk : chunks.subList(firstIndex + 1, chunks.size())) {
            outputs.addAll(convert(chunk, options));
        }
        return outputs;
    }
}
