package com.fromjson.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Builds a {@link JsonNode} tree from JSON text without recursing on the
 * call stack. Open objects and arrays live on an explicit stack whose size is
 * the current nesting depth, so the depth limit is checked before a container
 * is entered and the rest of the document is never read once it is breached.
 *
 * <p>Instances hold no per-call state and may be shared.
 */
public class JsonTreeParser {
    /** Highest depth limit a caller may request. */
    public static final int MAX_DEPTH_CEILING = 2048;

    private static final Logger logger = LoggerFactory.getLogger(JsonTreeParser.class);

    private final JsonFactory factory = createJsonFactory();

    private static JsonFactory createJsonFactory() {
        JsonFactory factory = new JsonFactory();
        // Jackson must never trip before our own counter does, and valid
        // documents are not rejected for long numbers, strings or names
        factory.setStreamReadConstraints(StreamReadConstraints.builder()
            .maxNestingDepth(MAX_DEPTH_CEILING + 1)
            .maxNumberLength(Integer.MAX_VALUE)
            .maxStringLength(Integer.MAX_VALUE)
            .maxNameLength(Integer.MAX_VALUE)
            .build());
        return factory;
    }

    /**
     * Parses one JSON document.
     *
     * @return the root node, or {@code null} when the text is blank
     * @throws MalformedJsonException if the text is not a single valid JSON document
     * @throws DepthExceededException if objects and arrays nest deeper than {@code maxDepth}
     */
    public JsonNode parse(String text, int maxDepth) {
        JsonParser parser;
        try {
            parser = factory.createParser(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        try (parser) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                return null;
            }

            JsonNode root = readValue(parser, token, maxDepth);

            if (parser.nextToken() != null) {
                JsonLocation location = parser.currentTokenLocation();
                throw new MalformedJsonException("additional text encountered after the JSON content",
                                                 location.getLineNr(), location.getColumnNr());
            }
            return root;
        } catch (JsonProcessingException e) {
            throw MalformedJsonException.from(e, parser.currentLocation());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private JsonNode readValue(JsonParser parser, JsonToken first, int maxDepth) throws IOException {
        Deque<Container> open = new ArrayDeque<>();
        JsonToken token = first;

        while (true) {
            if (token == null) {
                JsonLocation location = parser.currentLocation();
                throw new MalformedJsonException("unexpected end of input",
                                                 location.getLineNr(), location.getColumnNr());
            }

            JsonNode completed;
            switch (token) {
                case START_OBJECT, START_ARRAY -> {
                    if (open.size() >= maxDepth) {
                        throw depthExceeded(parser, maxDepth);
                    }
                    open.push(token == JsonToken.START_OBJECT ? Container.object() : Container.array());
                    token = parser.nextToken();
                    continue;
                }
                case FIELD_NAME -> {
                    open.peek().pendingName = parser.currentName();
                    token = parser.nextToken();
                    continue;
                }
                case END_OBJECT, END_ARRAY -> completed = open.pop().toNode();
                default -> completed = scalar(parser, token);
            }

            if (open.isEmpty()) {
                return completed;
            }
            open.peek().add(completed);
            token = parser.nextToken();
        }
    }

    private JsonNode scalar(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                ? JsonNode.JsonNumber.of(parser.getBigIntegerValue())
                : JsonNode.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> {
                double value = parser.getDoubleValue();
                // 1e999 and the like overflow a double; keep the exact literal
                yield Double.isFinite(value)
                    ? JsonNode.JsonNumber.of(value)
                    : JsonNode.JsonNumber.of(parser.getDecimalValue());
            }
            case VALUE_TRUE -> new JsonNode.JsonBoolean(true);
            case VALUE_FALSE -> new JsonNode.JsonBoolean(false);
            case VALUE_NULL -> new JsonNode.JsonNull();
            default -> {
                JsonLocation location = parser.currentTokenLocation();
                throw new MalformedJsonException("unexpected JSON token " + token,
                                                 location.getLineNr(), location.getColumnNr());
            }
        };
    }

    private DepthExceededException depthExceeded(JsonParser parser, int maxDepth) {
        String path = parser.getParsingContext().pathAsPointer().toString();
        JsonLocation location = parser.currentTokenLocation();
        logger.debug("Nesting depth limit {} exceeded at '{}'", maxDepth, path);
        return new DepthExceededException(maxDepth, path, location.getLineNr(), location.getColumnNr());
    }

    /** An object or array that has been opened but not yet closed. */
    private static final class Container {
        private final MutableMap<String, JsonNode> fields;
        private final MutableList<JsonNode> elements;
        private String pendingName;

        private Container(MutableMap<String, JsonNode> fields, MutableList<JsonNode> elements) {
            this.fields = fields;
            this.elements = elements;
        }

        static Container object() {
            return new Container(JsonNode.JsonObject.orderedFields(), null);
        }

        static Container array() {
            return new Container(null, Lists.mutable.empty());
        }

        void add(JsonNode value) {
            if (fields != null) {
                // last duplicate wins
                fields.put(pendingName, value);
                pendingName = null;
            } else {
                elements.add(value);
            }
        }

        JsonNode toNode() {
            return fields != null ? new JsonNode.JsonObject(fields) : new JsonNode.JsonArray(elements);
        }
    }
}
