package com.fromjson.convert;

import com.fromjson.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a parsed tree into plain Java values.
 *
 * <ul>
 *   <li>objects become ordered {@link MutableMap}s when {@code asHashtable} is set, otherwise {@link JsonRecord}s</li>
 *   <li>arrays become {@link MutableList}s</li>
 *   <li>integral numbers become {@link Integer}, {@link Long} or {@link java.math.BigInteger},
 *       the smallest that holds them; other numbers become {@link Double}, or
 *       {@link java.math.BigDecimal} when they overflow a double</li>
 *   <li>JSON {@code null} becomes {@code null}</li>
 * </ul>
 *
 * A top-level array is unwrapped into one output item per element unless
 * {@code noEnumerate} is set. Recursion is bounded by the depth the parser
 * already enforced.
 */
public class Materializer {
    private final ConvertOptions options;

    public Materializer(ConvertOptions options) {
        this.options = options;
    }

    public MutableList<Object> materialize(JsonNode root) {
        MutableList<Object> outputs = Lists.mutable.empty();
        if (root instanceof JsonNode.JsonArray arr && !options.noEnumerate()) {
            for (JsonNode element : arr.elements()) {
                outputs.add(toValue(element));
            }
        } else {
            outputs.add(toValue(root));
        }
        return outputs;
    }

    Object toValue(JsonNode node) {
        if (node instanceof JsonNode.JsonObject obj) {
            MutableMap<String, Object> members = MapAdapter.adapt(new LinkedHashMap<>(obj.fields().size() * 2));
            for (Map.Entry<String, JsonNode> field : obj.fields().entrySet()) {
                members.put(field.getKey(), toValue(field.getValue()));
            }
            return options.asHashtable() ? members : new JsonRecord(members);
        }
        if (node instanceof JsonNode.JsonArray arr) {
            MutableList<Object> elements = Lists.mutable.empty();
            for (JsonNode element : arr.elements()) {
                elements.add(toValue(element));
            }
            return elements;
        }
        if (node instanceof JsonNode.JsonNumber.JsonLong n) {
            long value = n.value();
            if (value == (int) value) {
                return (int) value;
            }
            return value;
        }
        if (node instanceof JsonNode.JsonNumber n) {
            return n.numberValue();
        }
        if (node instanceof JsonNode.JsonString s) {
            return s.value();
        }
        if (node instanceof JsonNode.JsonBoolean b) {
            return b.value();
        }
        if (node instanceof JsonNode.JsonNull) {
            return null;
        }
        throw new IllegalStateException("Unknown JSON node " + node);
    }
}
