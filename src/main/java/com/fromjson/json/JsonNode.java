package com.fromjson.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;

/**
 * Parsed JSON value. Objects keep their keys in document order.
 */
public sealed interface JsonNode {
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        public static JsonObject empty() {
            return new JsonObject(orderedFields());
        }

        public static MutableMap<String, JsonNode> orderedFields() {
            return MapAdapter.adapt(new LinkedHashMap<>());
        }
    }

    record JsonArray(MutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray empty() {
            return new JsonArray(Lists.mutable.empty());
        }
    }

    record JsonString(String value) implements JsonNode {}

    // Integral literals stay integral so 1 and 1.0 materialize differently
    sealed interface JsonNumber extends JsonNode {
        Number numberValue();

        record JsonLong(long value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonBigInteger(BigInteger value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonBigDecimal(BigDecimal value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(BigInteger value) {
            return new JsonBigInteger(value);
        }

        static JsonNumber of(BigDecimal value) {
            return new JsonBigDecimal(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {}
    record JsonNull() implements JsonNode {}
}
