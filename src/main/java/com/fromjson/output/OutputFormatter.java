package com.fromjson.output;

import com.fromjson.convert.JsonRecord;

import java.util.List;
import java.util.Map;

/**
 * Renders converted values back to JSON text, either indented by two spaces
 * or compressed with no whitespace at all.
 */
public class OutputFormatter {
    private final boolean prettyPrint;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(Object value) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        write(value, 0, sb);

        return sb.toString();
    }

    private void write(Object value, int indent, StringBuilder sb) {
        if (value instanceof JsonRecord record) {
            writeObject(record.asMap(), indent, sb);
        } else if (value instanceof Map<?, ?> map) {
            writeObject(map, indent, sb);
        } else if (value instanceof List<?> list) {
            writeArray(list, indent, sb);
        } else if (value instanceof String s) {
            sb.append('"').append(escapeString(s)).append('"');
        } else if (value == null) {
            sb.append("null");
        } else {
            // Number and Boolean print as themselves; Double keeps its ".0"
            sb.append(value);
        }
    }

    private void writeObject(Map<?, ?> map, int indent, StringBuilder sb) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }

        String indentStr = " ".repeat(indent);
        sb.append('{');

        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;

            if (prettyPrint) {
                sb.append('\n').append(indentStr).append("  ");
            }
            sb.append('"')
              .append(escapeString(String.valueOf(entry.getKey())))
              .append(prettyPrint ? "\": " : "\":");
            write(entry.getValue(), indent + 2, sb);
        }

        if (prettyPrint) {
            sb.append('\n').append(indentStr);
        }
        sb.append('}');
    }

    private void writeArray(List<?> list, int indent, StringBuilder sb) {
        if (list.isEmpty()) {
            sb.append("[]");
            return;
        }

        String indentStr = " ".repeat(indent);
        sb.append('[');

        boolean first = true;
        for (Object element : list) {
            if (!first) {
                sb.append(',');
            }
            first = false;

            if (prettyPrint) {
                sb.append('\n').append(indentStr).append("  ");
            }
            write(element, indent + 2, sb);
        }

        if (prettyPrint) {
            sb.append('\n').append(indentStr);
        }
        sb.append(']');
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                case '\b' -> result.append("\\b");
                case '\f' -> result.append("\\f");
                default -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
