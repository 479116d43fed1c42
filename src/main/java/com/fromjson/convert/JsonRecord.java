package com.fromjson.convert;

import org.eclipse.collections.api.RichIterable;
import org.eclipse.collections.api.map.MutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Record-like view of a JSON object. Every key is a member, looked up by name,
 * whether or not it is a valid Java identifier ({@code "$id"}, {@code "1"}).
 * Members keep document order. Instances are read-only.
 */
public final class JsonRecord {
    private final MutableMap<String, Object> members;

    JsonRecord(MutableMap<String, Object> members) {
        this.members = members;
    }

    /**
     * Value of the named member, or {@code null} when the member is absent or
     * holds JSON {@code null}; use {@link #hasMember} to tell them apart.
     */
    public Object get(String name) {
        return members.get(name);
    }

    public boolean hasMember(String name) {
        return members.containsKey(name);
    }

    public RichIterable<String> memberNames() {
        return members.keysView();
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /** Read-only, ordered view of the members. */
    public Map<String, Object> asMap() {
        return members.asUnmodifiable();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof JsonRecord other && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(members);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendMembers(this, sb);
        return sb.toString();
    }

    // One frame per nested record keeps deep documents off the stack limit
    private static void appendMembers(JsonRecord record, StringBuilder sb) {
        sb.append("@{");
        boolean first = true;
        for (Map.Entry<String, Object> member : record.members.entrySet()) {
            if (!first) {
                sb.append("; ");
            }
            first = false;
            sb.append(member.getKey()).append('=');
            appendValue(member.getValue(), sb);
        }
        sb.append('}');
    }

    private static void appendValue(Object value, StringBuilder sb) {
        if (value instanceof JsonRecord nested) {
            appendMembers(nested, sb);
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                appendValue(list.get(i), sb);
            }
            sb.append(']');
        } else {
            sb.append(value);
        }
    }
}
