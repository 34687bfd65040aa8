package com.galois.multifunction.dot;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes of a node or edge.  Attributes are written in the order they
 * were first set.
 */
public final class Attributes {
    private final Map<String,String> values = new LinkedHashMap<String,String>();

    Attributes() {
    }

    public void set(String key, String value) {
        if (key == null) throw new NullPointerException("key");
        if (value == null) throw new NullPointerException("value");
        values.put(key, value);
    }

    /**
     * Get value of attribute.
     * @return the value, or <code>null</code> if not set.
     */
    public String get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Append <code>[key="value", ...]</code> to the builder.
     */
    void appendTo(StringBuilder b) {
        b.append('[');
        boolean first = true;
        for (Map.Entry<String,String> e : values.entrySet()) {
            if (!first) {
                b.append(", ");
            }
            first = false;
            b.append(e.getKey()).append("=\"");
            appendEscaped(b, e.getValue());
            b.append('"');
        }
        b.append(']');
    }

    // Backslashes are kept so that escapes like \l reach dot unchanged.
    private static void appendEscaped(StringBuilder b, String value) {
        for (int i = 0; i != value.length(); ++i) {
            char c = value.charAt(i);
            switch (c) {
            case '"':
                b.append("\\\"");
                break;
            case '\n':
                b.append("\\n");
                break;
            default:
                b.append(c);
            }
        }
    }
}
