package org.kohsuke.maven.unit;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Renders values for assertion failure messages.
 *
 * <p>
 * Scalars are rendered so that their type is visible ({@code 1} vs {@code 1L} vs {@code "1"}).
 * Arrays, collections and maps are rendered one element per line, which makes differences
 * between large values readable as a diff.
 */
public final class ReadableSerializer {
    private static final String INDENT = "  ";

    private ReadableSerializer() {
    }

    public static String printableValue(Object value) {
        StringBuilder buf = new StringBuilder();
        render(value, buf, "", new IdentityHashMap<Object, Boolean>());
        return buf.toString();
    }

    private static void render(Object value, StringBuilder buf, String indent, Map<Object, Boolean> visiting) {
        if (value == null) {
            buf.append("null");
        } else if (value instanceof String) {
            buf.append('"').append(value).append('"');
        } else if (value instanceof Character) {
            buf.append('\'').append(value).append('\'');
        } else if (value instanceof Long) {
            buf.append(value).append('L');
        } else if (value instanceof Float) {
            buf.append(value).append('f');
        } else if (value instanceof Short) {
            buf.append("(short) ").append(value);
        } else if (value instanceof Byte) {
            buf.append("(byte) ").append(value);
        } else if (value.getClass().isArray()) {
            if (enter(value, buf, visiting)) {
                int len = Array.getLength(value);
                Object[] items = new Object[len];
                for (int i = 0; i < len; i++)
                    items[i] = Array.get(value, i);
                renderSequence(len, Arrays.asList(items).iterator(), buf, indent, visiting);
                visiting.remove(value);
            }
        } else if (value instanceof Collection) {
            if (enter(value, buf, visiting)) {
                Collection<?> c = (Collection<?>) value;
                renderSequence(c.size(), c.iterator(), buf, indent, visiting);
                visiting.remove(value);
            }
        } else if (value instanceof Map) {
            if (enter(value, buf, visiting)) {
                renderMap((Map<?, ?>) value, buf, indent, visiting);
                visiting.remove(value);
            }
        } else {
            buf.append(value);
        }
    }

    private static boolean enter(Object value, StringBuilder buf, Map<Object, Boolean> visiting) {
        if (visiting.containsKey(value)) {
            buf.append("*RECURSION*");
            return false;
        }
        visiting.put(value, Boolean.TRUE);
        return true;
    }

    private static void renderSequence(int size, Iterator<?> items, StringBuilder buf, String indent,
                                       Map<Object, Boolean> visiting) {
        if (size == 0) {
            buf.append("[]");
            return;
        }
        String inner = indent + INDENT;
        buf.append("[\n");
        while (items.hasNext()) {
            buf.append(inner);
            render(items.next(), buf, inner, visiting);
            if (items.hasNext())
                buf.append(',');
            buf.append('\n');
        }
        buf.append(indent).append(']');
    }

    private static void renderMap(Map<?, ?> map, StringBuilder buf, String indent, Map<Object, Boolean> visiting) {
        if (map.isEmpty()) {
            buf.append("{}");
            return;
        }
        String inner = indent + INDENT;
        buf.append("{\n");
        Iterator<? extends Entry<?, ?>> itr = map.entrySet().iterator();
        while (itr.hasNext()) {
            Entry<?, ?> e = itr.next();
            buf.append(inner);
            render(e.getKey(), buf, inner, visiting);
            buf.append(" => ");
            render(e.getValue(), buf, inner, visiting);
            if (itr.hasNext())
                buf.append(',');
            buf.append('\n');
        }
        buf.append(indent).append('}');
    }
}
