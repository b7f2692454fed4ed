package tech.syncbridge.transform.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed path expression into a nested record.
 *
 * <p>Syntax: dot separated keys, each optionally followed by one or more {@code [n]}
 * list indexes, e.g. {@code properties.email} or {@code contacts[0].phones[1]}.</p>
 *
 * <p>Reading a path that does not exist yields {@code null}; writing a path creates
 * the intermediate objects and lists it needs.</p>
 */
public final class FieldPath {

    private final String expression;
    private final List<Segment> segments;

    private FieldPath(String expression, List<Segment> segments) {
        this.expression = expression;
        this.segments = segments;
    }

    /**
     * Parse a path expression.
     *
     * @throws IllegalArgumentException if the expression is blank or malformed
     */
    public static FieldPath parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Path expression must not be blank");
        }
        List<Segment> segments = new ArrayList<>();
        for (String part : expression.split("\\.", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in path: " + expression);
            }
            int bracket = part.indexOf('[');
            String key = bracket < 0 ? part : part.substring(0, bracket);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Missing key before index in path: " + expression);
            }
            segments.add(Segment.key(key));
            while (bracket >= 0) {
                int close = part.indexOf(']', bracket);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed index in path: " + expression);
                }
                String index = part.substring(bracket + 1, close);
                try {
                    int i = Integer.parseInt(index);
                    if (i < 0) {
                        throw new IllegalArgumentException("Negative index in path: " + expression);
                    }
                    segments.add(Segment.index(i));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Non numeric index '" + index + "' in path: " + expression, e);
                }
                int next = close + 1;
                if (next < part.length() && part.charAt(next) != '[') {
                    throw new IllegalArgumentException("Unexpected characters after index in path: " + expression);
                }
                bracket = next < part.length() ? next : -1;
            }
        }
        return new FieldPath(expression, Collections.unmodifiableList(segments));
    }

    /**
     * Convenience for one-off reads.
     */
    public static Object read(Map<String, Object> root, String expression) {
        return parse(expression).get(root);
    }

    public Object get(Map<String, Object> root) {
        Object current = root;
        for (Segment segment : segments) {
            if (current == null) {
                return null;
            }
            if (segment.isIndex()) {
                if (!(current instanceof List<?> list) || segment.index() >= list.size()) {
                    return null;
                }
                current = list.get(segment.index());
            } else {
                if (!(current instanceof Map<?, ?> map)) {
                    return null;
                }
                current = map.get(segment.key());
            }
        }
        return current;
    }

    public boolean isPresent(Map<String, Object> root) {
        return get(root) != null;
    }

    @SuppressWarnings("unchecked")
    public void set(Map<String, Object> root, Object value) {
        Object container = root;
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            boolean last = i == segments.size() - 1;
            Segment next = last ? null : segments.get(i + 1);

            if (segment.isIndex()) {
                List<Object> list = (List<Object>) container;
                while (list.size() <= segment.index()) {
                    list.add(null);
                }
                if (last) {
                    list.set(segment.index(), value);
                    return;
                }
                Object child = list.get(segment.index());
                if (!fits(child, next)) {
                    child = newContainer(next);
                    list.set(segment.index(), child);
                }
                container = child;
            } else {
                if (!(container instanceof Map)) {
                    throw new IllegalStateException("Cannot write key '" + segment.key() + "' of " + expression);
                }
                Map<String, Object> map = (Map<String, Object>) container;
                if (last) {
                    map.put(segment.key(), value);
                    return;
                }
                Object child = map.get(segment.key());
                if (!fits(child, next)) {
                    child = newContainer(next);
                    map.put(segment.key(), child);
                }
                container = child;
            }
        }
    }

    /**
     * The top level key this path starts with.
     */
    public String rootKey() {
        return segments.get(0).key();
    }

    public String expression() {
        return expression;
    }

    public List<Segment> segments() {
        return segments;
    }

    private static boolean fits(Object child, Segment next) {
        return next.isIndex() ? child instanceof List : child instanceof Map;
    }

    private static Object newContainer(Segment next) {
        return next.isIndex() ? new ArrayList<>() : new LinkedHashMap<String, Object>();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldPath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        return expression;
    }

    /**
     * A key or a list index.
     */
    public record Segment(String key, int index) {

        static Segment key(String key) {
            return new Segment(key, -1);
        }

        static Segment index(int index) {
            return new Segment(null, index);
        }

        public boolean isIndex() {
            return key == null;
        }
    }
}
