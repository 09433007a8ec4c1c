package work.blocks.ast.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads typed fields out of a node props map. A key mapped to {@code null} counts as absent.
 */
final class Props {
    private Props() {}

    static Map<String, Object> orEmpty(Map<String, Object> props) {
        return props == null ? Map.of() : props;
    }

    static boolean has(Map<String, Object> props, String key) {
        return props.get(key) != null;
    }

    static String string(Map<String, Object> props, String key, String subject) {
        Object value = props.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw malformed(subject, "\"" + key + "\" must be a string (got " + value.getClass().getSimpleName() + ")");
    }

    static List<ArgElement> args(Map<String, Object> props, String key, String subject) {
        return listOf(props, key, subject, ArgElement.class);
    }

    static List<SyntaxElement> childStack(Map<String, Object> props, String key, String subject) {
        return listOf(props, key, subject, SyntaxElement.class);
    }

    private static <T> List<T> listOf(Map<String, Object> props, String key, String subject, Class<T> type) {
        Object value = props.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw malformed(subject, "\"" + key + "\" must be a list (got " + value.getClass().getSimpleName() + ")");
        }
        List<T> typed = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (!type.isInstance(item)) {
                String found = item == null ? "null" : item.getClass().getSimpleName();
                throw malformed(subject, "\"" + key + "\"[" + i + "] must be a " + type.getSimpleName() + " (got " + found + ")");
            }
            typed.add(type.cast(item));
        }
        return typed;
    }

    static AstConstructionException malformed(String subject, String detail) {
        String prefix = subject == null ? "" : "\"" + subject + "\": ";
        return new AstConstructionException(Violation.MALFORMED_PROPS, subject, "Invalid props: " + prefix + detail);
    }
}
