package com.jeeves.envelope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed reads from a state dict. Values may come straight from {@link Envelope#toStateDict()} or
 * from generic JSON (numbers of any width, lists instead of sets). A null or absent key yields the
 * default; a present value of the wrong shape raises {@link EnvelopeStateException}.
 */
final class StateValues {

    private StateValues() {
    }

    static String string(Map<String, ?> m, String key, String defaultValue) {
        Object v = m.get(key);
        if (v == null) return defaultValue;
        if (v instanceof String s) return s;
        throw new EnvelopeStateException(key, "expected a string but was " + v.getClass().getSimpleName());
    }

    static int intValue(Map<String, ?> m, String key, int defaultValue) {
        Object v = m.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Number n) return n.intValue();
        throw new EnvelopeStateException(key, "expected a number");
    }

    static long longValue(Map<String, ?> m, String key, long defaultValue) {
        Object v = m.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Number n) return n.longValue();
        throw new EnvelopeStateException(key, "expected a number");
    }

    static boolean bool(Map<String, ?> m, String key, boolean defaultValue) {
        Boolean b = optionalBool(m, key);
        return b != null ? b : defaultValue;
    }

    static Boolean optionalBool(Map<String, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Boolean b) return b;
        throw new EnvelopeStateException(key, "expected a boolean");
    }

    static Instant instant(Map<String, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Instant i) return i;
        if (v instanceof String s) return Timestamps.parse(s);
        throw new EnvelopeStateException(key, "expected a timestamp string");
    }

    /** Deep copy of a nested object; null when absent. */
    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Map<String, ?> m, String key) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(String.valueOf(e.getKey()), DeepCopy.copyValue(e.getValue()));
            }
            return copy;
        }
        throw new EnvelopeStateException(key, "expected an object");
    }

    static List<String> stringList(Map<String, ?> m, String key) {
        Object v = m.get(key);
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        if (!(v instanceof Collection<?> c)) throw new EnvelopeStateException(key, "expected a list");
        for (Object o : c) {
            if (!(o instanceof String s)) throw new EnvelopeStateException(key, "expected a list of strings");
            out.add(s);
        }
        return out;
    }

    /** Accepts a list of names or a {@code {name: true}} map (false entries are skipped). */
    static Set<String> stringSet(Map<String, ?> m, String key) {
        Object v = m.get(key);
        if (v instanceof Map<?, ?> map) {
            Set<String> out = new LinkedHashSet<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (Boolean.TRUE.equals(e.getValue())) {
                    out.add(String.valueOf(e.getKey()));
                }
            }
            return out;
        }
        return new LinkedHashSet<>(stringList(m, key));
    }

    static Map<String, String> stringMap(Map<String, ?> m, String key) {
        Object v = m.get(key);
        Map<String, String> out = new LinkedHashMap<>();
        if (v == null) return out;
        if (!(v instanceof Map<?, ?> map)) throw new EnvelopeStateException(key, "expected an object");
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getValue() instanceof String s)) {
                throw new EnvelopeStateException(key, "expected string values");
            }
            out.put(String.valueOf(e.getKey()), s);
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> mapList(Map<String, ?> m, String key) {
        Object v = m.get(key);
        List<Map<String, Object>> out = new ArrayList<>();
        if (v == null) return out;
        if (!(v instanceof Collection<?> c)) throw new EnvelopeStateException(key, "expected a list");
        for (Object o : c) {
            if (!(o instanceof Map<?, ?>)) throw new EnvelopeStateException(key, "expected a list of objects");
            out.add((Map<String, Object>) DeepCopy.copyValue(o));
        }
        return out;
    }
}
