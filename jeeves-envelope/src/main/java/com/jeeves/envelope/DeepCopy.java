package com.jeeves.envelope;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive value copy for the JSON-like values stored in an envelope (maps, lists, sets, arrays
 * and scalars). Containers are rebuilt at every level; scalars such as strings, numbers, booleans,
 * enums and {@link java.time.Instant} are immutable and shared.
 */
public final class DeepCopy {

    private DeepCopy() {
    }

    /**
     * Copies {@code value} so that no container is shared with the source.
     *
     * @param value any value; null is returned as null
     * @return the copy
     */
    public static Object copyValue(Object value) {
        if (value == null) return null;
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>(Math.max(16, map.size() * 2));
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(e.getKey(), copyValue(e.getValue()));
            }
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object o : set) {
                copy.add(copyValue(o));
            }
            return copy;
        }
        if (value instanceof Collection<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object o : list) {
                copy.add(copyValue(o));
            }
            return copy;
        }
        if (value instanceof Object[] array) {
            return copyArray(array);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object copy = Array.newInstance(value.getClass().getComponentType(), length);
            System.arraycopy(value, 0, copy, 0, length);
            return copy;
        }
        return value;
    }

    /**
     * Keeps the array's component type. Falls back to {@code Object[]} when a copied element no
     * longer fits it, e.g. a {@code TreeMap[]} whose maps are rebuilt as {@code LinkedHashMap}.
     */
    private static Object[] copyArray(Object[] array) {
        Class<?> component = array.getClass().getComponentType();
        Object[] elements = new Object[array.length];
        boolean fits = true;
        for (int i = 0; i < array.length; i++) {
            elements[i] = copyValue(array[i]);
            fits &= elements[i] == null || component.isInstance(elements[i]);
        }
        if (!fits || component == Object.class) {
            return elements;
        }
        Object[] copy = (Object[]) Array.newInstance(component, array.length);
        System.arraycopy(elements, 0, copy, 0, array.length);
        return copy;
    }

    /** Typed variant of {@link #copyValue} for string-keyed maps; null yields null. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyMap(Map<String, ?> map) {
        if (map == null) return null;
        return (Map<String, Object>) copyValue(map);
    }

    /** Copies every map of the list; null yields an empty list. */
    public static List<Map<String, Object>> copyMapList(List<? extends Map<String, ?>> maps) {
        List<Map<String, Object>> copy = new ArrayList<>();
        if (maps == null) return copy;
        for (Map<String, ?> m : maps) {
            copy.add(copyMap(m));
        }
        return copy;
    }
}
