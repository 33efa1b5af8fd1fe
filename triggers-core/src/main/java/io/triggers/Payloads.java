package io.triggers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates and deep-copies event payloads.
 *
 * <p>Accepted value kinds: {@link String}, {@link Boolean}, the immutable boxed numbers
 * plus {@link BigInteger} and {@link BigDecimal}, {@link Map} with string keys, and
 * {@link Collection}. Copies are unmodifiable at every level. Mutable numbers such as
 * {@code AtomicLong} or {@code LongAdder} are rejected.
 */
final class Payloads {

    // exact classes; BigInteger and BigDecimal are not final
    private static final Set<Class<?>> NUMBER_TYPES = Set.of(
            Byte.class, Short.class, Integer.class, Long.class,
            Float.class, Double.class, BigInteger.class, BigDecimal.class);

    private Payloads() {
    }

    static Map<String, Object> copyOf(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return Collections.emptyMap();
        }
        return copyMap(payload, "payload");
    }

    private static Map<String, Object> copyMap(Map<?, ?> source, String path) {
        Map<String, Object> copy = new LinkedHashMap<>(source.size() * 2);
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException(path + " keys must be non-null strings, got: "
                        + entry.getKey());
            }
            copy.put(key, copyValue(entry.getValue(), path + "." + key));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value, String path) {
        if (value == null) {
            throw new IllegalArgumentException(path + " cannot be null");
        }
        if (value instanceof String || value instanceof Boolean
                || NUMBER_TYPES.contains(value.getClass())) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            return copyMap(map, path);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            int i = 0;
            for (Object element : collection) {
                copy.add(copyValue(element, path + "[" + i++ + "]"));
            }
            return Collections.unmodifiableList(copy);
        }
        throw new IllegalArgumentException(path + " has unsupported type "
                + value.getClass().getName());
    }
}
