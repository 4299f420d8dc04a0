package info.isaksson.erland.widgettoir.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, insertion-ordered copies for the maps carried by IR nodes and components.
 *
 * <p>{@link Map#copyOf} is not used because it loses source order and rejects null values.</p>
 */
public final class IrMaps {

    private IrMaps() {}

    public static <K, V> Map<K, V> orderedCopy(Map<K, V> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Copy of {@code source} with {@code key} set to {@code value}. */
    public static <K, V> Map<K, V> with(Map<K, V> source, K key, V value) {
        Map<K, V> out = source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
        out.put(key, value);
        return Collections.unmodifiableMap(out);
    }
}
