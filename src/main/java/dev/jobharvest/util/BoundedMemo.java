package dev.jobharvest.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Size-capped memo with least-recently-used eviction. The loader runs outside the
 * lock, so two threads missing the same key may both load it; the last write wins.
 * Failed loads are not memoized.
 */
public class BoundedMemo<K, V> {

    private final int maxEntries;
    private final Map<K, V> entries;

    public BoundedMemo(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedMemo.this.maxEntries;
            }
        };
    }

    public V get(K key, Function<K, V> loader) {
        synchronized (entries) {
            V cached = entries.get(key);
            if (cached != null) {
                return cached;
            }
        }
        V loaded = loader.apply(key);
        if (loaded != null) {
            synchronized (entries) {
                entries.put(key, loaded);
            }
        }
        return loaded;
    }
}
