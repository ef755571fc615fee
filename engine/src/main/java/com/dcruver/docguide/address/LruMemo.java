package com.dcruver.docguide.address;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Size-bounded memo that drops the least recently used entry first.
 */
class LruMemo<K, V> {

    private final Map<K, V> entries;

    LruMemo(int maxEntries) {
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > maxEntries;
            }
        };
    }

    /**
     * Failures of the loader are not memoized.
     */
    synchronized V computeIfAbsent(K key, Function<K, V> loader) {
        V value = entries.get(key);
        if (value == null) {
            value = loader.apply(key);
            entries.put(key, value);
        }
        return value;
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized void clear() {
        entries.clear();
    }
}
