package rc.java.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Size-bounded map with least-recently-used eviction, used to hold per-target state.
 *
 * - O(1) lookup and insertion
 * - Access order: every lookup refreshes the entry
 * - Eviction callback runs under the registry's monitor, keep it cheap
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class LruRegistry<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;

    /**
     * @param maxSize maximum number of entries (must be > 0)
     * @param onEvict invoked with each evicted entry, may be null
     */
    public LruRegistry(int maxSize, BiConsumer<K, V> onEvict) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > LruRegistry.this.maxSize;
                if (evict && onEvict != null) {
                    onEvict.accept(eldest.getKey(), eldest.getValue());
                }
                return evict;
            }
        };
    }

    /**
     * Returns the value for {@code key}, creating it with {@code factory} on first use.
     * Creation is atomic: concurrent callers for the same key get the same instance.
     */
    public synchronized V getOrCreate(K key, Function<? super K, ? extends V> factory) {
        V existing = map.get(key);
        if (existing != null) {
            return existing;
        }
        V created = factory.apply(key);
        if (created == null) throw new IllegalStateException("factory returned null for " + key);
        map.put(key, created);
        return created;
    }

    public synchronized V get(K key) {
        return map.get(key);
    }

    public synchronized int size() {
        return map.size();
    }

    public int maxSize() {
        return maxSize;
    }
}
