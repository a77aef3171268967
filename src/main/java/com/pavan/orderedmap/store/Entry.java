package com.pavan.orderedmap.store;

import java.util.Objects;

/**
 * Immutable key-value pair copied out of a {@link ConcurrentOrderedMap}.
 * Later changes to the map are not reflected in an entry already returned.
 *
 * @param <K> the type of key
 * @param <V> the type of value
 */
public final class Entry<K, V> {
    
    private final K key;
    private final V value;
    
    public Entry(K key, V value) {
        this.key = key;
        this.value = value;
    }
    
    public K getKey() {
        return key;
    }
    
    public V getValue() {
        return value;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Entry)) {
            return false;
        }
        Entry<?, ?> other = (Entry<?, ?>) o;
        return Objects.equals(key, other.key) && Objects.equals(value, other.value);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }
    
    @Override
    public String toString() {
        return key + "=" + value;
    }
}
