package com.pavan.orderedmap.store;

import com.pavan.orderedmap.metrics.StatsCollector;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe map that remembers the order in which keys were first inserted.
 * Uses a single ReentrantReadWriteLock around the hash index and the insertion
 * sequence, so the two are always observed and mutated together.
 *
 * <p>Replacing the value of an existing key keeps its position. A key that is
 * deleted and set again is appended as the newest entry.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ConcurrentOrderedMap<K, V> {
    
    private final InsertionOrderIndex<K, V> entries;
    private final ReadWriteLock lock;
    private final StatsCollector stats;
    
    public ConcurrentOrderedMap() {
        this(new InsertionOrderIndex<>(), new StatsCollector());
    }
    
    public ConcurrentOrderedMap(int initialCapacity) {
        this(new InsertionOrderIndex<>(initialCapacity), new StatsCollector());
    }
    
    public ConcurrentOrderedMap(int initialCapacity, StatsCollector stats) {
        this(new InsertionOrderIndex<>(initialCapacity), stats);
    }
    
    private ConcurrentOrderedMap(InsertionOrderIndex<K, V> entries, StatsCollector stats) {
        if (stats == null) {
            throw new IllegalArgumentException("Stats collector must not be null");
        }
        this.entries = entries;
        this.lock = new ReentrantReadWriteLock();
        this.stats = stats;
    }
    
    /**
     * Retrieves the value for a key.
     *
     * @param key the key to look up
     * @return the value, or empty if the key is absent
     */
    public Optional<V> get(K key) {
        lock.readLock().lock();
        try {
            Node<K, V> node = entries.find(key);
            stats.recordGet(node != null);
            return node == null ? Optional.empty() : Optional.of(node.getValue());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Retrieves the value for a key, falling back to a default.
     * The default is not inserted.
     *
     * @param key the key to look up
     * @param defaultValue the value to return when the key is absent
     * @return the stored value, or defaultValue if the key is absent
     */
    public V getOrDefault(K key, V defaultValue) {
        lock.readLock().lock();
        try {
            Node<K, V> node = entries.find(key);
            stats.recordGet(node != null);
            return node == null ? defaultValue : node.getValue();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Inserts or replaces the value for a key.
     *
     * @param key the key to insert or update
     * @param value the value to associate with the key
     * @return true if the key was new, false if an existing value was replaced
     *         (even when the new value is equal to the old one)
     * @throws IllegalArgumentException if key or value is null
     */
    public boolean set(K key, V value) {
        if (key == null) {
            throw new IllegalArgumentException("Key must not be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Value must not be null");
        }
        
        lock.writeLock().lock();
        try {
            Node<K, V> node = entries.find(key);
            boolean wasNew = node == null;
            if (wasNew) {
                entries.append(key, value);
            } else {
                node.setValue(value);
            }
            stats.recordSet(wasNew);
            return wasNew;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Removes a key and its entry.
     *
     * @param key the key to remove
     * @return true if the key was present and removed
     */
    public boolean delete(K key) {
        lock.writeLock().lock();
        try {
            boolean removed = entries.unlink(key) != null;
            stats.recordDelete(removed);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Checks if a key is present.
     */
    public boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            return entries.find(key) != null;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Returns the number of entries.
     */
    public int len() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public boolean isEmpty() {
        return len() == 0;
    }
    
    /**
     * Returns the keys in insertion order, oldest first.
     * The list is a snapshot and is not affected by later changes.
     */
    public List<K> keys() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(entries.keys());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Returns the entries in insertion order, taken under a single read lock.
     */
    public List<Entry<K, V>> entries() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(entries.entries());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Returns the oldest entry, or empty if the map has no entries.
     */
    public Optional<Entry<K, V>> front() {
        lock.readLock().lock();
        try {
            Node<K, V> first = entries.first();
            return first == null ? Optional.empty() : Optional.of(first.toEntry());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Returns the most recently inserted entry, or empty if the map has no entries.
     */
    public Optional<Entry<K, V>> back() {
        lock.readLock().lock();
        try {
            Node<K, V> last = entries.last();
            return last == null ? Optional.empty() : Optional.of(last.toEntry());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Removes all entries.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Returns the statistics collector for this map.
     */
    public StatsCollector getStats() {
        return stats;
    }
    
    @Override
    public String toString() {
        return "ConcurrentOrderedMap" + entries();
    }
}
