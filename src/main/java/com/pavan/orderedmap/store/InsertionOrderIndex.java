package com.pavan.orderedmap.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash index over a doubly linked insertion sequence.
 * Lookup, append and unlink are all O(1): the index maps each key straight to
 * its node, and a node carries the links needed to splice itself out.
 *
 * <p>Not thread-safe. {@link ConcurrentOrderedMap} guards every call.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
class InsertionOrderIndex<K, V> {
    
    private static final int DEFAULT_INITIAL_CAPACITY = 16;
    
    private final Map<K, Node<K, V>> index;
    private final Node<K, V> head; // Sentinel before the oldest entry
    private final Node<K, V> tail; // Sentinel after the newest entry
    
    InsertionOrderIndex() {
        this(DEFAULT_INITIAL_CAPACITY);
    }
    
    InsertionOrderIndex(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity must not be negative");
        }
        this.index = new HashMap<>(initialCapacity);
        this.head = new Node<>(null, null);
        this.tail = new Node<>(null, null);
        head.next = tail;
        tail.prev = head;
    }
    
    /**
     * Looks up the node for a key.
     *
     * @param key the key to look up
     * @return the node holding the key, or null if not present
     */
    Node<K, V> find(K key) {
        return index.get(key);
    }
    
    /**
     * Appends a new entry after the newest one. The key must not be present.
     *
     * @param key the key to insert
     * @param value the value to associate with the key
     * @return the node that now holds the entry
     */
    Node<K, V> append(K key, V value) {
        Node<K, V> node = new Node<>(key, value);
        index.put(key, node);
        linkBeforeTail(node);
        return node;
    }
    
    /**
     * Removes a key from the index and its node from the sequence.
     *
     * @param key the key to remove
     * @return the removed node, or null if the key was not present
     */
    Node<K, V> unlink(K key) {
        Node<K, V> node = index.remove(key);
        if (node == null) {
            return null;
        }
        removeNode(node);
        return node;
    }
    
    /**
     * Returns the oldest node, or null when empty.
     */
    Node<K, V> first() {
        return head.next == tail ? null : head.next;
    }
    
    /**
     * Returns the newest node, or null when empty.
     */
    Node<K, V> last() {
        return tail.prev == head ? null : tail.prev;
    }
    
    /**
     * Copies the keys out in insertion order.
     */
    List<K> keys() {
        List<K> keys = new ArrayList<>(index.size());
        for (Node<K, V> node = head.next; node != tail; node = node.next) {
            keys.add(node.getKey());
        }
        return keys;
    }
    
    /**
     * Copies the entries out in insertion order.
     */
    List<Entry<K, V>> entries() {
        List<Entry<K, V>> entries = new ArrayList<>(index.size());
        for (Node<K, V> node = head.next; node != tail; node = node.next) {
            entries.add(node.toEntry());
        }
        return entries;
    }
    
    int size() {
        return index.size();
    }
    
    void clear() {
        index.clear();
        head.next = tail;
        tail.prev = head;
    }
    
    // Helper: Link node as the newest entry (right before tail)
    private void linkBeforeTail(Node<K, V> node) {
        node.prev = tail.prev;
        node.next = tail;
        tail.prev.next = node;
        tail.prev = node;
    }
    
    // Helper: Splice node out of the sequence
    private void removeNode(Node<K, V> node) {
        node.prev.next = node.next;
        node.next.prev = node.prev;
        node.prev = null;
        node.next = null;
    }
}
