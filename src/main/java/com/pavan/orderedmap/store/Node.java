package com.pavan.orderedmap.store;

/**
 * Doubly linked node holding one entry of the insertion sequence.
 * The key is fixed for the life of the node; the value is replaced in place
 * so that updating a key never moves it.
 *
 * @param <K> the type of key
 * @param <V> the type of value
 */
class Node<K, V> {
    
    private final K key;
    private V value;
    Node<K, V> prev;
    Node<K, V> next;
    
    Node(K key, V value) {
        this.key = key;
        this.value = value;
    }
    
    K getKey() {
        return key;
    }
    
    V getValue() {
        return value;
    }
    
    void setValue(V value) {
        this.value = value;
    }
    
    Entry<K, V> toEntry() {
        return new Entry<>(key, value);
    }
}
