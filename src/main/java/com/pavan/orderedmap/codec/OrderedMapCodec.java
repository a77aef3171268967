package com.pavan.orderedmap.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.pavan.orderedmap.store.ConcurrentOrderedMap;
import com.pavan.orderedmap.store.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts a {@link ConcurrentOrderedMap} to and from a JSON array of pairs:
 * {@code [[k1, v1], [k2, v2], ...]}, in insertion order.
 * Works only through the map's public operations.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class OrderedMapCodec<K, V> {
    
    private static final Logger logger = LoggerFactory.getLogger(OrderedMapCodec.class);
    
    private final ObjectMapper mapper;
    private final ObjectReader treeReader;
    private final ObjectReader keyReader;
    private final ObjectReader valueReader;
    
    public OrderedMapCodec(Class<K> keyType, Class<V> valueType) {
        this(new ObjectMapper(), keyType, valueType);
    }
    
    public OrderedMapCodec(ObjectMapper mapper, Class<K> keyType, Class<V> valueType) {
        this(mapper, typeOf(mapper, keyType), typeOf(mapper, valueType));
    }
    
    /**
     * Creates a codec for parameterized key or value types.
     *
     * @param mapper the mapper used for both directions
     * @param keyType the type keys are bound to when decoding
     * @param valueType the type values are bound to when decoding
     */
    public OrderedMapCodec(ObjectMapper mapper, JavaType keyType, JavaType valueType) {
        if (mapper == null) {
            throw new IllegalArgumentException("ObjectMapper must not be null");
        }
        if (keyType == null || valueType == null) {
            throw new IllegalArgumentException("Key and value types must not be null");
        }
        this.mapper = mapper;
        // Anything after the outer array makes the input invalid JSON
        this.treeReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.keyReader = mapper.readerFor(keyType).without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        this.valueReader = mapper.readerFor(valueType).without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }
    
    /**
     * Encodes the entries of a map in insertion order.
     *
     * @param map the map to encode
     * @return the JSON bytes
     * @throws EncodeException if a key or value cannot be written as JSON
     */
    public byte[] serialize(ConcurrentOrderedMap<K, V> map) throws EncodeException {
        List<Entry<K, V>> entries = map.entries();
        List<List<Object>> pairs = new ArrayList<>(entries.size());
        for (Entry<K, V> entry : entries) {
            pairs.add(Arrays.asList(entry.getKey(), entry.getValue()));
        }
        
        try {
            byte[] data = mapper.writeValueAsBytes(pairs);
            logger.debug("Encoded {} entries into {} bytes", pairs.size(), data.length);
            return data;
        } catch (JsonProcessingException e) {
            throw new EncodeException("Failed to encode ordered map: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Decodes entries into a new, empty map.
     *
     * @param data the JSON bytes
     * @return a map holding the decoded entries in their encoded order
     * @throws DecodeException if the input is malformed
     */
    public ConcurrentOrderedMap<K, V> deserialize(byte[] data) throws DecodeException {
        List<Entry<K, V>> entries = decodeEntries(data);
        ConcurrentOrderedMap<K, V> map = new ConcurrentOrderedMap<>(entries.size());
        apply(entries, map);
        return map;
    }
    
    /**
     * Decodes entries and sets each one into the target, in encoded order.
     * Keys already present keep their position and take the decoded value.
     * The whole input is validated first; on failure the target is untouched.
     *
     * @param data the JSON bytes
     * @param target the map to populate
     * @throws DecodeException if the input is malformed
     */
    public void deserialize(byte[] data, ConcurrentOrderedMap<K, V> target) throws DecodeException {
        if (target == null) {
            throw new IllegalArgumentException("Target map must not be null");
        }
        apply(decodeEntries(data), target);
    }
    
    private void apply(List<Entry<K, V>> entries, ConcurrentOrderedMap<K, V> target) {
        for (Entry<K, V> entry : entries) {
            target.set(entry.getKey(), entry.getValue());
        }
        logger.debug("Applied {} decoded entries", entries.size());
    }
    
    private List<Entry<K, V>> decodeEntries(byte[] data) throws DecodeException {
        if (data == null) {
            throw new IllegalArgumentException("Input must not be null");
        }
        
        JsonNode root;
        try {
            root = treeReader.readTree(data);
        } catch (IOException e) {
            throw reject(DecodeException.Reason.MALFORMED_INPUT, "Input is not valid JSON", e);
        }
        
        if (root == null || root.isMissingNode()) {
            throw reject(DecodeException.Reason.MALFORMED_INPUT, "Input is empty", null);
        }
        if (!root.isArray()) {
            throw reject(DecodeException.Reason.STRUCTURE_MISMATCH,
                "Expected an array of [key, value] pairs", null);
        }
        
        List<Entry<K, V>> entries = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode pair = root.get(i);
            if (!pair.isArray() || pair.size() != 2) {
                throw reject(DecodeException.Reason.STRUCTURE_MISMATCH,
                    "Entry " + i + " is not a two-element [key, value] array", null);
            }
            entries.add(new Entry<>(readKey(pair.get(0), i), readValue(pair.get(1), i)));
        }
        return entries;
    }
    
    private K readKey(JsonNode node, int position) throws DecodeException {
        if (node.isNull()) {
            throw reject(DecodeException.Reason.TYPE_MISMATCH,
                "Entry " + position + " has a null key", null);
        }
        try {
            return keyReader.readValue(node);
        } catch (IOException e) {
            throw reject(DecodeException.Reason.TYPE_MISMATCH,
                "Entry " + position + " has a key of the wrong type", e);
        }
    }
    
    private V readValue(JsonNode node, int position) throws DecodeException {
        if (node.isNull()) {
            throw reject(DecodeException.Reason.TYPE_MISMATCH,
                "Entry " + position + " has a null value", null);
        }
        try {
            return valueReader.readValue(node);
        } catch (IOException e) {
            throw reject(DecodeException.Reason.TYPE_MISMATCH,
                "Entry " + position + " has a value of the wrong type", e);
        }
    }
    
    private static DecodeException reject(DecodeException.Reason reason, String message, Throwable cause) {
        logger.warn("Rejected serialized ordered map ({}): {}", reason, message);
        return new DecodeException(reason, message, cause);
    }
    
    private static JavaType typeOf(ObjectMapper mapper, Class<?> type) {
        if (mapper == null || type == null) {
            throw new IllegalArgumentException("ObjectMapper and types must not be null");
        }
        return mapper.getTypeFactory().constructType(type);
    }
}
