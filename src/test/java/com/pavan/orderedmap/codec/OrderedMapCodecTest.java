package com.pavan.orderedmap.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pavan.orderedmap.store.ConcurrentOrderedMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OrderedMapCodecTest {
    
    private OrderedMapCodec<String, Integer> codec;
    private ConcurrentOrderedMap<String, Integer> map;
    
    @BeforeEach
    void setUp() {
        codec = new OrderedMapCodec<>(String.class, Integer.class);
        map = new ConcurrentOrderedMap<>();
    }
    
    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
    
    @Test
    void testSerializeAsArrayOfPairs() throws Exception {
        map.set("b", 2);
        map.set("a", 1);
        map.set("c", 3);
        
        String encoded = new String(codec.serialize(map), StandardCharsets.UTF_8);
        
        assertEquals("[[\"b\",2],[\"a\",1],[\"c\",3]]", encoded);
    }
    
    @Test
    void testSerializeEmptyMap() throws Exception {
        assertEquals("[]", new String(codec.serialize(map), StandardCharsets.UTF_8));
    }
    
    @Test
    void testSerializeReflectsUpdatesAndDeletes() throws Exception {
        map.set("a", 1);
        map.set("b", 2);
        map.set("c", 3);
        map.set("a", 10);
        map.delete("b");
        map.set("b", 20);
        
        String encoded = new String(codec.serialize(map), StandardCharsets.UTF_8);
        
        assertEquals("[[\"a\",10],[\"c\",3],[\"b\",20]]", encoded);
    }
    
    @Test
    void testRoundTrip() throws Exception {
        for (int i = 0; i < 100; i++) {
            map.set("key-" + (i * 7919 % 100), i);
        }
        map.delete("key-42");
        map.set("key-0", -1);
        
        ConcurrentOrderedMap<String, Integer> restored = codec.deserialize(codec.serialize(map));
        
        assertEquals(map.keys(), restored.keys());
        assertEquals(map.entries(), restored.entries());
    }
    
    @Test
    void testRoundTripWithNonStringKeys() throws Exception {
        OrderedMapCodec<Long, String> longCodec = new OrderedMapCodec<>(Long.class, String.class);
        ConcurrentOrderedMap<Long, String> source = new ConcurrentOrderedMap<>();
        source.set(30L, "thirty");
        source.set(10L, "ten");
        source.set(20L, "twenty");
        
        byte[] data = longCodec.serialize(source);
        
        assertEquals("[[30,\"thirty\"],[10,\"ten\"],[20,\"twenty\"]]", new String(data, StandardCharsets.UTF_8));
        assertEquals(List.of(30L, 10L, 20L), longCodec.deserialize(data).keys());
    }
    
    @Test
    void testRoundTripWithParameterizedValues() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        JavaType keyType = mapper.getTypeFactory().constructType(String.class);
        JavaType valueType = mapper.getTypeFactory().constructType(new TypeReference<List<Integer>>() { });
        OrderedMapCodec<String, List<Integer>> listCodec = new OrderedMapCodec<>(mapper, keyType, valueType);
        
        ConcurrentOrderedMap<String, List<Integer>> source = new ConcurrentOrderedMap<>();
        source.set("odd", List.of(1, 3, 5));
        source.set("even", List.of(2, 4));
        
        ConcurrentOrderedMap<String, List<Integer>> restored = listCodec.deserialize(listCodec.serialize(source));
        
        assertEquals(List.of("odd", "even"), restored.keys());
        assertEquals(Optional.of(List.of(2, 4)), restored.get("even"));
    }
    
    @Test
    void testDeserializeIntoExistingMap() throws Exception {
        map.set("x", 0);
        map.set("a", 0);
        
        codec.deserialize(json("[[\"a\",1],[\"b\",2]]"), map);
        
        // "a" keeps its original slot and takes the decoded value
        assertEquals(List.of("x", "a", "b"), map.keys());
        assertEquals(Optional.of(1), map.get("a"));
        assertEquals(Optional.of(2), map.get("b"));
    }
    
    @Test
    void testDeserializeDuplicateKeysLastValueWins() throws Exception {
        ConcurrentOrderedMap<String, Integer> restored = codec.deserialize(json("[[\"a\",1],[\"b\",2],[\"a\",3]]"));
        
        assertEquals(List.of("a", "b"), restored.keys());
        assertEquals(Optional.of(3), restored.get("a"));
    }
    
    @Test
    void testMalformedJson() {
        DecodeException e = assertThrows(DecodeException.class, () -> codec.deserialize(json("[[\"a\",1]"), map));
        assertEquals(DecodeException.Reason.MALFORMED_INPUT, e.getReason());
        assertEquals(0, map.len());
    }
    
    @Test
    void testTrailingContentRejected() {
        map.set("keep", 7);
        
        for (String input : List.of("[[\"a\",1]] garbage", "[[\"a\",1]]]", "[[\"a\",1]] [[\"b\",2]]")) {
            DecodeException e = assertThrows(DecodeException.class, () -> codec.deserialize(json(input), map), input);
            assertEquals(DecodeException.Reason.MALFORMED_INPUT, e.getReason(), input);
        }
        
        assertEquals(List.of("keep"), map.keys());
    }
    
    @Test
    void testEmptyInputRejected() {
        DecodeException e = assertThrows(DecodeException.class, () -> codec.deserialize(new byte[0]));
        assertEquals(DecodeException.Reason.MALFORMED_INPUT, e.getReason());
        
        e = assertThrows(DecodeException.class, () -> codec.deserialize(json("   ")));
        assertEquals(DecodeException.Reason.MALFORMED_INPUT, e.getReason());
    }
    
    @Test
    void testRootNotAnArray() {
        DecodeException e = assertThrows(DecodeException.class, () -> codec.deserialize(json("{\"a\":1}"), map));
        assertEquals(DecodeException.Reason.STRUCTURE_MISMATCH, e.getReason());
    }
    
    @Test
    void testFlattenedOddLengthRejected() {
        map.set("keep", 7);
        
        DecodeException e = assertThrows(DecodeException.class,
            () -> codec.deserialize(json("[\"a\",1,\"b\"]"), map));
        
        assertEquals(DecodeException.Reason.STRUCTURE_MISMATCH, e.getReason());
        assertEquals(List.of("keep"), map.keys());
        assertEquals(1, map.len());
    }
    
    @Test
    void testPairWithWrongArityRejected() {
        assertEquals(DecodeException.Reason.STRUCTURE_MISMATCH,
            assertThrows(DecodeException.class, () -> codec.deserialize(json("[[\"a\",1,2]]"))).getReason());
        assertEquals(DecodeException.Reason.STRUCTURE_MISMATCH,
            assertThrows(DecodeException.class, () -> codec.deserialize(json("[[\"a\"]]"))).getReason());
        assertEquals(DecodeException.Reason.STRUCTURE_MISMATCH,
            assertThrows(DecodeException.class, () -> codec.deserialize(json("[null]"))).getReason());
    }
    
    @Test
    void testLateFailureLeavesTargetUntouched() {
        map.set("keep", 7);
        
        assertThrows(DecodeException.class,
            () -> codec.deserialize(json("[[\"a\",1],[\"b\",2],[\"c\"]]"), map));
        
        assertEquals(List.of("keep"), map.keys());
        assertFalse(map.containsKey("a"));
    }
    
    @Test
    void testValueTypeMismatch() {
        DecodeException e = assertThrows(DecodeException.class,
            () -> codec.deserialize(json("[[\"a\",{\"nested\":true}]]"), map));
        
        assertEquals(DecodeException.Reason.TYPE_MISMATCH, e.getReason());
        assertEquals(0, map.len());
    }
    
    @Test
    void testFloatNotTruncatedToInteger() {
        DecodeException e = assertThrows(DecodeException.class,
            () -> codec.deserialize(json("[[\"a\",1.9]]"), map));
        
        assertEquals(DecodeException.Reason.TYPE_MISMATCH, e.getReason());
        assertEquals(0, map.len());
        
        OrderedMapCodec<Long, String> longCodec = new OrderedMapCodec<>(Long.class, String.class);
        assertEquals(DecodeException.Reason.TYPE_MISMATCH,
            assertThrows(DecodeException.class, () -> longCodec.deserialize(json("[[2.5,\"x\"]]"))).getReason());
    }
    
    @Test
    void testNullValueRejected() {
        map.set("keep", 7);
        
        DecodeException e = assertThrows(DecodeException.class,
            () -> codec.deserialize(json("[[\"a\",1],[\"b\",null]]"), map));
        
        assertEquals(DecodeException.Reason.TYPE_MISMATCH, e.getReason());
        assertEquals(List.of("keep"), map.keys());
    }
    
    @Test
    void testNullKeyRejected() {
        DecodeException e = assertThrows(DecodeException.class, () -> codec.deserialize(json("[[null,1]]")));
        assertEquals(DecodeException.Reason.TYPE_MISMATCH, e.getReason());
    }
    
    @Test
    void testEncodeFailure() {
        OrderedMapCodec<String, Object> objectCodec = new OrderedMapCodec<>(String.class, Object.class);
        ConcurrentOrderedMap<String, Object> source = new ConcurrentOrderedMap<>();
        source.set("opaque", new Object());
        
        assertThrows(EncodeException.class, () -> objectCodec.serialize(source));
    }
    
    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new OrderedMapCodec<>(null, Integer.class));
        assertThrows(IllegalArgumentException.class, () -> new OrderedMapCodec<>(null, String.class, Integer.class));
        assertThrows(IllegalArgumentException.class, () -> codec.deserialize(null));
        assertThrows(IllegalArgumentException.class, () -> codec.deserialize(json("[]"), null));
    }
}
