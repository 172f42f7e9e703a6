package com.tandemsystems.box;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BoxTest {

    @Test
    void testUnsafeUnpackReturnsPackedValue() {
        List<Object> values = List.of("hello", 42, 3.5d, List.of(1, 2), 'c');
        for (Object value : values) {
            assertEquals(value, Box.pack(value).unsafeUnpack(value.getClass()));
        }
    }

    @Test
    void testUnsafeUnpackWithWrongTypeIsProgrammerError() {
        Box box = Box.pack("not a number");
        assertThrows(ClassCastException.class, () -> box.unsafeUnpack(Integer.class));
    }

    @Test
    void testUnpackIsSafe() {
        Box box = Box.pack(7);

        assertEquals(Optional.of(7), box.unpack(Integer.class));
        assertEquals(Optional.of(7), box.unpack(Number.class));
        assertTrue(box.unpack(String.class).isEmpty());
    }

    @Test
    void testNullPayload() {
        Box box = Box.pack(null);

        assertNull(box.unsafeUnpack(String.class));
        assertTrue(box.unpack(String.class).isEmpty());
        assertTrue(box.payloadType().isEmpty());
    }

    @Test
    void testPayloadType() {
        assertEquals(Optional.of(String.class), Box.pack("x").payloadType());
    }

    @Test
    void testEqualityFollowsPayload() {
        assertEquals(Box.pack("a"), Box.pack("a"));
        assertEquals(Box.pack("a").hashCode(), Box.pack("a").hashCode());
        assertNotEquals(Box.pack("a"), Box.pack("b"));
        assertEquals(Box.pack(null), Box.pack(null));
    }
}
