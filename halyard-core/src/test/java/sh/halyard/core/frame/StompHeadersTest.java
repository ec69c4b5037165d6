// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.frame;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class StompHeadersTest {

    @Test
    void preservesInsertionOrder() {
        StompHeaders headers = new StompHeaders().set("b", "1").set("a", "2").set("c", "3");
        assertEquals(List.of("b", "a", "c"), List.copyOf(headers.names()));
    }

    @Test
    void setReplacesButPutIfAbsentKeepsExisting() {
        StompHeaders headers = new StompHeaders().set("k", "1");
        assertFalse(headers.putIfAbsent("k", "2"));
        assertEquals("1", headers.get("k"));
        headers.set("k", "3");
        assertEquals("3", headers.get("k"));
        assertTrue(headers.putIfAbsent("other", "x"));
    }

    @Test
    void ofRejectsOddArgumentCount() {
        assertThrows(IllegalArgumentException.class, () -> StompHeaders.of("a", "1", "b"));
    }

    @Test
    void readOnlyViewRejectsWrites() {
        StompHeaders headers = StompHeaders.of("a", "1").readOnly();
        assertTrue(headers.isReadOnly());
        assertThrows(UnsupportedOperationException.class, () -> headers.set("b", "2"));
        assertThrows(UnsupportedOperationException.class, () -> headers.remove("a"));
        assertThrows(UnsupportedOperationException.class, () -> StompHeaders.empty().set("x", "y"));
    }

    @Test
    void copyIsIndependentAndWritable() {
        StompHeaders original = StompHeaders.of("a", "1").readOnly();
        StompHeaders copy = original.copy();
        copy.set("b", "2");
        assertFalse(copy.isReadOnly());
        assertEquals(1, original.size());
        assertEquals(2, copy.size());
    }

    @Test
    void equalityIsByContent() {
        assertEquals(StompHeaders.of("a", "1"), new StompHeaders().set("a", "1").readOnly());
        assertNotEquals(StompHeaders.of("a", "1"), StompHeaders.of("a", "2"));
    }

    @Test
    void getOrDefaultFallsBack() {
        assertEquals("d", StompHeaders.empty().getOrDefault("missing", "d"));
    }
}
