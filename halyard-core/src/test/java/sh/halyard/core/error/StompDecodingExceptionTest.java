// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StompDecodingExceptionTest {

    @Test
    void isPartOfHalyardHierarchy() {
        HalyardException ex = StompDecodingException.missingTerminator("MESSAGE");
        assertInstanceOf(RuntimeException.class, ex);
    }

    @Test
    void invalidEscapeNamesSequenceAndIndex() {
        StompDecodingException ex = StompDecodingException.invalidEscape("ab\\tc", 2);
        assertEquals("Invalid escape sequence '\\t' at index 2", ex.getMessage());
        assertNull(ex.command());
    }

    @Test
    void trailingBackslashIsReported() {
        StompDecodingException ex = StompDecodingException.invalidEscape("ab\\", 2);
        assertTrue(ex.getMessage().contains("'\\'"));
    }

    @Test
    void withCommandAddsFrameAndKeepsStackTrace() {
        StompDecodingException original = StompDecodingException.invalidEscape("\\x", 0);
        StompDecodingException tagged = original.withCommand("MESSAGE");

        assertEquals("MESSAGE", tagged.command());
        assertTrue(tagged.getMessage().endsWith("(frame MESSAGE)"));
        assertArrayEquals(original.getStackTrace(), tagged.getStackTrace());
    }

    @Test
    void notConnectedNamesOperationAndState() {
        StompConnectionException ex = StompConnectionException.notConnected("send", "CONNECTING");
        assertEquals("Cannot send: client is CONNECTING, not CONNECTED", ex.getMessage());
    }
}
