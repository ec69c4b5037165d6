// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @AfterEach
    void resetDebug() {
        HalyardDebug.setEnabled(false);
    }

    @Test
    void redactsPasscodeHeader() {
        String sanitized = LogSanitizer.sanitize("CONNECT\nlogin:guest\npasscode:s3cret\n\n\0");

        assertFalse(sanitized.contains("s3cret"));
        assertTrue(sanitized.contains("passcode:***[REDACTED]***"));
        assertTrue(sanitized.contains("login:guest"));
    }

    @Test
    void passcodeInBodyIsNotAHeader() {
        String sanitized = LogSanitizer.sanitize("SEND\n\nmy passcode:visible\0");
        assertTrue(sanitized.contains("passcode:visible"));
    }

    @Test
    void makesControlCharactersVisible() {
        assertEquals("RECEIPT\\nreceipt-id:1\\r\\n\\n^@", LogSanitizer.sanitize("RECEIPT\nreceipt-id:1\r\n\n\0"));
    }

    @Test
    void truncatesLongDumps() {
        String sanitized = LogSanitizer.sanitize("x".repeat(5000));
        assertEquals(2000, sanitized.length());
        assertTrue(sanitized.endsWith("...(truncated)"));
    }

    @Test
    void nullBecomesLiteral() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void debugTogglesAreIndependent() {
        HalyardDebug.setFrameLogging(true);
        assertTrue(HalyardDebug.isEnabled());
        assertFalse(HalyardDebug.isHeartbeatLoggingEnabled());

        HalyardDebug.setEnabled(false);
        assertFalse(HalyardDebug.isFrameLoggingEnabled());
    }
}
