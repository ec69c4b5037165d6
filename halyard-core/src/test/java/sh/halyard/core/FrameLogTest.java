// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import sh.halyard.core.frame.StompCommand;
import sh.halyard.core.frame.StompFrame;
import sh.halyard.core.frame.StompHeaders;

class FrameLogTest {

    @AfterEach
    void resetDebug() {
        HalyardDebug.setEnabled(false);
    }

    @Test
    void previewKeepsShortInput() {
        assertEquals("hello", FrameLog.preview("hello".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void previewDecodesOnlyBoundedPrefixOfLargeBody() {
        byte[] body = new byte[1024 * 1024];
        Arrays.fill(body, (byte) 'x');

        String preview = FrameLog.preview(body);

        assertEquals(2000 + "...(truncated)".length(), preview.length());
        assertTrue(preview.endsWith("...(truncated)"));
    }

    @Test
    void inboundLoggingOfLargeFrameDoesNotThrow() {
        HalyardDebug.setFrameLogging(true);
        byte[] body = new byte[1024 * 1024];
        Arrays.fill(body, (byte) 0x7f);
        StompFrame frame = new StompFrame(StompCommand.MESSAGE, StompHeaders.empty(), body);

        assertDoesNotThrow(() -> FrameLog.inbound(frame));
        assertDoesNotThrow(() -> FrameLog.outbound(body));
    }
}
