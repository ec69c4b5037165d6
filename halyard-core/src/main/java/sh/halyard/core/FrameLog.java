// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.halyard.core.frame.StompFrame;

/**
 * Wire-level trace of frames and heartbeats, gated by {@link HalyardDebug}.
 * Every dump is passed through {@link LogSanitizer}.
 */
public final class FrameLog {

    private static final Logger LOG = LoggerFactory.getLogger("sh.halyard.wire");

    private FrameLog() {
    }

    public static void outbound(final byte[] raw) {
        if (!HalyardDebug.isFrameLoggingEnabled()) {
            return;
        }
        LOG.info(">>> {}", LogSanitizer.sanitize(preview(raw)));
    }

    public static void inbound(final StompFrame frame) {
        if (!HalyardDebug.isFrameLoggingEnabled()) {
            return;
        }
        String dump = frame.command() + "\n"
                + frame.headers().asMap().entrySet().stream()
                        .map(e -> e.getKey() + ":" + e.getValue() + "\n")
                        .reduce("", String::concat)
                + "\n" + preview(frame.body());
        LOG.info("<<< {}", LogSanitizer.sanitize(dump));
    }

    /**
     * Decodes at most {@link LogSanitizer#MAX_LOG_LENGTH} bytes; longer input is
     * marked as truncated.
     */
    static String preview(final byte[] bytes) {
        if (bytes.length <= LogSanitizer.MAX_LOG_LENGTH) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return new String(bytes, 0, LogSanitizer.MAX_LOG_LENGTH, StandardCharsets.UTF_8)
                + LogSanitizer.TRUNCATION_SUFFIX;
    }

    public static void heartbeat(final String direction) {
        if (!HalyardDebug.isHeartbeatLoggingEnabled()) {
            return;
        }
        LOG.info("{} heartbeat", direction);
    }
}
