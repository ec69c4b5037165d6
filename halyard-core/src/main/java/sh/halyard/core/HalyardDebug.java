// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core;

/**
 * Global toggles for verbose wire logging across Halyard modules.
 *
 * <p>Thread safety: the flags are volatile. {@link #isEnabled()} reads them
 * non-atomically, which is fine for best-effort logging.
 */
public final class HalyardDebug {

    private static volatile boolean frameLogging = false;
    private static volatile boolean heartbeatLogging = false;

    private HalyardDebug() {
    }

    /**
     * @return true if either frame or heartbeat logging is enabled
     */
    public static boolean isEnabled() {
        return frameLogging || heartbeatLogging;
    }

    public static void setEnabled(final boolean enabled) {
        frameLogging = enabled;
        heartbeatLogging = enabled;
    }

    public static void setFrameLogging(final boolean enabled) {
        frameLogging = enabled;
    }

    public static boolean isFrameLoggingEnabled() {
        return frameLogging;
    }

    public static void setHeartbeatLogging(final boolean enabled) {
        heartbeatLogging = enabled;
    }

    public static boolean isHeartbeatLoggingEnabled() {
        return heartbeatLogging;
    }
}
