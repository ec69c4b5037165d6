// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

import java.time.Duration;
import java.util.Objects;

import io.netty.channel.EventLoopGroup;
import org.jspecify.annotations.Nullable;

/**
 * Configuration for {@link StompClient}.
 *
 * <pre>{@code
 * StompClientConfig config = StompClientConfig.builder()
 *         .login("guest")
 *         .passcode("guest")
 *         .virtualHost("/")
 *         .heartBeatMargin(Duration.ofSeconds(2))
 *         .build();
 *
 * StompClient client = StompClient.create(config);
 * }</pre>
 *
 * <p>
 * <strong>Transport Type Selection:</strong> {@link TransportType#AUTO} picks
 * Epoll on Linux and KQueue on macOS/BSD when the native library is on the
 * class path, NIO otherwise. Ignored when an external {@code eventLoopGroup}
 * is supplied.
 *
 * @param login           value of the CONNECT {@code login} header, omitted when null
 * @param passcode        value of the CONNECT {@code passcode} header, omitted when null
 * @param virtualHost     value of the CONNECT {@code host} header; the connect host when null
 * @param heartBeatMargin grace period added to the negotiated incoming interval
 *                        before the broker is declared dead. Default: 1 second.
 * @param connectTimeout  TCP connection establishment timeout. Default: 10 seconds.
 * @param transportType   Netty transport type (AUTO, NIO, EPOLL, KQUEUE)
 * @param ioThreads       number of Netty I/O threads when the group is created internally
 * @param eventLoopGroup  externally managed event loop group, or null to create one
 * @param tls             wrap the connection in TLS using the JDK trust store
 * @since 0.1.0
 */
public record StompClientConfig(
        @Nullable String login,
        @Nullable String passcode,
        @Nullable String virtualHost,
        Duration heartBeatMargin,
        Duration connectTimeout,
        TransportType transportType,
        int ioThreads,
        @Nullable EventLoopGroup eventLoopGroup,
        boolean tls) {

    /**
     * Netty transport types for the underlying channel implementation.
     */
    public enum TransportType {
        /** Epoll on Linux, KQueue on macOS/BSD, NIO otherwise. */
        AUTO,
        /** Java NIO transport. Works on all platforms. */
        NIO,
        /** Linux Epoll transport. Requires {@code netty-transport-native-epoll}. */
        EPOLL,
        /** macOS/BSD KQueue transport. Requires {@code netty-transport-native-kqueue}. */
        KQUEUE
    }

    private static final Duration DEFAULT_HEART_BEAT_MARGIN = Duration.ofMillis(1000);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_IO_THREADS = 1;

    /**
     * Compact constructor with validation and defaults.
     */
    public StompClientConfig {
        if (heartBeatMargin == null)
            heartBeatMargin = DEFAULT_HEART_BEAT_MARGIN;
        if (connectTimeout == null || connectTimeout.isZero())
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (transportType == null)
            transportType = TransportType.AUTO;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;

        if (heartBeatMargin.isNegative()) {
            throw new IllegalArgumentException("heartBeatMargin must be >= 0, got: " + heartBeatMargin);
        }
        if (connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be > 0, got: " + connectTimeout);
        }
        if (connectTimeout.toMillis() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("connectTimeout too large: " + connectTimeout);
        }
    }

    /**
     * Creates a configuration with all defaults: no credentials, the connect host
     * as virtual host, plain TCP.
     */
    public static StompClientConfig withDefaults() {
        return new StompClientConfig(null, null, null, null, null, null, 0, null, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link StompClientConfig}.
     */
    public static final class Builder {
        private @Nullable String login;
        private @Nullable String passcode;
        private @Nullable String virtualHost;
        private @Nullable Duration heartBeatMargin;
        private @Nullable Duration connectTimeout;
        private @Nullable TransportType transportType;
        private int ioThreads;
        private @Nullable EventLoopGroup eventLoopGroup;
        private boolean tls;

        private Builder() {
        }

        public Builder login(String login) {
            this.login = Objects.requireNonNull(login, "login");
            return this;
        }

        /**
         * Sets the passcode. It is redacted from frame logs.
         */
        public Builder passcode(String passcode) {
            this.passcode = Objects.requireNonNull(passcode, "passcode");
            return this;
        }

        /**
         * Sets the CONNECT {@code host} header. Default: the host passed to connect.
         */
        public Builder virtualHost(String virtualHost) {
            this.virtualHost = Objects.requireNonNull(virtualHost, "virtualHost");
            return this;
        }

        /**
         * Sets the grace period added to the negotiated incoming heartbeat interval.
         * Default: 1 second.
         */
        public Builder heartBeatMargin(Duration margin) {
            this.heartBeatMargin = margin;
            return this;
        }

        /**
         * Sets the connection timeout.
         * Default: 10 seconds.
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Sets the Netty transport type.
         * Default: AUTO (selects best available for the platform).
         */
        public Builder transportType(TransportType transportType) {
            this.transportType = transportType;
            return this;
        }

        /**
         * Sets the number of Netty I/O threads. Ignored if eventLoopGroup is provided.
         */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Sets a custom Netty EventLoopGroup.
         * The caller is responsible for shutting down this group.
         */
        public Builder eventLoopGroup(EventLoopGroup group) {
            this.eventLoopGroup = group;
            return this;
        }

        public Builder tls(boolean tls) {
            this.tls = tls;
            return this;
        }

        public StompClientConfig build() {
            return new StompClientConfig(login, passcode, virtualHost, heartBeatMargin, connectTimeout,
                    transportType, ioThreads, eventLoopGroup, tls);
        }
    }
}
