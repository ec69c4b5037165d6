// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

import io.netty.buffer.ByteBuf;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.halyard.client.transport.NettyStompTransport;
import sh.halyard.client.transport.StompReactor;
import sh.halyard.client.transport.StompTransport;
import sh.halyard.client.transport.TransportListener;
import sh.halyard.core.FrameLog;
import sh.halyard.core.error.StompConnectionException;
import sh.halyard.core.error.StompDecodingException;
import sh.halyard.core.frame.StompCommand;
import sh.halyard.core.frame.StompFrame;
import sh.halyard.core.frame.StompFrameDecoder;
import sh.halyard.core.frame.StompFrameEncoder;
import sh.halyard.core.frame.StompHeaders;
import sh.halyard.core.heartbeat.HeartBeat;

/**
 * STOMP 1.2 client for a single broker connection.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * StompClient client = StompClient.create();
 * client.onConnected(c -> {
 *     client.subscribe("/queue/orders");
 *     client.send("/queue/audit", "hello");
 * });
 * client.onMessage(m -> System.out.println(m.bodyAsString()));
 * client.onDisconnected(d -> System.out.println("gone: " + d.reason()));
 * client.connect("broker.example.com", 61613, HeartBeat.of(10_000, 10_000));
 * }</pre>
 *
 * <p>
 * <strong>Lifecycle:</strong> {@code UNCONNECTED -> CONNECTING -> CONNECTED ->
 * DISCONNECTED}. Every path out of a live connection goes through one teardown
 * that stops the heartbeat timers, closes the transport and publishes
 * {@link StompEvent.Disconnected} exactly once. A client is single-use: create a
 * new one to reconnect.
 *
 * <p>
 * <strong>Thread Safety:</strong> all state is owned by the transport's reactor
 * thread. Methods may be called from any thread; calls from other threads are
 * handed to the reactor and wait for it. Listeners run on the reactor thread
 * and must not block.
 *
 * @since 0.1.0
 */
public final class StompClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StompClient.class);

    /** Default STOMP port. */
    public static final int DEFAULT_PORT = 61613;

    /** The only protocol version this client speaks. */
    public static final String PROTOCOL_VERSION = "1.2";

    private static final int RECEIPT_RANGE = 1_000_000;

    private final StompClientConfig config;
    private final StompTransport transport;
    private final StompReactor reactor;
    private final Random random;
    private final StompEventDispatcher dispatcher = new StompEventDispatcher();
    private final SubscriptionRegistry subscriptions;
    private final HeartbeatMonitor heartbeats;
    private final StompFrameDecoder decoder = new StompFrameDecoder();
    private final FrameHandler frameHandler = new FrameHandler();

    private volatile StompMetrics metrics = StompMetrics.noop();
    private volatile ConnectionState state = ConnectionState.UNCONNECTED;

    private @Nullable String host;
    private int port;
    private HeartBeat clientHeartBeat = HeartBeat.NONE;
    private volatile @Nullable String sessionId;
    private volatile @Nullable String version;
    private volatile @Nullable String server;
    private volatile HeartBeat serverHeartBeat = HeartBeat.NONE;
    private volatile HeartBeat negotiatedHeartBeat = HeartBeat.NONE;

    StompClient(final StompClientConfig config, final StompTransport transport, final Random random) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.reactor = transport.reactor();
        this.random = Objects.requireNonNull(random, "random");
        this.subscriptions = new SubscriptionRegistry(random);
        this.heartbeats = new HeartbeatMonitor(reactor, config.heartBeatMargin().toMillis(), new HeartbeatHandler());
    }

    /**
     * Creates a client with default configuration and its own Netty event loop.
     */
    public static StompClient create() {
        return create(StompClientConfig.withDefaults());
    }

    /**
     * Creates a client with the given configuration.
     */
    public static StompClient create(final StompClientConfig config) {
        return new StompClient(config, new NettyStompTransport(config), new Random());
    }

    /**
     * Creates a client over a caller-supplied transport, e.g. an in-memory one.
     */
    public static StompClient create(final StompClientConfig config, final StompTransport transport) {
        return new StompClient(config, transport, new Random());
    }

    /**
     * Sets the metrics collector. Default: {@link StompMetrics#noop()}.
     */
    public void setMetrics(final StompMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        dispatcher.setMetrics(metrics);
    }

    // ==================== Connection lifecycle ====================

    /**
     * Connects to {@code host} on the default port without heartbeats.
     */
    public void connect(final String host) {
        connect(host, DEFAULT_PORT, HeartBeat.NONE);
    }

    /**
     * Connects without heartbeats.
     */
    public void connect(final String host, final int port) {
        connect(host, port, HeartBeat.NONE);
    }

    /**
     * Connects with a heartbeat offer in header form, e.g. {@code "10000,10000"}.
     *
     * @throws IllegalArgumentException if the value is malformed
     */
    public void connect(final String host, final int port, final String heartBeat) {
        connect(host, port, HeartBeat.parse(heartBeat));
    }

    /**
     * Starts connecting. Returns once the transport connect was issued; the
     * outcome is published as {@link StompEvent.Connected} or
     * {@link StompEvent.Disconnected}.
     *
     * @param host      broker host name
     * @param port      broker port
     * @param heartBeat the cadence offered in CONNECT
     * @throws IllegalStateException if connect was already called on this client
     */
    public void connect(final String host, final int port, final HeartBeat heartBeat) {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(heartBeat, "heartBeat");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        runOnLoop(() -> {
            if (state != ConnectionState.UNCONNECTED) {
                throw new IllegalStateException(
                        "connect() already called (state " + state + "); create a new StompClient to reconnect");
            }
            this.host = host;
            this.port = port;
            this.clientHeartBeat = heartBeat;
            transition(ConnectionState.CONNECTING);
            log.info("Connecting to {}:{} (heart-beat {})", host, port, heartBeat);
            transport.connect(host, port, new TransportHandler());
        });
    }

    /**
     * Ends the connection. When connected, sends DISCONNECT with a receipt and
     * tears down without waiting for the broker's RECEIPT. While connecting,
     * tears down without sending anything. Otherwise does nothing.
     */
    public void disconnect() {
        if (state == ConnectionState.DISCONNECTED || state == ConnectionState.UNCONNECTED) {
            return;
        }
        runOnLoop(this::disconnectNow);
    }

    /**
     * Disconnects if needed and releases the transport, including an owned event
     * loop group.
     */
    @Override
    public void close() {
        if (state != ConnectionState.DISCONNECTED) {
            try {
                runOnLoop(() -> {
                    if (state == ConnectionState.UNCONNECTED) {
                        transition(ConnectionState.DISCONNECTED);
                        decoder.close();
                    } else {
                        disconnectNow();
                    }
                });
            } catch (StompConnectionException e) {
                log.debug("Reactor already stopped while closing", e);
            }
        }
        transport.close();
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public ConnectionState getState() {
        return state;
    }

    /** The {@code session} header of CONNECTED, or null. */
    public @Nullable String getSessionId() {
        return sessionId;
    }

    /** The {@code version} header of CONNECTED, or null. */
    public @Nullable String getVersion() {
        return version;
    }

    /** The {@code server} header of CONNECTED, or null. */
    public @Nullable String getServer() {
        return server;
    }

    /** The cadence the broker advertised in CONNECTED. */
    public HeartBeat getServerHeartBeat() {
        return serverHeartBeat;
    }

    /** The cadence in force: {@link HeartBeat#NONE} until CONNECTED. */
    public HeartBeat getNegotiatedHeartBeat() {
        return negotiatedHeartBeat;
    }

    /** Subscriptions currently tracked, in subscription order. */
    public List<Subscription> getSubscriptions() {
        if (state == ConnectionState.DISCONNECTED) {
            return List.of();
        }
        return callOnLoop(subscriptions::snapshot);
    }

    // ==================== Frame operations ====================

    /**
     * Subscribes with {@link AckMode#AUTO} and a generated id.
     */
    public String subscribe(final String destination) {
        return subscribe(destination, AckMode.AUTO, null);
    }

    public String subscribe(final String destination, final AckMode ackMode) {
        return subscribe(destination, ackMode, null);
    }

    /**
     * Subscribes to a destination. If the destination is already subscribed its
     * id is returned and nothing is sent.
     *
     * @param id the subscription id, or null to generate one
     * @return the subscription id
     * @throws StompConnectionException if not connected
     * @throws IllegalArgumentException if {@code id} is used by another subscription
     */
    public String subscribe(final String destination, final AckMode ackMode, final @Nullable String id) {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(ackMode, "ackMode");
        return callOnLoop(() -> {
            requireConnected("subscribe");
            Subscription existing = subscriptions.find(destination);
            if (existing != null) {
                log.debug("Already subscribed to {} as {}", destination, existing.id());
                return existing.id();
            }
            Subscription subscription = subscriptions.register(destination, ackMode, id);
            sendFrame(StompFrame.of(StompCommand.SUBSCRIBE, StompHeaders.of(
                    StompHeaders.DESTINATION, destination,
                    StompHeaders.ID, subscription.id(),
                    StompHeaders.ACK, ackMode.headerValue())));
            return subscription.id();
        });
    }

    /**
     * Sends UNSUBSCRIBE for an id and forgets the matching subscription. The id
     * does not have to be one this client tracks.
     */
    public void unsubscribe(final String id) {
        Objects.requireNonNull(id, "id");
        runOnLoop(() -> {
            requireConnected("unsubscribe");
            subscriptions.removeById(id);
            sendFrame(StompFrame.of(StompCommand.UNSUBSCRIBE, StompHeaders.of(StompHeaders.ID, id)));
        });
    }

    /**
     * Acknowledges a message.
     *
     * @param id the {@code ack} header of the MESSAGE (see {@link StompEvent.MessageReceived#ackId()})
     */
    public void ack(final String id) {
        Objects.requireNonNull(id, "id");
        runOnLoop(() -> {
            requireConnected("ack");
            sendFrame(StompFrame.of(StompCommand.ACK, StompHeaders.of(StompHeaders.ID, id)));
        });
    }

    /**
     * Rejects a message.
     */
    public void nack(final String id) {
        Objects.requireNonNull(id, "id");
        runOnLoop(() -> {
            requireConnected("nack");
            sendFrame(StompFrame.of(StompCommand.NACK, StompHeaders.of(StompHeaders.ID, id)));
        });
    }

    public void send(final String destination, final String body) {
        send(destination, null, body);
    }

    public void send(final String destination, final @Nullable StompHeaders headers, final @Nullable String body) {
        send(destination, headers, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Sends a message. The caller's headers are copied; {@code content-length} is
     * set to the body size unless the caller supplied one, and {@code destination}
     * always overrides.
     *
     * @throws StompConnectionException if not connected
     */
    public void send(final String destination, final @Nullable StompHeaders headers, final byte @Nullable [] body) {
        Objects.requireNonNull(destination, "destination");
        StompHeaders frameHeaders = headers == null ? new StompHeaders() : headers.copy();
        byte[] payload = body == null ? new byte[0] : body.clone();
        frameHeaders.putIfAbsent(StompHeaders.CONTENT_LENGTH, Integer.toString(payload.length));
        frameHeaders.set(StompHeaders.DESTINATION, destination);
        runOnLoop(() -> {
            requireConnected("send");
            sendFrame(new StompFrame(StompCommand.SEND, frameHeaders, payload));
        });
    }

    // ==================== Listeners ====================

    /** Every frame written, with its encoded bytes. */
    public Registration onSendFrame(final Consumer<? super StompEvent.FrameSent> listener) {
        return dispatcher.register(StompEvent.FrameSent.class, listener);
    }

    public Registration onConnected(final Consumer<? super StompEvent.Connected> listener) {
        return dispatcher.register(StompEvent.Connected.class, listener);
    }

    public Registration onMessage(final Consumer<? super StompEvent.MessageReceived> listener) {
        return dispatcher.register(StompEvent.MessageReceived.class, listener);
    }

    public Registration onReceipt(final Consumer<? super StompEvent.ReceiptReceived> listener) {
        return dispatcher.register(StompEvent.ReceiptReceived.class, listener);
    }

    /** ERROR frames sent by the broker. */
    public Registration onError(final Consumer<? super StompEvent.BrokerError> listener) {
        return dispatcher.register(StompEvent.BrokerError.class, listener);
    }

    public Registration onDisconnected(final Consumer<? super StompEvent.Disconnected> listener) {
        return dispatcher.register(StompEvent.Disconnected.class, listener);
    }

    public Registration onDecodeError(final Consumer<? super StompEvent.DecodeFailed> listener) {
        return dispatcher.register(StompEvent.DecodeFailed.class, listener);
    }

    public <E extends StompEvent> Registration addListener(final Class<E> type, final Consumer<? super E> listener) {
        return dispatcher.register(type, listener);
    }

    // ==================== Reactor-confined internals ====================

    private void disconnectNow() {
        switch (state) {
            case CONNECTED -> {
                String receipt = Integer.toString(random.nextInt(RECEIPT_RANGE));
                sendFrame(StompFrame.of(StompCommand.DISCONNECT, StompHeaders.of(StompHeaders.RECEIPT, receipt)));
                teardown(DisconnectReason.CLIENT_DISCONNECT, null);
            }
            case CONNECTING -> teardown(DisconnectReason.CLIENT_DISCONNECT, null);
            default -> log.debug("disconnect() ignored in state {}", state);
        }
    }

    private void sendConnect() {
        StompHeaders headers = new StompHeaders()
                .set(StompHeaders.HOST, config.virtualHost() != null ? config.virtualHost() : Objects.requireNonNull(host))
                .set(StompHeaders.HEART_BEAT, clientHeartBeat.toHeaderValue())
                .set(StompHeaders.ACCEPT_VERSION, PROTOCOL_VERSION);
        if (config.login() != null) {
            headers.set(StompHeaders.LOGIN, config.login());
        }
        if (config.passcode() != null) {
            headers.set(StompHeaders.PASSCODE, config.passcode());
        }
        sendFrame(StompFrame.of(StompCommand.CONNECT, headers));
    }

    private void sendFrame(final StompFrame frame) {
        byte[] raw = StompFrameEncoder.encode(frame);
        FrameLog.outbound(raw);
        transport.write(raw);
        metrics.onFrameSent(frame.command());
        heartbeats.onOutboundActivity();
        dispatcher.dispatch(new StompEvent.FrameSent(frame.command(), raw));
    }

    private void handleConnected(final StompFrame frame) {
        if (state != ConnectionState.CONNECTING) {
            log.warn("Ignoring CONNECTED frame received in state {}", state);
            return;
        }
        StompHeaders headers = frame.headers();
        sessionId = headers.get(StompHeaders.SESSION);
        version = headers.get(StompHeaders.VERSION);
        server = headers.get(StompHeaders.SERVER);
        if (version != null && !PROTOCOL_VERSION.equals(version)) {
            log.warn("Broker negotiated STOMP {}, expected {}", version, PROTOCOL_VERSION);
        }
        serverHeartBeat = parseServerHeartBeat(headers.get(StompHeaders.HEART_BEAT));
        negotiatedHeartBeat = HeartBeat.negotiate(clientHeartBeat, serverHeartBeat);
        transition(ConnectionState.CONNECTED);
        heartbeats.start(negotiatedHeartBeat);
        log.info("Connected to {}:{} (session={}, server={}, heart-beat={})",
                host, port, sessionId, server, negotiatedHeartBeat);
        dispatcher.dispatch(new StompEvent.Connected(headers));
    }

    private static HeartBeat parseServerHeartBeat(final @Nullable String value) {
        if (value == null) {
            return HeartBeat.NONE;
        }
        try {
            return HeartBeat.parse(value);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed heart-beat header from broker: {}", value);
            return HeartBeat.NONE;
        }
    }

    /**
     * The single way out of a live connection.
     */
    private void teardown(final DisconnectReason reason, final @Nullable Throwable cause) {
        if (state == ConnectionState.DISCONNECTED) {
            return;
        }
        ConnectionState previous = state;
        transition(ConnectionState.DISCONNECTED);
        heartbeats.stop();
        subscriptions.clear();
        decoder.close();
        transport.close();
        metrics.onDisconnected(reason);
        if (reason == DisconnectReason.CLIENT_DISCONNECT) {
            log.info("Disconnected from {}:{}", host, port);
        } else {
            log.warn("Connection to {}:{} ended while {}: {} ({})", host, port, previous, reason,
                    cause == null ? "no cause" : cause.toString());
        }
        dispatcher.dispatch(new StompEvent.Disconnected(reason, cause));
    }

    private void transition(final ConnectionState next) {
        log.debug("State {} -> {}", state, next);
        state = next;
    }

    private void requireConnected(final String operation) {
        if (state != ConnectionState.CONNECTED) {
            throw StompConnectionException.notConnected(operation, state);
        }
    }

    private void runOnLoop(final Runnable action) {
        callOnLoop(() -> {
            action.run();
            return null;
        });
    }

    private <T> T callOnLoop(final Supplier<T> action) {
        if (reactor.inEventLoop()) {
            return action.get();
        }
        try {
            return CompletableFuture.supplyAsync(action, reactor).join();
        } catch (RejectedExecutionException e) {
            throw new StompConnectionException("Client event loop has shut down", e);
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            if (e.getCause() instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    /**
     * Transport callbacks, all on the reactor thread.
     */
    private final class TransportHandler implements TransportListener {

        @Override
        public void onConnected() {
            if (state != ConnectionState.CONNECTING) {
                return;
            }
            log.debug("Transport connected to {}:{}, sending CONNECT", host, port);
            sendConnect();
        }

        @Override
        public void onConnectFailed(final Throwable cause) {
            teardown(DisconnectReason.CONNECT_FAILED, cause);
        }

        @Override
        public void onRead(final ByteBuf data) {
            if (state == ConnectionState.DISCONNECTED) {
                return;
            }
            heartbeats.onInboundActivity();
            decoder.decode(data, frameHandler);
        }

        @Override
        public void onError(final Throwable cause) {
            teardown(DisconnectReason.TRANSPORT_ERROR, cause);
        }
    }

    /**
     * Decoder output, in stream order.
     */
    private final class FrameHandler implements StompFrameDecoder.Listener {

        @Override
        public void onHeartbeat() {
            metrics.onHeartbeatReceived();
            FrameLog.heartbeat("<<<");
        }

        @Override
        public void onFrame(final StompFrame frame) {
            metrics.onFrameReceived(frame.command());
            FrameLog.inbound(frame);
            switch (frame.command()) {
                case CONNECTED -> handleConnected(frame);
                case MESSAGE -> dispatcher.dispatch(new StompEvent.MessageReceived(frame.headers(), frame.body()));
                case RECEIPT -> dispatcher.dispatch(new StompEvent.ReceiptReceived(frame.headers()));
                case ERROR -> {
                    log.warn("Broker sent ERROR: {}", frame.headers().get(StompHeaders.MESSAGE));
                    dispatcher.dispatch(new StompEvent.BrokerError(frame.headers(), frame.body()));
                }
                default -> log.debug("Ignoring {} frame from broker", frame.command());
            }
        }

        @Override
        public void onDecodeError(final StompDecodingException error) {
            log.warn("Dropped malformed frame: {}", error.getMessage());
            metrics.onDecodeError(error);
            dispatcher.dispatch(new StompEvent.DecodeFailed(error));
        }
    }

    /**
     * Heartbeat timer callbacks, on the reactor thread.
     */
    private final class HeartbeatHandler implements HeartbeatMonitor.Callbacks {

        @Override
        public void sendHeartbeat() {
            if (state != ConnectionState.CONNECTED) {
                return;
            }
            transport.write(StompFrameEncoder.heartbeat());
            metrics.onHeartbeatSent();
            FrameLog.heartbeat(">>>");
        }

        @Override
        public void onBrokerSilent(final long deadlineMillis) {
            metrics.onHeartbeatTimeout();
            teardown(DisconnectReason.HEARTBEAT_TIMEOUT,
                    new StompConnectionException("No data from broker within " + deadlineMillis + " ms"));
        }
    }
}
