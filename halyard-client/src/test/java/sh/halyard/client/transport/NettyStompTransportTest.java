// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client.transport;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import io.netty.buffer.ByteBuf;
import io.netty.channel.nio.NioEventLoopGroup;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import sh.halyard.client.StompClientConfig;
import sh.halyard.core.error.StompConnectionException;

@Timeout(30)
class NettyStompTransportTest {

    @Test
    void autoTransportRunsTasksOnItsReactor() throws Exception {
        NettyStompTransport transport = new NettyStompTransport(StompClientConfig.withDefaults());
        try {
            StompReactor reactor = transport.reactor();
            CompletableFuture<Boolean> inLoop = new CompletableFuture<>();
            reactor.execute(() -> inLoop.complete(reactor.inEventLoop()));

            assertTrue(inLoop.get(5, TimeUnit.SECONDS));
            assertFalse(reactor.inEventLoop());
        } finally {
            transport.close();
        }
    }

    @Test
    void closeLeavesExternalGroupRunning() {
        NioEventLoopGroup group = new NioEventLoopGroup(1);
        try {
            NettyStompTransport transport = new NettyStompTransport(StompClientConfig.builder()
                    .eventLoopGroup(group)
                    .build());
            transport.close();
            transport.close();

            assertFalse(group.isShuttingDown());
        } finally {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    @Test
    void refusedConnectionIsReportedToListener() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        NettyStompTransport transport = new NettyStompTransport(StompClientConfig.builder()
                .transportType(StompClientConfig.TransportType.NIO)
                .connectTimeout(Duration.ofSeconds(2))
                .build());
        CompletableFuture<Throwable> failure = new CompletableFuture<>();
        try {
            transport.connect(InetAddress.getLoopbackAddress().getHostAddress(), port, new TransportListener() {
                @Override
                public void onConnected() {
                    failure.completeExceptionally(new AssertionError("unexpected connect"));
                }

                @Override
                public void onConnectFailed(Throwable cause) {
                    failure.complete(cause);
                }

                @Override
                public void onRead(ByteBuf data) {
                }

                @Override
                public void onError(Throwable cause) {
                }
            });

            assertNotNull(failure.get(10, TimeUnit.SECONDS));
        } finally {
            transport.close();
        }
    }

    @Test
    void connectAfterCloseIsRejected() {
        NettyStompTransport transport = new NettyStompTransport(StompClientConfig.builder()
                .transportType(StompClientConfig.TransportType.NIO)
                .build());
        transport.close();

        TransportListener listener = mock(TransportListener.class);
        assertThrows(StompConnectionException.class, () -> transport.connect("localhost", 61613, listener));
    }
}
