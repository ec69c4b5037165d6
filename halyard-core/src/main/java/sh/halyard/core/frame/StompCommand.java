// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.frame;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

/**
 * STOMP 1.2 frame commands understood by this client.
 */
public enum StompCommand {
    CONNECT(false, false),
    CONNECTED(true, false),
    SUBSCRIBE(false, false),
    UNSUBSCRIBE(false, false),
    SEND(false, true),
    MESSAGE(true, true),
    ACK(false, false),
    NACK(false, false),
    DISCONNECT(false, false),
    RECEIPT(true, false),
    ERROR(true, true);

    private static final Map<String, StompCommand> SERVER_COMMANDS = Arrays.stream(values())
            .filter(StompCommand::isServerFrame)
            .collect(Collectors.toUnmodifiableMap(StompCommand::name, Function.identity()));

    private final boolean serverFrame;
    private final boolean body;

    StompCommand(boolean serverFrame, boolean body) {
        this.serverFrame = serverFrame;
        this.body = body;
    }

    /**
     * Returns true for commands a broker sends to a client.
     */
    public boolean isServerFrame() {
        return serverFrame;
    }

    /**
     * Returns true for commands whose frames carry a body (SEND, MESSAGE, ERROR).
     */
    public boolean hasBody() {
        return body;
    }

    /**
     * Returns true if headers of this frame are written and read without escaping.
     * STOMP 1.2 exempts CONNECT and CONNECTED since escaping is not yet negotiated.
     */
    public boolean isEscapeExempt() {
        return this == CONNECT || this == CONNECTED;
    }

    /**
     * Looks up a server command by its exact wire token.
     *
     * @param token the command line of an inbound frame
     * @return the command, or null if the token is not a server frame command
     */
    public static @Nullable StompCommand serverCommand(final String token) {
        return SERVER_COMMANDS.get(token);
    }
}
