// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.frame;

import java.nio.charset.StandardCharsets;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

/**
 * Encodes outbound frames into their exact wire representation.
 *
 * <pre>
 * COMMAND LF
 * (name:value LF)*
 * LF
 * BODY NUL
 * </pre>
 *
 * <p>Only SEND frames carry a body on the way out; for every other command the
 * body is omitted. Headers are escaped except on CONNECT.
 */
public final class StompFrameEncoder {

    /** Line feed, the line terminator this client writes. */
    public static final byte LF = '\n';

    /** Frame terminator. */
    public static final byte NUL = 0;

    /** A heartbeat is a lone end-of-line with no command. */
    private static final byte[] HEARTBEAT = {LF};

    private StompFrameEncoder() {
    }

    /**
     * Returns the heartbeat byte sequence.
     */
    public static byte[] heartbeat() {
        return HEARTBEAT.clone();
    }

    /**
     * Encodes a frame.
     *
     * @param frame the frame to encode
     * @return the bytes to write, including the NUL terminator
     */
    public static byte[] encode(final StompFrame frame) {
        StompCommand command = frame.command();
        byte[] body = command == StompCommand.SEND ? frame.body() : new byte[0];

        ByteBuf buf = Unpooled.buffer(64 + frame.headers().size() * 32 + body.length);
        try {
            buf.writeCharSequence(command.name(), StandardCharsets.US_ASCII);
            buf.writeByte(LF);
            StompHeaders headers = command.isEscapeExempt()
                    ? frame.headers()
                    : HeaderCodec.escapeHeaders(frame.headers());
            if (!headers.isEmpty()) {
                buf.writeCharSequence(HeaderCodec.toHeaderBlock(headers), StandardCharsets.UTF_8);
                buf.writeByte(LF);
            }
            buf.writeByte(LF);
            buf.writeBytes(body);
            buf.writeByte(NUL);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }
}
