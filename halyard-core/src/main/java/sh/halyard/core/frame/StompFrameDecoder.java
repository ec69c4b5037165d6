// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.frame;

import java.nio.charset.StandardCharsets;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.halyard.core.error.StompDecodingException;

/**
 * Incremental decoder for inbound STOMP frames.
 *
 * <p>Bytes are fed in chunks of any size. The decoder accumulates them and
 * works through three stages per frame:
 * <ol>
 *   <li><b>Command</b> - the first line. An empty line is a server heartbeat.
 *       A command outside the server frame set marks the frame as unsupported;
 *       it is still consumed so decoding stays aligned, then discarded.</li>
 *   <li><b>Headers</b> - lines up to the first empty line.</li>
 *   <li><b>Body</b> - exactly {@code content-length} bytes followed by NUL when that
 *       header is present, otherwise everything up to the first NUL.</li>
 * </ol>
 * Body length is resolved from the headers before any body byte is inspected,
 * because bodies may contain the LF and NUL patterns that delimit the other
 * sections.
 *
 * <p>A decoding error drops the current frame only; the listener is told and
 * decoding continues with the next frame. Splitting the input at arbitrary byte
 * boundaries yields exactly the same callbacks as feeding it in one piece.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. A decoder belongs to one connection
 * and is driven from its I/O thread.
 */
public final class StompFrameDecoder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StompFrameDecoder.class);

    private static final byte CR = '\r';
    private static final byte[] NO_BODY = new byte[0];

    /** Largest {@code content-length} accepted by the no-arg constructor: 16 MiB. */
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 16 * 1024 * 1024;

    /**
     * Receives the decoder output in stream order.
     */
    public interface Listener {

        /** A lone line terminator was received. */
        void onHeartbeat();

        /** A complete, supported frame was decoded. */
        void onFrame(StompFrame frame);

        /** A frame was dropped because it violates the STOMP 1.2 grammar. */
        void onDecodeError(StompDecodingException error);
    }

    private enum Stage {
        COMMAND,
        HEADERS,
        BODY
    }

    private final ByteBuf cumulation = Unpooled.buffer(256);
    private final int maxContentLength;

    private Stage stage = Stage.COMMAND;
    private String commandToken = "";
    private @Nullable StompCommand command;
    private final StringBuilder headerBlock = new StringBuilder();
    private StompHeaders rawHeaders = StompHeaders.empty();
    private int contentLength = -1;
    private @Nullable StompDecodingException pendingError;

    private boolean decoding;
    private boolean closed;

    public StompFrameDecoder() {
        this(DEFAULT_MAX_CONTENT_LENGTH);
    }

    /**
     * @param maxContentLength largest {@code content-length} honoured; a frame
     *        declaring more is reported as malformed and read up to its NUL
     */
    public StompFrameDecoder(final int maxContentLength) {
        if (maxContentLength < 0 || maxContentLength == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxContentLength out of range: " + maxContentLength);
        }
        this.maxContentLength = maxContentLength;
    }

    /**
     * Feeds a chunk and reports every frame it completes. The chunk's reader
     * index is left untouched and the caller keeps ownership of it.
     */
    public void decode(final ByteBuf chunk, final Listener listener) {
        if (closed) {
            return;
        }
        cumulation.writeBytes(chunk, chunk.readerIndex(), chunk.readableBytes());
        decoding = true;
        try {
            while (!closed && step(listener)) {
                // keep consuming complete sections
            }
        } finally {
            decoding = false;
            if (closed) {
                release();
            } else {
                cumulation.discardSomeReadBytes();
            }
        }
    }

    /**
     * Convenience overload for raw byte arrays.
     */
    public void decode(final byte[] chunk, final Listener listener) {
        decode(Unpooled.wrappedBuffer(chunk), listener);
    }

    /**
     * Returns the number of received bytes not yet consumed by a complete section.
     */
    public int bufferedBytes() {
        return closed ? 0 : cumulation.readableBytes();
    }

    /**
     * Releases the accumulation buffer. Safe to call from within a listener
     * callback; no further callbacks are made once closed.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!decoding) {
            release();
        }
    }

    private void release() {
        if (cumulation.refCnt() > 0) {
            cumulation.release();
        }
    }

    private boolean step(final Listener listener) {
        return switch (stage) {
            case COMMAND -> readCommand(listener);
            case HEADERS -> readHeaders();
            case BODY -> readBody(listener);
        };
    }

    private boolean readCommand(final Listener listener) {
        String line = readLine();
        if (line == null) {
            return false;
        }
        if (line.isEmpty()) {
            listener.onHeartbeat();
            return true;
        }
        commandToken = line;
        command = StompCommand.serverCommand(line);
        headerBlock.setLength(0);
        stage = Stage.HEADERS;
        return true;
    }

    private boolean readHeaders() {
        String line;
        while ((line = readLine()) != null) {
            if (line.isEmpty()) {
                rawHeaders = HeaderCodec.parseHeaderBlock(headerBlock.toString());
                contentLength = resolveContentLength();
                stage = Stage.BODY;
                return true;
            }
            if (headerBlock.length() > 0) {
                headerBlock.append('\n');
            }
            headerBlock.append(line);
        }
        return false;
    }

    private boolean readBody(final Listener listener) {
        byte[] body;
        if (contentLength >= 0) {
            if (cumulation.readableBytes() <= contentLength) {
                return false;
            }
            body = new byte[contentLength];
            cumulation.readBytes(body);
            if (cumulation.getByte(cumulation.readerIndex()) == StompFrameEncoder.NUL) {
                cumulation.skipBytes(1);
            } else if (pendingError == null) {
                // leave the byte in place: it starts whatever comes next
                pendingError = StompDecodingException.missingTerminator(commandToken);
            }
        } else {
            int nul = cumulation.indexOf(cumulation.readerIndex(), cumulation.writerIndex(), StompFrameEncoder.NUL);
            if (nul < 0) {
                return false;
            }
            body = new byte[nul - cumulation.readerIndex()];
            cumulation.readBytes(body);
            cumulation.skipBytes(1);
        }
        complete(body, listener);
        return true;
    }

    private void complete(final byte[] body, final Listener listener) {
        StompCommand decoded = command;
        StompHeaders headers = rawHeaders;
        StompDecodingException error = pendingError;
        String token = commandToken;

        stage = Stage.COMMAND;
        command = null;
        rawHeaders = StompHeaders.empty();
        contentLength = -1;
        pendingError = null;

        if (decoded == null) {
            log.debug("Discarding unsupported frame '{}' ({} body bytes)", token, body.length);
            return;
        }
        if (error != null) {
            listener.onDecodeError(error);
            return;
        }
        try {
            if (!decoded.isEscapeExempt()) {
                headers = HeaderCodec.unescapeHeaders(headers);
            }
        } catch (StompDecodingException e) {
            listener.onDecodeError(e.withCommand(token));
            return;
        }
        listener.onFrame(new StompFrame(decoded, headers.readOnly(), decoded.hasBody() ? body : NO_BODY));
    }

    private int resolveContentLength() {
        String value = rawHeaders.get(StompHeaders.CONTENT_LENGTH);
        if (value == null) {
            return -1;
        }
        try {
            int length = Integer.parseInt(value.trim());
            if (length >= 0 && length <= maxContentLength) {
                return length;
            }
        } catch (NumberFormatException e) {
            log.trace("Unparseable content-length '{}'", value, e);
        }
        pendingError = StompDecodingException.invalidContentLength(value, commandToken);
        return -1;
    }

    /**
     * Consumes one line if a line feed is buffered. A CR immediately before the
     * LF belongs to the terminator.
     */
    private @Nullable String readLine() {
        int start = cumulation.readerIndex();
        int lf = cumulation.indexOf(start, cumulation.writerIndex(), StompFrameEncoder.LF);
        if (lf < 0) {
            return null;
        }
        int end = lf;
        if (end > start && cumulation.getByte(end - 1) == CR) {
            end--;
        }
        String line = cumulation.toString(start, end - start, StandardCharsets.UTF_8);
        cumulation.readerIndex(lf + 1);
        return line;
    }
}
