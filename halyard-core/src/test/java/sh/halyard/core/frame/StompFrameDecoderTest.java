// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.frame;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.halyard.core.error.StompDecodingException;

class StompFrameDecoderTest {

    private static final String STREAM =
            "CONNECTED\nversion:1.2\nheart-beat:4000,6000\nsession:s-1\n\n\0"
                    + "\n"
                    + "MESSAGE\ndestination:/queue/a\nmessage-id:m1\ncontent-length:5\n\nab\0cd\0"
                    + "\r\n"
                    + "MESSAGE\ndestination:/queue/b\\cc\n\nplain body\0"
                    + "RECEIPT\nreceipt-id:77\n\n\0"
                    + "ERROR\nmessage:bad things\n\noops\0";

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static RecordingListener decodeWhole(String input) {
        RecordingListener listener = new RecordingListener();
        try (StompFrameDecoder decoder = new StompFrameDecoder()) {
            decoder.decode(bytes(input), listener);
        }
        return listener;
    }

    @Test
    void decodesMixedStream() {
        RecordingListener listener = decodeWhole(STREAM);

        assertEquals(5, listener.frames.size());
        assertTrue(listener.errors.isEmpty());
        assertEquals(List.of("heartbeat", "heartbeat"),
                listener.events.stream().filter("heartbeat"::equals).toList());

        StompFrame connected = listener.frames.get(0);
        assertEquals(StompCommand.CONNECTED, connected.command());
        assertEquals("4000,6000", connected.headers().get("heart-beat"));

        StompFrame message = listener.frames.get(1);
        assertArrayEquals(new byte[]{'a', 'b', 0, 'c', 'd'}, message.body());

        StompFrame escaped = listener.frames.get(2);
        assertEquals("/queue/b:c", escaped.headers().get("destination"));
        assertEquals("plain body", escaped.bodyAsString());

        assertEquals("77", listener.frames.get(3).headers().get("receipt-id"));
        assertEquals("oops", listener.frames.get(4).bodyAsString());
        assertEquals("bad things", listener.frames.get(4).headers().get("message"));
    }

    @Test
    @DisplayName("any split of the input yields the same callbacks")
    void chunkBoundaryInvariance() {
        List<String> expected = decodeWhole(STREAM).events;
        byte[] input = bytes(STREAM);

        for (int split = 1; split < input.length; split++) {
            RecordingListener listener = new RecordingListener();
            StompFrameDecoder decoder = new StompFrameDecoder();
            decoder.decode(Arrays.copyOfRange(input, 0, split), listener);
            decoder.decode(Arrays.copyOfRange(input, split, input.length), listener);
            decoder.close();
            assertEquals(expected, listener.events, "split at " + split);
        }

        RecordingListener byteWise = new RecordingListener();
        StompFrameDecoder decoder = new StompFrameDecoder();
        for (byte b : input) {
            decoder.decode(new byte[]{b}, byteWise);
        }
        decoder.close();
        assertEquals(expected, byteWise.events);
    }

    @Test
    void contentLengthBodyMayContainNul() {
        RecordingListener listener = decodeWhole("MESSAGE\ncontent-length:3\n\n\0\0\0\0");
        assertEquals(1, listener.frames.size());
        assertArrayEquals(new byte[]{0, 0, 0}, listener.frames.get(0).body());
    }

    @Test
    void bodyWithoutContentLengthEndsAtFirstNul() {
        RecordingListener listener = decodeWhole("MESSAGE\ndestination:/q\n\nab\0cd\0");
        assertEquals(1, listener.frames.size());
        assertEquals("ab", listener.frames.get(0).bodyAsString());
        // "cd\0" is an incomplete command line, not a frame
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    void acceptsCrLfLineEndings() {
        RecordingListener listener = decodeWhole("MESSAGE\r\ndestination:/q\r\nmessage-id:1\r\n\r\nhi\0");
        StompFrame frame = listener.frames.get(0);
        assertEquals("/q", frame.headers().get("destination"));
        assertEquals("1", frame.headers().get("message-id"));
        assertEquals("hi", frame.bodyAsString());
    }

    @Test
    void lineFeedsBetweenFramesAreHeartbeats() {
        RecordingListener listener = decodeWhole("\n\r\n\n");
        assertEquals(List.of("heartbeat", "heartbeat", "heartbeat"), listener.events);
    }

    @Test
    void connectedHeadersAreNotUnescaped() {
        RecordingListener listener = decodeWhole("CONNECTED\nserver:weird\\tname\n\n\0");
        assertEquals("weird\\tname", listener.frames.get(0).headers().get("server"));
    }

    @Test
    void bodyOfFramesWithoutBodyIsDropped() {
        RecordingListener listener = decodeWhole("RECEIPT\nreceipt-id:1\n\nunexpected\0");
        assertEquals(0, listener.frames.get(0).body().length);
    }

    @Test
    void decodedHeadersAreReadOnly() {
        StompFrame frame = decodeWhole("RECEIPT\nreceipt-id:1\n\n\0").frames.get(0);
        assertThrows(UnsupportedOperationException.class, () -> frame.headers().set("x", "y"));
    }

    @Test
    void leavesSourceBufferUntouched() {
        ByteBuf chunk = Unpooled.wrappedBuffer(bytes("RECEIPT\nreceipt-id:1\n\n\0"));
        int readerIndex = chunk.readerIndex();
        try (StompFrameDecoder decoder = new StompFrameDecoder()) {
            decoder.decode(chunk, new RecordingListener());
        }
        assertEquals(readerIndex, chunk.readerIndex());
        assertEquals(1, chunk.refCnt());
    }

    @Test
    void tracksBufferedBytesOfPartialFrame() {
        StompFrameDecoder decoder = new StompFrameDecoder();
        RecordingListener listener = new RecordingListener();
        decoder.decode(bytes("MESSAGE\ndestination:/q\n\npartial"), listener);
        assertTrue(listener.frames.isEmpty());
        assertEquals("partial".length(), decoder.bufferedBytes());

        decoder.decode(bytes(" body\0"), listener);
        assertEquals("partial body", listener.frames.get(0).bodyAsString());
        assertEquals(0, decoder.bufferedBytes());
        decoder.close();
    }

    @Test
    void closeFromListenerStopsDecoding() {
        StompFrameDecoder decoder = new StompFrameDecoder();
        RecordingListener listener = new RecordingListener() {
            @Override
            public void onFrame(StompFrame frame) {
                super.onFrame(frame);
                decoder.close();
            }
        };
        decoder.decode(bytes("RECEIPT\nreceipt-id:1\n\n\0RECEIPT\nreceipt-id:2\n\n\0"), listener);

        assertEquals(1, listener.frames.size());
        assertEquals(0, decoder.bufferedBytes());

        decoder.decode(bytes("RECEIPT\nreceipt-id:3\n\n\0"), listener);
        assertEquals(1, listener.frames.size());
    }

    @Nested
    class UnsupportedAndMalformedFrames {

        @Test
        void unknownCommandIsConsumedAndDiscarded() {
            RecordingListener listener = decodeWhole(
                    "SEND\ndestination:/q\n\nbody\0MESSAGE\ndestination:/q\n\nok\0");
            assertEquals(1, listener.frames.size());
            assertEquals(StompCommand.MESSAGE, listener.frames.get(0).command());
            assertTrue(listener.errors.isEmpty());
        }

        @Test
        void invalidEscapeDropsOnlyThatFrame() {
            RecordingListener listener = decodeWhole(
                    "MESSAGE\nbad:a\\tb\n\nx\0RECEIPT\nreceipt-id:9\n\n\0");

            assertEquals(1, listener.errors.size());
            StompDecodingException error = listener.errors.get(0);
            assertEquals("MESSAGE", error.command());
            assertTrue(error.getMessage().contains("Invalid escape sequence"));

            assertEquals(1, listener.frames.size());
            assertEquals("9", listener.frames.get(0).headers().get("receipt-id"));
        }

        @Test
        void invalidContentLengthFallsBackToNulAndReportsError() {
            RecordingListener listener = decodeWhole(
                    "MESSAGE\ncontent-length:abc\n\nhi\0RECEIPT\nreceipt-id:1\n\n\0");

            assertEquals(1, listener.errors.size());
            assertTrue(listener.errors.get(0).getMessage().contains("content-length 'abc'"));
            assertEquals(StompCommand.RECEIPT, listener.frames.get(0).command());
        }

        @Test
        void negativeContentLengthIsInvalid() {
            RecordingListener listener = decodeWhole("MESSAGE\ncontent-length:-1\n\n\0");
            assertEquals(1, listener.errors.size());
            assertTrue(listener.frames.isEmpty());
        }

        @Test
        void contentLengthOfIntMaxIsRejectedWithoutAllocating() {
            RecordingListener listener = assertDoesNotThrow(() -> decodeWhole(
                    "MESSAGE\ncontent-length:2147483647\n\nab\0RECEIPT\nreceipt-id:1\n\n\0"));

            assertEquals(1, listener.errors.size());
            assertTrue(listener.errors.get(0).getMessage().contains("content-length '2147483647'"));
            assertEquals(1, listener.frames.size());
            assertEquals(StompCommand.RECEIPT, listener.frames.get(0).command());
        }

        @Test
        void contentLengthAboveConfiguredMaximumIsRejected() {
            RecordingListener listener = new RecordingListener();
            try (StompFrameDecoder decoder = new StompFrameDecoder(4)) {
                decoder.decode(bytes("MESSAGE\ncontent-length:5\n\nhello\0"), listener);
                decoder.decode(bytes("MESSAGE\ncontent-length:4\n\nhell\0"), listener);
            }

            assertEquals(1, listener.errors.size());
            assertEquals(1, listener.frames.size());
            assertEquals("hell", listener.frames.get(0).bodyAsString());
        }

        @Test
        void rejectsOutOfRangeMaximum() {
            assertThrows(IllegalArgumentException.class, () -> new StompFrameDecoder(-1));
            assertThrows(IllegalArgumentException.class, () -> new StompFrameDecoder(Integer.MAX_VALUE));
        }

        @Test
        void missingNulAfterContentLengthBodyIsReported() {
            RecordingListener listener = decodeWhole(
                    "MESSAGE\ncontent-length:2\n\nhi\nRECEIPT\nreceipt-id:1\n\n\0");

            assertEquals(List.of(
                    "error: Body not followed by NUL terminator (frame MESSAGE)",
                    "heartbeat"), listener.events.subList(0, 2));
            assertEquals(StompCommand.RECEIPT, listener.frames.get(0).command());
        }
    }
}
