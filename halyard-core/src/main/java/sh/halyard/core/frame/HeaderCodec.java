// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.frame;

import java.util.Map;

import sh.halyard.core.error.StompDecodingException;

/**
 * Textual encoding of STOMP header blocks and the STOMP 1.2 header escapes.
 *
 * <p>Escaping replaces the four reserved characters in a single pass:
 * <pre>
 * backslash  -&gt; \\
 * CR         -&gt; \r
 * LF         -&gt; \n
 * colon      -&gt; \c
 * </pre>
 * Names and values are escaped independently. CONNECT and CONNECTED frames are
 * exempt (see {@link StompCommand#isEscapeExempt()}).
 */
public final class HeaderCodec {

    private HeaderCodec() {
    }

    /**
     * Escapes the reserved characters of a header name or value.
     */
    public static String escape(final String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement = switch (c) {
                case '\\' -> "\\\\";
                case '\r' -> "\\r";
                case '\n' -> "\\n";
                case ':' -> "\\c";
                default -> null;
            };
            if (replacement != null) {
                if (sb == null) {
                    sb = new StringBuilder(text.length() + 8).append(text, 0, i);
                }
                sb.append(replacement);
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? text : sb.toString();
    }

    /**
     * Reverses {@link #escape}.
     *
     * @throws StompDecodingException on any escape sequence other than the four
     *                                defined by STOMP 1.2, including a trailing backslash
     */
    public static String unescape(final String text) {
        int first = text.indexOf('\\');
        if (first < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length()).append(text, 0, first);
        for (int i = first; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i + 1 >= text.length()) {
                throw StompDecodingException.invalidEscape(text, i);
            }
            char next = text.charAt(i + 1);
            switch (next) {
                case '\\' -> sb.append('\\');
                case 'r' -> sb.append('\r');
                case 'n' -> sb.append('\n');
                case 'c' -> sb.append(':');
                default -> throw StompDecodingException.invalidEscape(text, i);
            }
            i++;
        }
        return sb.toString();
    }

    /**
     * Returns a copy of the headers with every name and value escaped.
     */
    public static StompHeaders escapeHeaders(final StompHeaders headers) {
        StompHeaders escaped = new StompHeaders();
        for (Map.Entry<String, String> e : headers) {
            escaped.putIfAbsent(escape(e.getKey()), escape(e.getValue()));
        }
        return escaped;
    }

    /**
     * Returns a copy of the headers with every name and value unescaped.
     *
     * @throws StompDecodingException if a name or value holds an invalid escape sequence
     */
    public static StompHeaders unescapeHeaders(final StompHeaders headers) {
        StompHeaders unescaped = new StompHeaders();
        for (Map.Entry<String, String> e : headers) {
            unescaped.putIfAbsent(unescape(e.getKey()), unescape(e.getValue()));
        }
        return unescaped;
    }

    /**
     * Serializes headers to {@code name:value} lines joined by LF, without a
     * trailing line terminator. No escaping is applied.
     */
    public static String toHeaderBlock(final StompHeaders headers) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : headers) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(e.getKey()).append(':').append(e.getValue());
        }
        return sb.toString();
    }

    /**
     * Parses {@code name:value} lines. A trailing CR on a line is ignored, lines
     * without a colon or with an empty name are skipped, and the first value of a
     * repeated name wins. No unescaping is applied.
     */
    public static StompHeaders parseHeaderBlock(final String block) {
        StompHeaders headers = new StompHeaders();
        int start = 0;
        while (start <= block.length()) {
            int end = block.indexOf('\n', start);
            if (end < 0) {
                end = block.length();
            }
            parseLine(block, start, end, headers);
            start = end + 1;
        }
        return headers;
    }

    private static void parseLine(final String block, final int start, int end, final StompHeaders headers) {
        if (end > start && block.charAt(end - 1) == '\r') {
            end--;
        }
        int colon = block.indexOf(':', start);
        if (colon <= start || colon >= end) {
            return;
        }
        headers.putIfAbsent(block.substring(start, colon), block.substring(colon + 1, end));
    }
}
