// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.frame;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

/**
 * Ordered STOMP header mapping.
 *
 * <p>Names are unique. Iteration follows insertion order, which is the order
 * headers are written on the wire. {@link #set} replaces a value in place;
 * {@link #putIfAbsent} keeps the first value of a repeated name, which is how
 * STOMP 1.2 resolves duplicate headers in a received frame.
 *
 * <p>Not thread-safe. Instances handed to listeners are read-only views
 * ({@link #readOnly()}).
 */
public final class StompHeaders implements Iterable<Map.Entry<String, String>> {

    public static final String ACCEPT_VERSION = "accept-version";
    public static final String ACK = "ack";
    public static final String CONTENT_LENGTH = "content-length";
    public static final String DESTINATION = "destination";
    public static final String HEART_BEAT = "heart-beat";
    public static final String HOST = "host";
    public static final String ID = "id";
    public static final String LOGIN = "login";
    public static final String MESSAGE = "message";
    public static final String MESSAGE_ID = "message-id";
    public static final String PASSCODE = "passcode";
    public static final String RECEIPT = "receipt";
    public static final String RECEIPT_ID = "receipt-id";
    public static final String SERVER = "server";
    public static final String SESSION = "session";
    public static final String SUBSCRIPTION = "subscription";
    public static final String VERSION = "version";

    private static final StompHeaders EMPTY = new StompHeaders(Collections.emptyMap(), true);

    private final Map<String, String> entries;
    private final boolean readOnly;

    public StompHeaders() {
        this(new LinkedHashMap<>(), false);
    }

    private StompHeaders(Map<String, String> entries, boolean readOnly) {
        this.entries = entries;
        this.readOnly = readOnly;
    }

    /**
     * Returns an empty, read-only header mapping.
     */
    public static StompHeaders empty() {
        return EMPTY;
    }

    /**
     * Creates headers from alternating name/value arguments.
     *
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public static StompHeaders of(final String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        StompHeaders headers = new StompHeaders();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            headers.set(namesAndValues[i], namesAndValues[i + 1]);
        }
        return headers;
    }

    /**
     * Sets a header, replacing any existing value while keeping its position.
     *
     * @return this instance
     */
    public StompHeaders set(final String name, final String value) {
        checkWritable();
        entries.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return this;
    }

    /**
     * Adds a header unless the name is already present.
     *
     * @return true if the header was added
     */
    public boolean putIfAbsent(final String name, final String value) {
        checkWritable();
        return entries.putIfAbsent(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value")) == null;
    }

    public @Nullable String get(final String name) {
        return entries.get(name);
    }

    public String getOrDefault(final String name, final String defaultValue) {
        return entries.getOrDefault(name, defaultValue);
    }

    public boolean contains(final String name) {
        return entries.containsKey(name);
    }

    public @Nullable String remove(final String name) {
        checkWritable();
        return entries.remove(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Returns an unmodifiable view of the entries in insertion order.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Returns a mutable copy.
     */
    public StompHeaders copy() {
        return new StompHeaders(new LinkedHashMap<>(entries), false);
    }

    /**
     * Returns a read-only snapshot of these headers.
     */
    public StompHeaders readOnly() {
        return readOnly ? this : new StompHeaders(Collections.unmodifiableMap(new LinkedHashMap<>(entries)), true);
    }

    @Override
    public Iterator<Map.Entry<String, String>> iterator() {
        return asMap().entrySet().iterator();
    }

    private void checkWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException("headers are read-only");
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof StompHeaders other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
