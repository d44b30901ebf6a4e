package com.questrail.ircproxy.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamEndpoint} implementation.
 *
 * <p>Stores outbound writes and lets tests inject inbound bytes and
 * disconnects. It contains no IRC semantics.</p>
 */
public final class FakeStreamEndpoint implements StreamEndpoint {

    private final SocketAddress remote;
    private StreamEndpointListener listener;
    private final List<byte[]> written = new ArrayList<>();
    private boolean reading;
    private boolean closeAfterWritingRequested;
    private boolean closed;

    public FakeStreamEndpoint() {
        this(InetSocketAddress.createUnresolved("fake.example", 6667));
    }

    public FakeStreamEndpoint(SocketAddress remote) {
        this.remote = remote;
    }

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void write(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (!closed) {
            written.add(payload.clone());
        }
    }

    @Override
    public void setReading(boolean reading) {
        this.reading = reading;
    }

    @Override
    public void closeAfterWriting() {
        closeAfterWritingRequested = true;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public SocketAddress remoteAddress() {
        return remote;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void inject(byte[] payload) {
        requireListener().onBytes(payload);
    }

    public void inject(String text) {
        inject(text.getBytes(StandardCharsets.UTF_8));
    }

    public void disconnect(Throwable cause) {
        closed = true;
        requireListener().onDisconnected(cause);
    }

    public void writabilityChanged(boolean writable) {
        requireListener().onWritabilityChanged(writable);
    }

    public List<byte[]> written() {
        return Collections.unmodifiableList(written);
    }

    /** Everything written so far, decoded as UTF-8. */
    public String writtenText() {
        StringBuilder sb = new StringBuilder();
        for (byte[] chunk : written) {
            sb.append(new String(chunk, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    public void clear() {
        written.clear();
    }

    public boolean isReading() {
        return reading;
    }

    public boolean closeAfterWritingRequested() {
        return closeAfterWritingRequested;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean hasListener() {
        return listener != null;
    }

    private StreamEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
