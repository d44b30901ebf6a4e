package com.questrail.ircproxy.codec.impl;

import com.questrail.ircproxy.codec.IrcStreamDecoder;
import com.questrail.ircproxy.model.IrcMessage;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * LineStreamDecoder
 * -----------------------------------------------------------------------------
 * Incremental framing for the RFC 1459 line format.
 *
 * <p>Received bytes are accumulated until an LF is seen. Each complete line
 * (an optional CR before the LF is dropped) is decoded to UTF-8, with
 * malformed sequences replaced, and parsed by {@link LineCodec}.</p>
 *
 * <p>Lines are located on the byte level, so a chunk boundary in the middle
 * of a multi-byte character is harmless. A trailing fragment without an LF
 * stays buffered until more data arrives, the connection closes, or
 * {@link #takeUnconsumed()} hands it to a different decoder.</p>
 *
 * <p>Blank lines are skipped.</p>
 */
public final class LineStreamDecoder implements IrcStreamDecoder
{
    private static final byte LF = '\n';
    private static final byte CR = '\r';
    private static final int INITIAL_CAPACITY = 512;

    private final LineCodec codec;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int start;
    private int end;

    public LineStreamDecoder()
    {
        this(new LineCodec());
    }

    public LineStreamDecoder(LineCodec codec)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public void feed(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        ensureCapacity(chunk.length);
        System.arraycopy(chunk, 0, buffer, end, chunk.length);
        end += chunk.length;
    }

    @Override
    public Optional<IrcMessage> next()
    {
        while (true) {
            int lf = indexOf(LF);
            if (lf < 0) {
                return Optional.empty();
            }

            int lineEnd = lf;
            if (lineEnd > start && buffer[lineEnd - 1] == CR) {
                lineEnd--;
            }

            String line = new String(buffer, start, lineEnd - start, StandardCharsets.UTF_8);
            start = lf + 1;

            if (line.isBlank()) {
                continue;
            }
            return Optional.of(codec.parse(line));
        }
    }

    /**
     * An unterminated line at end of stream is discarded.
     */
    @Override
    public void finish()
    {
        start = 0;
        end = 0;
    }

    /**
     * Remove and return every byte that has been fed but not yet consumed
     * into a message.
     */
    public byte[] takeUnconsumed()
    {
        byte[] rest = Arrays.copyOfRange(buffer, start, end);
        start = 0;
        end = 0;
        return rest;
    }

    /** Number of bytes waiting for a line terminator. */
    public int buffered()
    {
        return end - start;
    }

    private int indexOf(byte b)
    {
        for (int i = start; i < end; i++) {
            if (buffer[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private void ensureCapacity(int extra)
    {
        int live = end - start;
        if (start > 0) {
            // compact before growing
            System.arraycopy(buffer, start, buffer, 0, live);
            start = 0;
            end = live;
        }
        if (live + extra > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, live + extra));
        }
    }
}
