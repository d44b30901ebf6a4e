package com.questrail.ircproxy.cli;

import com.questrail.ircproxy.codec.IrcMessageEncoder;
import com.questrail.ircproxy.codec.IrcStreamDecoder;
import com.questrail.ircproxy.codec.WireFormat;
import com.questrail.ircproxy.codec.impl.WireCodecs;
import com.questrail.ircproxy.model.IrcMessage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts a stream of messages from one wire format to another, e.g. RFC 1459
 * lines on stdin to JSON on stdout.
 *
 * <p>Each output message is followed by a newline unless its encoding already
 * ends in one, so JSON output has one value per line.</p>
 */
public final class FormatConverter
{
    private static final int CHUNK_SIZE = 8192;

    private final WireFormat from;
    private final WireFormat to;

    public FormatConverter(WireFormat from, WireFormat to)
    {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    /**
     * Convert until {@code in} is exhausted.
     *
     * @return the number of messages written
     * @throws IOException on a read or write failure
     * @throws com.questrail.ircproxy.codec.IrcDecodeException on malformed input
     * @throws com.questrail.ircproxy.codec.IrcEncodeException if a message
     *         cannot be represented in the target format
     */
    public long convert(InputStream in, OutputStream out) throws IOException
    {
        IrcStreamDecoder decoder = WireCodecs.newDecoder(from);
        IrcMessageEncoder encoder = WireCodecs.newEncoder(to);

        long count = 0;
        byte[] chunk = new byte[CHUNK_SIZE];
        int read;
        while ((read = in.read(chunk)) != -1) {
            decoder.feed(Arrays.copyOf(chunk, read));

            Optional<IrcMessage> next;
            while ((next = decoder.next()).isPresent()) {
                byte[] encoded = encoder.encode(next.get());
                out.write(encoded);
                if (encoded.length == 0 || encoded[encoded.length - 1] != '\n') {
                    out.write('\n');
                }
                count++;
            }
            out.flush();
        }

        decoder.finish();
        return count;
    }
}
