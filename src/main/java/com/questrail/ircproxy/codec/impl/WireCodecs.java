package com.questrail.ircproxy.codec.impl;

import com.questrail.ircproxy.codec.IrcMessageEncoder;
import com.questrail.ircproxy.codec.IrcStreamDecoder;
import com.questrail.ircproxy.codec.WireFormat;

/**
 * Factory for the codec pair of a {@link WireFormat}.
 *
 * <p>Encoders are stateless and may be shared. Stream decoders hold buffered
 * input and must be created per connection direction.</p>
 */
public final class WireCodecs
{
    private WireCodecs() {}

    public static IrcStreamDecoder newDecoder(WireFormat format)
    {
        switch (format) {
            case RFC1459:
                return new LineStreamDecoder();
            case JSON:
                return new JsonStreamDecoder();
            default:
                throw new IllegalArgumentException("Unsupported wire format: " + format);
        }
    }

    public static IrcMessageEncoder newEncoder(WireFormat format)
    {
        switch (format) {
            case RFC1459:
                return new LineCodec();
            case JSON:
                return new JsonCodec();
            default:
                throw new IllegalArgumentException("Unsupported wire format: " + format);
        }
    }
}
