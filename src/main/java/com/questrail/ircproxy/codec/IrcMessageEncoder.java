package com.questrail.ircproxy.codec;

import com.questrail.ircproxy.model.IrcMessage;

/**
 * Serializes one {@link IrcMessage} into wire-ready bytes.
 *
 * <p>The returned bytes are a complete unit for the format: a CR LF
 * terminated line, or one JSON value. They can be written to the transport
 * as-is.</p>
 */
public interface IrcMessageEncoder
{
    /**
     * @throws IrcEncodeException if the message cannot be represented in
     *         this format without corrupting the stream
     */
    byte[] encode(IrcMessage message);
}
