package com.questrail.ircproxy.codec;

import com.questrail.ircproxy.model.IrcMessage;

import java.util.Optional;

/**
 * IrcStreamDecoder
 * -----------------------------------------------------------------------------
 * Incremental decoder from a byte stream to {@link IrcMessage}s.
 *
 * <p>Bytes arrive in arbitrary chunks via {@link #feed(byte[])}. The caller
 * then pulls complete messages with {@link #next()} until it returns
 * {@link Optional#empty()}. The pull model lets the caller stop between two
 * messages (for example, to hand the unread remainder to a different decoder)
 * without any bytes being lost or parsed twice.</p>
 *
 * <p>Implementations:</p>
 * <ul>
 *   <li>must emit messages in the order their bytes arrived</li>
 *   <li>must produce the same message sequence however the input is split
 *       into chunks</li>
 *   <li>are single-threaded; callers serialize access</li>
 * </ul>
 */
public interface IrcStreamDecoder
{
    /**
     * Append a chunk of received bytes. The array is copied.
     */
    void feed(byte[] chunk);

    /**
     * Decode the next complete message from the bytes fed so far.
     *
     * @return the next message, or {@link Optional#empty()} if more input is needed
     * @throws IrcDecodeException if the buffered input is malformed; the
     *         caller must discard the decoder afterwards
     */
    Optional<IrcMessage> next();

    /**
     * Signal that no more input will arrive.
     *
     * @throws IrcDecodeException if a partially received message cannot be
     *         abandoned silently for this format
     */
    void finish();
}
