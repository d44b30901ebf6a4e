package com.questrail.ircproxy.codec;

/**
 * Indicates that received bytes could not be turned into a valid
 * {@link com.questrail.ircproxy.model.IrcMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>A native line with no command</li>
 *   <li>Malformed JSON or a JSON value of the wrong shape</li>
 *   <li>A connection closing inside an unterminated JSON value</li>
 * </ul>
 */
public final class IrcDecodeException extends RuntimeException
{
    public IrcDecodeException(String message) {
        super(message);
    }

    public IrcDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
