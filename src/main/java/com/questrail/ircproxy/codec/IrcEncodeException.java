package com.questrail.ircproxy.codec;

/**
 * Indicates that a message cannot be serialized without emitting corrupt
 * bytes, for example a command containing a space or a middle parameter that
 * the line format cannot delimit.
 */
public final class IrcEncodeException extends RuntimeException
{
    public IrcEncodeException(String message) {
        super(message);
    }

    public IrcEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
