package com.questrail.ircproxy.model;

import java.util.Objects;

/**
 * Value of an IRCv3 message tag.
 *
 * <p>A tag written as {@code key=value} (including {@code key=}) carries a
 * {@link Present} value. A bare {@code key} is a {@link Flag}, which is not
 * the same thing as an empty string.</p>
 */
public sealed interface TagValue
        permits TagValue.Present, TagValue.Flag
{
    static TagValue of(String value)
    {
        return new Present(value);
    }

    static TagValue flag()
    {
        return Flag.INSTANCE;
    }

    record Present(String value) implements TagValue
    {
        public Present {
            Objects.requireNonNull(value, "value");
        }
    }

    enum Flag implements TagValue
    {
        INSTANCE
    }
}
