package com.questrail.ircproxy.model;

import java.util.Locale;
import java.util.Objects;

/**
 * IrcCommand
 * -----------------------------------------------------------------------------
 * The verb of an IRC message: either a three-digit numeric reply or a
 * symbolic command token.
 *
 * <p>Every raw verb entering the system goes through {@link #parse(String)},
 * which applies the single normalization rule:</p>
 * <ul>
 *   <li>a token made only of ASCII digits whose value lies in
 *       {@code [1, 999]} becomes {@link Numeric}</li>
 *   <li>anything else is lowercased and kept as a {@link Token}</li>
 * </ul>
 *
 * <p>{@code "001"} therefore becomes {@code Numeric(1)}, {@code "PRIVMSG"}
 * becomes {@code Token("privmsg")} and {@code "1000"} stays a
 * {@code Token("1000")}.</p>
 */
public sealed interface IrcCommand
        permits IrcCommand.Numeric, IrcCommand.Token
{
    int MIN_NUMERIC = 1;
    int MAX_NUMERIC = 999;

    /**
     * Normalize a raw verb.
     *
     * @throws IllegalArgumentException if {@code raw} is empty
     */
    static IrcCommand parse(String raw)
    {
        Objects.requireNonNull(raw, "raw");
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }

        if (isAsciiDigits(raw)) {
            String digits = stripLeadingZeros(raw);
            // More than three significant digits is always out of range.
            if (digits.length() <= 3) {
                int value = Integer.parseInt(digits);
                if (value >= MIN_NUMERIC && value <= MAX_NUMERIC) {
                    return new Numeric(value);
                }
            }
        }
        return new Token(raw);
    }

    /**
     * Normalize an integer verb, as found in the JSON wire format.
     */
    static IrcCommand of(long value)
    {
        if (value >= MIN_NUMERIC && value <= MAX_NUMERIC) {
            return new Numeric((int) value);
        }
        return new Token(Long.toString(value));
    }

    /**
     * Returns true if this command is the symbolic token {@code name}
     * (compared case-insensitively).
     */
    default boolean is(String name)
    {
        return false;
    }

    /** Numeric reply code in {@code [1, 999]}. */
    record Numeric(int code) implements IrcCommand
    {
        public Numeric {
            if (code < MIN_NUMERIC || code > MAX_NUMERIC) {
                throw new IllegalArgumentException("numeric out of range: " + code);
            }
        }

        @Override
        public String toString()
        {
            return String.format(Locale.ROOT, "%03d", code);
        }
    }

    /** Symbolic command, always held in lowercase. */
    record Token(String name) implements IrcCommand
    {
        public Token {
            Objects.requireNonNull(name, "name");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("command token must not be empty");
            }
            name = name.toLowerCase(Locale.ROOT);
        }

        @Override
        public boolean is(String other)
        {
            return name.equalsIgnoreCase(other);
        }

        @Override
        public String toString()
        {
            return name;
        }
    }

    private static boolean isAsciiDigits(String s)
    {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String digits)
    {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
