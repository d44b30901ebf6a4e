package com.questrail.ircproxy.codec;

import java.util.Locale;

/**
 * The two serializations a relay leg can speak, one per direction.
 */
public enum WireFormat
{
    /** CR LF terminated line protocol, the initial format of every direction. */
    RFC1459("rfc1459"),

    /** Concatenated JSON objects, entered after a STARTJSON signal. */
    JSON("json");

    private final String label;

    WireFormat(String label)
    {
        this.label = label;
    }

    public String label()
    {
        return label;
    }

    /**
     * Resolve a format from its command-line label.
     *
     * @throws IllegalArgumentException for an unknown label
     */
    public static WireFormat fromLabel(String label)
    {
        String wanted = label.toLowerCase(Locale.ROOT);
        for (WireFormat format : values()) {
            if (format.label.equals(wanted)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown wire format: " + label);
    }
}
