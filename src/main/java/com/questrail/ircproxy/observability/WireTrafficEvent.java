package com.questrail.ircproxy.observability;

import com.questrail.ircproxy.relay.LegId;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Record of raw bytes read from or written to one leg.
 */
public record WireTrafficEvent(
    Instant timestamp,
    LegId leg,
    TrafficDirection direction,
    byte[] payload
) {
    /**
     * Payload decoded as UTF-8 and quoted with control characters escaped,
     * e.g. {@code "PING :x\r\n"}.
     */
    public String quotedText() {
        String text = new String(payload, StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(text.length() + 8).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\r' -> sb.append("\\r");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\x%02X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
