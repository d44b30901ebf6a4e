package com.questrail.ircproxy.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class IrcMessageTest
{
    @Test
    void valueListWithSenderMarker()
    {
        IrcMessage message = IrcMessage.of(":nick!user@host", "PRIVMSG", "#chan", "hello there");

        assertEquals("nick!user@host", message.sender().orElseThrow());
        assertEquals(new IrcCommand.Token("privmsg"), message.command());
        assertEquals(List.of("#chan", "hello there"), message.args());
    }

    @Test
    void valueListWithoutSender()
    {
        IrcMessage message = IrcMessage.of("001", "nick", "Welcome");

        assertTrue(message.sender().isEmpty());
        assertEquals(new IrcCommand.Numeric(1), message.command());
        assertEquals(List.of("nick", "Welcome"), message.args());
    }

    @Test
    void valueListNeedsACommand()
    {
        assertThrows(IllegalArgumentException.class, IrcMessage::of);
        assertThrows(IllegalArgumentException.class, () -> IrcMessage.of(":server"));
    }

    @Test
    void absentAndEmptySenderAreDistinct()
    {
        IrcMessage absent = IrcMessage.of("PING", "x");
        IrcMessage empty = IrcMessage.of("PING", "x");
        empty.setSender("");

        assertTrue(absent.sender().isEmpty());
        assertEquals("", empty.sender().orElseThrow());
        assertNotEquals(absent, empty);
    }

    @Test
    void tagKeysAreLowercased()
    {
        IrcMessage message = IrcMessage.of("PING");
        message.putTag("Time", TagValue.of("2020"));
        message.setTags(Map.of("MSGID", TagValue.flag()));

        assertEquals(Map.of("msgid", TagValue.flag()), message.tags());
    }

    @Test
    void flagIsNotTheEmptyString()
    {
        assertNotEquals(TagValue.flag(), TagValue.of(""));
    }

    @Test
    void equalityIgnoresTagOrderAndTrailingHint()
    {
        IrcMessage a = IrcMessage.of("PRIVMSG", "#chan", "hi");
        a.putTag("a", TagValue.of("1"));
        a.putTag("b", TagValue.flag());

        IrcMessage b = IrcMessage.of("PRIVMSG", "#chan", "hi");
        b.putTag("b", TagValue.flag());
        b.putTag("a", TagValue.of("1"));
        b.setTrailingArg(true);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
