package com.questrail.ircproxy.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.ircproxy.codec.IrcDecodeException;
import com.questrail.ircproxy.model.IrcCommand;
import com.questrail.ircproxy.model.IrcMessage;
import com.questrail.ircproxy.model.TagValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JsonCodecTest
{
    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonCodec codec = new JsonCodec(mapper);

    @Test
    void encodesFieldsInWireOrder()
    {
        IrcMessage message = IrcMessage.of("PRIVMSG", "#chan", "hi");

        String json = new String(codec.encode(message), StandardCharsets.UTF_8);

        assertEquals("{\"tags\":{},\"source\":null,\"verb\":\"privmsg\",\"params\":[\"#chan\",\"hi\"]}", json);
    }

    @Test
    void numericVerbIsWrittenAsInteger()
    {
        IrcMessage message = new LineCodec().parse(":irc.example.com 001 nick :Welcome");

        String json = new String(codec.encode(message), StandardCharsets.UTF_8);

        assertEquals("{\"tags\":{},\"source\":\"irc.example.com\",\"verb\":1,\"params\":[\"nick\",\"Welcome\"]}", json);
    }

    @Test
    void flagTagIsTrueAndPresentTagIsString()
    {
        IrcMessage message = IrcMessage.of("PING", "x");
        message.putTag("bot", TagValue.flag());
        message.putTag("msgid", TagValue.of(""));

        JsonNode tags = codec.toTree(message).get("tags");

        assertTrue(tags.get("bot").isBoolean());
        assertTrue(tags.get("bot").booleanValue());
        assertEquals("", tags.get("msgid").textValue());
    }

    @Test
    void decodesFullObject() throws Exception
    {
        JsonNode node = mapper.readTree(
                "{\"tags\":{\"Time\":\"now\",\"bot\":true},\"source\":\"n!u@h\",\"verb\":\"PRIVMSG\",\"params\":[\"#chan\",\"hi\"]}");

        IrcMessage message = codec.decode(node);

        assertEquals(TagValue.of("now"), message.tags().get("time"));
        assertEquals(TagValue.flag(), message.tags().get("bot"));
        assertEquals("n!u@h", message.sender().orElseThrow());
        assertEquals(new IrcCommand.Token("privmsg"), message.command());
        assertEquals(List.of("#chan", "hi"), message.args());
    }

    @Test
    void integerAndStringVerbsNormalizeAlike() throws Exception
    {
        IrcMessage fromInt = codec.decode(mapper.readTree("{\"verb\":1}"));
        IrcMessage fromString = codec.decode(mapper.readTree("{\"verb\":\"001\"}"));
        IrcMessage outOfRange = codec.decode(mapper.readTree("{\"verb\":1000}"));

        assertEquals(new IrcCommand.Numeric(1), fromInt.command());
        assertEquals(fromInt, fromString);
        assertEquals(new IrcCommand.Token("1000"), outOfRange.command());
    }

    @Test
    void optionalFieldsMayBeMissing() throws Exception
    {
        IrcMessage message = codec.decode(mapper.readTree("{\"verb\":\"ping\"}"));

        assertTrue(message.tags().isEmpty());
        assertTrue(message.sender().isEmpty());
        assertTrue(message.args().isEmpty());
    }

    @Test
    void numericTagValueBecomesText() throws Exception
    {
        IrcMessage message = codec.decode(mapper.readTree("{\"tags\":{\"n\":5},\"verb\":\"ping\"}"));

        assertEquals(TagValue.of("5"), message.tags().get("n"));
    }

    @Test
    void missingVerbIsRejected() throws Exception
    {
        JsonNode node = mapper.readTree("{\"params\":[\"x\"]}");

        assertThrows(IrcDecodeException.class, () -> codec.decode(node));
    }

    @Test
    void wrongFieldTypesAreRejected() throws Exception
    {
        assertThrows(IrcDecodeException.class, () -> codec.decode(mapper.readTree("{\"verb\":true}")));
        assertThrows(IrcDecodeException.class, () -> codec.decode(mapper.readTree("{\"verb\":\"\"}")));
        assertThrows(IrcDecodeException.class, () -> codec.decode(mapper.readTree("{\"verb\":\"x\",\"params\":[1]}")));
        assertThrows(IrcDecodeException.class, () -> codec.decode(mapper.readTree("{\"verb\":\"x\",\"params\":\"a\"}")));
        assertThrows(IrcDecodeException.class, () -> codec.decode(mapper.readTree("{\"verb\":\"x\",\"source\":7}")));
        assertThrows(IrcDecodeException.class, () -> codec.decode(mapper.readTree("{\"verb\":\"x\",\"tags\":{\"a\":false}}")));
        assertThrows(IrcDecodeException.class, () -> codec.decode(mapper.readTree("[1,2]")));
    }

    @Test
    void decodedMessageEqualsTheLineItCameFrom()
    {
        LineCodec lines = new LineCodec();
        IrcMessage original = lines.parse("@a=1;b :n!u@h PRIVMSG #chan :hi there");

        IrcMessage copy = codec.decode(codec.toTree(original));

        assertEquals(original, copy);
    }
}
