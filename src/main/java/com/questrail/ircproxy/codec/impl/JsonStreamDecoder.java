package com.questrail.ircproxy.codec.impl;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.async.ByteArrayFeeder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import com.questrail.ircproxy.codec.IrcDecodeException;
import com.questrail.ircproxy.codec.IrcStreamDecoder;
import com.questrail.ircproxy.model.IrcMessage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * JsonStreamDecoder
 * -----------------------------------------------------------------------------
 * Incremental decoder for a stream of concatenated JSON objects.
 *
 * <p>Built on Jackson's non-blocking parser. Chunks are queued by
 * {@link #feed(byte[])} and handed to the parser only when it has consumed
 * everything it was given before. Tokens of the value in progress are
 * collected in a {@link TokenBuffer}; when the outermost object closes, the
 * buffer is read back as a tree and mapped by {@link JsonCodec}.</p>
 *
 * <p>No separator is needed between values, and a value may span any number
 * of chunks. Whitespace between values is ignored.</p>
 */
public final class JsonStreamDecoder implements IrcStreamDecoder
{
    private final JsonCodec codec;
    private final JsonParser parser;
    private final ByteArrayFeeder feeder;
    private final Deque<byte[]> pending = new ArrayDeque<>();

    private TokenBuffer value;
    private int depth;
    private boolean failed;

    public JsonStreamDecoder()
    {
        this(new JsonCodec());
    }

    public JsonStreamDecoder(JsonCodec codec)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        try {
            this.parser = codec.mapper().getFactory().createNonBlockingByteArrayParser();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Cannot create non-blocking JSON parser", e);
        }
        this.feeder = (ByteArrayFeeder) parser.getNonBlockingInputFeeder();
    }

    @Override
    public void feed(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        if (chunk.length > 0) {
            pending.add(chunk.clone());
        }
    }

    @Override
    public Optional<IrcMessage> next()
    {
        if (failed) {
            throw new IrcDecodeException("JSON stream is unusable after an earlier decode error");
        }

        try {
            while (true) {
                JsonToken token = parser.nextToken();

                if (token == JsonToken.NOT_AVAILABLE) {
                    byte[] chunk = pending.poll();
                    if (chunk == null) {
                        return Optional.empty();
                    }
                    feeder.feedInput(chunk, 0, chunk.length);
                    continue;
                }
                if (token == null) {
                    return Optional.empty();
                }

                if (value == null) {
                    if (token != JsonToken.START_OBJECT) {
                        throw new IrcDecodeException("Expected a JSON object but found " + token);
                    }
                    value = new TokenBuffer(parser);
                }

                value.copyCurrentEvent(parser);
                if (token.isStructStart()) {
                    depth++;
                }
                else if (token.isStructEnd()) {
                    depth--;
                }

                if (depth == 0) {
                    TokenBuffer complete = value;
                    value = null;
                    return Optional.of(codec.decode(readTree(complete)));
                }
            }
        }
        catch (IrcDecodeException e) {
            failed = true;
            throw e;
        }
        catch (JsonProcessingException e) {
            failed = true;
            throw new IrcDecodeException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        catch (IOException e) {
            failed = true;
            throw new IrcDecodeException("Failed to read JSON value", e);
        }
    }

    /**
     * @throws IrcDecodeException if the stream ends inside a JSON value
     */
    @Override
    public void finish()
    {
        boolean partial = value != null || pendingHasContent();
        pending.clear();
        value = null;
        feeder.endOfInput();
        if (partial && !failed) {
            failed = true;
            throw new IrcDecodeException("Stream ended inside an unterminated JSON value");
        }
    }

    private JsonNode readTree(TokenBuffer tokens) throws IOException
    {
        try (JsonParser replay = tokens.asParser(codec.mapper())) {
            return codec.mapper().readValue(replay, JsonNode.class);
        }
    }

    private boolean pendingHasContent()
    {
        for (byte[] chunk : pending) {
            for (byte b : chunk) {
                if (b != ' ' && b != '\t' && b != '\r' && b != '\n') {
                    return true;
                }
            }
        }
        return false;
    }
}
