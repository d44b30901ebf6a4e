package com.questrail.ircproxy.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.ircproxy.codec.IrcDecodeException;
import com.questrail.ircproxy.codec.IrcEncodeException;
import com.questrail.ircproxy.codec.IrcMessageEncoder;
import com.questrail.ircproxy.model.IrcCommand;
import com.questrail.ircproxy.model.IrcMessage;
import com.questrail.ircproxy.model.TagValue;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JsonCodec
 * -----------------------------------------------------------------------------
 * Maps {@link IrcMessage} to and from the JSON wire shape:
 *
 * <pre>
 *   {"tags": {...}, "source": "nick!user@host" | null, "verb": "privmsg" | 1, "params": ["..."]}
 * </pre>
 *
 * <ul>
 *   <li>{@code tags}: {@link TagValue.Flag} is {@code true}, a present value
 *       is a string</li>
 *   <li>{@code source}: written as explicit {@code null} when the sender is
 *       absent</li>
 *   <li>{@code verb}: an integer for numerics, the lowercase token otherwise</li>
 *   <li>{@code params}: array of strings</li>
 * </ul>
 *
 * <p>Serialized values carry no separator; the format relies on JSON objects
 * being self-delimiting. Stream handling lives in {@link JsonStreamDecoder}.</p>
 */
public final class JsonCodec implements IrcMessageEncoder
{
    static final String TAGS = "tags";
    static final String SOURCE = "source";
    static final String VERB = "verb";
    static final String PARAMS = "params";

    private final ObjectMapper mapper;

    public JsonCodec()
    {
        this(new ObjectMapper());
    }

    public JsonCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    ObjectMapper mapper()
    {
        return mapper;
    }

    /**
     * Convert one complete JSON value into a message.
     *
     * @throws IrcDecodeException if the value does not have the message shape
     */
    public IrcMessage decode(JsonNode node)
    {
        if (node == null || !node.isObject()) {
            throw new IrcDecodeException("Expected a JSON object but found " + describe(node));
        }

        IrcMessage message = new IrcMessage();

        JsonNode tags = node.get(TAGS);
        if (tags != null && !tags.isNull()) {
            if (!tags.isObject()) {
                throw new IrcDecodeException("'tags' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = tags.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> tag = fields.next();
                message.putTag(tag.getKey(), tagValue(tag.getKey(), tag.getValue()));
            }
        }

        JsonNode source = node.get(SOURCE);
        if (source != null && !source.isNull()) {
            if (!source.isTextual()) {
                throw new IrcDecodeException("'source' must be a string or null");
            }
            message.setSender(source.textValue());
        }

        JsonNode verb = node.get(VERB);
        if (verb == null || verb.isNull()) {
            throw new IrcDecodeException("Message has no 'verb'");
        }
        if (verb.isIntegralNumber() && verb.canConvertToLong()) {
            message.setCommand(IrcCommand.of(verb.longValue()));
        }
        else if (verb.isTextual() && !verb.textValue().isEmpty()) {
            message.setCommand(verb.textValue());
        }
        else {
            throw new IrcDecodeException("'verb' must be a non-empty string or an integer");
        }

        JsonNode params = node.get(PARAMS);
        if (params != null && !params.isNull()) {
            if (!params.isArray()) {
                throw new IrcDecodeException("'params' must be an array");
            }
            for (JsonNode param : params) {
                if (!param.isTextual()) {
                    throw new IrcDecodeException("'params' elements must be strings, found " + describe(param));
                }
                message.addArg(param.textValue());
            }
        }

        return message;
    }

    /**
     * Build the JSON tree for a message, fields in wire order.
     */
    public ObjectNode toTree(IrcMessage message)
    {
        if (message.command() == null) {
            throw new IrcEncodeException("Message has no command");
        }

        ObjectNode root = mapper.createObjectNode();

        ObjectNode tags = root.putObject(TAGS);
        for (Map.Entry<String, TagValue> tag : message.tags().entrySet()) {
            if (tag.getValue() instanceof TagValue.Present) {
                tags.put(tag.getKey(), ((TagValue.Present) tag.getValue()).value());
            }
            else {
                tags.put(tag.getKey(), true);
            }
        }

        if (message.sender().isPresent()) {
            root.put(SOURCE, message.sender().get());
        }
        else {
            root.putNull(SOURCE);
        }

        IrcCommand command = message.command();
        if (command instanceof IrcCommand.Numeric) {
            root.put(VERB, ((IrcCommand.Numeric) command).code());
        }
        else {
            root.put(VERB, ((IrcCommand.Token) command).name());
        }

        ArrayNode params = root.putArray(PARAMS);
        message.args().forEach(params::add);

        return root;
    }

    @Override
    public byte[] encode(IrcMessage message)
    {
        try {
            return mapper.writeValueAsBytes(toTree(message));
        }
        catch (JsonProcessingException e) {
            throw new IrcEncodeException("Failed to write message as JSON: " + message, e);
        }
    }

    private static TagValue tagValue(String key, JsonNode value)
    {
        if (value.isBoolean() && value.booleanValue()) {
            return TagValue.flag();
        }
        if (value.isTextual()) {
            return TagValue.of(value.textValue());
        }
        if (value.isNumber()) {
            return TagValue.of(value.asText());
        }
        throw new IrcDecodeException("Tag '" + key + "' must be a string or true, found " + describe(value));
    }

    private static String describe(JsonNode node)
    {
        return node == null ? "nothing" : node.getNodeType().toString().toLowerCase(Locale.ROOT);
    }
}
