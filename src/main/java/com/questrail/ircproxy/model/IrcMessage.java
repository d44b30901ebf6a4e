package com.questrail.ircproxy.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * IrcMessage
 * =============================================================================
 * Format-agnostic representation of one IRC protocol message.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code IrcMessage} is the only form of message that crosses between the two
 * legs of a relay. Codecs create it on the receive side and consume it on the
 * send side; nothing in between looks at bytes.
 * </p>
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code tags}: lowercase key to {@link TagValue}; insertion order is
 *       kept only so that serialization is deterministic</li>
 *   <li>{@code sender}: optional; absent and empty are distinct states</li>
 *   <li>{@code command}: {@link IrcCommand}; never unset on a complete message</li>
 *   <li>{@code args}: ordered parameters</li>
 * </ul>
 *
 * <p>The class is mutable so that codecs can fill it in step by step. Once a
 * message has been handed to a relay it is treated as read-only.</p>
 *
 * <h2>Wire hint</h2>
 * <p>
 * The native parser records whether the last parameter arrived in trailing
 * ({@code :}-prefixed) form so that re-serializing reproduces the same bytes.
 * The hint carries no meaning and is excluded from {@link #equals(Object)}.
 * </p>
 */
public final class IrcMessage
{
    /** Marks a leading sender element in {@link #of(String...)}. */
    public static final char SENDER_MARKER = ':';

    private final Map<String, TagValue> tags = new LinkedHashMap<>();
    private String sender;
    private IrcCommand command;
    private final List<String> args = new ArrayList<>();
    private boolean trailingArg;

    public IrcMessage()
    {
    }

    public IrcMessage(IrcCommand command, List<String> args)
    {
        this.command = Objects.requireNonNull(command, "command");
        setArgs(args);
    }

    /**
     * Build a message from a raw value list.
     *
     * <p>If the first element starts with {@value #SENDER_MARKER} it is taken
     * as the sender (marker stripped). The next element is the command and
     * the rest are parameters.</p>
     *
     * @throws IllegalArgumentException if no command element is present
     */
    public static IrcMessage of(String... values)
    {
        List<String> rest = new ArrayList<>(Arrays.asList(values));
        IrcMessage message = new IrcMessage();

        if (!rest.isEmpty() && rest.get(0) != null && rest.get(0).indexOf(SENDER_MARKER) == 0) {
            message.setSender(rest.remove(0).substring(1));
        }
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("no command in " + Arrays.toString(values));
        }

        message.setCommand(rest.remove(0));
        message.setArgs(rest);
        return message;
    }

    public Map<String, TagValue> tags()
    {
        return Collections.unmodifiableMap(tags);
    }

    public void setTags(Map<String, TagValue> tags)
    {
        this.tags.clear();
        if (tags != null) {
            tags.forEach(this::putTag);
        }
    }

    /**
     * Add or replace a tag. The key is lowercased.
     */
    public void putTag(String key, TagValue value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        tags.put(key.toLowerCase(Locale.ROOT), value);
    }

    public Optional<String> sender()
    {
        return Optional.ofNullable(sender);
    }

    /**
     * @param sender the sender, or {@code null} to mark it absent
     */
    public void setSender(String sender)
    {
        this.sender = sender;
    }

    public IrcCommand command()
    {
        return command;
    }

    public void setCommand(IrcCommand command)
    {
        this.command = Objects.requireNonNull(command, "command");
    }

    /**
     * Set the command from a raw verb, applying {@link IrcCommand#parse(String)}.
     */
    public void setCommand(String raw)
    {
        this.command = IrcCommand.parse(raw);
    }

    public List<String> args()
    {
        return Collections.unmodifiableList(args);
    }

    public void setArgs(List<String> args)
    {
        this.args.clear();
        if (args != null) {
            for (String arg : args) {
                this.args.add(Objects.requireNonNull(arg, "arg"));
            }
        }
    }

    public void addArg(String arg)
    {
        args.add(Objects.requireNonNull(arg, "arg"));
    }

    public boolean trailingArg()
    {
        return trailingArg;
    }

    public void setTrailingArg(boolean trailingArg)
    {
        this.trailingArg = trailingArg;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IrcMessage)) {
            return false;
        }
        IrcMessage other = (IrcMessage) o;
        return tags.equals(other.tags)
                && Objects.equals(sender, other.sender)
                && Objects.equals(command, other.command)
                && args.equals(other.args);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(tags, sender, command, args);
    }

    @Override
    public String toString()
    {
        return "IrcMessage{tags=" + tags
                + ", sender=" + (sender == null ? "<absent>" : '"' + sender + '"')
                + ", command=" + command
                + ", args=" + args + '}';
    }
}
