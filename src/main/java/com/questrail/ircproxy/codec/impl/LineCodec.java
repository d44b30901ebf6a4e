package com.questrail.ircproxy.codec.impl;

import com.questrail.ircproxy.codec.IrcDecodeException;
import com.questrail.ircproxy.codec.IrcEncodeException;
import com.questrail.ircproxy.codec.IrcMessageEncoder;
import com.questrail.ircproxy.model.IrcCommand;
import com.questrail.ircproxy.model.IrcMessage;
import com.questrail.ircproxy.model.TagValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * LineCodec
 * -----------------------------------------------------------------------------
 * Parses and serializes single lines of the RFC 1459 wire format:
 *
 * <pre>
 *   [@tag1=val1;tag2 ][:sender ]COMMAND[ param1 ...][ :last param with spaces]\r\n
 * </pre>
 *
 * <p>Parsing applies the grammar in a fixed order:</p>
 * <ol>
 *   <li>Tag block: a leading {@code @} up to the first space, split on
 *       {@code ;}, each segment split on the first {@code =}. A segment
 *       without {@code =} is a {@link TagValue.Flag}. Keys are lowercased.</li>
 *   <li>Sender: a leading {@code :} up to the next run of spaces.</li>
 *   <li>Command and parameters: the rest is split once on {@code " :"};
 *       the left side is space-delimited tokens (command first), the right
 *       side, if present, is one final parameter that may contain spaces.</li>
 * </ol>
 *
 * <p>Serialization uppercases the command, renders numerics as three digits,
 * and strips a {@code ctcp_} prefix from symbolic commands
 * ({@code ctcp_action} is written as {@code ACTION}). The prefix is a
 * rendering convention only; parsing never adds it.</p>
 *
 * <p>This class is stateless. Stream framing lives in
 * {@link LineStreamDecoder}.</p>
 */
public final class LineCodec implements IrcMessageEncoder
{
    static final String CRLF = "\r\n";
    static final String CTCP_PREFIX = "ctcp_";

    /**
     * Parse one line. A trailing LF and/or CR is tolerated and removed.
     *
     * @throws IrcDecodeException if the line carries no command
     */
    public IrcMessage parse(String line)
    {
        String rest = stripLineEnding(line);
        IrcMessage message = new IrcMessage();

        // 1) Tag block
        if (rest.startsWith("@")) {
            int space = rest.indexOf(' ');
            if (space < 0) {
                throw new IrcDecodeException("Line has a tag block but no command: " + line);
            }
            parseTags(rest.substring(1, space), message);
            rest = skipSpaces(rest, space);
        }

        // 2) Sender
        if (rest.startsWith(":")) {
            int space = rest.indexOf(' ');
            if (space < 0) {
                throw new IrcDecodeException("Line has a sender but no command: " + line);
            }
            String sender = rest.substring(1, space);
            if (!sender.isEmpty()) {
                message.setSender(sender);
            }
            rest = skipSpaces(rest, space);
        }

        // 3) Command and parameters
        int split = rest.indexOf(" :");
        String middle = split < 0 ? rest : rest.substring(0, split);

        List<String> tokens = splitOnSpaces(middle);
        if (tokens.isEmpty()) {
            throw new IrcDecodeException("Line has no command: " + line);
        }

        message.setCommand(tokens.get(0));
        message.setArgs(tokens.subList(1, tokens.size()));
        if (split >= 0) {
            message.addArg(rest.substring(split + 2));
            message.setTrailingArg(true);
        }
        return message;
    }

    @Override
    public byte[] encode(IrcMessage message)
    {
        return serialize(message).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Render a message as one CR LF terminated line.
     *
     * @throws IrcEncodeException if a field cannot be represented in this format
     */
    public String serialize(IrcMessage message)
    {
        if (message.command() == null) {
            throw new IrcEncodeException("Message has no command");
        }

        StringBuilder sb = new StringBuilder(128);

        Map<String, TagValue> tags = message.tags();
        if (!tags.isEmpty()) {
            sb.append('@');
            boolean first = true;
            for (Map.Entry<String, TagValue> tag : tags.entrySet()) {
                if (!first) {
                    sb.append(';');
                }
                first = false;
                appendTag(sb, tag.getKey(), tag.getValue());
            }
            sb.append(' ');
        }

        Optional<String> sender = message.sender();
        if (sender.isPresent() && !sender.get().isEmpty()) {
            requireToken("sender", sender.get());
            sb.append(':').append(sender.get()).append(' ');
        }

        sb.append(commandText(message.command()));

        List<String> args = message.args();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            sb.append(' ');
            if (i < args.size() - 1) {
                requireMiddleParam(arg);
                sb.append(arg);
            }
            else {
                requireNoLineBreaks("parameter", arg);
                if (message.trailingArg() || needsTrailingForm(arg)) {
                    sb.append(':');
                }
                sb.append(arg);
            }
        }

        return sb.append(CRLF).toString();
    }

    /**
     * Wire spelling of a command: numerics zero-padded to three digits,
     * tokens uppercased with any {@code ctcp_} prefix removed.
     */
    static String commandText(IrcCommand command)
    {
        if (command instanceof IrcCommand.Numeric) {
            return command.toString();
        }

        String name = ((IrcCommand.Token) command).name();
        if (name.startsWith(CTCP_PREFIX)) {
            name = name.substring(CTCP_PREFIX.length());
        }
        requireToken("command", name);
        return name.toUpperCase(Locale.ROOT);
    }

    private static void parseTags(String block, IrcMessage message)
    {
        for (String segment : block.split(";")) {
            if (segment.isEmpty()) {
                continue;
            }
            int eq = segment.indexOf('=');
            String key = eq < 0 ? segment : segment.substring(0, eq);
            if (key.isEmpty()) {
                continue;
            }
            message.putTag(key, eq < 0 ? TagValue.flag() : TagValue.of(segment.substring(eq + 1)));
        }
    }

    private static void appendTag(StringBuilder sb, String key, TagValue value)
    {
        if (key.isEmpty() || containsAny(key, " ;=\r\n\0")) {
            throw new IrcEncodeException("Tag key cannot be written on a line: '" + key + "'");
        }
        sb.append(key);

        if (value instanceof TagValue.Present) {
            String text = ((TagValue.Present) value).value();
            if (containsAny(text, " ;\r\n\0")) {
                throw new IrcEncodeException("Tag value for '" + key + "' cannot be written on a line");
            }
            sb.append('=').append(text);
        }
    }

    private static boolean needsTrailingForm(String last)
    {
        return last.isEmpty() || last.indexOf(' ') >= 0 || last.startsWith(":");
    }

    private static void requireMiddleParam(String arg)
    {
        if (arg.isEmpty() || arg.indexOf(' ') >= 0 || arg.startsWith(":")) {
            throw new IrcEncodeException("Only the last parameter may be empty, contain a space or start with ':': '"
                    + arg + "'");
        }
        requireNoLineBreaks("parameter", arg);
    }

    private static void requireToken(String what, String value)
    {
        if (value.isEmpty() || value.indexOf(' ') >= 0) {
            throw new IrcEncodeException("Invalid " + what + ": '" + value + "'");
        }
        requireNoLineBreaks(what, value);
    }

    private static void requireNoLineBreaks(String what, String value)
    {
        if (containsAny(value, "\r\n\0")) {
            throw new IrcEncodeException(what + " contains CR, LF or NUL");
        }
    }

    private static boolean containsAny(String value, String chars)
    {
        for (int i = 0; i < chars.length(); i++) {
            if (value.indexOf(chars.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static String stripLineEnding(String line)
    {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
        }
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }

    private static String skipSpaces(String s, int from)
    {
        int i = from;
        while (i < s.length() && s.charAt(i) == ' ') {
            i++;
        }
        return s.substring(i);
    }

    private static List<String> splitOnSpaces(String s)
    {
        List<String> tokens = new ArrayList<>();
        for (String token : s.split(" ")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
