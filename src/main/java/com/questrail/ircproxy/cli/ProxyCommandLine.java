package com.questrail.ircproxy.cli;

import com.questrail.ircproxy.codec.WireFormat;
import com.questrail.ircproxy.config.RelayConfig;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * Positional command-line parsing for {@link IrcProxyMain}.
 */
public final class ProxyCommandLine
{
    public static final String HELP_TEXT = String.join("\n",
            "Trivial IRC proxy and JSON converter.",
            "",
            "This uses the STARTJSON command to signal that the remainder of the stream in",
            "that direction is JSON. No capability negotiation is done to determine if this",
            "will work.",
            "",
            "Subcommands:",
            "",
            "  parser <from> <to>",
            "    Convert between serialisations. \"rfc1459\" and \"json\" are the valid values",
            "    of the arguments. Reads stdin, writes stdout.",
            "",
            "  simple <listenhost> <listenport> <connecthost> <connectport>",
            "    Be a simple IRC proxy. Listen on the host and port given by the first two",
            "    arguments. Any connections are relayed to the host and port given by the",
            "    last two. If STARTJSON is used, respond in kind.",
            "",
            "  startjson <listenhost> <listenport> <connecthost> <connectport>",
            "    Like simple, except start the connection to upstream with STARTJSON.",
            "",
            "Both simple and startjson log the strings read and written to stderr. \"<<\"",
            "for a write, \">>\" for a read. C for clientwards, S for serverwards.",
            "");

    private ProxyCommandLine() {}

    public static ProxyCommand parse(String... args)
    {
        if (args.length == 0) {
            return help(null);
        }

        switch (args[0]) {
            case "parser":
                return parseConvert(args);
            case "simple":
                return parseRelay(args, false);
            case "startjson":
                return parseRelay(args, true);
            case "help":
            case "-h":
            case "--help":
                return help(null);
            default:
                return help("Unknown subcommand: " + args[0]);
        }
    }

    private static ProxyCommand parseConvert(String[] args)
    {
        if (args.length != 3) {
            return help("parser takes exactly two arguments: <from> <to>");
        }
        try {
            return new ProxyCommand.Convert(WireFormat.fromLabel(args[1]), WireFormat.fromLabel(args[2]));
        }
        catch (IllegalArgumentException e) {
            return help(e.getMessage());
        }
    }

    private static ProxyCommand parseRelay(String[] args, boolean startJson)
    {
        if (args.length != 5) {
            return help(args[0] + " takes exactly four arguments: "
                    + "<listenhost> <listenport> <connecthost> <connectport>");
        }
        try {
            RelayConfig config = RelayConfig.builder()
                    .withListenAddress(new InetSocketAddress(args[1], port(args[2])))
                    .withUpstreamAddress(InetSocketAddress.createUnresolved(args[3], port(args[4])))
                    .withStartJson(startJson)
                    .build();
            return new ProxyCommand.Relay(config);
        }
        catch (IllegalArgumentException e) {
            return help(e.getMessage());
        }
    }

    private static int port(String text)
    {
        final int port;
        try {
            port = Integer.parseInt(text);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a port number: " + text, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + text);
        }
        return port;
    }

    private static ProxyCommand help(String error)
    {
        return new ProxyCommand.Help(Optional.ofNullable(error));
    }
}
