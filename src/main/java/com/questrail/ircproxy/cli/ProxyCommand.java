package com.questrail.ircproxy.cli;

import com.questrail.ircproxy.codec.WireFormat;
import com.questrail.ircproxy.config.RelayConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * A parsed command line.
 */
public sealed interface ProxyCommand
        permits ProxyCommand.Convert, ProxyCommand.Relay, ProxyCommand.Help
{
    /** {@code parser <from> <to>}: convert stdin to stdout. */
    record Convert(WireFormat from, WireFormat to) implements ProxyCommand
    {
        public Convert {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    /** {@code simple|startjson <listenhost> <listenport> <connecthost> <connectport>}. */
    record Relay(RelayConfig config) implements ProxyCommand
    {
        public Relay {
            Objects.requireNonNull(config, "config");
        }
    }

    /**
     * Print the help text.
     *
     * @param error why the arguments were rejected; empty when help was asked for
     */
    record Help(Optional<String> error) implements ProxyCommand
    {
        public Help {
            Objects.requireNonNull(error, "error");
        }
    }
}
