package com.questrail.ircproxy.cli;

import com.questrail.ircproxy.codec.IrcDecodeException;
import com.questrail.ircproxy.codec.IrcEncodeException;
import com.questrail.ircproxy.observability.Slf4jRelayObservabilitySink;
import com.questrail.ircproxy.runtime.IrcProxyRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Command-line entry point.
 *
 * @see ProxyCommandLine#HELP_TEXT
 */
public final class IrcProxyMain
{
    private static final Logger log = LoggerFactory.getLogger(IrcProxyMain.class);

    private IrcProxyMain() {}

    public static void main(String[] args)
    {
        System.exit(run(ProxyCommandLine.parse(args)));
    }

    static int run(ProxyCommand command)
    {
        if (command instanceof ProxyCommand.Convert) {
            return convert((ProxyCommand.Convert) command);
        }
        if (command instanceof ProxyCommand.Relay) {
            return relay((ProxyCommand.Relay) command);
        }

        ProxyCommand.Help help = (ProxyCommand.Help) command;
        help.error().ifPresent(error -> System.err.println(error + "\n"));
        System.out.print(ProxyCommandLine.HELP_TEXT);
        return help.error().isPresent() ? 2 : 0;
    }

    private static int convert(ProxyCommand.Convert command)
    {
        try {
            new FormatConverter(command.from(), command.to()).convert(System.in, System.out);
            return 0;
        }
        catch (IrcDecodeException | IrcEncodeException e) {
            log.error("Conversion from {} to {} failed: {}", command.from().label(), command.to().label(), e.getMessage());
            return 1;
        }
        catch (IOException e) {
            log.error("I/O failure during conversion", e);
            return 1;
        }
    }

    private static int relay(ProxyCommand.Relay command)
    {
        IrcProxyRuntime runtime = IrcProxyRuntime.builder()
                .withConfig(command.config())
                .withObservabilitySink(new Slf4jRelayObservabilitySink())
                .build();

        try {
            runtime.start();
        }
        catch (IllegalStateException e) {
            log.error(e.getMessage(), e.getCause());
            runtime.stop();
            return 1;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "irc-proxy-shutdown"));
        log.info("Relaying to {} (startjson={})", command.config().upstreamAddress(), command.config().startJson());

        try {
            runtime.awaitTermination();
            return 0;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runtime.stop();
            return 1;
        }
    }
}
