package com.questrail.ircproxy.runtime;

import com.questrail.ircproxy.config.RelayConfig;
import com.questrail.ircproxy.observability.NullObservabilitySink;
import com.questrail.ircproxy.observability.RelayObservabilitySink;
import com.questrail.ircproxy.observability.RelayTransportEvent;
import com.questrail.ircproxy.relay.ConnectionChannel;
import com.questrail.ircproxy.relay.LegId;
import com.questrail.ircproxy.relay.RelayLeg;
import com.questrail.ircproxy.relay.RelayPair;
import com.questrail.ircproxy.transport.DialCallback;
import com.questrail.ircproxy.transport.StreamEndpoint;
import com.questrail.ircproxy.transport.StreamTransport;
import com.questrail.ircproxy.transport.tcp.netty.NettyStreamTransport;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * IrcProxyRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the relay.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>wiring and ownership component only</strong>. For
 * every accepted client connection it:
 *
 * <pre>
 *   StreamTransport.onAccepted(downstream)
 *        → StreamTransport.dial(upstream address)
 *            → ConnectionChannel(DOWNSTREAM) + ConnectionChannel(UPSTREAM, eager JSON?)
 *                → RelayPair.open()
 * </pre>
 *
 * <p>No IRC semantics live here. If the upstream connection cannot be
 * established the client connection is closed.</p>
 */
public final class IrcProxyRuntime {
    private final RelayConfig config;
    private final StreamTransport transport;
    private final RelayObservabilitySink observabilitySink;
    private final AtomicLong pairSequence = new AtomicLong();

    private IrcProxyRuntime(RelayConfig config, StreamTransport transport, RelayObservabilitySink observabilitySink) {
        this.config = config;
        this.transport = transport;
        this.observabilitySink = observabilitySink;
    }

    /**
     * Bind the listen address and start relaying.
     *
     * @return the bound address
     */
    public InetSocketAddress start() {
        return transport.start(config.listenAddress(), this::onAccepted);
    }

    public void stop() {
        transport.stop();
    }

    /**
     * Block until the listener is closed.
     */
    public void awaitTermination() throws InterruptedException {
        transport.awaitTermination();
    }

    public RelayConfig config() {
        return config;
    }

    private void onAccepted(StreamEndpoint downstream) {
        long pair = pairSequence.incrementAndGet();

        transport.dial(downstream, config.upstreamAddress(), new DialCallback() {
            @Override
            public void onConnected(StreamEndpoint upstream) {
                relay(pair, downstream, upstream);
            }

            @Override
            public void onFailed(Throwable cause) {
                observabilitySink.onTransportEvent(new RelayTransportEvent(
                    Instant.now(),
                    new LegId(pair, RelayLeg.UPSTREAM),
                    RelayTransportEvent.Kind.DIAL_FAILED,
                    config.upstreamAddress(),
                    cause));
                downstream.close();
            }
        });
    }

    /**
     * Wire two connected endpoints into a relay pair and start reading.
     */
    RelayPair relay(long pair, StreamEndpoint downstream, StreamEndpoint upstream) {
        ConnectionChannel client = new ConnectionChannel(
            new LegId(pair, RelayLeg.DOWNSTREAM), downstream, observabilitySink, false);
        ConnectionChannel server = new ConnectionChannel(
            new LegId(pair, RelayLeg.UPSTREAM), upstream, observabilitySink, config.startJson());

        RelayPair relayPair = new RelayPair(client, server, observabilitySink, config.propagateFormatSwitch());
        relayPair.open();
        return relayPair;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RelayConfig config;
        private StreamTransport transport;
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(RelayConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Use a specific transport instead of the default Netty TCP transport.
         */
        public Builder withTransport(StreamTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public IrcProxyRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            StreamTransport t = transport != null
                ? transport
                : new NettyStreamTransport(config.workerThreads(), config.connectTimeout());
            return new IrcProxyRuntime(config, t, observabilitySink);
        }
    }
}
