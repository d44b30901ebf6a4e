package com.questrail.ircproxy.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the relay runtime.
 *
 * @param listenAddress         where client connections are accepted
 * @param upstreamAddress       the IRC server every client is relayed to
 * @param startJson             announce JSON on the upstream leg immediately
 * @param propagateFormatSwitch when a leg enters JSON receive mode, switch the
 *                              opposite leg's send side as well
 * @param connectTimeout        limit for establishing the upstream connection
 * @param workerThreads         event loop threads for connection I/O
 */
public record RelayConfig(
    InetSocketAddress listenAddress,
    InetSocketAddress upstreamAddress,
    boolean startJson,
    boolean propagateFormatSwitch,
    Duration connectTimeout,
    int workerThreads
) {
    public RelayConfig {
        Objects.requireNonNull(listenAddress, "listenAddress");
        Objects.requireNonNull(upstreamAddress, "upstreamAddress");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must be >= 0 (0 selects the Netty default)");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress listenAddress;
        private InetSocketAddress upstreamAddress;
        private boolean startJson = false;
        private boolean propagateFormatSwitch = false;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int workerThreads = 0;

        public Builder withListenAddress(InetSocketAddress listenAddress) {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder withUpstreamAddress(InetSocketAddress upstreamAddress) {
            this.upstreamAddress = upstreamAddress;
            return this;
        }

        public Builder withStartJson(boolean startJson) {
            this.startJson = startJson;
            return this;
        }

        public Builder withPropagateFormatSwitch(boolean propagateFormatSwitch) {
            this.propagateFormatSwitch = propagateFormatSwitch;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public RelayConfig build() {
            return new RelayConfig(listenAddress, upstreamAddress, startJson,
                propagateFormatSwitch, connectTimeout, workerThreads);
        }
    }
}
