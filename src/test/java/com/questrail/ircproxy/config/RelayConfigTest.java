package com.questrail.ircproxy.config;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class RelayConfigTest {

    private static final InetSocketAddress LISTEN = new InetSocketAddress("127.0.0.1", 6667);
    private static final InetSocketAddress UPSTREAM = InetSocketAddress.createUnresolved("irc.example.net", 6667);

    @Test
    void builderDefaults() {
        RelayConfig config = RelayConfig.builder()
            .withListenAddress(LISTEN)
            .withUpstreamAddress(UPSTREAM)
            .build();

        assertFalse(config.startJson());
        assertFalse(config.propagateFormatSwitch());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(0, config.workerThreads());
    }

    @Test
    void addressesAreRequired() {
        assertThrows(NullPointerException.class,
            () -> RelayConfig.builder().withUpstreamAddress(UPSTREAM).build());
        assertThrows(NullPointerException.class,
            () -> RelayConfig.builder().withListenAddress(LISTEN).build());
    }

    @Test
    void invalidValuesAreRejected() {
        RelayConfig.Builder builder = RelayConfig.builder()
            .withListenAddress(LISTEN)
            .withUpstreamAddress(UPSTREAM);

        assertThrows(IllegalArgumentException.class, () -> builder.withConnectTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> builder.withConnectTimeout(Duration.ofSeconds(1)).withWorkerThreads(-1).build());
    }
}
