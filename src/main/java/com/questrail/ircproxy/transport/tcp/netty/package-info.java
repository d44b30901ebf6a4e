/**
 * Netty TCP adapter for the stream transport ports.
 *
 * <p>Netty types (e.g., {@code Channel}, {@code EventLoopGroup},
 * {@code ByteBuf}) MUST NOT escape this package. Only
 * {@link com.questrail.ircproxy.transport.tcp.netty.NettyStreamTransport} is
 * public.</p>
 */
package com.questrail.ircproxy.transport.tcp.netty;
