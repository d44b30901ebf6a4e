package com.questrail.ircproxy.transport.tcp.netty;

import com.questrail.ircproxy.transport.StreamEndpoint;
import com.questrail.ircproxy.transport.StreamEndpointListener;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.EventLoop;
import io.netty.channel.SimpleChannelInboundHandler;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * NettyStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port for one TCP
 * connection.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT frame,
 * decode or interpret IRC traffic.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound {@link ByteBuf}s are copied
 * into {@code byte[]} and released by {@link SimpleChannelInboundHandler}.
 *
 * <h2>Lifecycle</h2>
 * The channel is created with auto-read off. Reading starts when the relay
 * calls {@link #setReading(boolean)}. A disconnect that happens before a
 * listener is installed is remembered and replayed on
 * {@link #setListener(StreamEndpointListener)}.
 */
final class NettyStreamEndpoint implements StreamEndpoint
{
    private final Channel channel;

    private volatile StreamEndpointListener listener;
    private volatile boolean disconnected;
    private volatile Throwable disconnectCause;
    private volatile Throwable pendingFault;

    NettyStreamEndpoint(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    EventLoop eventLoop()
    {
        return channel.eventLoop();
    }

    /**
     * Handler to install at the end of the channel pipeline.
     */
    InboundHandler handler()
    {
        return new InboundHandler();
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
        if (disconnected) {
            listener.onDisconnected(disconnectCause);
        }
    }

    @Override
    public void write(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(Unpooled.wrappedBuffer(payload))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public void setReading(boolean reading)
    {
        channel.config().setAutoRead(reading);
    }

    @Override
    public void closeAfterWriting()
    {
        if (channel.isActive()) {
            channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        }
        else {
            channel.close();
        }
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies received bytes to the port listener and turns channel shutdown
     * into a single {@code onDisconnected} call.
     */
    final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            StreamEndpointListener l = listener;
            if (l == null) {
                return;
            }

            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onBytes(bytes);
        }

        @Override
        public void channelWritabilityChanged(ChannelHandlerContext ctx)
        {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onWritabilityChanged(ctx.channel().isWritable());
            }
            ctx.fireChannelWritabilityChanged();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            disconnectCause = pendingFault;
            disconnected = true;

            StreamEndpointListener l = listener;
            if (l != null) {
                l.onDisconnected(disconnectCause);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Reported once, from channelInactive.
            if (pendingFault == null) {
                pendingFault = cause;
            }
            ctx.close();
        }
    }
}
